package com.yongkangl.labeling.tree;

import com.yongkangl.labeling.io.RootedTree;
import com.yongkangl.labeling.io.TreeNode;
import org.apache.commons.math3.util.Pair;

import java.util.List;

/**
 * Re-roots a pre-order traversal at the center of the tree.
 */
public class Rebalancer {
    private final int[] sequence;
    private final RootedTree original;
    private final int[] distances;
    private final int[] origins;
    private int position;

    public Rebalancer(int[] sequence) {
        this.sequence = sequence;
        this.original = RootedTree.fromSequence(sequence);
        this.distances = new int[sequence.length];
        this.origins = new int[sequence.length];
    }

    public static BalancedSequence balance(int[] sequence, List<Pair<Integer, Integer>> centers) {
        return new Rebalancer(sequence).balance(centers);
    }

    /**
     * With one center the center's branch comes first, renumbered from 0. With two adjacent
     * centers the lower-indexed one becomes the root, the branch of its partner is its first
     * subtree and its remaining children follow. Then, climbing one ancestor at a time towards the
     * old root, every ancestor is appended one level deeper than the previous one together with
     * its other branches: those after the path in reverse order, then those before it.
     */
    public BalancedSequence balance(List<Pair<Integer, Integer>> centers) {
        int center = centers.get(0).getSecond();
        if (centers.size() == 1 && center == 0) {
            int[] identity = new int[sequence.length];
            for (int i = 0; i < identity.length; i++) {
                identity[i] = i;
            }
            return new BalancedSequence(sequence.clone(), identity);
        }

        position = 0;
        if (centers.size() == 1) {
            appendBranch(center, 0);
        } else {
            int partner = centers.get(1).getSecond();
            append(center, 0);
            appendBranch(partner, 1);
            List<Integer> children = original.getNode(center).getChildren();
            int path = children.indexOf(partner);
            if (path < 0) {
                throw new IllegalStateException("Centers " + center + " and " + partner + " are not adjacent");
            }
            for (int k = path + 1; k < children.size(); k++) {
                appendBranch(children.get(k), 1);
            }
            for (int k = 0; k < path; k++) {
                appendBranch(children.get(k), 1);
            }
        }

        int child = center;
        int ancestor = original.getNode(center).getParent();
        int distance = 1;
        while (ancestor != TreeNode.NO_PARENT) {
            append(ancestor, distance);
            List<Integer> siblings = original.getNode(ancestor).getChildren();
            int path = siblings.indexOf(child);
            for (int k = siblings.size() - 1; k > path; k--) {
                appendBranch(siblings.get(k), distance + 1);
            }
            for (int k = 0; k < path; k++) {
                appendBranch(siblings.get(k), distance + 1);
            }
            child = ancestor;
            ancestor = original.getNode(ancestor).getParent();
            distance++;
        }
        return new BalancedSequence(distances.clone(), origins.clone());
    }

    private void appendBranch(int node, int distance) {
        append(node, distance);
        for (int child : original.getNode(node).getChildren()) {
            appendBranch(child, distance + 1);
        }
    }

    private void append(int node, int distance) {
        distances[position] = distance;
        origins[position] = node;
        position++;
    }
}
