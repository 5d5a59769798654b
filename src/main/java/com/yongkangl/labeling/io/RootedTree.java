package com.yongkangl.labeling.io;

import java.util.ArrayList;
import java.util.List;

/**
 * Nodes of a rooted tree addressed by stable integer ids. Ids {@code 0..realNodeCount-1}
 * follow the pre-order of the sequence the tree was built from; a synthetic super-root, when
 * present, takes the next free id.
 */
public class RootedTree {
    private final List<TreeNode> nodes;
    private final int realNodeCount;
    private int root;

    private RootedTree(List<TreeNode> nodes) {
        this.nodes = nodes;
        this.realNodeCount = nodes.size();
        this.root = 0;
    }

    /**
     * Builds the tree described by a validated pre-order depth sequence. Every element becomes
     * a node appended to its parent's children in order of appearance.
     */
    public static RootedTree fromSequence(int[] sequence) {
        List<TreeNode> nodes = new ArrayList<>(sequence.length + 1);
        nodes.add(new TreeNode(TreeNode.NO_PARENT, 0));
        int parent = 0;
        for (int i = 1; i < sequence.length; i++) {
            if (sequence[i] <= sequence[i - 1]) {
                parent = nodes.get(parent).getParent();
                while (nodes.get(parent).getDistance() >= sequence[i]) {
                    parent = nodes.get(parent).getParent();
                }
            }
            nodes.add(new TreeNode(parent, sequence[i]));
            nodes.get(parent).addChild(i);
            parent = i;
        }
        return new RootedTree(nodes);
    }

    /**
     * Hangs the current root and one of its children under a new synthetic root, cutting the
     * edge between them.
     * @return the id of the synthetic root
     */
    public int addSuperRoot(int second) {
        if (hasSuperRoot()) {
            throw new IllegalStateException("The tree already has a super-root");
        }
        int first = root;
        if (nodes.get(second).getParent() != first) {
            throw new IllegalStateException("Node " + second + " is not a child of the root");
        }
        int superRoot = nodes.size();
        TreeNode node = new TreeNode(TreeNode.NO_PARENT, 0);
        node.addChild(first);
        node.addChild(second);
        node.setSymmetric(true);
        nodes.add(node);
        nodes.get(first).setParent(superRoot);
        nodes.get(first).removeChild(second);
        nodes.get(second).setParent(superRoot);
        root = superRoot;
        return superRoot;
    }

    public boolean hasSuperRoot() {
        return nodes.size() > realNodeCount;
    }

    public int getRoot() {
        return root;
    }

    public TreeNode getNode(int id) {
        return nodes.get(id);
    }

    /** Number of nodes including the synthetic super-root. */
    public int size() {
        return nodes.size();
    }

    public int getRealNodeCount() {
        return realNodeCount;
    }

    public int getLabel(int id) {
        return nodes.get(id).getLabel();
    }

    public void resetLabels(int id) {
        TreeNode node = nodes.get(id);
        node.setLabel(0);
        for (int child : node.getChildren()) {
            resetLabels(child);
        }
    }

    /**
     * Copies the labeling of one branch onto a structurally identical branch.
     */
    public void copyLabels(int source, int destination) {
        TreeNode from = nodes.get(source);
        TreeNode to = nodes.get(destination);
        to.setLabel(from.getLabel());
        for (int i = 0; i < from.getChildCount(); i++) {
            copyLabels(from.getChild(i), to.getChild(i));
        }
    }
}
