package com.yongkangl.labeling.tree;

import com.yongkangl.labeling.io.TreeNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Rooted tree where each run of isomorphic sibling branches is stored once, with the length of
 * the run as the node's multiplicity.
 */
public class EquivalenceTree {
    public static final int ROOT = 0;

    private final List<TreeNode> nodes;

    public EquivalenceTree() {
        this.nodes = new ArrayList<>();
        nodes.add(new TreeNode(TreeNode.NO_PARENT, 0));
    }

    int addNode(int parent, int multiplicity) {
        int id = nodes.size();
        TreeNode node = new TreeNode(parent, nodes.get(parent).getDistance() + 1);
        node.setMultiplicity(multiplicity);
        nodes.add(node);
        nodes.get(parent).addChild(id);
        return id;
    }

    public TreeNode getNode(int id) {
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }

    public int depth() {
        int depth = 0;
        for (TreeNode node : nodes) {
            depth = Math.max(depth, node.getDistance());
        }
        return depth;
    }
}
