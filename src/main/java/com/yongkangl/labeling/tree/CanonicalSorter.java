package com.yongkangl.labeling.tree;

import com.yongkangl.labeling.io.RootedTree;
import com.yongkangl.labeling.io.TreeNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class CanonicalSorter {
    private CanonicalSorter() {
    }

    /**
     * Sorts the branch below the given node so that at every level the children follow the
     * increasing order of their order-vectors, and stores each node's order-vector on the way up.
     * Isomorphic sibling branches end up adjacent. The sort is stable.
     */
    public static void sort(RootedTree tree, int id) {
        TreeNode node = tree.getNode(id);
        for (int child : node.getChildren()) {
            sort(tree, child);
        }
        if (node.getChildCount() > 1) {
            List<Integer> children = new ArrayList<>(node.getChildren());
            children.sort((a, b) -> Arrays.compare(tree.getNode(a).getOrderVector(), tree.getNode(b).getOrderVector()));
            node.setChildren(children);
        }

        int length = 1;
        for (int child : node.getChildren()) {
            length += tree.getNode(child).getOrderVector().length;
        }
        int[] orderVector = new int[length];
        orderVector[0] = node.getChildCount();
        int offset = 1;
        for (int child : node.getChildren()) {
            int[] childVector = tree.getNode(child).getOrderVector();
            System.arraycopy(childVector, 0, orderVector, offset, childVector.length);
            offset += childVector.length;
        }
        node.setOrderVector(orderVector);
    }
}
