package com.yongkangl.labeling.tree;

import com.yongkangl.labeling.io.RootedTree;

import java.util.ArrayDeque;
import java.util.Deque;

public final class SymmetryDetector {
    /** Balanced id of the second center: the first node after the root. */
    public static final int PARTNER_CENTER = 1;

    private SymmetryDetector() {
    }

    /**
     * Finds out whether a sorted, bicentral tree is symmetric. The root is the first center and
     * node {@link #PARTNER_CENTER} the second one. Both halves (the edge between the centers
     * excluded) are traversed breadth-first in lock step; the tree is symmetric iff the two queues
     * always hold the same number of nodes and run out together.
     */
    public static boolean isSymmetric(RootedTree tree) {
        if (tree.getRealNodeCount() < 2) {
            return false;
        }
        int first = tree.getRoot();
        int second = PARTNER_CENTER;
        Deque<Integer> left = new ArrayDeque<>();
        for (int child : tree.getNode(first).getChildren()) {
            if (child != second) {
                left.add(child);
            }
        }
        Deque<Integer> right = new ArrayDeque<>(tree.getNode(second).getChildren());
        while (left.size() == right.size() && !left.isEmpty()) {
            left.addAll(tree.getNode(left.poll()).getChildren());
            right.addAll(tree.getNode(right.poll()).getChildren());
        }
        return left.isEmpty() && right.isEmpty();
    }
}
