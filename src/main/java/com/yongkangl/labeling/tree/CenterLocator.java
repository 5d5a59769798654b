package com.yongkangl.labeling.tree;

import org.apache.commons.math3.util.Pair;

import java.util.ArrayList;
import java.util.List;

public final class CenterLocator {
    private CenterLocator() {
    }

    /**
     * Finds the center of a free tree given by its pre-order traversal. A center is a node whose
     * largest distance from every other node is minimal, therefore a tree has one or two of them.
     * <p>
     * Leaves are peeled off the traversal round by round until at most two positions remain. A
     * position is a leaf when its successor is not deeper; the current root is a leaf when it has
     * fewer than two children left.
     *
     * @return (distance, original index) pairs of the center(s), ordered by index
     */
    public static List<Pair<Integer, Integer>> findCenters(int[] sequence) {
        List<Pair<Integer, Integer>> remaining = new ArrayList<>(sequence.length);
        for (int i = 0; i < sequence.length; i++) {
            remaining.add(new Pair<>(sequence[i], i));
        }
        while (remaining.size() > 2) {
            int rootChildren = 0;
            int rootChildDistance = remaining.get(0).getFirst() + 1;
            int i = 0;
            while (i < remaining.size()) {
                int distance = remaining.get(i).getFirst();
                if (distance == rootChildDistance) {
                    rootChildren++;
                }
                if (i == remaining.size() - 1 || remaining.get(i + 1).getFirst() <= distance) {
                    remaining.remove(i);
                } else {
                    i++;
                }
            }
            if (rootChildren < 2) {
                remaining.remove(0);
            }
        }
        return remaining;
    }
}
