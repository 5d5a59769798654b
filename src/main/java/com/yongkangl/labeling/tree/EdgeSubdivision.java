package com.yongkangl.labeling.tree;

/**
 * Turns the edges of a tree into nodes, so that labeling the edges becomes labeling those nodes.
 * Every node at depth d moves to depth 2d and gets a new node at depth 2d-1 in front of it,
 * standing for the edge to its parent. Original node i ends up at index 2i; the edge above node
 * k+1 (edge k) at index 2k+1.
 */
public final class EdgeSubdivision {
    private EdgeSubdivision() {
    }

    public static int[] subdivide(int[] sequence) {
        int[] subdivided = new int[2 * sequence.length - 1];
        for (int i = 1; i < sequence.length; i++) {
            subdivided[2 * i - 1] = 2 * sequence[i] - 1;
            subdivided[2 * i] = 2 * sequence[i];
        }
        return subdivided;
    }

    public static boolean isEdgeNode(int index) {
        return index % 2 == 1;
    }
}
