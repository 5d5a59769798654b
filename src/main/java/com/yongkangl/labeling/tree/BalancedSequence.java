package com.yongkangl.labeling.tree;

import java.util.Arrays;

/**
 * A pre-order depth sequence re-rooted at the center, with the original index of every position.
 */
public class BalancedSequence {
    private final int[] distances;
    private final int[] origins;

    public BalancedSequence(int[] distances, int[] origins) {
        if (distances.length != origins.length) {
            throw new IllegalArgumentException("Distances and origins must have the same length.");
        }
        this.distances = distances;
        this.origins = origins;
    }

    public int[] getDistances() {
        return distances.clone();
    }

    /** Original pre-order index of the node at the given balanced position. */
    public int getOrigin(int position) {
        return origins[position];
    }

    /** Balanced position of every original index. */
    public int[] positionsByOrigin() {
        int[] positions = new int[origins.length];
        for (int i = 0; i < origins.length; i++) {
            positions[origins[i]] = i;
        }
        return positions;
    }

    public int length() {
        return distances.length;
    }

    @Override
    public String toString() {
        return Arrays.toString(distances);
    }
}
