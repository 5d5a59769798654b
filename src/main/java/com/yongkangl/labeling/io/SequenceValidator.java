package com.yongkangl.labeling.io;

import org.apache.commons.lang3.ArrayUtils;

import java.util.List;

public final class SequenceValidator {
    private static final String INVALID_SEQUENCE =
            "The given object should be a nonempty list that contains a valid pre-order traversal of a free-tree";

    private SequenceValidator() {
    }

    /**
     * Determines whether the given depths form a valid nonempty pre-order traversal of a tree:
     * the first depth is 0, every later depth is at least 1 (a single root) and no step goes
     * more than one level deeper.
     */
    public static boolean isProperTraversal(int[] sequence) {
        if (sequence == null || sequence.length == 0 || sequence[0] != 0) {
            return false;
        }
        for (int i = 1; i < sequence.length; i++) {
            if (sequence[i] < 1 || sequence[i] > sequence[i - 1] + 1) {
                return false;
            }
        }
        return true;
    }

    public static int[] requireValidSequence(int[] sequence) {
        if (!isProperTraversal(sequence)) {
            throw new InvalidTreeDescriptionException(INVALID_SEQUENCE + ": " + describe(sequence));
        }
        return sequence.clone();
    }

    public static int[] requireValidSequence(List<Integer> sequence) {
        if (sequence == null) {
            throw new InvalidTreeDescriptionException(INVALID_SEQUENCE + ": null");
        }
        for (int i = 0; i < sequence.size(); i++) {
            if (sequence.get(i) == null) {
                throw new InvalidTreeDescriptionException("Missing depth at position " + i + " of " + sequence);
            }
        }
        return requireValidSequence(ArrayUtils.toPrimitive(sequence.toArray(new Integer[0])));
    }

    public static int requireValidAlphabetSize(int maxLabel) {
        if (maxLabel <= 0) {
            throw new InvalidAlphabetSizeException("maxLabel should be a positive integer, got " + maxLabel);
        }
        return maxLabel;
    }

    private static String describe(int[] sequence) {
        return sequence == null ? "null" : ArrayUtils.toString(sequence);
    }
}
