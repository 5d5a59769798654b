package com.yongkangl.labeling.enumeration;

import com.yongkangl.labeling.io.RootedTree;
import com.yongkangl.labeling.io.TreeNode;
import com.yongkangl.labeling.tree.EquivalenceTree;

/**
 * Odometer over the labels of a canonical rooted tree. Sibling branches that share an
 * equivalence-tree node are kept in lock step, so every automorphism orbit of labelings is
 * visited exactly once. The tree is mutated in place; one instance per enumeration session.
 */
public class LabelingEnumerator {
    private final RootedTree tree;
    private final EquivalenceTree equivalenceTree;
    private final int[] alphabetSizes;

    /**
     * @param alphabetSizes number of labels available to each node id, super-root included
     */
    public LabelingEnumerator(RootedTree tree, EquivalenceTree equivalenceTree, int[] alphabetSizes) {
        if (alphabetSizes.length != tree.size()) {
            throw new IllegalArgumentException("Expected " + tree.size() + " alphabet sizes, got " + alphabetSizes.length);
        }
        this.tree = tree;
        this.equivalenceTree = equivalenceTree;
        this.alphabetSizes = alphabetSizes;
    }

    /**
     * Moves to the next labeling.
     * @return false once every labeling has been generated; a symmetric tree is done as soon as
     * its super-root would get a nonzero label, because that only swaps the two halves
     */
    public boolean advance() {
        int root = tree.getRoot();
        if (!advance(root, EquivalenceTree.ROOT)) {
            return false;
        }
        return !(tree.hasSuperRoot() && tree.getLabel(root) != 0);
    }

    private boolean advance(int id, int equivalentId) {
        TreeNode node = tree.getNode(id);
        int offset = 0;
        for (int run : equivalenceTree.getNode(equivalentId).getChildren()) {
            int multiplicity = equivalenceTree.getNode(run).getMultiplicity();
            for (int j = 0; j < multiplicity; j++) {
                int child = node.getChild(offset + j);
                if (tree.getLabel(child) < alphabetSizes[child] && advance(child, run)) {
                    // the equivalent siblings before the advanced one follow its labeling
                    for (int k = 0; k < j; k++) {
                        tree.copyLabels(child, node.getChild(offset + k));
                    }
                    return true;
                }
            }
            offset += multiplicity;
        }

        node.setLabel(node.getLabel() + 1);
        if (node.getLabel() < alphabetSizes[id]) {
            for (int child : node.getChildren()) {
                tree.resetLabels(child);
            }
            return true;
        }
        node.setLabel(0);
        return false;
    }

    /** Current labels of the given node ids, in the given order. */
    public int[] labels(int[] ids) {
        int[] labels = new int[ids.length];
        for (int i = 0; i < ids.length; i++) {
            labels[i] = tree.getLabel(ids[i]);
        }
        return labels;
    }
}
