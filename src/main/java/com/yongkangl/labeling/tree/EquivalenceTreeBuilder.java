package com.yongkangl.labeling.tree;

import com.yongkangl.labeling.io.RootedTree;
import com.yongkangl.labeling.io.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

public final class EquivalenceTreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(EquivalenceTreeBuilder.class);

    private EquivalenceTreeBuilder() {
    }

    /**
     * Brings a balanced tree into canonical form and returns its equivalence tree, which holds
     * every automorphism of the tree with the proper multiplicity. A bicentral tree whose halves
     * are symmetric first gets a synthetic super-root above its two centers. All labels are reset
     * to 0 afterwards.
     *
     * @param centerCount number of centers the balanced tree was rooted at
     */
    public static EquivalenceTree build(RootedTree tree, int centerCount) {
        CanonicalSorter.sort(tree, tree.getRoot());
        if (centerCount == 2 && SymmetryDetector.isSymmetric(tree)) {
            int superRoot = tree.addSuperRoot(SymmetryDetector.PARTNER_CENTER);
            CanonicalSorter.sort(tree, superRoot);
            logger.debug("Symmetric tree, super-root {} added above both centers", superRoot);
        }

        EquivalenceTree equivalenceTree = new EquivalenceTree();
        collapse(tree, equivalenceTree, tree.getRoot(), EquivalenceTree.ROOT);
        tree.resetLabels(tree.getRoot());
        logger.debug("Equivalence tree has {} of {} nodes", equivalenceTree.size(), tree.size());
        return equivalenceTree;
    }

    private static void collapse(RootedTree tree, EquivalenceTree equivalenceTree, int id, int equivalentId) {
        TreeNode node = tree.getNode(id);
        int i = 0;
        while (i < node.getChildCount()) {
            int[] shape = tree.getNode(node.getChild(i)).getOrderVector();
            int j = i + 1;
            while (j < node.getChildCount() && Arrays.equals(tree.getNode(node.getChild(j)).getOrderVector(), shape)) {
                j++;
            }
            int run = equivalenceTree.addNode(equivalentId, j - i);
            collapse(tree, equivalenceTree, node.getChild(i), run);
            i = j;
        }
    }
}
