package com.yongkangl.labeling.tree;

import com.yongkangl.labeling.io.RootedTree;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EquivalenceTreeBuilderTest {

    @Test
    void starCollapsesIntoOneRun() {
        RootedTree tree = RootedTree.fromSequence(new int[]{0, 1, 1, 1});
        EquivalenceTree equivalenceTree = EquivalenceTreeBuilder.build(tree, 1);

        assertThat(equivalenceTree.size()).isEqualTo(2);
        assertThat(equivalenceTree.getNode(EquivalenceTree.ROOT).getChildren()).containsExactly(1);
        assertThat(equivalenceTree.getNode(1).getMultiplicity()).isEqualTo(3);
        assertThat(tree.hasSuperRoot()).isFalse();
    }

    @Test
    void distinctBranchesKeepTheirOwnNodes() {
        RootedTree tree = RootedTree.fromSequence(new int[]{0, 1, 2, 3, 1, 2, 2});
        EquivalenceTree equivalenceTree = EquivalenceTreeBuilder.build(tree, 2);

        assertThat(tree.hasSuperRoot()).isFalse();
        assertThat(equivalenceTree.size()).isEqualTo(6);
        assertThat(equivalenceTree.getNode(EquivalenceTree.ROOT).getChildren()).containsExactly(1, 4);
        assertThat(equivalenceTree.getNode(4).getChildren()).containsExactly(5);
        assertThat(equivalenceTree.getNode(5).getMultiplicity()).isEqualTo(2);
        assertThat(equivalenceTree.depth()).isEqualTo(3);
    }

    @Test
    void symmetricTreeGetsASuperRoot() {
        RootedTree tree = RootedTree.fromSequence(new int[]{0, 1, 2, 1});
        EquivalenceTree equivalenceTree = EquivalenceTreeBuilder.build(tree, 2);

        assertThat(tree.hasSuperRoot()).isTrue();
        assertThat(tree.getRoot()).isEqualTo(4);
        assertThat(tree.getNode(4).getChildren()).containsExactly(0, 1);
        assertThat(equivalenceTree.getNode(EquivalenceTree.ROOT).getChildren()).containsExactly(1);
        assertThat(equivalenceTree.getNode(1).getMultiplicity()).isEqualTo(2);
        assertThat(equivalenceTree.getNode(2).getMultiplicity()).isEqualTo(1);
        assertThat(equivalenceTree.size()).isEqualTo(3);
    }

    @Test
    void labelsAreResetAfterwards() {
        RootedTree tree = RootedTree.fromSequence(new int[]{0, 1, 1});
        tree.getNode(2).setLabel(1);
        EquivalenceTreeBuilder.build(tree, 1);

        assertThat(tree.getLabel(2)).isZero();
    }

    @Test
    void equivalenceTreeIsNeverLargerThanTheTree() {
        RootedTree tree = RootedTree.fromSequence(new int[]{0, 1, 2, 2, 1, 2, 2, 1, 2});
        EquivalenceTree equivalenceTree = EquivalenceTreeBuilder.build(tree, 1);

        assertThat(equivalenceTree.size()).isLessThanOrEqualTo(tree.size());
        assertThat(equivalenceTree.getNode(EquivalenceTree.ROOT).getChildren()).hasSize(2);
    }
}
