package com.yongkangl.labeling.tree;

import com.yongkangl.labeling.io.SequenceValidator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RebalancerTest {

    private static BalancedSequence balance(int... sequence) {
        return Rebalancer.balance(sequence, CenterLocator.findCenters(sequence));
    }

    private static int[] origins(BalancedSequence balanced) {
        int[] origins = new int[balanced.length()];
        for (int i = 0; i < origins.length; i++) {
            origins[i] = balanced.getOrigin(i);
        }
        return origins;
    }

    @Test
    void rootThatIsTheCenterStaysPut() {
        BalancedSequence balanced = balance(0, 1, 1, 1);

        assertThat(balanced.getDistances()).containsExactly(0, 1, 1, 1);
        assertThat(origins(balanced)).containsExactly(0, 1, 2, 3);
    }

    @Test
    void singleCenterBecomesTheRoot() {
        BalancedSequence balanced = balance(0, 1, 2);

        assertThat(balanced.getDistances()).containsExactly(0, 1, 1);
        assertThat(origins(balanced)).containsExactly(1, 2, 0);
        assertThat(balanced.positionsByOrigin()).containsExactly(2, 0, 1);
    }

    @Test
    void ancestorsAreReattachedLevelByLevel() {
        BalancedSequence balanced = balance(0, 1, 2, 3, 4);

        assertThat(balanced.getDistances()).containsExactly(0, 1, 2, 1, 2);
        assertThat(origins(balanced)).containsExactly(2, 3, 4, 1, 0);
    }

    @Test
    void branchesAfterThePathComeFirstInReverseOrder() {
        BalancedSequence balanced = balance(0, 1, 2, 3, 2, 1);

        assertThat(balanced.getDistances()).containsExactly(0, 1, 2, 1, 1, 2);
        assertThat(origins(balanced)).containsExactly(1, 2, 3, 4, 0, 5);
    }

    @Test
    void secondCenterHeadsTheFirstBranch() {
        BalancedSequence lowerRoot = balance(0, 1, 1, 2);
        assertThat(lowerRoot.getDistances()).containsExactly(0, 1, 2, 1);
        assertThat(origins(lowerRoot)).containsExactly(0, 2, 3, 1);

        BalancedSequence path = balance(0, 1, 2, 3);
        assertThat(path.getDistances()).containsExactly(0, 1, 2, 1);
        assertThat(origins(path)).containsExactly(1, 2, 3, 0);

        BalancedSequence broom = balance(0, 1, 2, 2, 1, 2, 3);
        assertThat(broom.getDistances()).containsExactly(0, 1, 2, 3, 1, 2, 2);
        assertThat(origins(broom)).containsExactly(0, 4, 5, 6, 1, 2, 3);
    }

    @Test
    void balancedSequenceIsAValidTraversal() {
        int[] sequence = {0, 1, 2, 3, 4, 3, 2, 1, 2, 2, 3};
        BalancedSequence balanced = balance(sequence);

        assertThat(SequenceValidator.isProperTraversal(balanced.getDistances())).isTrue();
        assertThat(balanced.positionsByOrigin()).hasSize(sequence.length).doesNotHaveDuplicates();
    }
}
