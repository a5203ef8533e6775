package com.example.shiftrota.roster;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RotationRulesTest {

    @Test
    void stabilityMonths_shrinksWithRank() {
        assertThat(RotationRules.stabilityMonths(1)).isEqualTo(3);
        assertThat(RotationRules.stabilityMonths(2)).isEqualTo(2);
        assertThat(RotationRules.stabilityMonths(3)).isEqualTo(1);
        assertThat(RotationRules.stabilityMonths(7)).isEqualTo(1);
    }

    @Test
    void isFloaterEligible_excludesOnlyRankOne() {
        assertThat(RotationRules.isFloaterEligible(1)).isFalse();
        assertThat(RotationRules.isFloaterEligible(2)).isTrue();
        assertThat(RotationRules.isFloaterEligible(5)).isTrue();
    }

    @Test
    void mustRotate_onceStabilityMonthsAreUsed() {
        assertThat(RotationRules.mustRotate(1, 2)).isFalse();
        assertThat(RotationRules.mustRotate(1, 3)).isTrue();
        assertThat(RotationRules.mustRotate(3, 1)).isTrue();
        assertThat(RotationRules.mustRotate(3, 0)).isFalse();
    }

    @Test
    void exceedsStability_onlyBeyondTheLimit() {
        assertThat(RotationRules.exceedsStability(2, 2)).isFalse();
        assertThat(RotationRules.exceedsStability(2, 3)).isTrue();
        assertThat(RotationRules.exceedsStability(3, 2)).isTrue();
    }

    @Test
    void stabilityMonths_rejectsRankBelowOne() {
        assertThatThrownBy(() -> RotationRules.stabilityMonths(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
