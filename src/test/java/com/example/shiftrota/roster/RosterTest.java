package com.example.shiftrota.roster;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.shiftrota.TestRosters.employee;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RosterTest {

    @Test
    void ranksAreRelativeToLevelsPresentInTeam() {
        Roster roster = Roster.of(List.of(
                employee(1, "Ana", 9),
                employee(2, "Ben", 4),
                employee(3, "Cai", 7),
                employee(4, "Dee", 9)));

        assertThat(roster.distinctLevels()).containsExactly(4, 7, 9);
        assertThat(roster.rankCount()).isEqualTo(3);
        assertThat(roster.rankOfName("Ben")).contains(1);
        assertThat(roster.rankOfName("Cai")).contains(2);
        assertThat(roster.rankOfName("Ana")).contains(3);
        assertThat(roster.stabilityTable()).containsEntry(1, 3).containsEntry(2, 2).containsEntry(3, 1);
    }

    @Test
    void of_sortsByLevelKeepingInputOrderWithinLevel() {
        Roster roster = Roster.of(List.of(
                employee(1, "Ana", 3),
                employee(2, "Ben", 1),
                employee(3, "Cai", 3),
                employee(4, "Dee", 2)));

        assertThat(roster.employees()).extracting(RosterEmployee::name)
                .containsExactly("Ben", "Dee", "Ana", "Cai");
    }

    @Test
    void of_dropsRepeatedMembers() {
        Roster roster = Roster.of(List.of(
                employee(1, "Ana", 1),
                employee(1, "Ana", 1),
                employee(2, "Ben", 2)));

        assertThat(roster.size()).isEqualTo(2);
    }

    @Test
    void sharedNames_resolveToMostSeniorMember() {
        Roster roster = Roster.of(List.of(
                employee(1, "Ana", 3),
                employee(2, "Ana", 1),
                employee(3, "Ben", 2)));

        assertThat(roster.size()).isEqualTo(3);
        assertThat(roster.sharedNames()).containsExactly("Ana");
        assertThat(roster.rankOfName("Ana")).contains(1);
    }

    @Test
    void unknownEmployeeHasNoRank() {
        Roster roster = Roster.of(List.of(employee(1, "Ana", 1)));

        assertThat(roster.rankOfName("Zed")).isEmpty();
        assertThat(roster.rankOfName(null)).isEmpty();
        assertThatThrownBy(() -> roster.rankOfLevel(5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void floaterEligibilityFollowsTeamRank() {
        RosterEmployee senior = employee(1, "Ana", 5);
        RosterEmployee junior = employee(2, "Ben", 6);
        Roster roster = Roster.of(List.of(senior, junior));

        assertThat(roster.isFloaterEligible(senior)).isFalse();
        assertThat(roster.isFloaterEligible(junior)).isTrue();
        assertThat(roster.stabilityMonthsOf(junior)).isEqualTo(2);
    }

    @Test
    void emptyRoster() {
        assertThat(Roster.of(List.of()).isEmpty()).isTrue();
        assertThat(Roster.of(null).rankCount()).isZero();
    }
}
