package com.example.shiftrota.schedule.generation;

import com.example.shiftrota.TestRosters;
import com.example.shiftrota.roster.Roster;
import com.example.shiftrota.roster.RosterEmployee;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FloaterSelectorTest {

    private final Roster roster = TestRosters.demo();

    @Test
    void select_prefersSeniorEligibleOnFirstMonth() {
        FloaterSelector.Selection selection = FloaterSelector.select(roster, freshStates(), 4);

        assertThat(selection.floaters()).extracting(RosterEmployee::name)
                .containsExactly("Employee 04", "Employee 05", "Employee 06", "Employee 07");
        assertThat(selection.backfilled()).isEmpty();
    }

    @Test
    void select_backfillsFromLastMonthWhenFreshPoolIsShort() {
        Map<RosterEmployee, EmployeeMonthlyState> states = freshStates();
        FloaterSelector.Selection first = FloaterSelector.select(roster, states, 6);
        states.forEach((employee, state) -> {
            if (first.floaters().contains(employee)) {
                state.markFloater();
            } else {
                state.markNotFloater();
            }
        });

        FloaterSelector.Selection second = FloaterSelector.select(roster, states, 6);

        assertThat(second.floaters()).hasSize(6);
        assertThat(second.backfilled()).hasSize(3);
        assertThat(first.floaters()).containsAll(second.backfilled());
    }

    @Test
    void select_nothingRequired() {
        assertThat(FloaterSelector.select(roster, freshStates(), 0).floaters()).isEmpty();
    }

    private Map<RosterEmployee, EmployeeMonthlyState> freshStates() {
        Map<RosterEmployee, EmployeeMonthlyState> states = new LinkedHashMap<>();
        roster.employees().forEach(e -> states.put(e, new EmployeeMonthlyState(roster.rankOf(e))));
        return states;
    }
}
