package com.example.shiftrota.schedule.generation;

import com.example.shiftrota.roster.Roster;
import com.example.shiftrota.roster.RosterEmployee;
import com.example.shiftrota.roster.RotationRules;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Picks the month's floaters: never rank 1, preferably not someone who floated last month,
 * longest-waiting first and more senior first on ties.
 */
final class FloaterSelector {

    private FloaterSelector() {
    }

    static Selection select(Roster roster, Map<RosterEmployee, EmployeeMonthlyState> states, int required) {
        if (required <= 0) {
            return new Selection(List.of(), List.of());
        }
        Comparator<RosterEmployee> byFairness = Comparator
                .comparingInt((RosterEmployee e) -> -states.get(e).monthsSinceFloater())
                .thenComparingInt(e -> states.get(e).rank());

        List<RosterEmployee> preferred = new ArrayList<>();
        List<RosterEmployee> floatedLastMonth = new ArrayList<>();
        for (RosterEmployee employee : roster.employees()) {
            EmployeeMonthlyState state = states.get(employee);
            if (!RotationRules.isFloaterEligible(state.rank())) {
                continue;
            }
            if (state.wasFloaterLastMonth()) {
                floatedLastMonth.add(employee);
            } else {
                preferred.add(employee);
            }
        }
        preferred.sort(byFairness);
        if (preferred.size() >= required) {
            return new Selection(List.copyOf(preferred.subList(0, required)), List.of());
        }

        floatedLastMonth.sort(byFairness);
        int missing = Math.min(required - preferred.size(), floatedLastMonth.size());
        List<RosterEmployee> backfill = floatedLastMonth.subList(0, missing);
        List<RosterEmployee> chosen = new ArrayList<>(preferred);
        chosen.addAll(backfill);
        return new Selection(List.copyOf(chosen), List.copyOf(backfill));
    }

    record Selection(List<RosterEmployee> floaters, List<RosterEmployee> backfilled) {
    }
}
