package com.example.shiftrota.schedule.generation;

import com.example.shiftrota.roster.RosterEmployee;
import com.example.shiftrota.roster.RotationRules;
import com.example.shiftrota.roster.ShiftName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Partitions the month's non-floaters across shifts with a scored greedy search.
 * <p>
 * Each step places the (employee, shift) pair with the best score among all open pairs.
 * An attempt is accepted when no multi-member shift is made of a single rank; the whole
 * month is reshuffled and retried otherwise, and after the last attempt a plain round-robin
 * split is used instead.
 */
final class FixedStaffAssigner {

    static final int ROTATION_PENALTY = -1000;
    static final int DIVERSITY_BONUS = 50;
    static final int LOAD_WEIGHT = 10;

    private final int maxAttempts;

    FixedStaffAssigner(int maxAttempts) {
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    Result assign(List<RosterEmployee> pool,
                  List<ShiftName> shifts,
                  int peoplePerShift,
                  boolean multiRankTeam,
                  Map<RosterEmployee, EmployeeMonthlyState> states,
                  Random random) {
        Attempt best = null;
        int attempts = 0;
        for (int i = 0; i < maxAttempts; i++) {
            attempts++;
            List<RosterEmployee> order = i == 0 ? shuffledWithinRank(pool, states, random) : shuffled(pool, random);
            Attempt attempt = greedy(order, shifts, peoplePerShift, states);
            if (!isDiverse(attempt.teams(), states, multiRankTeam)) {
                continue;
            }
            if (attempt.penalties() == 0) {
                return new Result(attempt.teams(), attempts, false);
            }
            if (best == null || attempt.penalties() < best.penalties()) {
                best = attempt;
            }
        }
        if (best != null) {
            return new Result(best.teams(), attempts, false);
        }
        return new Result(roundRobin(pool, shifts, states), attempts, true);
    }

    private Attempt greedy(List<RosterEmployee> order,
                           List<ShiftName> shifts,
                           int peoplePerShift,
                           Map<RosterEmployee, EmployeeMonthlyState> states) {
        Map<ShiftName, List<RosterEmployee>> teams = emptyTeams(shifts);
        List<RosterEmployee> remaining = new ArrayList<>(order);
        int capacity = shifts.size() * peoplePerShift;
        int placed = 0;
        int penalties = 0;
        while (!remaining.isEmpty()) {
            boolean allFull = placed >= capacity;
            RosterEmployee bestEmployee = null;
            ShiftName bestShift = null;
            int bestScore = Integer.MIN_VALUE;
            for (RosterEmployee candidate : remaining) {
                for (ShiftName shift : shifts) {
                    List<RosterEmployee> team = teams.get(shift);
                    if (!allFull && team.size() >= peoplePerShift) {
                        continue;
                    }
                    int score = score(candidate, shift, team, peoplePerShift, states);
                    if (score > bestScore) {
                        bestScore = score;
                        bestEmployee = candidate;
                        bestShift = shift;
                    }
                }
            }
            teams.get(bestShift).add(bestEmployee);
            remaining.remove(bestEmployee);
            placed++;
            if (violatesRotation(states.get(bestEmployee), bestShift)) {
                penalties++;
            }
        }
        return new Attempt(teams, penalties);
    }

    static int score(RosterEmployee candidate,
                     ShiftName shift,
                     List<RosterEmployee> team,
                     int peoplePerShift,
                     Map<RosterEmployee, EmployeeMonthlyState> states) {
        EmployeeMonthlyState state = states.get(candidate);
        int score = 0;
        if (violatesRotation(state, shift)) {
            score += ROTATION_PENALTY;
        }
        boolean rankPresent = team.stream().anyMatch(m -> states.get(m).rank() == state.rank());
        if (!rankPresent) {
            score += DIVERSITY_BONUS;
        }
        score += LOAD_WEIGHT * (peoplePerShift - team.size());
        return score;
    }

    /**
     * Staying on the current shift is a violation once the stability duration is used up.
     * For rank 3 and below the duration is one month, so any repeat of last month's shift counts.
     */
    static boolean violatesRotation(EmployeeMonthlyState state, ShiftName shift) {
        return state.currentShift() == shift
                && state.consecutiveMonthsOnShift() > 0
                && RotationRules.mustRotate(state.rank(), state.consecutiveMonthsOnShift());
    }

    static boolean isDiverse(Map<ShiftName, List<RosterEmployee>> teams,
                             Map<RosterEmployee, EmployeeMonthlyState> states,
                             boolean multiRankTeam) {
        if (!multiRankTeam) {
            return true;
        }
        for (List<RosterEmployee> team : teams.values()) {
            if (team.size() <= 1) {
                continue;
            }
            Set<Integer> ranks = team.stream().map(m -> states.get(m).rank()).collect(Collectors.toSet());
            if (ranks.size() == 1) {
                return false;
            }
        }
        return true;
    }

    private Map<ShiftName, List<RosterEmployee>> roundRobin(List<RosterEmployee> pool,
                                                           List<ShiftName> shifts,
                                                           Map<RosterEmployee, EmployeeMonthlyState> states) {
        Map<ShiftName, List<RosterEmployee>> teams = emptyTeams(shifts);
        List<RosterEmployee> ordered = new ArrayList<>(pool);
        ordered.sort(Comparator.comparingInt(e -> states.get(e).rank()));
        for (int i = 0; i < ordered.size(); i++) {
            teams.get(shifts.get(i % shifts.size())).add(ordered.get(i));
        }
        return teams;
    }

    private static List<RosterEmployee> shuffledWithinRank(List<RosterEmployee> pool,
                                                           Map<RosterEmployee, EmployeeMonthlyState> states,
                                                           Random random) {
        Map<Integer, List<RosterEmployee>> byRank = new TreeMap<>();
        for (RosterEmployee employee : pool) {
            byRank.computeIfAbsent(states.get(employee).rank(), r -> new ArrayList<>()).add(employee);
        }
        List<RosterEmployee> order = new ArrayList<>();
        for (List<RosterEmployee> group : byRank.values()) {
            Collections.shuffle(group, random);
            order.addAll(group);
        }
        return order;
    }

    private static List<RosterEmployee> shuffled(List<RosterEmployee> pool, Random random) {
        List<RosterEmployee> order = new ArrayList<>(pool);
        Collections.shuffle(order, random);
        return order;
    }

    private static Map<ShiftName, List<RosterEmployee>> emptyTeams(List<ShiftName> shifts) {
        Map<ShiftName, List<RosterEmployee>> teams = new LinkedHashMap<>();
        for (ShiftName shift : shifts) {
            teams.put(shift, new ArrayList<>());
        }
        return teams;
    }

    private record Attempt(Map<ShiftName, List<RosterEmployee>> teams, int penalties) {
    }

    record Result(Map<ShiftName, List<RosterEmployee>> teams, int attempts, boolean roundRobinFallback) {
    }
}
