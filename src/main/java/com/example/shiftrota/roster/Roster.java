package com.example.shiftrota.roster;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Seniority-ranked view of one team. Ranks are team-relative: rank 1 is the most senior
 * level actually present in the team, whatever its absolute level.
 * <p>
 * Instances are immutable snapshots built per call and never shared between generations.
 */
public final class Roster {

    private final List<RosterEmployee> employees;
    private final List<Integer> distinctLevels;
    private final Map<Integer, Integer> rankByLevel;
    private final Map<String, RosterEmployee> byName;
    private final List<String> sharedNames;

    private Roster(List<RosterEmployee> employees) {
        this.employees = List.copyOf(employees);
        this.distinctLevels = employees.stream()
                .map(RosterEmployee::seniorityLevel)
                .distinct()
                .sorted()
                .toList();
        Map<Integer, Integer> ranks = new TreeMap<>();
        for (int i = 0; i < distinctLevels.size(); i++) {
            ranks.put(distinctLevels.get(i), i + 1);
        }
        this.rankByLevel = Collections.unmodifiableMap(ranks);
        Map<String, RosterEmployee> names = new LinkedHashMap<>();
        Set<String> shared = new LinkedHashSet<>();
        for (RosterEmployee e : this.employees) {
            if (names.putIfAbsent(e.name(), e) != null) {
                shared.add(e.name());
            }
        }
        this.byName = Collections.unmodifiableMap(names);
        this.sharedNames = List.copyOf(shared);
    }

    /**
     * Builds a roster sorted by absolute seniority level. Employees sharing a level keep their
     * input order; repeated members (same id, or same name when no id) are dropped.
     */
    public static Roster of(Collection<RosterEmployee> members) {
        if (members == null || members.isEmpty()) {
            return new Roster(List.of());
        }
        Map<Object, RosterEmployee> unique = new LinkedHashMap<>();
        for (RosterEmployee member : members) {
            if (member != null) {
                unique.putIfAbsent(member.identity(), member);
            }
        }
        List<RosterEmployee> sorted = new ArrayList<>(unique.values());
        sorted.sort(Comparator.comparingInt(RosterEmployee::seniorityLevel));
        return new Roster(sorted);
    }

    /**
     * Names carried by more than one member. Lookups by name resolve to the most senior of them.
     */
    public List<String> sharedNames() {
        return sharedNames;
    }

    public boolean isEmpty() {
        return employees.isEmpty();
    }

    public int size() {
        return employees.size();
    }

    public List<RosterEmployee> employees() {
        return employees;
    }

    public List<Integer> distinctLevels() {
        return distinctLevels;
    }

    public int rankCount() {
        return distinctLevels.size();
    }

    public int rankOf(RosterEmployee employee) {
        return rankOfLevel(employee.seniorityLevel());
    }

    public int rankOfLevel(int level) {
        Integer rank = rankByLevel.get(level);
        if (rank == null) {
            throw new IllegalArgumentException("Seniority level " + level + " is not present in this roster");
        }
        return rank;
    }

    public int stabilityMonthsOf(RosterEmployee employee) {
        return RotationRules.stabilityMonths(rankOf(employee));
    }

    public boolean isFloaterEligible(RosterEmployee employee) {
        return RotationRules.isFloaterEligible(rankOf(employee));
    }

    /**
     * Stability duration per rank present in this team.
     */
    public Map<Integer, Integer> stabilityTable() {
        Map<Integer, Integer> table = new LinkedHashMap<>();
        for (int rank = 1; rank <= rankCount(); rank++) {
            table.put(rank, RotationRules.stabilityMonths(rank));
        }
        return table;
    }

    public int floaterExemptRank() {
        return RotationRules.FLOATER_EXEMPT_RANK;
    }

    public Optional<RosterEmployee> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * Rank of the named employee, if present.
     */
    public Optional<Integer> rankOfName(String name) {
        return findByName(name).map(this::rankOf);
    }
}
