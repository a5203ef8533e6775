package com.example.shiftrota.roster;

import com.example.shiftrota.employee.Employee;
import com.example.shiftrota.team.Team;
import com.example.shiftrota.team.TeamRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a stored team and turns it into a fresh {@link TeamRoster} snapshot.
 */
@Component
public class RosterAssembler {

    private static final Logger logger = LoggerFactory.getLogger(RosterAssembler.class);

    private final TeamRepository teamRepository;

    public RosterAssembler(TeamRepository teamRepository) {
        this.teamRepository = teamRepository;
    }

    @Transactional(readOnly = true)
    public TeamRoster load(Long teamId) {
        Team team = teamRepository.findById(teamId)
                .orElseThrow(() -> new IllegalArgumentException("Team not found: " + teamId));
        return toTeamRoster(team);
    }

    public TeamRoster toTeamRoster(Team team) {
        List<RosterEmployee> members = new ArrayList<>();
        for (Employee employee : team.getMembers()) {
            if (employee.getDesignation() == null || employee.getDesignation().getHierarchyLevel() == null) {
                logger.warn("Employee {} in team {} has no designation level and is left out of the roster",
                        employee.getName(), team.getName());
                continue;
            }
            members.add(new RosterEmployee(
                    employee.getId(),
                    employee.getName(),
                    employee.getDesignation().getTitle(),
                    employee.getDesignation().getHierarchyLevel()));
        }
        int peoplePerShift = team.getPeoplePerShift() == null ? 0 : team.getPeoplePerShift();
        TeamConfiguration configuration = new TeamConfiguration(
                team.getId(), team.getName(), team.getShiftTemplate(), peoplePerShift);
        return new TeamRoster(configuration, Roster.of(members));
    }
}
