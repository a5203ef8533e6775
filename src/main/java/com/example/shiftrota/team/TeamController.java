package com.example.shiftrota.team;

import com.example.shiftrota.common.ApiResponse;
import com.example.shiftrota.roster.Roster;
import com.example.shiftrota.roster.RosterAssembler;
import com.example.shiftrota.roster.RosterEmployee;
import com.example.shiftrota.roster.TeamRoster;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/teams")
public class TeamController {

    private final TeamRepository teamRepository;
    private final RosterAssembler rosterAssembler;

    public TeamController(TeamRepository teamRepository, RosterAssembler rosterAssembler) {
        this.teamRepository = teamRepository;
        this.rosterAssembler = rosterAssembler;
    }

    @GetMapping
    @Transactional(readOnly = true)
    public ResponseEntity<ApiResponse<List<TeamView>>> listTeams() {
        List<TeamView> teams = teamRepository.findAll().stream()
                .sorted(Comparator.comparing(Team::getId))
                .map(t -> new TeamView(t.getId(), t.getName(), t.getShiftTemplate(), t.getPeoplePerShift(),
                        t.getMembers().size()))
                .toList();
        return ResponseEntity.ok(ApiResponse.success("Teams", teams, Map.of("count", teams.size())));
    }

    @GetMapping("/{teamId}/roster")
    public ResponseEntity<ApiResponse<RosterView>> roster(@PathVariable Long teamId) {
        TeamRoster team = rosterAssembler.load(teamId);
        Roster roster = team.roster();
        List<RosterView.Member> members = roster.employees().stream()
                .map(e -> member(roster, e))
                .toList();
        RosterView view = new RosterView(teamId, team.configuration().name(), team.configuration().shiftTemplate(),
                team.configuration().peoplePerShift(), roster.stabilityTable(), members);
        return ResponseEntity.ok(ApiResponse.success("Team roster", view, Map.of("ranks", roster.rankCount())));
    }

    private static RosterView.Member member(Roster roster, RosterEmployee employee) {
        return new RosterView.Member(employee.id(), employee.name(), employee.designation(),
                employee.seniorityLevel(), roster.rankOf(employee), roster.stabilityMonthsOf(employee),
                roster.isFloaterEligible(employee));
    }

    public record TeamView(Long id, String name, String shiftTemplate, Integer peoplePerShift, int memberCount) {
    }

    public record RosterView(Long teamId,
                             String name,
                             String shiftTemplate,
                             int peoplePerShift,
                             Map<Integer, Integer> stabilityMonthsByRank,
                             List<Member> members) {

        public record Member(Long id,
                             String name,
                             String designation,
                             int level,
                             int rank,
                             int stabilityMonths,
                             boolean floaterEligible) {
        }
    }
}
