package com.example.shiftrota.roster;

/**
 * A team's configuration together with the roster snapshot it was read with.
 */
public record TeamRoster(TeamConfiguration configuration, Roster roster) {
}
