package com.example.shiftrota.common.error;

import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Most recent unhandled failures, newest first, for the admin error-log endpoint.
 * Each entry names the request that failed and, for team-scoped endpoints, the team.
 */
@Component
public class ErrorLogBuffer {
    private static final int MAX_ENTRIES = 200;
    private static final Pattern TEAM_PATH = Pattern.compile("/api/teams/(\\d+)(?:/|$)");

    private final Deque<Entry> deque = new ConcurrentLinkedDeque<>();

    /**
     * @param request e.g. {@code POST /api/teams/3/schedule/repair}; the team id is taken from it
     */
    public void addError(String request, Throwable t) {
        String r = request == null ? "" : request;
        String detail = t == null ? "" : (t.getClass().getName() + ": " + t.getMessage());
        deque.addFirst(new Entry(LocalDateTime.now(), r, teamIdOf(r), detail));
        while (deque.size() > MAX_ENTRIES) deque.removeLast();
    }

    public List<Entry> recent() {
        return new ArrayList<>(deque);
    }

    public void clear() {
        deque.clear();
    }

    static Long teamIdOf(String request) {
        Matcher m = TEAM_PATH.matcher(request);
        if (!m.find()) {
            return null;
        }
        try {
            return Long.valueOf(m.group(1));
        } catch (NumberFormatException e) {
            // more digits than a team id can hold
            return null;
        }
    }

    public record Entry(LocalDateTime time, String request, Long teamId, String detail) {}
}
