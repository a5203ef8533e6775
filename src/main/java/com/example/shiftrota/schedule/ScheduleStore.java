package com.example.shiftrota.schedule;

import com.example.shiftrota.exception.ScheduleFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Get, put and delete of the single stored schedule per team. Each call commits on its own
 * so a caller holding the team lock sees its write committed before releasing it.
 */
@Component
public class ScheduleStore {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleStore.class);

    private final SavedScheduleRepository repository;

    public ScheduleStore(SavedScheduleRepository repository) {
        this.repository = repository;
    }

    @Transactional(readOnly = true)
    public boolean exists(Long teamId) {
        return repository.existsByTeamId(teamId);
    }

    @Transactional(readOnly = true)
    public Optional<String> getDocument(Long teamId) {
        return repository.findByTeamId(teamId).map(SavedSchedule::getScheduleData);
    }

    /**
     * Parsed stored schedule. A stored document that no longer parses is reported, not hidden.
     */
    @Transactional(readOnly = true)
    public Optional<Schedule> get(Long teamId) throws ScheduleFormatException {
        Optional<String> document = getDocument(teamId);
        if (document.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ScheduleDocumentCodec.read(document.get()));
    }

    @Transactional
    public SavedSchedule put(Long teamId, Schedule schedule) {
        String json = ScheduleDocumentCodec.write(schedule);
        SavedSchedule saved = repository.findByTeamId(teamId)
                .map(existing -> {
                    existing.setScheduleData(json);
                    return existing;
                })
                .orElseGet(() -> new SavedSchedule(teamId, json));
        SavedSchedule result = repository.save(saved);
        logger.debug("Stored schedule for team {} ({} month(s))", teamId, schedule.monthCount());
        return result;
    }

    @Transactional
    public boolean delete(Long teamId) {
        return repository.deleteByTeamId(teamId) > 0;
    }
}
