package com.example.shiftrota.schedule;

import com.example.shiftrota.exception.BusinessException;
import com.example.shiftrota.exception.ScheduleFormatException;
import com.example.shiftrota.exception.ScheduleGenerationException;
import com.example.shiftrota.oracle.OracleReport;
import com.example.shiftrota.oracle.RuleCheckOracle;
import com.example.shiftrota.oracle.SchedulingRules;
import com.example.shiftrota.roster.RosterAssembler;
import com.example.shiftrota.roster.TeamRoster;
import com.example.shiftrota.schedule.generation.AssignmentGenerator;
import com.example.shiftrota.schedule.generation.GenerationResult;
import com.example.shiftrota.schedule.generation.MonthDiagnostics;
import com.example.shiftrota.schedule.repair.RepairResult;
import com.example.shiftrota.schedule.repair.ScheduleRepairer;
import com.example.shiftrota.schedule.validation.ScheduleValidator;
import com.example.shiftrota.schedule.validation.ValidationReport;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Ties the engine to the stored schedules. Generation, repair and deletion of one team's
 * schedule run under that team's lock; loading and validation do not lock.
 */
@Service
public class ScheduleService {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleService.class);

    public static final String ALREADY_VALID = "No violations found, schedule is already valid.";
    static final int DEFAULT_MONTHS = 1;

    private final RosterAssembler rosterAssembler;
    private final AssignmentGenerator generator;
    private final ScheduleValidator validator;
    private final ScheduleRepairer repairer;
    private final ScheduleStore store;
    private final ViolationCache violationCache;
    private final TeamScheduleLocks locks;
    private final RuleCheckOracle oracle;
    private final ScheduleCsvExporter csvExporter;
    private final Executor scheduleExecutor;
    private final Clock clock;

    @Value("${rotation.generation.max-months:24}")
    private int maxMonths;
    @Value("${rotation.validation.timeout:PT5S}")
    private Duration validationTimeout;

    public ScheduleService(RosterAssembler rosterAssembler,
                           AssignmentGenerator generator,
                           ScheduleValidator validator,
                           ScheduleRepairer repairer,
                           ScheduleStore store,
                           ViolationCache violationCache,
                           TeamScheduleLocks locks,
                           RuleCheckOracle oracle,
                           ScheduleCsvExporter csvExporter,
                           @Qualifier("scheduleExecutor") Executor scheduleExecutor,
                           Clock clock) {
        this.rosterAssembler = rosterAssembler;
        this.generator = generator;
        this.validator = validator;
        this.repairer = repairer;
        this.store = store;
        this.violationCache = violationCache;
        this.locks = locks;
        this.oracle = oracle;
        this.csvExporter = csvExporter;
        this.scheduleExecutor = scheduleExecutor;
        this.clock = clock;
    }

    /**
     * Generates and stores a schedule for a team that has none.
     *
     * @param months number of months, {@value #DEFAULT_MONTHS} when null
     * @param seed   random seed, derived from the clock when null
     * @throws BusinessException            when the team already has a schedule
     * @throws ScheduleGenerationException  on a configuration error; nothing is stored
     */
    public GeneratedSchedule generate(Long teamId, Integer months, Long seed) {
        int monthCount = months == null ? DEFAULT_MONTHS : months;
        if (monthCount > maxMonths) {
            throw new ScheduleGenerationException(ScheduleGenerationException.INVALID_MONTHS,
                    "Number of months must not exceed " + maxMonths + ".", monthCount);
        }
        long effectiveSeed = seed == null ? clock.millis() : seed;
        TeamRoster team = rosterAssembler.load(teamId);

        return locks.withLock(teamId, () -> {
            if (store.exists(teamId)) {
                throw new BusinessException(BusinessException.SCHEDULE_EXISTS,
                        "A schedule for this team already exists. Delete it before generating a new one.", teamId);
            }
            GenerationResult result = generator.generate(team.configuration(), team.roster(), monthCount, effectiveSeed);
            store.put(teamId, result.schedule());
            ValidationReport report = validator.validate(result.schedule(), team.roster());
            violationCache.put(teamId, report);
            logger.info("Stored {}-month schedule for team {} ({} violation(s))",
                    monthCount, teamId, report.details().size());
            return new GeneratedSchedule(teamId, result.schedule(), report, result.seed(), result.months());
        });
    }

    /**
     * Stored schedule with a fresh validation report.
     */
    public StoredSchedule load(Long teamId) {
        TeamRoster team = rosterAssembler.load(teamId);
        String document = store.getDocument(teamId).orElseThrow(() -> notFound(teamId));
        Optional<Schedule> parsed = parse(teamId, document);
        if (parsed.isEmpty()) {
            return new StoredSchedule(teamId, Schedule.empty(), validator.validate(document, team.roster()));
        }
        Schedule schedule = parsed.get();
        ValidationReport report = validateWithDeadline(teamId,
                () -> validator.validate(schedule, team.roster()), true);
        return new StoredSchedule(teamId, schedule, withOracle(schedule, report));
    }

    public ValidationReport validate(Long teamId) {
        return load(teamId).validation();
    }

    /**
     * Validates a posted document against a team's roster. Nothing is stored or cached.
     */
    public ValidationReport validateDocument(Long teamId, JsonNode document) {
        TeamRoster team = rosterAssembler.load(teamId);
        Schedule schedule;
        try {
            schedule = ScheduleDocumentCodec.fromTree(document);
        } catch (ScheduleFormatException e) {
            return validator.validate(document, team.roster());
        }
        ValidationReport report = validateWithDeadline(teamId,
                () -> validator.validate(schedule, team.roster()), false);
        return withOracle(schedule, report);
    }

    public RepairOutcome repair(Long teamId) {
        TeamRoster team = rosterAssembler.load(teamId);
        return locks.withLock(teamId, () -> repairLocked(teamId, team));
    }

    private RepairOutcome repairLocked(Long teamId, TeamRoster team) {
        String document = store.getDocument(teamId).orElseThrow(() -> notFound(teamId));
        Optional<Schedule> parsed = parse(teamId, document);
        if (parsed.isEmpty()) {
            ValidationReport report = validator.validate(document, team.roster());
            return new RepairOutcome(new RepairResult(Schedule.empty(), List.of(), List.of(), report.violations(),
                    "Stored schedule could not be read; delete and regenerate it.", false), report);
        }
        Schedule schedule = parsed.get();
        ValidationReport before = validateWithDeadline(teamId,
                () -> validator.validate(schedule, team.roster()), true);
        if (before.valid()) {
            return new RepairOutcome(
                    new RepairResult(schedule, List.of(), List.of(), List.of(), ALREADY_VALID, true), before);
        }

        logger.info("Repairing schedule of team {}: {} violation(s), {} core",
                teamId, before.details().size(), before.coreCount());
        RepairResult result = repairer.repair(schedule, before.violations(), team.roster());
        if (!result.changed()) {
            return new RepairOutcome(result, before);
        }
        store.put(teamId, result.schedule());
        ValidationReport after = validator.validate(result.schedule(), team.roster());
        violationCache.put(teamId, after);
        return new RepairOutcome(result, after);
    }

    public void delete(Long teamId) {
        locks.withLock(teamId, () -> {
            if (!store.delete(teamId)) {
                throw notFound(teamId);
            }
            violationCache.evict(teamId);
            logger.info("Deleted schedule of team {}", teamId);
            return null;
        });
    }

    public ScheduleCsvExporter.CsvFile export(Long teamId) {
        TeamRoster team = rosterAssembler.load(teamId);
        return csvExporter.export(team.configuration().name(), readStored(teamId));
    }

    public ScheduleSummary summary(Long teamId) {
        rosterAssembler.load(teamId);
        return ScheduleSummary.of(teamId, readStored(teamId));
    }

    private Schedule readStored(Long teamId) {
        String document = store.getDocument(teamId).orElseThrow(() -> notFound(teamId));
        return parse(teamId, document).orElseThrow(() -> new BusinessException(BusinessException.SCHEDULE_UNREADABLE,
                "Stored schedule could not be read; delete and regenerate it.", teamId));
    }

    private Optional<Schedule> parse(Long teamId, String document) {
        try {
            return Optional.of(ScheduleDocumentCodec.read(document));
        } catch (ScheduleFormatException e) {
            logger.warn("Stored schedule of team {} is malformed: {}", teamId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Runs a validation on the schedule executor. Past the deadline the team's last cached
     * result is returned instead, marked as such.
     */
    private ValidationReport validateWithDeadline(Long teamId, Supplier<ValidationReport> task, boolean cache) {
        CompletableFuture<ValidationReport> future;
        try {
            future = CompletableFuture.supplyAsync(task, scheduleExecutor);
        } catch (RejectedExecutionException e) {
            logger.warn("Schedule executor saturated, validating team {} on the caller thread", teamId);
            future = CompletableFuture.completedFuture(task.get());
        }
        try {
            ValidationReport report = future.get(validationTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (cache) {
                violationCache.put(teamId, report);
            }
            return report;
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Validation of team {} exceeded {}", teamId, validationTimeout);
            return violationCache.get(teamId)
                    .map(cached -> cached.report().withNote("Validation exceeded " + validationTimeout
                            + "; showing the result checked at " + cached.checkedAt() + "."))
                    .orElseGet(() -> new ValidationReport(false, List.of(),
                            "Validation exceeded " + validationTimeout + " and no earlier result is available."));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Validation interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Validation failed for team " + teamId, e.getCause());
        }
    }

    private ValidationReport withOracle(Schedule schedule, ValidationReport report) {
        if (!oracle.isEnabled()) {
            return report;
        }
        OracleReport advisory = oracle.check(schedule, SchedulingRules.TEXT);
        if (!advisory.available()) {
            logger.warn("Rule-check oracle unavailable: {}", advisory.note());
        }
        return report.withNote(advisory.summary());
    }

    private static BusinessException notFound(Long teamId) {
        return new BusinessException(BusinessException.SCHEDULE_NOT_FOUND,
                "No schedule found for team " + teamId + ".", teamId);
    }

    public record GeneratedSchedule(Long teamId,
                                    Schedule schedule,
                                    ValidationReport validation,
                                    long seed,
                                    List<MonthDiagnostics> diagnostics) {
    }

    public record StoredSchedule(Long teamId, Schedule schedule, ValidationReport validation) {
    }

    public record RepairOutcome(RepairResult repair, ValidationReport validation) {
    }
}
