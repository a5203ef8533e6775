package com.example.shiftrota.schedule;

import com.example.shiftrota.common.ApiResponse;
import com.example.shiftrota.schedule.generation.MonthDiagnostics;
import com.example.shiftrota.schedule.validation.ValidationReport;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class ScheduleController {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleController.class);

    private final ScheduleService scheduleService;

    public ScheduleController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @GetMapping("/teams/{teamId}/schedule")
    public ResponseEntity<ApiResponse<ScheduleService.StoredSchedule>> getSchedule(@PathVariable Long teamId) {
        ScheduleService.StoredSchedule stored = scheduleService.load(teamId);
        return ResponseEntity.ok(ApiResponse.success("Stored schedule", stored, validationMeta(stored.validation())));
    }

    @PostMapping("/teams/{teamId}/schedule")
    public ResponseEntity<ApiResponse<ScheduleService.GeneratedSchedule>> generateSchedule(
            @PathVariable Long teamId,
            @RequestParam(name = "months", required = false) Integer months,
            @RequestParam(name = "seed", required = false) Long seed) {
        ScheduleService.GeneratedSchedule generated = scheduleService.generate(teamId, months, seed);
        Map<String, Object> meta = validationMeta(generated.validation());
        meta.put("months", generated.schedule().monthCount());
        meta.put("seed", generated.seed());
        meta.put("roundRobinMonths", generated.diagnostics().stream().filter(MonthDiagnostics::roundRobinFallback).count());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("New schedule generated and saved.", generated, meta));
    }

    @PostMapping("/teams/{teamId}/schedule/validate")
    public ResponseEntity<ApiResponse<ValidationReport>> validateStored(@PathVariable Long teamId) {
        ValidationReport report = scheduleService.validate(teamId);
        return ResponseEntity.ok(ApiResponse.success(validationMessage(report), report, validationMeta(report)));
    }

    @PostMapping("/schedule/validate")
    public ResponseEntity<ApiResponse<ValidationReport>> validateDocument(@Valid @RequestBody ValidateScheduleRequest request) {
        ValidationReport report = scheduleService.validateDocument(request.teamId(), request.schedule());
        return ResponseEntity.ok(ApiResponse.success(validationMessage(report), report, validationMeta(report)));
    }

    @PostMapping("/teams/{teamId}/schedule/repair")
    public ResponseEntity<ApiResponse<ScheduleService.RepairOutcome>> repairSchedule(@PathVariable Long teamId) {
        ScheduleService.RepairOutcome outcome = scheduleService.repair(teamId);
        Map<String, Object> meta = validationMeta(outcome.validation());
        meta.put("changes", outcome.repair().changesMade().size());
        logger.debug("Repair of team {} answered: {}", teamId, outcome.repair().message());
        return ResponseEntity.ok(new ApiResponse<>(outcome.repair().success(), outcome.repair().message(), outcome, meta));
    }

    @DeleteMapping("/teams/{teamId}/schedule")
    public ResponseEntity<ApiResponse<Map<String, Object>>> deleteSchedule(@PathVariable Long teamId) {
        scheduleService.delete(teamId);
        return ResponseEntity.ok(ApiResponse.success("Schedule deleted.", Map.of("teamId", teamId)));
    }

    @GetMapping(value = "/teams/{teamId}/schedule/export", produces = "text/csv")
    public ResponseEntity<byte[]> exportCsv(@PathVariable Long teamId) {
        ScheduleCsvExporter.CsvFile file = scheduleService.export(teamId);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + file.filename() + "\"")
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(file.data());
    }

    @GetMapping("/teams/{teamId}/schedule/summary")
    public ResponseEntity<ApiResponse<ScheduleSummary>> summary(@PathVariable Long teamId) {
        ScheduleSummary summary = scheduleService.summary(teamId);
        return ResponseEntity.ok(ApiResponse.success("Schedule summary", summary,
                Map.of("employees", summary.employees().size())));
    }

    private static String validationMessage(ValidationReport report) {
        return report.valid() ? "Schedule is valid." : report.details().size() + " violation(s) found.";
    }

    private static Map<String, Object> validationMeta(ValidationReport report) {
        Map<String, Object> meta = new HashMap<>();
        meta.put("valid", report.valid());
        meta.put("violations", report.details().size());
        meta.put("coreViolations", report.coreCount());
        return meta;
    }

    public record ValidateScheduleRequest(
            @NotNull(message = "teamId is required") Long teamId,
            @NotNull(message = "schedule is required") JsonNode schedule) {
    }
}
