package com.example.oncall.schedule;

import com.example.oncall.common.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/schedule")
public class ScheduleController {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleController.class);

    private final ScheduleService scheduleService;
    private final ScheduleCsvExporter csvExporter;

    public ScheduleController(ScheduleService scheduleService, ScheduleCsvExporter csvExporter) {
        this.scheduleService = scheduleService;
        this.csvExporter = csvExporter;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<WeekAssignment>>> getSchedule(
            @RequestParam(name = "start", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(name = "weeks", required = false) Integer weeks) {
        ScheduleService.ScheduleRun run = scheduleService.generate(start, weeks);
        Schedule schedule = run.schedule();

        Map<String, Object> meta = new LinkedHashMap<>();
        if (!schedule.isEmpty()) {
            meta.put("start", schedule.firstDay().toString());
            meta.put("end", schedule.lastDay().toString());
        }
        meta.put("weeks", schedule.size());
        meta.put("rosterSize", run.roster().size());
        meta.put("unassigned", schedule.unassignedCount());
        meta.put("members", run.summary().members());
        logger.debug("GET /api/schedule start={} weeks={} -> {} week(s)", start, weeks, schedule.size());
        return ResponseEntity.ok(ApiResponse.success("On-call schedule generated", schedule.weeks(), meta));
    }

    @GetMapping(value = "/export/csv", produces = "text/csv")
    public ResponseEntity<byte[]> exportCsv(
            @RequestParam(name = "start", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(name = "weeks", required = false) Integer weeks) {
        Schedule schedule = scheduleService.generate(start, weeks).schedule();
        ScheduleCsvExporter.CsvFile file = csvExporter.export(schedule);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + file.filename() + "\"")
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(file.data());
    }
}
