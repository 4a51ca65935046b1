package io.jobcast4j.web;

import io.jobcast4j.JobScheduler;
import io.jobcast4j.core.Job;
import io.jobcast4j.core.Schedule;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/schedules")
public class ScheduleController {

    private final JobScheduler scheduler;

    public ScheduleController(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping
    public List<Job> list() {
        return scheduler.jobs();
    }

    @GetMapping("/running")
    public List<Job> running() {
        return scheduler.runningJobs();
    }

    @GetMapping("/{id}/{action}")
    public ResponseEntity<String> trigger(@PathVariable String id, @PathVariable String action) {
        switch (action) {
            case "run" -> scheduler.runJobById(id);
            case "stop" -> scheduler.stopJobById(id);
            default -> {
                return ResponseEntity.badRequest().body("Unknown action");
            }
        }
        return ResponseEntity.ok(action + " schedule in the background");
    }

    /**
     * Replace the schedule generation, as done whenever configuration is saved.
     */
    @PostMapping
    public ResponseEntity<String> replace(@RequestBody List<Schedule> schedules) {
        scheduler.rebuildSchedule(schedules == null ? List.of() : schedules);
        return ResponseEntity.ok("OK");
    }
}
