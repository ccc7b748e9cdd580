package com.reviewflow.controller;

import com.reviewflow.service.DeadlineMonitorResult;
import com.reviewflow.service.DeadlineMonitorScheduler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual trigger for the deadline sweep, for external cron runners.
 */
@RestController
@RequestMapping("/api/cron/deadline-monitor")
public class DeadlineMonitorController {

    private final DeadlineMonitorScheduler deadlineMonitorScheduler;

    public DeadlineMonitorController(DeadlineMonitorScheduler deadlineMonitorScheduler) {
        this.deadlineMonitorScheduler = deadlineMonitorScheduler;
    }

    @PostMapping
    public ResponseEntity<DeadlineMonitorResult> runSweep() {
        return ResponseEntity.ok(deadlineMonitorScheduler.runSweep());
    }
}
