package com.demo.lending.controller;

import com.demo.lending.monitor.LedgerHealth;
import com.demo.lending.monitor.LiquidationMonitor;
import com.demo.lending.monitor.MonitorStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/liquidation")
@RequiredArgsConstructor
public class LiquidationController {

    private final LiquidationMonitor monitor;

    @GetMapping("/status")
    public MonitorStatus status() {
        return monitor.status();
    }

    // Runs one cycle now; answers 409 if a cycle is already running or the ledger is down
    @PostMapping("/check")
    public ResponseEntity<Object> check() {
        return monitor.runCycle()
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(409).body(Map.of(
                        "skipped", true,
                        "running", monitor.isRunning())));
    }

    @PostMapping("/start")
    public MonitorStatus start() {
        monitor.start();
        return monitor.status();
    }

    @PostMapping("/stop")
    public MonitorStatus stop() {
        monitor.stop();
        return monitor.status();
    }

    @GetMapping("/health")
    public ResponseEntity<LedgerHealth> health() {
        LedgerHealth h = monitor.health();
        return ResponseEntity.status(h.healthy() ? 200 : 503).body(h);
    }
}
