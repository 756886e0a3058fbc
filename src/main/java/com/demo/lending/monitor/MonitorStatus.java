package com.demo.lending.monitor;

public record MonitorStatus(
        boolean active,
        boolean running,
        long cyclesCompleted,
        String signer,
        String ledgerMode,
        boolean connectionLost,
        CycleReport lastCycle
) {}
