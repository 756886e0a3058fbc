package com.demo.lending.service;

import com.demo.lending.domain.LoanLifecycleEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hand-off point to the notification collaborator. Runs after commit, so a failed
 * delivery can never undo a ledger write.
 */
@Slf4j
@Component
public class LoanNotificationRelay {

    private final AtomicLong relayed = new AtomicLong();
    private volatile long lastSequence = -1;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onLifecycleEvent(LoanLifecycleEvent e) {
        relayed.incrementAndGet();
        lastSequence = e.sequence();
        log.info("loan {} {} actor={} amount={} {}", e.loanId(), e.type(), e.actor(),
                e.amount() == null ? "-" : e.amount(), e.detail() == null ? "" : e.detail());
    }

    public long relayedCount() {
        return relayed.get();
    }

    public long lastSequence() {
        return lastSequence;
    }
}
