package com.demo.lending.service;

import com.demo.lending.domain.LoanEventType;
import com.demo.lending.domain.LoanLifecycleEvent;
import com.demo.lending.repository.LedgerEventRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;

@Component
@RequiredArgsConstructor
public class LoanEventPublisher {

    private final LedgerEventRepository events;
    private final ApplicationEventPublisher publisher;

    /** Must be called inside a ledger write; listeners see the event only once it commits. */
    public LoanLifecycleEvent emit(long loanId, LoanEventType type, String actor,
                                   BigInteger amount, String detail, Instant at) {
        LoanLifecycleEvent event = events.append(loanId, type, actor, amount, detail, at);
        publisher.publishEvent(event);
        return event;
    }
}
