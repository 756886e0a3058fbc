package com.demo.lending.controller;

import com.demo.lending.config.AdminTokenInterceptor;
import com.demo.lending.controller.dto.LoanDtos;
import com.demo.lending.domain.Addresses;
import com.demo.lending.domain.Contribution;
import com.demo.lending.domain.LoanLifecycleEvent;
import com.demo.lending.domain.RepaymentQuote;
import com.demo.lending.domain.SettlementReceipt;
import com.demo.lending.domain.Vote;
import com.demo.lending.monitor.SettlementSubmitter;
import com.demo.lending.service.ContributionLedger;
import com.demo.lending.service.LoanLifecycleService;
import com.demo.lending.service.LoanQueryService;
import com.demo.lending.service.SettlementService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/loans")
@RequiredArgsConstructor
public class LoanController {

    private final LoanLifecycleService lifecycle;
    private final ContributionLedger ledger;
    private final SettlementService settlement;
    private final LoanQueryService queries;
    private final SettlementSubmitter submitter;
    private final AdminTokenInterceptor admin;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public LoanDtos.LoanView request(@Valid @RequestBody LoanDtos.RequestLoan body) {
        return LoanDtos.LoanView.of(lifecycle.requestLoan(body.toRequest()));
    }

    @PostMapping("/{id}/contributions")
    public LoanDtos.LoanView contribute(@PathVariable long id, @Valid @RequestBody LoanDtos.Contribute body) {
        return LoanDtos.LoanView.of(ledger.contribute(id, body.lender, body.amount));
    }

    @PostMapping("/{id}/expire")
    public LoanDtos.LoanView expire(@PathVariable long id) {
        return LoanDtos.LoanView.of(ledger.expire(id));
    }

    @PostMapping("/{id}/refund")
    public LoanDtos.RefundResult refund(@PathVariable long id, @Valid @RequestBody LoanDtos.Refund body) {
        return new LoanDtos.RefundResult(id, body.lender, ledger.refund(id, body.lender));
    }

    @PostMapping("/{id}/repay")
    public LoanDtos.LoanView repay(@PathVariable long id, @Valid @RequestBody LoanDtos.Repay body) {
        return LoanDtos.LoanView.of(lifecycle.repay(id, body.payer, body.amount));
    }

    @PostMapping("/{id}/votes")
    public LoanDtos.LoanView vote(@PathVariable long id, @Valid @RequestBody LoanDtos.CastVote body) {
        return LoanDtos.LoanView.of(lifecycle.castVote(id, body.lender, body.choice));
    }

    @PostMapping("/{id}/liquidate")
    public SettlementReceipt liquidate(@PathVariable long id, @Valid @RequestBody LoanDtos.Liquidate body,
                                       HttpServletRequest request) {
        // The monitor's signing account is an operator identity.
        if (Addresses.normalize(body.caller).equals(Addresses.normalize(submitter.signerAddress()))) {
            admin.requireAdmin(request);
        }
        long sequence = body.sequence != null ? body.sequence : settlement.nextSequence(body.caller);
        return settlement.liquidate(id, body.caller, sequence);
    }

    @GetMapping("/{id}")
    public LoanDtos.LoanView get(@PathVariable long id) {
        return LoanDtos.LoanView.of(queries.getLoan(id));
    }

    @GetMapping("/active")
    public List<Long> active() {
        return queries.getActiveLoanIds();
    }

    @GetMapping("/{id}/contributions")
    public List<Contribution> contributions(@PathVariable long id) {
        return queries.getContributions(id);
    }

    @GetMapping("/{id}/votes")
    public List<Vote> votes(@PathVariable long id) {
        return queries.getVotes(id);
    }

    @GetMapping("/{id}/events")
    public List<LoanLifecycleEvent> events(@PathVariable long id) {
        return queries.getEvents(id);
    }

    @GetMapping("/{id}/repayment-quote")
    public RepaymentQuote repaymentQuote(@PathVariable long id) {
        return queries.repaymentQuote(id);
    }

    @GetMapping("/sequences/{account}")
    public Map<String, Object> sequence(@PathVariable String account) {
        return Map.of("account", account, "nextSequence", settlement.nextSequence(account));
    }
}
