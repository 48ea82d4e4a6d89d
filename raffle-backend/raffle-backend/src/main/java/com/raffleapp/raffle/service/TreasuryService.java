package com.raffleapp.raffle.service;

import com.raffleapp.common.exception.BadRequestException;
import com.raffleapp.common.exception.NotFoundException;
import com.raffleapp.common.exception.PayoutFailedException;
import com.raffleapp.raffle.domain.treasury.PayoutStatus;
import com.raffleapp.raffle.domain.treasury.PrizePayout;
import com.raffleapp.raffle.domain.treasury.TreasuryAccount;
import com.raffleapp.raffle.event.PayoutFailedEvent;
import com.raffleapp.raffle.payout.PayoutGateway;
import com.raffleapp.raffle.payout.PayoutGateway.TransferResult;
import com.raffleapp.raffle.repository.PrizePayoutRepository;
import com.raffleapp.raffle.repository.TreasuryAccountRepository;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Owns the pooled entry fees and every movement of prize money out of the raffle.
 */
@Slf4j
@Service
public class TreasuryService {

    private final TreasuryAccountRepository accountRepository;
    private final PrizePayoutRepository payoutRepository;
    private final PayoutGateway payoutGateway;
    private final RoundGuard guard;
    private final ApplicationEventPublisher events;

    public TreasuryService(
            TreasuryAccountRepository accountRepository,
            PrizePayoutRepository payoutRepository,
            PayoutGateway payoutGateway,
            RoundGuard guard,
            ApplicationEventPublisher events
    ) {
        this.accountRepository = accountRepository;
        this.payoutRepository = payoutRepository;
        this.payoutGateway = payoutGateway;
        this.guard = guard;
        this.events = events;
    }

    @Transactional(Transactional.TxType.MANDATORY)
    public BigDecimal balance() {
        return requireAccount().getBalance();
    }

    @Transactional(Transactional.TxType.MANDATORY)
    public void credit(BigDecimal amount) {
        TreasuryAccount account = requireAccount();
        if (!TreasuryAccount.fitsAmountColumn(account.getBalance().add(amount))) {
            throw new BadRequestException("treasury balance limit reached", Map.of(
                    "balance", account.getBalance().toPlainString(),
                    "amount", amount.toPlainString(),
                    "maxIntegerDigits", TreasuryAccount.AMOUNT_INTEGER_DIGITS));
        }
        account.credit(amount);
        accountRepository.save(account);
    }

    /**
     * Moves the whole balance onto a new PENDING payout for the round's winner.
     * The treasury is empty afterwards.
     */
    @Transactional(Transactional.TxType.MANDATORY)
    public PrizePayout openPayout(long roundNumber, String requestToken, String winner) {
        TreasuryAccount account = requireAccount();
        BigDecimal prize = account.drain();
        accountRepository.save(account);

        return payoutRepository.save(PrizePayout.builder()
                .roundNumber(roundNumber)
                .requestToken(requestToken)
                .winner(winner)
                .amount(prize)
                .status(PayoutStatus.PENDING)
                .build());
    }

    /**
     * Transfers {@code amount} to {@code identity}. All or nothing: a gateway
     * error is reported as a failed result.
     */
    public TransferResult payout(String identity, BigDecimal amount, String reference) {
        try {
            TransferResult result = payoutGateway.transfer(identity, amount, reference);
            return (result == null) ? TransferResult.failure("gateway returned no result") : result;
        } catch (RuntimeException e) {
            log.warn("Payout gateway threw while paying {}: {}", identity, e.toString());
            return TransferResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    /**
     * Attempts the transfer for a payout and records the outcome.
     *
     * @throws PayoutFailedException when the transfer does not go through; the
     *                               payout is left FAILED for a later retry
     */
    public PrizePayout settle(Long payoutId) {
        return guard.exclusive(() -> {
            PrizePayout payout = guard.read(() -> requirePayout(payoutId));
            TransferResult result = payout(payout.getWinner(), payout.getAmount(), "round-" + payout.getRoundNumber());

            PrizePayout recorded = guard.write(() -> {
                PrizePayout p = requirePayout(payoutId);
                if (result.succeeded()) {
                    p.markPaid(result.transferReference());
                } else {
                    p.markFailed(result.failureReason());
                }
                return payoutRepository.save(p);
            });

            if (!result.succeeded()) {
                events.publishEvent(new PayoutFailedEvent(recorded.getId(), recorded.getWinner(), recorded.getAmount(), result.failureReason()));
                throw new PayoutFailedException(recorded.getId(), recorded.getWinner(), recorded.getAmount(), result.failureReason());
            }

            log.info("Paid {} to {} for round {}", recorded.getAmount(), recorded.getWinner(), recorded.getRoundNumber());
            return recorded;
        });
    }

    /** Re-attempts a payout whose transfer has not gone through. */
    public PrizePayout retryPayout(Long payoutId) {
        if (payoutId == null) {
            throw new BadRequestException("payoutId is required");
        }
        return guard.exclusive(() -> {
            PrizePayout payout = guard.read(() -> requirePayout(payoutId));
            if (payout.getStatus() == PayoutStatus.PAID) {
                throw new BadRequestException("Payout already paid", Map.of("payoutId", payoutId));
            }
            log.info("Retrying payout {} to {} (attempts so far {})", payoutId, payout.getWinner(), payout.getAttempts());
            return settle(payoutId);
        });
    }

    public List<PrizePayout> listPayouts(PayoutStatus status) {
        return guard.read(() -> (status == null)
                ? payoutRepository.findAllByOrderByIdAsc()
                : payoutRepository.findByStatusOrderByIdAsc(status));
    }

    public PrizePayout getPayout(Long payoutId) {
        return guard.read(() -> requirePayout(payoutId));
    }

    private PrizePayout requirePayout(Long payoutId) {
        return payoutRepository.findById(payoutId)
                .orElseThrow(() -> new NotFoundException("Payout not found", Map.of("payoutId", payoutId)));
    }

    private TreasuryAccount requireAccount() {
        return accountRepository.findById(TreasuryAccount.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Treasury account has not been initialized"));
    }
}
