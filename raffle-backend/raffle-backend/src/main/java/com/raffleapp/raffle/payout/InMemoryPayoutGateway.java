package com.raffleapp.raffle.payout;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ledger-backed gateway: credits winners in process memory. Identities can be
 * blocked to rehearse failed transfers.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "raffle.payout.mode", havingValue = "ledger", matchIfMissing = true)
public class InMemoryPayoutGateway implements PayoutGateway {

    private final Map<String, BigDecimal> credited = new ConcurrentHashMap<>();
    private final Set<String> rejected = ConcurrentHashMap.newKeySet();

    @Override
    public TransferResult transfer(String identity, BigDecimal amount, String reference) {
        if (identity == null || identity.isBlank()) {
            return TransferResult.failure("recipient is required");
        }
        if (amount == null || amount.signum() < 0) {
            return TransferResult.failure("amount must be >= 0");
        }
        if (rejected.contains(identity)) {
            log.warn("Ledger transfer to {} rejected", identity);
            return TransferResult.failure("recipient rejected transfer");
        }

        credited.merge(identity, amount, BigDecimal::add);
        return TransferResult.success("ledger:" + reference);
    }

    public BigDecimal creditedTo(String identity) {
        return credited.getOrDefault(identity, BigDecimal.ZERO);
    }

    public void rejectTransfersTo(String identity) {
        rejected.add(identity);
    }

    public void acceptTransfersTo(String identity) {
        rejected.remove(identity);
    }

    public void reset() {
        credited.clear();
        rejected.clear();
    }
}
