package com.raffleapp.raffle.service;

import com.raffleapp.raffle.domain.round.RaffleRound;
import com.raffleapp.raffle.domain.round.RoundPhase;
import com.raffleapp.raffle.domain.treasury.TreasuryAccount;
import com.raffleapp.raffle.repository.RaffleRoundRepository;
import com.raffleapp.raffle.repository.TreasuryAccountRepository;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;

@Slf4j
@Service
public class RoundStateService {

    private final RaffleRoundRepository roundRepository;
    private final TreasuryAccountRepository treasuryAccountRepository;

    public RoundStateService(RaffleRoundRepository roundRepository, TreasuryAccountRepository treasuryAccountRepository) {
        this.roundRepository = roundRepository;
        this.treasuryAccountRepository = treasuryAccountRepository;
    }

    @Transactional(Transactional.TxType.MANDATORY)
    public RaffleRound requireRound() {
        return roundRepository.findById(RaffleRound.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Raffle round has not been initialized"));
    }

    @Transactional(Transactional.TxType.MANDATORY)
    public RaffleRound save(RaffleRound round) {
        return roundRepository.save(round);
    }

    /** Creates the live round and the treasury account on first start; a no-op afterwards. */
    @Transactional(Transactional.TxType.MANDATORY)
    public RaffleRound initialize(Instant now) {
        if (treasuryAccountRepository.findById(TreasuryAccount.SINGLETON_ID).isEmpty()) {
            treasuryAccountRepository.save(TreasuryAccount.builder()
                    .id(TreasuryAccount.SINGLETON_ID)
                    .balance(BigDecimal.ZERO)
                    .build());
        }

        return roundRepository.findById(RaffleRound.SINGLETON_ID).orElseGet(() -> {
            log.info("Initializing raffle round at {}", now);
            return roundRepository.save(RaffleRound.builder()
                    .id(RaffleRound.SINGLETON_ID)
                    .phase(RoundPhase.OPEN)
                    .roundNumber(1L)
                    .lastDrawTimestamp(now)
                    .build());
        });
    }
}
