package com.raffleapp.raffle.service;

import com.raffleapp.common.exception.BadRequestException;
import com.raffleapp.common.exception.InsufficientFeeException;
import com.raffleapp.common.exception.RoundNotOpenException;
import com.raffleapp.raffle.config.RaffleProperties;
import com.raffleapp.raffle.domain.round.Entrant;
import com.raffleapp.raffle.domain.round.RaffleRound;
import com.raffleapp.raffle.domain.treasury.TreasuryAccount;
import com.raffleapp.raffle.event.EnteredRoundEvent;
import com.raffleapp.raffle.repository.EntrantRepository;
import jakarta.transaction.Transactional;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, append-only list of the current round's entrants.
 */
@Service
public class PlayerRegistryService {

    private static final int MAX_IDENTITY_LENGTH = 128;

    private final EntrantRepository entrantRepository;
    private final RoundStateService rounds;
    private final TreasuryService treasury;
    private final RoundGuard guard;
    private final RaffleProperties properties;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    public PlayerRegistryService(
            EntrantRepository entrantRepository,
            RoundStateService rounds,
            TreasuryService treasury,
            RoundGuard guard,
            RaffleProperties properties,
            ApplicationEventPublisher events,
            Clock clock
    ) {
        this.entrantRepository = entrantRepository;
        this.rounds = rounds;
        this.treasury = treasury;
        this.guard = guard;
        this.properties = properties;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Admits {@code identity} into the open round and credits the whole
     * {@code feePaid} to the treasury. The same identity may enter repeatedly.
     *
     * @throws InsufficientFeeException when {@code feePaid} is below the entrance fee
     * @throws RoundNotOpenException    while a draw is being calculated
     * @throws BadRequestException      when {@code feePaid} or the resulting balance does not fit NUMERIC(38,18)
     */
    public Entrant enter(String identity, BigDecimal feePaid) {
        String player = normalizeIdentity(identity);
        if (feePaid == null) {
            throw new BadRequestException("feePaid is required");
        }
        if (!TreasuryAccount.fitsAmountColumn(feePaid)) {
            throw new BadRequestException("feePaid is out of range", Map.of(
                    "feePaid", feePaid.toPlainString(),
                    "maxIntegerDigits", TreasuryAccount.AMOUNT_INTEGER_DIGITS,
                    "maxFractionDigits", TreasuryAccount.AMOUNT_FRACTION_DIGITS));
        }

        Entrant admitted = guard.write(() -> {
            BigDecimal entranceFee = properties.getEntranceFee();
            if (feePaid.compareTo(entranceFee) < 0) {
                throw new InsufficientFeeException(feePaid, entranceFee);
            }

            RaffleRound round = rounds.requireRound();
            if (!round.isOpen()) {
                throw new RoundNotOpenException(round.getPhase());
            }

            int index = Math.toIntExact(entrantRepository.countByRoundNumber(round.getRoundNumber()));
            Entrant entrant = entrantRepository.save(Entrant.builder()
                    .roundNumber(round.getRoundNumber())
                    .entryIndex(index)
                    .identity(player)
                    .feePaid(feePaid)
                    .enteredAt(clock.instant())
                    .build());

            treasury.credit(feePaid);
            return entrant;
        });

        events.publishEvent(new EnteredRoundEvent(admitted.getIdentity(), admitted.getRoundNumber(), admitted.getEntryIndex(), admitted.getFeePaid()));
        return admitted;
    }

    @Transactional(Transactional.TxType.MANDATORY)
    public List<Entrant> entrants(long roundNumber) {
        return entrantRepository.findByRoundNumberOrderByEntryIndexAsc(roundNumber);
    }

    @Transactional(Transactional.TxType.MANDATORY)
    public Optional<Entrant> entrantAt(long roundNumber, int index) {
        return entrantRepository.findByRoundNumberAndEntryIndex(roundNumber, index);
    }

    @Transactional(Transactional.TxType.MANDATORY)
    public long count(long roundNumber) {
        return entrantRepository.countByRoundNumber(roundNumber);
    }

    // Winner resolution only, after the winning index has been read
    @Transactional(Transactional.TxType.MANDATORY)
    public void clear(long roundNumber) {
        entrantRepository.deleteByRoundNumber(roundNumber);
    }

    private static String normalizeIdentity(String identity) {
        if (identity == null || identity.isBlank()) {
            throw new BadRequestException("identity is required");
        }
        String trimmed = identity.trim();
        if (trimmed.length() > MAX_IDENTITY_LENGTH) {
            throw new BadRequestException("identity must be at most " + MAX_IDENTITY_LENGTH + " characters");
        }
        return trimmed;
    }
}
