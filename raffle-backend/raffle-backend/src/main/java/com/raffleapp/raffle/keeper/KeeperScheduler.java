package com.raffleapp.raffle.keeper;

import com.raffleapp.common.exception.RaffleException;
import com.raffleapp.raffle.domain.round.DrawRequest;
import com.raffleapp.raffle.domain.round.UpkeepDecision;
import com.raffleapp.raffle.service.RandomnessRequesterService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Optional in-process keeper. Polls the upkeep check and requests a draw when
 * it passes, the way an external keeper would.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "raffle.keeper.enabled", havingValue = "true")
public class KeeperScheduler {

    private final RandomnessRequesterService requester;
    private final Clock clock;

    public KeeperScheduler(RandomnessRequesterService requester, Clock clock) {
        this.requester = requester;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${raffle.keeper.poll-delay-ms:5000}")
    public void poll() {
        Instant now = clock.instant();
        UpkeepDecision decision = requester.checkUpkeep(now);
        if (!decision.upkeepNeeded()) return;

        try {
            DrawRequest draw = requester.requestDraw(now);
            log.info("Keeper triggered draw for round {} (request {})", draw.roundNumber(), draw.requestToken());
        } catch (RaffleException e) {
            // state moved between check and perform; the next poll re-evaluates
            log.warn("Keeper perform rejected: {} {}", e.getErrorCode(), e.getDetails());
        }
    }
}
