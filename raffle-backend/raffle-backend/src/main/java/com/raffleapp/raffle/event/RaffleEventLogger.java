package com.raffleapp.raffle.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes the raffle's observable events to the application log.
 */
@Slf4j
@Component
public class RaffleEventLogger {

    @EventListener
    public void onEntered(EnteredRoundEvent event) {
        log.info("EnteredRound identity={} round={} index={} fee={}",
                event.identity(), event.roundNumber(), event.entryIndex(), event.feePaid());
    }

    @EventListener
    public void onDrawRequested(DrawRequestedEvent event) {
        log.info("DrawRequested token={} round={}", event.requestToken(), event.roundNumber());
    }

    @EventListener
    public void onDrawAbandoned(DrawAbandonedEvent event) {
        log.warn("DrawAbandoned round={} players={}", event.roundNumber(), event.numPlayers());
    }

    @EventListener
    public void onWinnerPicked(WinnerPickedEvent event) {
        log.info("WinnerPicked winner={} round={} index={} prize={}",
                event.winner(), event.roundNumber(), event.winningIndex(), event.prize());
    }

    @EventListener
    public void onPayoutFailed(PayoutFailedEvent event) {
        log.warn("PayoutFailed payoutId={} winner={} amount={} reason={}",
                event.payoutId(), event.winner(), event.amount(), event.reason());
    }
}
