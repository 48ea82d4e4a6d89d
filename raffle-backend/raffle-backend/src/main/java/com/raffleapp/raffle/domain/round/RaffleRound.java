package com.raffleapp.raffle.domain.round;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * The single live round. Only the draw requester (OPEN to CALCULATING) and the
 * winner resolver (CALCULATING to OPEN) change its phase.
 */
@Entity
@Table(name = "raffle_round")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RaffleRound {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase", nullable = false, length = 16)
    @Builder.Default
    private RoundPhase phase = RoundPhase.OPEN;

    @Column(name = "round_number", nullable = false)
    @Builder.Default
    private long roundNumber = 1L;

    @Column(name = "last_draw_at", nullable = false)
    private Instant lastDrawTimestamp;

    // Set iff phase == CALCULATING
    @Column(name = "pending_request_token", length = 128)
    private String pendingRequestToken;

    @Column(name = "recent_winner", length = 128)
    private String recentWinner;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isOpen() {
        return phase == RoundPhase.OPEN;
    }

    public void beginCalculating() {
        this.phase = RoundPhase.CALCULATING;
        this.pendingRequestToken = null;
    }

    public void recordPendingRequest(String token) {
        if (phase != RoundPhase.CALCULATING) {
            throw new IllegalStateException("request token recorded outside CALCULATING");
        }
        this.pendingRequestToken = token;
    }

    public void closeWithWinner(String winner, Instant drawnAt) {
        this.recentWinner = winner;
        this.phase = RoundPhase.OPEN;
        this.pendingRequestToken = null;
        this.lastDrawTimestamp = drawnAt;
        this.roundNumber++;
    }

    /** CALCULATING with no request on record: the oracle never accepted the draw. */
    public boolean isDrawStalled() {
        return phase == RoundPhase.CALCULATING && pendingRequestToken == null;
    }

    // Entrants, balance and lastDrawTimestamp carry over to the reopened round
    public void reopenStalledDraw() {
        if (!isDrawStalled()) {
            throw new IllegalStateException("no stalled draw to reopen");
        }
        this.phase = RoundPhase.OPEN;
    }

    public boolean matchesPendingRequest(String token) {
        return phase == RoundPhase.CALCULATING
                && pendingRequestToken != null
                && pendingRequestToken.equals(token);
    }
}
