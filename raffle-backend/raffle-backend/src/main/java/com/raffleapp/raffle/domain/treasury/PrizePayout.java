package com.raffleapp.raffle.domain.treasury;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Prize owed to a round's winner. Holds the drained treasury balance until the
 * transfer succeeds, so a failed transfer can be retried.
 */
@Entity
@Table(
        name = "prize_payout",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_payout_round", columnNames = {"round_number"})
        },
        indexes = {
                @Index(name = "ix_payout_status", columnList = "status")
        }
)
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PrizePayout {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "round_number", nullable = false)
    private long roundNumber;

    @Column(name = "request_token", length = 128)
    private String requestToken;

    @Column(name = "winner", nullable = false, length = 128)
    private String winner;

    @Column(name = "amount", nullable = false, precision = 38, scale = 18)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    @Builder.Default
    private PayoutStatus status = PayoutStatus.PENDING;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "transfer_reference", length = 200)
    private String transferReference;

    @Column(name = "last_error", length = 500)
    private String lastError;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public void markPaid(String reference) {
        this.attempts++;
        this.status = PayoutStatus.PAID;
        this.transferReference = reference;
        this.lastError = null;
    }

    public void markFailed(String reason) {
        this.attempts++;
        this.status = PayoutStatus.FAILED;
        this.lastError = (reason != null && reason.length() > 500) ? reason.substring(0, 500) : reason;
    }
}
