package com.raffleapp.raffle.domain.round;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(
        name = "entrant",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_entrant_round_index", columnNames = {"round_number", "entry_index"})
        },
        indexes = {
                @Index(name = "ix_entrant_round", columnList = "round_number")
        }
)
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Entrant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "round_number", nullable = false)
    private long roundNumber;

    // Insertion order; the index space for winner selection
    @Column(name = "entry_index", nullable = false)
    private int entryIndex;

    @Column(name = "player_identity", nullable = false, length = 128)
    private String identity;

    @Column(name = "fee_paid", nullable = false, precision = 38, scale = 18)
    private BigDecimal feePaid;

    @Column(name = "entered_at", nullable = false)
    private Instant enteredAt;
}
