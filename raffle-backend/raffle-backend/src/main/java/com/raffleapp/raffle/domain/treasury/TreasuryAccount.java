package com.raffleapp.raffle.domain.treasury;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "treasury_account")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TreasuryAccount {

    public static final long SINGLETON_ID = 1L;

    // NUMERIC(38,18): fees, balances and payouts share these limits
    public static final int AMOUNT_INTEGER_DIGITS = 20;
    public static final int AMOUNT_FRACTION_DIGITS = 18;

    @Id
    private Long id;

    @Column(name = "balance", nullable = false, precision = 38, scale = 18)
    @Builder.Default
    private BigDecimal balance = BigDecimal.ZERO;

    @Version
    private Long version;

    public void credit(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("credit amount must be >= 0");
        }
        this.balance = this.balance.add(amount);
    }

    /** Whether {@code amount} can be stored without rounding or overflowing the amount columns. */
    public static boolean fitsAmountColumn(BigDecimal amount) {
        BigDecimal plain = amount.stripTrailingZeros();
        int integerDigits = plain.precision() - plain.scale();
        return plain.scale() <= AMOUNT_FRACTION_DIGITS && integerDigits <= AMOUNT_INTEGER_DIGITS;
    }

    /** Empties the account and returns what it held. */
    public BigDecimal drain() {
        BigDecimal held = this.balance;
        this.balance = BigDecimal.ZERO;
        return held;
    }
}
