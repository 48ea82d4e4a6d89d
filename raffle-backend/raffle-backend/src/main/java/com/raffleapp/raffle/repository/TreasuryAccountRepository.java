package com.raffleapp.raffle.repository;

import com.raffleapp.raffle.domain.treasury.TreasuryAccount;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TreasuryAccountRepository extends JpaRepository<TreasuryAccount, Long> {
}
