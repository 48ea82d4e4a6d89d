package com.raffleapp.raffle.repository;

import com.raffleapp.raffle.domain.round.RaffleRound;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RaffleRoundRepository extends JpaRepository<RaffleRound, Long> {
}
