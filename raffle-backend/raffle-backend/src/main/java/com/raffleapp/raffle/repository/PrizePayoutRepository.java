package com.raffleapp.raffle.repository;

import com.raffleapp.raffle.domain.treasury.PayoutStatus;
import com.raffleapp.raffle.domain.treasury.PrizePayout;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PrizePayoutRepository extends JpaRepository<PrizePayout, Long> {

    List<PrizePayout> findByStatusOrderByIdAsc(PayoutStatus status);

    List<PrizePayout> findAllByOrderByIdAsc();
}
