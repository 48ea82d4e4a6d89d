package com.raffleapp.raffle.repository;

import com.raffleapp.raffle.domain.round.Entrant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface EntrantRepository extends JpaRepository<Entrant, Long> {

    List<Entrant> findByRoundNumberOrderByEntryIndexAsc(long roundNumber);

    Optional<Entrant> findByRoundNumberAndEntryIndex(long roundNumber, int entryIndex);

    long countByRoundNumber(long roundNumber);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Entrant e where e.roundNumber = :roundNumber")
    int deleteByRoundNumber(@Param("roundNumber") long roundNumber);
}
