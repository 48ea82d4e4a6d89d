package com.raffleapp.raffle.service;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class RoundBootstrap implements ApplicationRunner {

    private final RoundGuard guard;
    private final RoundStateService rounds;
    private final Clock clock;

    public RoundBootstrap(RoundGuard guard, RoundStateService rounds, Clock clock) {
        this.guard = guard;
        this.rounds = rounds;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        guard.write(() -> rounds.initialize(clock.instant()));
    }
}
