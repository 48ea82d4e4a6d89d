package com.raffleapp.raffle.config;

import com.raffleapp.raffle.domain.round.EligibilityChecker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class RaffleConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EligibilityChecker eligibilityChecker(RaffleProperties properties) {
        return new EligibilityChecker(properties.getInterval());
    }

    @Bean
    public ThreadPoolTaskScheduler raffleTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("raffle-sched-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
