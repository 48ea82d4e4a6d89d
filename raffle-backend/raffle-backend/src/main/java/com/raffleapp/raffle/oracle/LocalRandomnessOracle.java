package com.raffleapp.raffle.oracle;

import com.raffleapp.common.exception.BadRequestException;
import com.raffleapp.common.exception.NotFoundException;
import com.raffleapp.common.exception.PayoutFailedException;
import com.raffleapp.common.exception.RaffleException;
import com.raffleapp.common.exception.UnknownOrStaleRequestException;
import com.raffleapp.raffle.config.RaffleProperties;
import com.raffleapp.raffle.domain.round.DrawOutcome;
import com.raffleapp.raffle.service.WinnerResolverService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process stand-in for the randomness coordinator, for development and tests.
 * <p>
 * Request ids are sequential. Each accepted request is fulfilled at most once,
 * either automatically after {@code confirmations x blockTime} with 256-bit
 * words from {@link SecureRandom}, or on demand through {@link #fulfillNow}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "raffle.oracle.mode", havingValue = "local", matchIfMissing = true)
public class LocalRandomnessOracle implements RandomnessOracleClient {

    private final AtomicLong nextRequestId = new AtomicLong(1);
    private final Map<String, OracleRequest> pending = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();

    private final WinnerResolverService resolver;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final RaffleProperties.Local settings;

    public LocalRandomnessOracle(
            WinnerResolverService resolver,
            TaskScheduler scheduler,
            Clock clock,
            RaffleProperties properties
    ) {
        this.resolver = resolver;
        this.scheduler = scheduler;
        this.clock = clock;
        this.settings = properties.getOracle().getLocal();
    }

    @Override
    public String submitRequest(OracleRequest request) {
        if (request.numWords() < 1) {
            throw new BadRequestException("numWords must be >= 1");
        }

        String requestId = String.valueOf(nextRequestId.getAndIncrement());
        pending.put(requestId, request);

        if (settings.isAutoFulfill()) {
            Duration delay = settings.getBlockTime().multipliedBy(request.requestConfirmations());
            scheduler.schedule(() -> autoFulfill(requestId), Instant.now().plus(delay));
        }
        return requestId;
    }

    /** Fulfills a pending request with fresh random words. */
    public DrawOutcome fulfillNow(String requestId) {
        return fulfillNow(requestId, randomWords(requirePending(requestId).numWords()));
    }

    /**
     * Fulfills a pending request with the given words. The request stays pending
     * when the resolver refuses the words or fails before applying them, so it
     * can still be answered.
     */
    public DrawOutcome fulfillNow(String requestId, List<BigInteger> randomWords) {
        requirePending(requestId);
        try {
            DrawOutcome outcome = resolver.fulfill(requestId, randomWords, clock.instant());
            pending.remove(requestId);
            return outcome;
        } catch (PayoutFailedException | UnknownOrStaleRequestException e) {
            // applied with an unpaid prize, or no longer answerable
            pending.remove(requestId);
            throw e;
        }
    }

    public Set<String> pendingRequestIds() {
        return Set.copyOf(pending.keySet());
    }

    private void autoFulfill(String requestId) {
        try {
            DrawOutcome outcome = fulfillNow(requestId);
            log.info("Local oracle fulfilled request {} -> winner {}", requestId, outcome.winner());
        } catch (NotFoundException e) {
            log.debug("Request {} was already fulfilled", requestId);
        } catch (RaffleException e) {
            log.warn("Local oracle fulfillment of {} rejected: {} {}", requestId, e.getErrorCode(), e.getDetails());
        } catch (RuntimeException e) {
            log.error("Local oracle fulfillment of {} failed; request stays pending", requestId, e);
        }
    }

    private OracleRequest requirePending(String requestId) {
        OracleRequest request = (requestId == null) ? null : pending.get(requestId);
        if (request == null) {
            throw new NotFoundException("nonexistent request", Map.of("requestId", String.valueOf(requestId)));
        }
        return request;
    }

    private List<BigInteger> randomWords(int numWords) {
        List<BigInteger> words = new ArrayList<>(numWords);
        for (int i = 0; i < numWords; i++) {
            words.add(new BigInteger(256, random));
        }
        return words;
    }
}
