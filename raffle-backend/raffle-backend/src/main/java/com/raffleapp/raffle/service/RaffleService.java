package com.raffleapp.raffle.service;

import com.raffleapp.common.exception.BadRequestException;
import com.raffleapp.common.exception.NotFoundException;
import com.raffleapp.raffle.config.RaffleProperties;
import com.raffleapp.raffle.domain.round.*;
import com.raffleapp.raffle.domain.treasury.PrizePayout;
import com.raffleapp.raffle.dto.common.ApiResponse;
import com.raffleapp.raffle.dto.entry.request.EnterRaffleRequest;
import com.raffleapp.raffle.dto.entry.response.EntrantResponse;
import com.raffleapp.raffle.dto.oracle.request.FulfillRandomWordsRequest;
import com.raffleapp.raffle.dto.oracle.response.DrawOutcomeResponse;
import com.raffleapp.raffle.dto.payout.request.ListPayoutsRequest;
import com.raffleapp.raffle.dto.payout.request.RetryPayoutRequest;
import com.raffleapp.raffle.dto.payout.response.PayoutResponse;
import com.raffleapp.raffle.dto.round.request.GetEntrantRequest;
import com.raffleapp.raffle.dto.round.response.RoundStateResponse;
import com.raffleapp.raffle.dto.upkeep.response.CheckUpkeepResponse;
import com.raffleapp.raffle.dto.upkeep.response.DrawRequestedResponse;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only query surface of the raffle plus the request/response mapping for
 * the HTTP controllers. Commands are delegated to the component that owns them.
 */
@Service
public class RaffleService {

    private final RoundGuard guard;
    private final RoundStateService rounds;
    private final PlayerRegistryService registry;
    private final TreasuryService treasury;
    private final RandomnessRequesterService requester;
    private final WinnerResolverService resolver;
    private final RaffleProperties properties;
    private final Clock clock;

    public RaffleService(
            RoundGuard guard,
            RoundStateService rounds,
            PlayerRegistryService registry,
            TreasuryService treasury,
            RandomnessRequesterService requester,
            WinnerResolverService resolver,
            RaffleProperties properties,
            Clock clock
    ) {
        this.guard = guard;
        this.rounds = rounds;
        this.registry = registry;
        this.treasury = treasury;
        this.requester = requester;
        this.resolver = resolver;
        this.properties = properties;
        this.clock = clock;
    }

    // ---- queries ----

    public BigDecimal getEntranceFee() {
        return properties.getEntranceFee();
    }

    public Duration getInterval() {
        return properties.getInterval();
    }

    public int getRequestConfirmations() {
        return RaffleProperties.REQUEST_CONFIRMATIONS;
    }

    public int getNumWords() {
        return RaffleProperties.NUM_WORDS;
    }

    public RoundPhase getPhase() {
        return guard.read(() -> rounds.requireRound().getPhase());
    }

    public Instant getLastDrawTimestamp() {
        return guard.read(() -> rounds.requireRound().getLastDrawTimestamp());
    }

    public String getRecentWinner() {
        return guard.read(() -> rounds.requireRound().getRecentWinner());
    }

    public long getNumberOfPlayers() {
        return guard.read(() -> registry.count(rounds.requireRound().getRoundNumber()));
    }

    public BigDecimal getBalance() {
        return guard.read(treasury::balance);
    }

    public Entrant getEntrant(int index) {
        if (index < 0) {
            throw new BadRequestException("index must be >= 0");
        }
        return guard.read(() -> registry.entrantAt(rounds.requireRound().getRoundNumber(), index))
                .orElseThrow(() -> new NotFoundException("No entrant at index " + index, Map.of("index", index)));
    }

    public List<Entrant> getEntrants() {
        return guard.read(() -> registry.entrants(rounds.requireRound().getRoundNumber()));
    }

    public RaffleRound getRound() {
        return guard.read(rounds::requireRound);
    }

    // ---- HTTP mapping ----

    public ApiResponse<EntrantResponse> enter(EnterRaffleRequest request) {
        if (request == null) {
            throw new BadRequestException("Request body is required");
        }
        Entrant entrant = registry.enter(request.getIdentity(), request.getFeePaid());
        return ApiResponse.ok("Entered raffle", toEntrantResponse(entrant));
    }

    public ApiResponse<RoundStateResponse> state() {
        RoundStateResponse state = guard.read(() -> {
            RaffleRound round = rounds.requireRound();
            return RoundStateResponse.builder()
                    .roundNumber(round.getRoundNumber())
                    .phase(round.getPhase())
                    .entranceFee(properties.getEntranceFee())
                    .intervalSeconds(properties.getInterval().getSeconds())
                    .lastDrawTimestamp(round.getLastDrawTimestamp())
                    .numberOfPlayers(registry.count(round.getRoundNumber()))
                    .balance(treasury.balance())
                    .recentWinner(round.getRecentWinner())
                    .drawPending(round.getPendingRequestToken() != null)
                    .drawStalled(round.isDrawStalled())
                    .requestConfirmations(RaffleProperties.REQUEST_CONFIRMATIONS)
                    .numWords(RaffleProperties.NUM_WORDS)
                    .build();
        });
        return ApiResponse.ok("Raffle state loaded", state);
    }

    public ApiResponse<EntrantResponse> entrantAt(GetEntrantRequest request) {
        if (request == null || request.getIndex() == null) {
            throw new BadRequestException("index is required");
        }
        return ApiResponse.ok("Entrant loaded", toEntrantResponse(getEntrant(request.getIndex())));
    }

    public ApiResponse<List<EntrantResponse>> entrants() {
        List<EntrantResponse> items = getEntrants().stream().map(this::toEntrantResponse).toList();
        return ApiResponse.ok("Entrants loaded", items, Map.of("count", items.size()));
    }

    public ApiResponse<CheckUpkeepResponse> checkUpkeep() {
        UpkeepDecision decision = requester.checkUpkeep(clock.instant());
        return ApiResponse.ok("Upkeep checked", CheckUpkeepResponse.builder()
                .upkeepNeeded(decision.upkeepNeeded())
                .performData("0x")
                .build());
    }

    public ApiResponse<DrawRequestedResponse> performUpkeep() {
        DrawRequest draw = requester.requestDraw(clock.instant());
        return ApiResponse.ok("Draw requested", DrawRequestedResponse.builder()
                .requestId(draw.requestToken())
                .roundNumber(draw.roundNumber())
                .build());
    }

    public ApiResponse<RoundStateResponse> abandonStalledDraw() {
        requester.abandonStalledDraw();
        return ApiResponse.ok("Stalled draw abandoned", state().getData());
    }

    public ApiResponse<DrawOutcomeResponse> fulfill(FulfillRandomWordsRequest request) {
        if (request == null) {
            throw new BadRequestException("Request body is required");
        }
        DrawOutcome outcome = resolver.fulfill(request.getRequestId(), request.getRandomWords(), clock.instant());
        return ApiResponse.ok("Winner picked", DrawOutcomeResponse.builder()
                .requestId(outcome.requestToken())
                .roundNumber(outcome.roundNumber())
                .winner(outcome.winner())
                .winningIndex(outcome.winningIndex())
                .prize(outcome.prize())
                .payoutId(outcome.payoutId())
                .payoutStatus(outcome.payoutStatus())
                .build());
    }

    public ApiResponse<List<PayoutResponse>> listPayouts(ListPayoutsRequest request) {
        List<PayoutResponse> items = treasury.listPayouts(request == null ? null : request.getStatus())
                .stream()
                .map(this::toPayoutResponse)
                .toList();
        return ApiResponse.ok("Payouts loaded", items);
    }

    public ApiResponse<PayoutResponse> retryPayout(RetryPayoutRequest request) {
        if (request == null) {
            throw new BadRequestException("Request body is required");
        }
        PrizePayout paid = treasury.retryPayout(request.getPayoutId());
        return ApiResponse.ok("Payout completed", toPayoutResponse(paid));
    }

    private EntrantResponse toEntrantResponse(Entrant e) {
        return EntrantResponse.builder()
                .index(e.getEntryIndex())
                .identity(e.getIdentity())
                .feePaid(e.getFeePaid())
                .roundNumber(e.getRoundNumber())
                .enteredAt(e.getEnteredAt())
                .build();
    }

    private PayoutResponse toPayoutResponse(PrizePayout p) {
        return PayoutResponse.builder()
                .id(p.getId())
                .roundNumber(p.getRoundNumber())
                .winner(p.getWinner())
                .amount(p.getAmount())
                .status(p.getStatus())
                .attempts(p.getAttempts())
                .transferReference(p.getTransferReference())
                .lastError(p.getLastError())
                .createdAt(p.getCreatedAt())
                .updatedAt(p.getUpdatedAt())
                .build();
    }
}
