package com.raffleapp.raffle.controller;

import com.raffleapp.raffle.dto.common.ApiResponse;
import com.raffleapp.raffle.dto.round.response.RoundStateResponse;
import com.raffleapp.raffle.dto.upkeep.response.CheckUpkeepResponse;
import com.raffleapp.raffle.dto.upkeep.response.DrawRequestedResponse;
import com.raffleapp.raffle.service.RaffleService;
import org.springframework.web.bind.annotation.*;

/**
 * Polling contract for an external keeper: check, then perform when needed.
 */
@RestController
@RequestMapping("/api/raffle/upkeep")
public class KeeperController {

    private final RaffleService raffleService;

    public KeeperController(RaffleService raffleService) {
        this.raffleService = raffleService;
    }

    @PostMapping("/check")
    public ApiResponse<CheckUpkeepResponse> check() {
        return raffleService.checkUpkeep();
    }

    @PostMapping("/perform")
    public ApiResponse<DrawRequestedResponse> perform() {
        return raffleService.performUpkeep();
    }

    // Recovery after a failed perform: the round is CALCULATING with no request id
    @PostMapping("/abandon")
    public ApiResponse<RoundStateResponse> abandon() {
        return raffleService.abandonStalledDraw();
    }
}
