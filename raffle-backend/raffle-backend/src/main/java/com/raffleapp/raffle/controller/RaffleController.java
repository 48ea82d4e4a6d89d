package com.raffleapp.raffle.controller;

import com.raffleapp.raffle.dto.common.ApiResponse;
import com.raffleapp.raffle.dto.entry.request.EnterRaffleRequest;
import com.raffleapp.raffle.dto.entry.response.EntrantResponse;
import com.raffleapp.raffle.dto.round.request.GetEntrantRequest;
import com.raffleapp.raffle.dto.round.response.RoundStateResponse;
import com.raffleapp.raffle.service.RaffleService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/raffle")
public class RaffleController {

    private final RaffleService raffleService;

    public RaffleController(RaffleService raffleService) {
        this.raffleService = raffleService;
    }

    @PostMapping("/enter")
    public ApiResponse<EntrantResponse> enter(@Valid @RequestBody EnterRaffleRequest request) {
        return raffleService.enter(request);
    }

    @PostMapping("/state")
    public ApiResponse<RoundStateResponse> state() {
        return raffleService.state();
    }

    @PostMapping("/entrants/at")
    public ApiResponse<EntrantResponse> entrantAt(@Valid @RequestBody GetEntrantRequest request) {
        return raffleService.entrantAt(request);
    }

    @PostMapping("/entrants")
    public ApiResponse<List<EntrantResponse>> entrants() {
        return raffleService.entrants();
    }
}
