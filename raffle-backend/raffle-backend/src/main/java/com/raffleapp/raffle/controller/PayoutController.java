package com.raffleapp.raffle.controller;

import com.raffleapp.raffle.dto.common.ApiResponse;
import com.raffleapp.raffle.dto.payout.request.ListPayoutsRequest;
import com.raffleapp.raffle.dto.payout.request.RetryPayoutRequest;
import com.raffleapp.raffle.dto.payout.response.PayoutResponse;
import com.raffleapp.raffle.service.RaffleService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/raffle/payouts")
public class PayoutController {

    private final RaffleService raffleService;

    public PayoutController(RaffleService raffleService) {
        this.raffleService = raffleService;
    }

    @PostMapping("/search")
    public ApiResponse<List<PayoutResponse>> list(@RequestBody(required = false) ListPayoutsRequest request) {
        return raffleService.listPayouts(request);
    }

    @PostMapping("/retry")
    public ApiResponse<PayoutResponse> retry(@Valid @RequestBody RetryPayoutRequest request) {
        return raffleService.retryPayout(request);
    }
}
