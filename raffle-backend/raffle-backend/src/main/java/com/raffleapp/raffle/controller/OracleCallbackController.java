package com.raffleapp.raffle.controller;

import com.raffleapp.common.exception.ForbiddenException;
import com.raffleapp.raffle.config.RaffleProperties;
import com.raffleapp.raffle.dto.common.ApiResponse;
import com.raffleapp.raffle.dto.oracle.request.FulfillRandomWordsRequest;
import com.raffleapp.raffle.dto.oracle.response.DrawOutcomeResponse;
import com.raffleapp.raffle.service.RaffleService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

@RestController
@RequestMapping("/api/raffle/oracle")
public class OracleCallbackController {

    static final String CALLBACK_KEY_HEADER = "X-Oracle-Callback-Key";

    private final RaffleService raffleService;
    private final String callbackKey;

    public OracleCallbackController(RaffleService raffleService, RaffleProperties properties) {
        this.raffleService = raffleService;
        this.callbackKey = properties.getOracle().getCallbackKey();
    }

    @PostMapping("/fulfill")
    public ApiResponse<DrawOutcomeResponse> fulfill(
            @RequestHeader(value = CALLBACK_KEY_HEADER, required = false) String presentedKey,
            @Valid @RequestBody FulfillRandomWordsRequest request
    ) {
        verifyCallbackKey(presentedKey);
        return raffleService.fulfill(request);
    }

    // Fails closed: without a configured key nobody may fulfill over HTTP
    private void verifyCallbackKey(String presentedKey) {
        if (callbackKey == null || callbackKey.isBlank()) {
            throw new ForbiddenException("Oracle callback endpoint is disabled: no callback key configured");
        }

        boolean ok = presentedKey != null && MessageDigest.isEqual(
                callbackKey.getBytes(StandardCharsets.UTF_8),
                presentedKey.getBytes(StandardCharsets.UTF_8));
        if (!ok) {
            throw new ForbiddenException("Oracle callback key rejected");
        }
    }
}
