package com.raffleapp.raffle.payout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raffleapp.common.http.JsonHttpClient;
import com.raffleapp.common.http.JsonHttpException;
import com.raffleapp.raffle.config.RaffleProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
@ConditionalOnProperty(name = "raffle.payout.mode", havingValue = "http")
public class HttpPayoutGateway implements PayoutGateway {

    private final JsonHttpClient http;
    private final String endpoint;
    private final String apiKey;

    public HttpPayoutGateway(RaffleProperties properties, ObjectMapper objectMapper) {
        RaffleProperties.Payout payout = properties.getPayout();
        this.http = new JsonHttpClient(objectMapper, Duration.ofSeconds(10), payout.getRequestTimeout());
        this.endpoint = payout.getEndpoint();
        this.apiKey = payout.getApiKey();
    }

    @Override
    public TransferResult transfer(String identity, BigDecimal amount, String reference) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("to", identity);
        body.put("amount", amount.toPlainString());
        body.put("reference", reference);

        Map<String, String> headers = new LinkedHashMap<>();
        if (apiKey != null && !apiKey.isBlank()) headers.put("X-Api-Key", apiKey);

        try {
            JsonNode resp = http.post(endpoint, body, headers);
            String txRef = resp.path("transferId").asText(null);
            return TransferResult.success(txRef == null ? reference : txRef);
        } catch (JsonHttpException e) {
            log.warn("Payout transfer to {} failed: {}", identity, e.getMessage());
            return TransferResult.failure(e.getMessage());
        }
    }
}
