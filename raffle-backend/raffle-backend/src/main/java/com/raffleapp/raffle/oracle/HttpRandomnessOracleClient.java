package com.raffleapp.raffle.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raffleapp.common.http.JsonHttpClient;
import com.raffleapp.common.http.JsonHttpException;
import com.raffleapp.raffle.config.RaffleProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Submits requests to a remote oracle coordinator over https. The coordinator
 * answers later on {@code /api/raffle/oracle/fulfill}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "raffle.oracle.mode", havingValue = "http")
public class HttpRandomnessOracleClient implements RandomnessOracleClient {

    private final JsonHttpClient http;
    private final String endpoint;
    private final String apiKey;

    public HttpRandomnessOracleClient(RaffleProperties properties, ObjectMapper objectMapper) {
        RaffleProperties.Oracle oracle = properties.getOracle();
        this.http = new JsonHttpClient(objectMapper, oracle.getConnectTimeout(), oracle.getRequestTimeout());
        this.endpoint = oracle.getEndpoint();
        this.apiKey = oracle.getApiKey();
    }

    @Override
    public String submitRequest(OracleRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("keyHash", request.gasLane());
        body.put("subscriptionId", request.subscriptionId());
        body.put("minimumRequestConfirmations", request.requestConfirmations());
        body.put("callbackGasLimit", request.callbackGasLimit());
        body.put("numWords", request.numWords());

        Map<String, String> headers = new LinkedHashMap<>();
        if (apiKey != null && !apiKey.isBlank()) headers.put("X-Api-Key", apiKey);

        JsonNode resp = http.post(endpoint, body, headers);
        String requestId = resp.path("requestId").asText("");
        if (requestId.isBlank()) {
            throw new JsonHttpException("Oracle response carried no requestId", 200, null);
        }

        log.debug("Oracle accepted request {}", requestId);
        return requestId;
    }
}
