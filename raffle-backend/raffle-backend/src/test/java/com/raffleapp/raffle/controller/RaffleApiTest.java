package com.raffleapp.raffle.controller;

import com.jayway.jsonpath.JsonPath;
import com.raffleapp.raffle.support.RaffleTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class RaffleApiTest extends RaffleTestSupport {

    static final String CALLBACK_KEY = "test-callback-key";

    @Autowired MockMvc mvc;

    private ResultActions postJson(String path, String body) throws Exception {
        return mvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body));
    }

    private ResultActions enter(String identity, String fee) throws Exception {
        return postJson("/api/raffle/enter", "{\"identity\":\"" + identity + "\",\"feePaid\":" + fee + "}");
    }

    private String fulfillBody(String requestId, long word) {
        return "{\"requestId\":\"" + requestId + "\",\"randomWords\":[" + word + "]}";
    }

    @Test
    void enterAndReadState() throws Exception {
        enter("alice", "0.01")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.index").value(0))
                .andExpect(jsonPath("$.data.identity").value("alice"))
                .andExpect(jsonPath("$.data.roundNumber").value(1));

        mvc.perform(post("/api/raffle/state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.phase").value("OPEN"))
                .andExpect(jsonPath("$.data.numberOfPlayers").value(1))
                .andExpect(jsonPath("$.data.intervalSeconds").value(30))
                .andExpect(jsonPath("$.data.requestConfirmations").value(3))
                .andExpect(jsonPath("$.data.numWords").value(1))
                .andExpect(jsonPath("$.data.drawPending").value(false))
                .andExpect(jsonPath("$.data.drawStalled").value(false))
                .andExpect(jsonPath("$.warnings").doesNotExist());

        postJson("/api/raffle/entrants/at", "{\"index\":0}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.identity").value("alice"));

        mvc.perform(post("/api/raffle/entrants"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.meta.count").value(1));
    }

    @Test
    void errorsMapToStatusAndCode() throws Exception {
        enter("alice", "0.001")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INSUFFICIENT_FEE"));

        postJson("/api/raffle/enter", "{\"feePaid\":0.01}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));

        enter("alice", "1e25")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));
        enter("alice", "0.0100000000000000001")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));

        postJson("/api/raffle/entrants/at", "{\"index\":4}")
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));

        mvc.perform(post("/api/raffle/upkeep/perform"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("UPKEEP_NOT_NEEDED"))
                .andExpect(jsonPath("$.details.numPlayers").value(0))
                .andExpect(jsonPath("$.details.phase").value("OPEN"));

        mvc.perform(post("/api/raffle/upkeep/abandon"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("DRAW_NOT_STALLED"))
                .andExpect(jsonPath("$.details.requestOutstanding").value(false));
    }

    @Test
    void keeperAndOracleRoundTrip() throws Exception {
        enter("alice", "0.01").andExpect(status().isOk());

        mvc.perform(post("/api/raffle/upkeep/check"))
                .andExpect(jsonPath("$.data.upkeepNeeded").value(false))
                .andExpect(jsonPath("$.data.performData").value("0x"));

        clock.advance(PAST_INTERVAL);
        mvc.perform(post("/api/raffle/upkeep/check"))
                .andExpect(jsonPath("$.data.upkeepNeeded").value(true));

        String performed = mvc.perform(post("/api/raffle/upkeep/perform"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        String requestId = JsonPath.read(performed, "$.data.requestId");

        enter("bob", "0.01")
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("ROUND_NOT_OPEN"));

        postJson("/api/raffle/oracle/fulfill", fulfillBody(requestId, 9))
                .andExpect(status().isForbidden());

        mvc.perform(post("/api/raffle/oracle/fulfill")
                        .header(OracleCallbackController.CALLBACK_KEY_HEADER, "wrong")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(fulfillBody(requestId, 9)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("FORBIDDEN"));

        mvc.perform(post("/api/raffle/oracle/fulfill")
                        .header(OracleCallbackController.CALLBACK_KEY_HEADER, CALLBACK_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(fulfillBody(requestId, 9)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.winner").value("alice"))
                .andExpect(jsonPath("$.data.payoutStatus").value("PAID"));

        mvc.perform(post("/api/raffle/oracle/fulfill")
                        .header(OracleCallbackController.CALLBACK_KEY_HEADER, CALLBACK_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(fulfillBody(requestId, 9)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("UNKNOWN_OR_STALE_REQUEST"));

        postJson("/api/raffle/payouts/search", "{\"status\":\"PAID\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].winner").value("alice"))
                .andExpect(jsonPath("$.data[0].attempts").value(1));

        mvc.perform(post("/api/raffle/state"))
                .andExpect(jsonPath("$.data.phase").value("OPEN"))
                .andExpect(jsonPath("$.data.recentWinner").value("alice"))
                .andExpect(jsonPath("$.data.numberOfPlayers").value(0));
    }

    @Test
    void failedPayoutCanBeRetriedOverHttp() throws Exception {
        ledger.rejectTransfersTo("alice");
        enter("alice", "0.01").andExpect(status().isOk());
        clock.advance(PAST_INTERVAL);

        String performed = mvc.perform(post("/api/raffle/upkeep/perform"))
                .andReturn().getResponse().getContentAsString();
        String requestId = JsonPath.read(performed, "$.data.requestId");

        String failed = mvc.perform(post("/api/raffle/oracle/fulfill")
                        .header(OracleCallbackController.CALLBACK_KEY_HEADER, CALLBACK_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(fulfillBody(requestId, 0)))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.errorCode").value("PAYOUT_FAILED"))
                .andReturn().getResponse().getContentAsString();
        Number payoutId = JsonPath.read(failed, "$.details.payoutId");

        ledger.acceptTransfersTo("alice");
        postJson("/api/raffle/payouts/retry", "{\"payoutId\":" + payoutId.longValue() + "}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("PAID"))
                .andExpect(jsonPath("$.data.attempts").value(2));
    }
}
