package com.tokenexchange.rollup.http;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.tokenexchange.rollup.AdapterFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.assertEquals;

class StatusEndpointsTest {

    private EndpointHarness harness;

    @BeforeEach
    void setUp() throws Exception {
        harness = new EndpointHarness();
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void shouldReportHealthy() throws Exception {
        HttpResponse<String> response = harness.get("/health");

        assertEquals(200, response.statusCode());
        JsonObject body = JsonParser.parseString(response.body()).getAsJsonObject();
        assertEquals("healthy", body.get("status").getAsString());
        assertEquals("token-exchange-rollup", body.get("service").getAsString());
    }

    @Test
    void shouldServeEffectiveConfigurationAndCounters() throws Exception {
        harness.post("/execute-raw", AdapterFixtures.crossingPayload());
        harness.post("/execute-raw", AdapterFixtures.garbagePayload());

        HttpResponse<String> response = harness.get("/inspect");

        assertEquals(200, response.statusCode());
        JsonObject body = JsonParser.parseString(response.body()).getAsJsonObject();
        JsonObject config = body.getAsJsonObject("config");
        assertEquals(100, config.get("maxTradesPerBatch").getAsInt());
        assertEquals(1, config.get("minTradeAmount").getAsLong());
        assertEquals(10, config.get("makerFeeBps").getAsInt());
        assertEquals(20, config.get("takerFeeBps").getAsInt());
        assertEquals("STRICT", config.get("matchingMode").getAsString());

        JsonObject counters = body.getAsJsonObject("counters");
        assertEquals(2, counters.get("batchesProcessed").getAsLong());
        assertEquals(1, counters.get("notices").getAsLong());
        assertEquals(1, counters.get("decodeErrors").getAsLong());
        assertEquals(1, counters.get("tradesEmitted").getAsLong());
    }

    @Test
    void shouldRejectInspectPost() throws Exception {
        assertEquals(405, harness.postJson("/inspect", "{}").statusCode());
        assertEquals(0, harness.stats.inspects.get());
    }
}
