package com.tokenexchange.rollup.http;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.tokenexchange.engine.codec.HexPayloads;
import com.tokenexchange.engine.codec.TradeCodec;
import com.tokenexchange.engine.domain.Trade;
import com.tokenexchange.rollup.AdapterFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.net.http.HttpResponse;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecuteHttpHandlerTest {

    private EndpointHarness harness;

    @BeforeEach
    void setUp() throws Exception {
        harness = new EndpointHarness();
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private static JsonObject json(HttpResponse<String> response) {
        return JsonParser.parseString(response.body()).getAsJsonObject();
    }

    @Test
    void shouldReturnTradeArrayForValidBatch() throws Exception {
        String input = HexPayloads.toHex(AdapterFixtures.crossingPayload());

        HttpResponse<String> response = harness.postJson("/execute",
                "{\"input_payload_hex\":\"" + input + "\"}");

        assertEquals(200, response.statusCode());
        byte[] output = HexPayloads.fromHex(json(response).get("output_payload_hex").getAsString());
        List<Trade> trades = TradeCodec.decodeTrades(output);
        assertEquals(1, trades.size());
        assertEquals(BigInteger.ONE, trades.get(0).buyOrderId());
        assertEquals(BigInteger.TWO, trades.get(0).sellOrderId());
        assertEquals(BigInteger.TEN, trades.get(0).quantity());
        assertEquals(1.0, harness.metrics.httpRequestsTotal.labelValues("/execute", "2xx").get());
    }

    @Test
    void shouldAcceptHexWithoutPrefix() throws Exception {
        String input = HexPayloads.toHex(AdapterFixtures.crossingPayload()).substring(2);

        HttpResponse<String> response = harness.postJson("/execute",
                "{\"input_payload_hex\":\"" + input + "\"}");

        assertEquals(200, response.statusCode());
    }

    @Test
    void shouldReturnServerErrorWithDetailsForMalformedPayload() throws Exception {
        HttpResponse<String> response = harness.postJson("/execute",
                "{\"input_payload_hex\":\"0x010203\"}");

        assertEquals(500, response.statusCode());
        JsonObject body = json(response);
        assertTrue(body.get("error").getAsString().startsWith("DecodeError: "));
        assertEquals("DecodeError", body.getAsJsonObject("details").get("errorKind").getAsString());
    }

    @Test
    void shouldRejectMissingField() throws Exception {
        HttpResponse<String> response = harness.postJson("/execute", "{\"payload\":\"0x00\"}");

        assertEquals(400, response.statusCode());
        assertTrue(json(response).get("error").getAsString().contains("input_payload_hex"));
        assertEquals(0, harness.stats.batchesProcessed.get());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{\"input_payload_hex\":{}}",
        "{\"input_payload_hex\":[\"0x00\"]}",
        "{\"input_payload_hex\":42}"
    })
    void shouldRejectNonStringPayloadField(String body) throws Exception {
        HttpResponse<String> response = harness.postJson("/execute", body);

        assertEquals(400, response.statusCode());
        assertTrue(json(response).get("error").getAsString().contains("input_payload_hex"));
        assertEquals(1.0, harness.metrics.httpRequestsTotal.labelValues("/execute", "4xx").get());
        assertEquals(0, harness.stats.batchesProcessed.get());
    }

    @Test
    void shouldRejectInvalidHex() throws Exception {
        HttpResponse<String> response = harness.postJson("/execute",
                "{\"input_payload_hex\":\"0xzz\"}");

        assertEquals(400, response.statusCode());
    }

    @Test
    void shouldRejectInvalidJson() throws Exception {
        HttpResponse<String> response = harness.postJson("/execute", "not json {");

        assertEquals(400, response.statusCode());
    }

    @Test
    void shouldRejectGet() throws Exception {
        assertEquals(405, harness.get("/execute").statusCode());
    }
}
