package com.tokenexchange.rollup.rollup;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.tokenexchange.engine.codec.HexPayloads;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Client for the rollup HTTP server.
 *
 * <ul>
 *   <li>POST /finish {"status":"accept"|"reject"}: 202 means nothing pending, 200 carries
 *       the next request</li>
 *   <li>POST /notice {"payload":"0x..."}</li>
 *   <li>POST /report {"payload":"0x..."}</li>
 * </ul>
 */
public class RollupHttpClient {

    public static final String ACCEPT = "accept";
    public static final String REJECT = "reject";

    private final String baseUrl;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public RollupHttpClient(String baseUrl, HttpClient httpClient, Duration requestTimeout) {
        this.baseUrl = baseUrl;
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Report the status of the previous request and wait for the next one.
     *
     * @return empty when the server has nothing pending (HTTP 202)
     * @throws IOException on transport failure, an unexpected status code or a
     *                     malformed request body
     */
    public Optional<RollupRequest> finish(String status) throws IOException, InterruptedException {
        JsonObject body = new JsonObject();
        body.addProperty("status", status);

        // /finish long-polls until the next request arrives, so it has no request timeout
        HttpResponse<String> response = post("/finish", body, null);
        if (response.statusCode() == 202) {
            return Optional.empty();
        }
        if (response.statusCode() != 200) {
            throw new IOException("Unexpected /finish status " + response.statusCode());
        }

        try {
            JsonObject json = JsonParser.parseString(response.body()).getAsJsonObject();
            String requestType = json.get("request_type").getAsString();
            JsonObject data = json.getAsJsonObject("data");
            String payloadHex = data.get("payload").getAsString();
            return Optional.of(new RollupRequest(requestType, HexPayloads.fromHex(payloadHex)));
        } catch (JsonParseException | IllegalStateException | IllegalArgumentException
                 | NullPointerException | ClassCastException e) {
            throw new IOException("Malformed /finish response: " + e.getMessage(), e);
        }
    }

    public void sendNotice(byte[] payload) throws IOException, InterruptedException {
        sendPayload("/notice", payload);
    }

    public void sendReport(byte[] payload) throws IOException, InterruptedException {
        sendPayload("/report", payload);
    }

    private void sendPayload(String path, byte[] payload) throws IOException, InterruptedException {
        JsonObject body = new JsonObject();
        body.addProperty("payload", HexPayloads.toHex(payload));

        HttpResponse<String> response = post(path, body, requestTimeout);
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("Unexpected " + path + " status " + response.statusCode());
        }
    }

    private HttpResponse<String> post(String path, JsonObject body, Duration timeout)
            throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8));
        if (timeout != null) {
            builder.timeout(timeout);
        }
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }
}
