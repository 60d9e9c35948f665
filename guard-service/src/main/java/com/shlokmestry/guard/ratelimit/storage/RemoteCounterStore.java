package com.shlokmestry.guard.ratelimit.storage;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlokmestry.guard.config.RateLimitProps;

/**
 * Counters in a shared key-value service reached over HTTP. Commands are sent as a JSON
 * array of command arrays to {@code /pipeline}; the service answers with one
 * {@code {"result": ...}} or {@code {"error": ...}} object per command.
 */
public class RemoteCounterStore implements RateLimitStorage {

    private static final Logger log = LoggerFactory.getLogger(RemoteCounterStore.class);
    private static final String PIPELINE_PATH = "/pipeline";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RemoteCounterStore(RestClient restClient, ObjectMapper objectMapper, Clock clock) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Points {@code builder} at the configured endpoint with the bearer token attached.
     */
    public static RestClient restClient(RestClient.Builder builder, RateLimitProps.Remote remote) {
        return builder
                .baseUrl(remote.normalizedUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + remote.token())
                .build();
    }

    /**
     * Entries written by {@link #set} come back as stored. Bare counters written by
     * {@link #increment} carry no window start, so it is reported as 0 and the expiry is
     * taken from the key's remaining TTL.
     */
    @Override
    public Optional<RateLimitEntry> get(String key) {
        JsonNode results = pipeline(List.of(
                List.of("GET", key),
                List.of("PTTL", key)));

        JsonNode value = result(results, 0, "GET");
        if (value == null || value.isNull()) {
            return Optional.empty();
        }

        String raw = value.asText().trim();
        if (raw.startsWith("{")) {
            try {
                return Optional.of(objectMapper.readValue(raw, RateLimitEntry.class));
            } catch (JsonProcessingException e) {
                throw new StorageException("Unreadable rate limit entry at " + key, e);
            }
        }

        long count;
        try {
            count = Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new StorageException("Unexpected value at " + key, e);
        }
        JsonNode pttl = optionalResult(results, 1, "PTTL");
        long ttl = pttl == null ? -1 : pttl.asLong(-1);
        long expiresAt = ttl > 0 ? clock.millis() + ttl : 0;
        return Optional.of(new RateLimitEntry(count, 0, expiresAt));
    }

    @Override
    public void set(String key, RateLimitEntry entry, long ttlMs) {
        String json;
        try {
            json = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot serialize rate limit entry", e);
        }
        JsonNode results = pipeline(List.of(List.of("SETEX", key, ttlSeconds(ttlMs), json)));
        result(results, 0, "SETEX");
    }

    /**
     * INCR and EXPIRE travel in one pipeline. EXPIRE carries NX so only the first increment
     * of a window sets the TTL; its failure is logged, not raised.
     */
    @Override
    public long increment(String key, long ttlMs) {
        JsonNode results = pipeline(List.of(
                List.of("INCR", key),
                List.of("EXPIRE", key, ttlSeconds(ttlMs), "NX")));

        JsonNode count = result(results, 0, "INCR");
        if (count == null || !count.canConvertToLong()) {
            throw new StorageException("INCR returned a non-integer result for " + key);
        }

        JsonNode expire = results.get(1);
        if (expire != null && expire.hasNonNull("error")) {
            log.warn("remote store EXPIRE failed key={} error={}", key, expire.get("error").asText());
        }
        return count.asLong();
    }

    @Override
    public String type() {
        return "remote";
    }

    /**
     * Round trip to the service.
     *
     * @return the PING reply, normally {@code PONG}
     */
    public String ping() {
        JsonNode reply = result(pipeline(List.of(List.of("PING"))), 0, "PING");
        return reply == null ? null : reply.asText();
    }

    private JsonNode pipeline(List<List<String>> commands) {
        JsonNode response;
        try {
            response = restClient.post()
                    .uri(PIPELINE_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(commands)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new StorageException("Remote store request failed", e);
        }
        if (response == null || !response.isArray() || response.size() != commands.size()) {
            throw new StorageException("Remote store returned an unexpected pipeline response");
        }
        return response;
    }

    private static JsonNode result(JsonNode results, int index, String command) {
        JsonNode reply = results.get(index);
        if (reply.hasNonNull("error")) {
            throw new StorageException(command + " failed: " + reply.get("error").asText());
        }
        return reply.get("result");
    }

    private static JsonNode optionalResult(JsonNode results, int index, String command) {
        JsonNode reply = results.get(index);
        if (reply.hasNonNull("error")) {
            log.warn("remote store {} failed error={}", command, reply.get("error").asText());
            return null;
        }
        return reply.get("result");
    }

    private static String ttlSeconds(long ttlMs) {
        return String.valueOf(Math.max(1, (ttlMs + 999) / 1000));
    }
}
