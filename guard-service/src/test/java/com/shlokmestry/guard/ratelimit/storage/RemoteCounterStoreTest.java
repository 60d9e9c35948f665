package com.shlokmestry.guard.ratelimit.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.io.IOException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlokmestry.guard.config.RateLimitProps;
import com.shlokmestry.guard.testutil.MutableClock;

class RemoteCounterStoreTest {

    private static final String PIPELINE = "https://kv.example.com/pipeline";

    private final MutableClock clock = new MutableClock(1_700_000_000_000L);
    private MockRestServiceServer server;
    private RemoteCounterStore store;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        RateLimitProps.Remote remote = new RateLimitProps.Remote("https://kv.example.com//", "s3cret", null);
        store = new RemoteCounterStore(RemoteCounterStore.restClient(builder, remote), new ObjectMapper(), clock);
    }

    @Test
    void increment_sendsIncrAndExpireNx_inOnePipeline() {
        server.expect(requestTo(PIPELINE))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer s3cret"))
                .andExpect(content().json("[[\"INCR\",\"ratelimit:alice:0\"],[\"EXPIRE\",\"ratelimit:alice:0\",\"60\",\"NX\"]]", true))
                .andRespond(withSuccess("[{\"result\":3},{\"result\":0}]", MediaType.APPLICATION_JSON));

        assertThat(store.increment("ratelimit:alice:0", 60_000)).isEqualTo(3);
        server.verify();
    }

    @Test
    void increment_roundsSubSecondTtlUp() {
        server.expect(requestTo(PIPELINE))
                .andExpect(content().json("[[\"INCR\",\"k\"],[\"EXPIRE\",\"k\",\"1\",\"NX\"]]", true))
                .andRespond(withSuccess("[{\"result\":1},{\"result\":1}]", MediaType.APPLICATION_JSON));

        assertThat(store.increment("k", 250)).isEqualTo(1);
    }

    @Test
    void increment_toleratesExpireError() {
        server.expect(requestTo(PIPELINE))
                .andRespond(withSuccess("[{\"result\":1},{\"error\":\"ERR syntax error\"}]", MediaType.APPLICATION_JSON));

        assertThat(store.increment("k", 60_000)).isEqualTo(1);
    }

    @Test
    void increment_failsOnIncrError() {
        server.expect(requestTo(PIPELINE))
                .andRespond(withSuccess("[{\"error\":\"WRONGTYPE\"},{\"result\":0}]", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> store.increment("k", 60_000))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("WRONGTYPE");
    }

    @Test
    void serverError_becomesStorageException() {
        server.expect(requestTo(PIPELINE)).andRespond(withServerError());

        assertThatThrownBy(() -> store.increment("k", 60_000)).isInstanceOf(StorageException.class);
    }

    @Test
    void connectionFailure_becomesStorageException() {
        server.expect(requestTo(PIPELINE)).andRespond(withException(new IOException("connection refused")));

        assertThatThrownBy(() -> store.increment("k", 60_000)).isInstanceOf(StorageException.class);
    }

    @Test
    void malformedPipelineResponse_becomesStorageException() {
        server.expect(requestTo(PIPELINE))
                .andRespond(withSuccess("[{\"result\":1}]", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> store.increment("k", 60_000)).isInstanceOf(StorageException.class);
    }

    @Test
    void get_missingKey_isEmpty() {
        server.expect(requestTo(PIPELINE))
                .andExpect(content().json("[[\"GET\",\"k\"],[\"PTTL\",\"k\"]]", true))
                .andRespond(withSuccess("[{\"result\":null},{\"result\":-2}]", MediaType.APPLICATION_JSON));

        assertThat(store.get("k")).isEmpty();
    }

    @Test
    void get_bareCounter_usesRemainingTtl() {
        server.expect(requestTo(PIPELINE))
                .andRespond(withSuccess("[{\"result\":\"7\"},{\"result\":45000}]", MediaType.APPLICATION_JSON));

        assertThat(store.get("k")).contains(new RateLimitEntry(7, 0, 1_700_000_045_000L));
    }

    @Test
    void get_storedEntry_isParsed() {
        server.expect(requestTo(PIPELINE))
                .andRespond(withSuccess(
                        "[{\"result\":\"{\\\"count\\\":4,\\\"windowStart\\\":60000,\\\"expiresAt\\\":120000}\"},{\"result\":30000}]",
                        MediaType.APPLICATION_JSON));

        assertThat(store.get("k")).contains(new RateLimitEntry(4, 60_000, 120_000));
    }

    @Test
    void set_writesJsonEntryWithSetex() {
        server.expect(requestTo(PIPELINE))
                .andExpect(jsonPath("$[0][0]").value("SETEX"))
                .andExpect(jsonPath("$[0][1]").value("k"))
                .andExpect(jsonPath("$[0][2]").value("60"))
                .andExpect(jsonPath("$[0][3]").value(containsString("\"count\":2")))
                .andRespond(withSuccess("[{\"result\":\"OK\"}]", MediaType.APPLICATION_JSON));

        store.set("k", new RateLimitEntry(2, 0, 60_000), 60_000);
        server.verify();
    }

    @Test
    void ping_returnsReply() {
        server.expect(requestTo(PIPELINE))
                .andExpect(content().json("[[\"PING\"]]", true))
                .andRespond(withSuccess("[{\"result\":\"PONG\"}]", MediaType.APPLICATION_JSON));

        assertThat(store.ping()).isEqualTo("PONG");
        assertThat(store.type()).isEqualTo("remote");
    }
}
