package com.shlokmestry.guard;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.TestPropertySource;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@TestPropertySource(properties = {
        "app.mode=production",
        // nothing listens here, so every counter update fails
        "app.ratelimit.remote.url=http://127.0.0.1:6390",
        "app.ratelimit.remote.token=test-token",
        "app.ratelimit.remote.timeout=500ms",
        "app.encryption.key=000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f"
})
class FailClosedWhenRemoteStoreDownTest {

    @LocalServerPort
    int port;

    private final HttpClient http = HttpClient.newHttpClient();

    @Test
    void request_returns429_whenRemoteStoreUnavailable() throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + port + "/api/projects"))
                .GET()
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());

        assertThat(resp.statusCode()).isEqualTo(429);
        assertThat(resp.headers().firstValue(HttpHeaders.RETRY_AFTER)).contains("60");
        assertThat(resp.body()).contains("Too many requests");
    }

    @Test
    void excludedPath_bypassesLimiter() throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + port + "/actuator/health"))
                .GET()
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());

        assertThat(resp.statusCode()).isEqualTo(200);
        assertThat(resp.headers().firstValue("X-RateLimit-Limit")).isEmpty();
    }
}
