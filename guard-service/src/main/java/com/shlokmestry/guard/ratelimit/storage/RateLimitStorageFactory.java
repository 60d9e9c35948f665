package com.shlokmestry.guard.ratelimit.storage;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlokmestry.guard.config.RateLimitProps;

@Component
public class RateLimitStorageFactory {

    private static final Logger log = LoggerFactory.getLogger(RateLimitStorageFactory.class);

    private final RestClient.Builder restClientBuilder;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RateLimitStorageFactory(RestClient.Builder restClientBuilder, ObjectMapper objectMapper, Clock clock) {
        this.restClientBuilder = restClientBuilder;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public RateLimitStorage create(StorageBackend backend) {
        if (backend instanceof StorageBackend.Remote remote) {
            RateLimitProps.Remote config = remote.config();
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(config.timeout());
            requestFactory.setReadTimeout(config.timeout());

            RestClient restClient = RemoteCounterStore.restClient(
                    restClientBuilder.clone().requestFactory(requestFactory), config);
            log.info("ratelimit storage=remote url={} timeout={}", config.normalizedUrl(), config.timeout());
            return new RemoteCounterStore(restClient, objectMapper, clock);
        }

        log.warn("ratelimit storage=local: best-effort only, counters are per process and reset on restart. "
                + "Configure UPSTASH_REDIS_REST_URL and UPSTASH_REDIS_REST_TOKEN for shared limits.");
        return new LocalCounterStore(clock);
    }
}
