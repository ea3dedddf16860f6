package io.cspbuilder.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.cspbuilder.core.model.PolicyConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Builds policies from one shared {@link PolicyConfig} on many threads. Each
 * request carries its own update and nonce; no request may observe another's
 * tokens.
 */
@DisplayName("Concurrent policy builds")
class ConcurrentBuildTest {

    private static final int THREADS = 8;
    private static final int REQUESTS = 2_000;

    @Test
    @DisplayName("per-request overrides never leak across requests")
    void overridesDoNotLeak() throws Exception {
        PolicyConfig shared = PolicyConfig.builder()
                .directive("script-src", List.of("'self'"))
                .directive("report-uri", "/csp-report")
                .includeNonceIn("script-src")
                .build();

        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        try {
            List<Callable<String[]>> tasks = new ArrayList<>();
            for (int i = 0; i < REQUESTS; i++) {
                String host = "cdn" + i + ".example";
                String nonce = "n" + i;
                tasks.add(() -> {
                    String actual = PolicyBuilder.build(shared, Map.of("script-src", host), null, nonce);
                    String expected = "default-src 'self'; script-src 'self' " + host + " 'nonce-" + nonce
                            + "'; report-uri /csp-report";
                    return new String[] {expected, actual};
                });
            }

            for (Future<String[]> future : pool.invokeAll(tasks)) {
                String[] pair = future.get(10, TimeUnit.SECONDS);
                assertThat(pair[1]).isEqualTo(pair[0]);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(PolicyBuilder.build(shared))
                .isEqualTo("default-src 'self'; script-src 'self'; report-uri /csp-report");
    }
}
