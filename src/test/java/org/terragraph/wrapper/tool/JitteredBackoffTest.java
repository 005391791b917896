package org.terragraph.wrapper.tool;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class JitteredBackoffTest {

    @Test
    void delaysGrowButStayBelowTheCap() throws InterruptedException {
        List<Duration> delays = new ArrayList<>();
        JitteredBackoff backoff = new JitteredBackoff(Duration.ofMillis(100), Duration.ofMillis(500), delays::add);

        Duration total = Duration.ZERO;
        for (int i = 0; i < 10; i++) {
            total = backoff.next();
        }

        assertThat(delays).hasSize(10);
        assertThat(delays.get(0)).isBetween(Duration.ZERO, Duration.ofMillis(100));
        assertThat(delays).allSatisfy(delay -> assertThat(delay).isBetween(Duration.ZERO, Duration.ofMillis(500)));
        assertThat(total).isEqualTo(delays.stream().reduce(Duration.ZERO, Duration::plus));
    }

    @Test
    void retriableErrorsMatchKnownFragments() {
        List<String> found = RetriableErrors.find(List.of(
            "Plan: 1 to add",
            "Error: RequestError: send request failed",
            "read tcp: connection reset by peer"));

        assertThat(found).containsExactly("Error: RequestError: send request failed", "read tcp: connection reset by peer");
        assertThat(RetriableErrors.find(List.of("Error: Invalid reference"))).isEmpty();
    }
}
