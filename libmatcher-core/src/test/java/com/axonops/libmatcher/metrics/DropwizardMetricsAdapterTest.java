/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.libmatcher.metrics;

import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the Dropwizard adapter and the no-op registry.
 */
class DropwizardMetricsAdapterTest {

    private MetricRegistry registry;

    @BeforeEach
    void setup() {
        registry = new MetricRegistry();
    }

    @Test
    void testCountersUsePrefix() {
        DropwizardMetricsAdapter adapter = new DropwizardMetricsAdapter(registry, "test.prefix");

        adapter.incrementCounter(MetricNames.QUERIES_FIND);
        adapter.incrementCounter(MetricNames.QUERIES_FIND, 4);

        assertThat(registry.counter("test.prefix.queries.find.total.count").getCount()).isEqualTo(5);
        assertThat(adapter.getPrefix()).isEqualTo("test.prefix");
    }

    @Test
    void testTimerRecordsNanos() {
        DropwizardMetricsAdapter adapter = new DropwizardMetricsAdapter(registry, "t");

        adapter.recordTimer(MetricNames.QUERIES_FIND_LATENCY, 1_500);

        assertThat(registry.timer("t.queries.find.latency").getCount()).isEqualTo(1);
        assertThat(registry.timer("t.queries.find.latency").getSnapshot().getMax()).isEqualTo(1_500);
    }

    @Test
    void testDefaultPrefix() {
        DropwizardMetricsAdapter adapter = new DropwizardMetricsAdapter(registry);

        adapter.incrementCounter(MetricNames.ERRORS_ENGINE);

        assertThat(registry.getCounters()).containsOnlyKeys("com.axonops.libmatcher.errors.engine.total.count");
    }

    @Test
    void testNullArgumentsRejected() {
        assertThatNullPointerException().isThrownBy(() -> new DropwizardMetricsAdapter(null));
        assertThatNullPointerException().isThrownBy(() -> new DropwizardMetricsAdapter(registry, null));
    }

    @Test
    void testNoOpRegistryAcceptsEverything() {
        MatcherMetricsRegistry noop = NoOpMetricsRegistry.INSTANCE;

        assertThatCode(() -> {
            noop.incrementCounter(MetricNames.QUERIES_FIND);
            noop.incrementCounter(MetricNames.QUERIES_FIND, 10);
            noop.recordTimer(MetricNames.ITERATIONS_LATENCY, 100);
        }).doesNotThrowAnyException();
    }
}
