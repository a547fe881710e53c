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

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Dropwizard Metrics adapter for libmatcher-java.
 *
 * <p>Wraps a Dropwizard {@link MetricRegistry} and delegates all metric operations to it, so
 * matcher metrics land in whatever registry the host application already reports from.
 *
 * <p><strong>Thread Safety:</strong> MetricRegistry and all Dropwizard metric
 * types are thread-safe. This adapter is fully thread-safe.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * MatcherMetricsRegistry metrics = new DropwizardMetricsAdapter(registry, "com.myapp.search");
 * // -> com.myapp.search.queries.find.total.count, com.myapp.search.queries.find.latency, ...
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements MatcherMetricsRegistry {

    /** Prefix used when none is given. */
    public static final String DEFAULT_PREFIX = "com.axonops.libmatcher";

    private final MetricRegistry registry;
    private final String prefix;

    /**
     * Creates adapter with default metric prefix: {@code com.axonops.libmatcher}
     *
     * @param registry the Dropwizard MetricRegistry to register metrics with
     * @throws NullPointerException if registry is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates adapter with custom metric prefix.
     *
     * @param registry the Dropwizard MetricRegistry to register metrics with
     * @param prefix the metric name prefix (e.g., "com.myapp.search")
     * @throws NullPointerException if registry or prefix is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(metricName(name)).inc();
    }

    @Override
    public void incrementCounter(String name, long delta) {
        registry.counter(metricName(name)).inc(delta);
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        registry.timer(metricName(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    public String getPrefix() {
        return prefix;
    }

    private String metricName(String name) {
        return MetricRegistry.name(prefix, name);
    }
}
