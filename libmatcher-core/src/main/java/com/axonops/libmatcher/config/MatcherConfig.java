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

package com.axonops.libmatcher.config;

import com.axonops.libmatcher.metrics.MatcherMetricsRegistry;
import com.axonops.libmatcher.metrics.NoOpMetricsRegistry;
import java.util.Objects;

/**
 * Configuration for matcher instrumentation.
 *
 * <p>Immutable configuration using Java 17 records. Consumed by {@link
 * com.axonops.libmatcher.instrument.InstrumentedMatcher}; plain engines take no configuration from
 * this library.
 *
 * <h2>Configuration Examples</h2>
 *
 * <h3>Default</h3>
 *
 * <pre>{@code
 * // Metrics disabled, no timing, no slow-query warnings
 * MatcherConfig config = MatcherConfig.DEFAULT;
 * }</pre>
 *
 * <h3>Production Service</h3>
 *
 * <pre>{@code
 * MatcherConfig config = MatcherConfig.builder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.search"))
 *     .latencyTimingEnabled(true)
 *     .slowQueryThresholdMicros(50_000)   // warn on queries slower than 50ms
 *     .build();
 * }</pre>
 *
 * <h2>Tuning Recommendations</h2>
 *
 * <ul>
 *   <li><b>latencyTimingEnabled default: false</b> - costs two {@code System.nanoTime()} calls per
 *       query; enable when latency histograms are wanted
 *   <li><b>slowQueryThresholdMicros default: 0 (disabled)</b> - engines bound their own worst case;
 *       this only makes pathological inputs visible in logs and metrics
 * </ul>
 *
 * @param latencyTimingEnabled record query and iteration latency timers
 * @param slowQueryThresholdMicros log and count engine queries slower than this (0 = disabled)
 * @param metricsRegistry Metrics implementation (use {@link NoOpMetricsRegistry} for zero overhead)
 * @since 1.0.0
 * @see com.axonops.libmatcher.metrics.MetricNames
 */
public record MatcherConfig(
    boolean latencyTimingEnabled,
    long slowQueryThresholdMicros,
    MatcherMetricsRegistry metricsRegistry) {

  public static final MatcherConfig DEFAULT =
      new MatcherConfig(
          false, // No latency timers
          0, // Slow-query detection disabled
          NoOpMetricsRegistry.INSTANCE // Metrics disabled (zero overhead)
          );

  public MatcherConfig {
    if (slowQueryThresholdMicros < 0) {
      throw new IllegalArgumentException(
          "slowQueryThresholdMicros must be non-negative (0 disables slow-query detection)");
    }
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
  }

  /** True if queries must be timed, for latency timers or slow-query detection. */
  public boolean timingRequired() {
    return latencyTimingEnabled || slowQueryThresholdMicros > 0;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private boolean latencyTimingEnabled = false;
    private long slowQueryThresholdMicros = 0;
    private MatcherMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    public Builder latencyTimingEnabled(boolean enabled) {
      this.latencyTimingEnabled = enabled;
      return this;
    }

    public Builder slowQueryThresholdMicros(long micros) {
      this.slowQueryThresholdMicros = micros;
      return this;
    }

    public Builder metricsRegistry(MatcherMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    public MatcherConfig build() {
      return new MatcherConfig(latencyTimingEnabled, slowQueryThresholdMicros, metricsRegistry);
    }
  }
}
