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

package com.axonops.libmatcher.dropwizard;

import com.axonops.libmatcher.config.MatcherConfig;
import com.axonops.libmatcher.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for MatcherConfig with Dropwizard Metrics integration.
 *
 * <p>This class provides easy setup for applications using Dropwizard Metrics,
 * including automatic JMX exposure.
 *
 * <p><strong>Usage Examples:</strong>
 * <pre>{@code
 * // Framework registry:
 * MetricRegistry frameworkRegistry = getFrameworkRegistry();
 * MatcherConfig config = MatcherMetricsConfig.withMetrics(frameworkRegistry, "com.myapp.search");
 *
 * // Standalone app:
 * MetricRegistry registry = new MetricRegistry();
 * MatcherConfig config = MatcherMetricsConfig.withMetrics(registry);
 *
 * Matcher<ArrayCaptures> matcher = new InstrumentedMatcher<>(engine, "keywords", config);
 * }</pre>
 *
 * <p><strong>JMX Exposure:</strong> This class sets up a single JmxReporter for the first
 * registry it is given (if not already configured), so matcher metrics are visible via JMX.
 *
 * @since 1.0.0
 */
public final class MatcherMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(MatcherMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private MatcherMetricsConfig() {
        // Utility class
    }

    /**
     * Creates MatcherConfig with Dropwizard Metrics integration, latency timing and automatic JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return configured MatcherConfig with metrics enabled
     */
    public static MatcherConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates MatcherConfig with Dropwizard Metrics integration and latency timing.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to automatically set up JMX exposure
     * @return configured MatcherConfig with metrics enabled
     */
    public static MatcherConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return MatcherConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
            .latencyTimingEnabled(true)
            .build();
    }

    /**
     * Creates MatcherConfig with Dropwizard Metrics using default prefix.
     *
     * <p>Uses default metric prefix: {@code "com.axonops.libmatcher"}
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return configured MatcherConfig with metrics enabled
     */
    public static MatcherConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * True while a JmxReporter started by this class is running.
     */
    public static boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /**
     * Ensures JmxReporter is registered for the given MetricRegistry.
     *
     * <p>Idempotent: safe to call multiple times, only creates one reporter.
     *
     * @param registry the MetricRegistry to expose via JMX
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("libmatcher: Registering JmxReporter for metrics");
                JmxReporter reporter = JmxReporter.forRegistry(registry).build();
                reporter.start();
                jmxReporter = reporter;
                logger.info("libmatcher: JmxReporter started - metrics available via JMX");
            } catch (RuntimeException e) {
                // Not fatal - registry may already have JMX exposure
                logger.warn("libmatcher: Failed to start JmxReporter (may already be configured)", e);
            }
        }
    }

    /**
     * Stops the JmxReporter started by this class, if any.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("libmatcher: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
