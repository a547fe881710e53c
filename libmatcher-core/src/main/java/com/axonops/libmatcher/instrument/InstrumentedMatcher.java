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

package com.axonops.libmatcher.instrument;

import com.axonops.libmatcher.api.Captures;
import com.axonops.libmatcher.api.FallibleCapturesSink;
import com.axonops.libmatcher.api.FallibleMatchSink;
import com.axonops.libmatcher.api.IterationControl;
import com.axonops.libmatcher.api.Match;
import com.axonops.libmatcher.api.Matcher;
import com.axonops.libmatcher.api.MatcherException;
import com.axonops.libmatcher.config.MatcherConfig;
import com.axonops.libmatcher.metrics.MatcherMetricsRegistry;
import com.axonops.libmatcher.metrics.MetricNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Decorator that records metrics and logs around any {@link Matcher}.
 *
 * <p>Every single-lookup operation is delegated to the wrapped engine. The iteration methods are
 * the inherited defaults, so each step of a scan goes through the instrumented {@link #findAt} or
 * {@link #capturesAt}; the scan as a whole is additionally counted and timed.
 *
 * <pre>{@code
 * MatcherConfig config = MatcherConfig.builder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.search"))
 *     .latencyTimingEnabled(true)
 *     .build();
 * Matcher<ArrayCaptures> matcher = new InstrumentedMatcher<>(engine, "keywords", config);
 * }</pre>
 *
 * <p><strong>Thread Safety:</strong> as thread-safe as the wrapped engine. The decorator keeps no
 * per-search state of its own; scan statistics live on the calling thread's stack.
 *
 * @param <C> the wrapped engine's captures type
 * @since 1.0.0
 */
public final class InstrumentedMatcher<C extends Captures> implements Matcher<C> {

    private static final Logger logger = LoggerFactory.getLogger(InstrumentedMatcher.class);

    private final Matcher<C> delegate;
    private final String engineName;
    private final MatcherConfig config;
    private final MatcherMetricsRegistry metrics;
    private final boolean timed;
    private final long slowQueryThresholdNanos;

    public InstrumentedMatcher(Matcher<C> delegate, String engineName, MatcherConfig config) {
        this.delegate = Objects.requireNonNull(delegate, "delegate cannot be null");
        this.engineName = Objects.requireNonNull(engineName, "engineName cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.metrics = config.metricsRegistry();
        this.timed = config.timingRequired();
        this.slowQueryThresholdNanos = config.slowQueryThresholdMicros() * 1000L;

        logger.debug("libmatcher: Instrumented matcher created - engine: {}, timing: {}, slowQueryThresholdMicros: {}",
            engineName, config.latencyTimingEnabled(), config.slowQueryThresholdMicros());
    }

    @Override
    public Optional<Match> findAt(byte[] haystack, int at) {
        metrics.incrementCounter(MetricNames.QUERIES_FIND);
        long startNanos = timed ? System.nanoTime() : 0L;

        Optional<Match> result;
        try {
            result = delegate.findAt(haystack, at);
        } catch (MatcherException e) {
            engineFailed("findAt", at, e);
            throw e;
        }

        if (timed) {
            queryFinished(MetricNames.QUERIES_FIND_LATENCY, "findAt", haystack, at, System.nanoTime() - startNanos);
        }
        result.ifPresent(this::countMatch);
        logger.trace("libmatcher: findAt - engine: {}, offset: {}, result: {}", engineName, at, result);
        return result;
    }

    @Override
    public C newCaptures() {
        try {
            C captures = delegate.newCaptures();
            metrics.incrementCounter(MetricNames.CAPTURES_ALLOCATED);
            return captures;
        } catch (MatcherException e) {
            engineFailed("newCaptures", 0, e);
            throw e;
        }
    }

    @Override
    public int captureCount() {
        return delegate.captureCount();
    }

    @Override
    public OptionalInt captureIndex(String name) {
        return delegate.captureIndex(name);
    }

    @Override
    public boolean capturesAt(byte[] haystack, int at, C captures) {
        metrics.incrementCounter(MetricNames.QUERIES_CAPTURES);
        long startNanos = timed ? System.nanoTime() : 0L;

        boolean matched;
        try {
            matched = delegate.capturesAt(haystack, at, captures);
        } catch (MatcherException e) {
            engineFailed("capturesAt", at, e);
            throw e;
        }

        if (timed) {
            queryFinished(MetricNames.QUERIES_CAPTURES_LATENCY, "capturesAt", haystack, at, System.nanoTime() - startNanos);
        }
        if (matched) {
            countMatch(captures.asMatch());
        }
        logger.trace("libmatcher: capturesAt - engine: {}, offset: {}, matched: {}", engineName, at, matched);
        return matched;
    }

    @Override
    public <E extends Exception> void tryFindIterAt(byte[] haystack, int at, FallibleMatchSink<E> sink) throws E {
        Objects.requireNonNull(sink, "sink cannot be null");
        Scan scan = new Scan();
        try {
            Matcher.super.<E>tryFindIterAt(haystack, at, match -> {
                scan.delivering();
                return scan.delivered(sink.matched(match));
            });
        } finally {
            scanFinished(scan, at);
        }
    }

    @Override
    public <E extends Exception> void tryCapturesIterAt(
            byte[] haystack, int at, C captures, FallibleCapturesSink<C, E> sink) throws E {
        Objects.requireNonNull(sink, "sink cannot be null");
        Scan scan = new Scan();
        try {
            Matcher.super.<E>tryCapturesIterAt(haystack, at, captures, caps -> {
                scan.delivering();
                return scan.delivered(sink.matched(caps));
            });
        } finally {
            scanFinished(scan, at);
        }
    }

    public Matcher<C> getDelegate() {
        return delegate;
    }

    public String getEngineName() {
        return engineName;
    }

    public MatcherConfig getConfig() {
        return config;
    }

    private void countMatch(Match match) {
        metrics.incrementCounter(MetricNames.QUERIES_MATCHED);
        if (match.isEmpty()) {
            metrics.incrementCounter(MetricNames.QUERIES_MATCHED_EMPTY);
        }
    }

    private void engineFailed(String operation, int at, MatcherException e) {
        metrics.incrementCounter(MetricNames.ERRORS_ENGINE);
        logger.debug("libmatcher: Engine error - engine: {}, operation: {}, offset: {}", engineName, operation, at, e);
    }

    private void queryFinished(String timerName, String operation, byte[] haystack, int at, long elapsedNanos) {
        if (config.latencyTimingEnabled()) {
            metrics.recordTimer(timerName, elapsedNanos);
        }
        if (slowQueryThresholdNanos > 0 && elapsedNanos > slowQueryThresholdNanos) {
            metrics.incrementCounter(MetricNames.QUERIES_SLOW);
            logger.warn("libmatcher: Slow {} query - engine: {}, offset: {}, haystackBytes: {}, timeUs: {}",
                operation, engineName, at, haystack.length, elapsedNanos / 1000);
        }
    }

    private void scanFinished(Scan scan, int at) {
        metrics.incrementCounter(MetricNames.ITERATIONS);
        if (scan.emitted > 0) {
            metrics.incrementCounter(MetricNames.ITERATIONS_MATCHES_EMITTED, scan.emitted);
        }
        if (scan.stopped) {
            metrics.incrementCounter(MetricNames.ITERATIONS_STOPPED);
        }
        if (scan.sinkPending) {
            // Sink threw: it was entered but never returned
            metrics.incrementCounter(MetricNames.ERRORS_SINK);
            logger.debug("libmatcher: Iteration sink failed - engine: {}, emitted: {}", engineName, scan.emitted);
        }
        long elapsedNanos = System.nanoTime() - scan.startNanos;
        if (config.latencyTimingEnabled()) {
            metrics.recordTimer(MetricNames.ITERATIONS_LATENCY, elapsedNanos);
        }
        logger.trace("libmatcher: Iteration finished - engine: {}, from: {}, emitted: {}, stopped: {}, timeNs: {}",
            engineName, at, scan.emitted, scan.stopped, elapsedNanos);
    }

    /** Statistics of one scan; confined to the scanning thread. */
    private static final class Scan {
        private final long startNanos = System.nanoTime();
        private long emitted;
        private boolean stopped;
        private boolean sinkPending;

        void delivering() {
            emitted++;
            sinkPending = true;
        }

        IterationControl delivered(IterationControl control) {
            sinkPending = false;
            stopped = control == IterationControl.STOP;
            return control;
        }
    }

    @Override
    public String toString() {
        return "InstrumentedMatcher{engine=" + engineName + ", delegate=" + delegate + "}";
    }
}
