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

import com.axonops.libmatcher.api.ArrayCaptures;
import com.axonops.libmatcher.api.IterationControl;
import com.axonops.libmatcher.api.Match;
import com.axonops.libmatcher.api.Matcher;
import com.axonops.libmatcher.api.MatcherException;
import com.axonops.libmatcher.api.NoCaptures;
import com.axonops.libmatcher.config.MatcherConfig;
import com.axonops.libmatcher.metrics.DropwizardMetricsAdapter;
import com.axonops.libmatcher.metrics.MetricNames;
import com.axonops.libmatcher.test.AssignmentMatcher;
import com.axonops.libmatcher.test.ScriptedMatcher;
import com.axonops.libmatcher.test.TestUtils;
import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static com.axonops.libmatcher.test.TestUtils.bytes;
import static com.axonops.libmatcher.test.TestUtils.findAll;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests verifying InstrumentedMatcher delegates faithfully and records metrics.
 */
class InstrumentedMatcherTest {

    private static final String PREFIX = "test.matcher";

    private MetricRegistry registry;
    private MatcherConfig config;

    @BeforeEach
    void setup() {
        registry = new MetricRegistry();
        config = TestUtils.metricsConfig(registry, PREFIX);
    }

    private long count(String name) {
        return registry.counter(PREFIX + "." + name).getCount();
    }

    private long timerCount(String name) {
        return registry.timer(PREFIX + "." + name).getCount();
    }

    @Test
    void testIterationMetrics() {
        ScriptedMatcher engine = new ScriptedMatcher(new Match(0, 2), Match.zero(2), Match.zero(4));
        InstrumentedMatcher<ArrayCaptures> matcher = new InstrumentedMatcher<>(engine, "scripted", config);

        List<Match> matches = findAll(matcher, new byte[5]);

        assertThat(matches).containsExactly(new Match(0, 2), Match.zero(4));
        assertThat(count(MetricNames.QUERIES_FIND)).isEqualTo(4);
        assertThat(count(MetricNames.QUERIES_MATCHED)).isEqualTo(3);
        assertThat(count(MetricNames.QUERIES_MATCHED_EMPTY)).isEqualTo(2);
        assertThat(count(MetricNames.ITERATIONS)).isEqualTo(1);
        assertThat(count(MetricNames.ITERATIONS_MATCHES_EMITTED)).isEqualTo(2);
        assertThat(count(MetricNames.ITERATIONS_STOPPED)).isZero();
        assertThat(timerCount(MetricNames.QUERIES_FIND_LATENCY)).isEqualTo(4);
        assertThat(timerCount(MetricNames.ITERATIONS_LATENCY)).isEqualTo(1);
    }

    @Test
    void testResultsMatchUninstrumentedEngine() {
        AssignmentMatcher engine = new AssignmentMatcher();
        InstrumentedMatcher<ArrayCaptures> matcher = new InstrumentedMatcher<>(engine, "assign", config);
        byte[] haystack = bytes("a=1 bb cc=22");

        assertThat(findAll(matcher, haystack)).isEqualTo(findAll(engine, haystack));
        assertThat(matcher.find(haystack)).isEqualTo(engine.find(haystack));
        assertThat(matcher.captureCount()).isEqualTo(3);
        assertThat(matcher.captureIndex("value")).hasValue(AssignmentMatcher.VALUE);
        assertThat(matcher.captureIndex("nope")).isEmpty();
        assertThat(matcher.getDelegate()).isSameAs(engine);
        assertThat(matcher.getEngineName()).isEqualTo("assign");
    }

    @Test
    void testEngineErrorCountedAndRethrown() {
        ScriptedMatcher engine = new ScriptedMatcher(new Match(0, 1), new Match(2, 3)).failOnQuery(2);
        InstrumentedMatcher<ArrayCaptures> matcher = new InstrumentedMatcher<>(engine, "failing", config);

        assertThatExceptionOfType(MatcherException.class)
            .isThrownBy(() -> findAll(matcher, new byte[5]))
            .withMessageContaining("scripted failure");

        assertThat(count(MetricNames.ERRORS_ENGINE)).isEqualTo(1);
        assertThat(count(MetricNames.ERRORS_SINK)).isZero();
        assertThat(count(MetricNames.ITERATIONS)).isEqualTo(1);
        assertThat(count(MetricNames.ITERATIONS_MATCHES_EMITTED)).isEqualTo(1);
    }

    @Test
    void testSinkErrorCountedSeparately() {
        ScriptedMatcher engine = new ScriptedMatcher(new Match(0, 1), new Match(2, 3), new Match(3, 4));
        InstrumentedMatcher<ArrayCaptures> matcher = new InstrumentedMatcher<>(engine, "scripted", config);

        assertThatExceptionOfType(IOException.class)
            .isThrownBy(() -> matcher.tryFindIter(new byte[5], m -> {
                if (m.start() == 2) {
                    throw new IOException("handler failed");
                }
                return IterationControl.CONTINUE;
            }));

        assertThat(engine.queries()).isEqualTo(2);
        assertThat(count(MetricNames.ERRORS_SINK)).isEqualTo(1);
        assertThat(count(MetricNames.ERRORS_ENGINE)).isZero();
    }

    @Test
    void testStopCounted() {
        ScriptedMatcher engine = new ScriptedMatcher(new Match(0, 1), new Match(2, 3));
        InstrumentedMatcher<ArrayCaptures> matcher = new InstrumentedMatcher<>(engine, "scripted", config);

        matcher.findIter(new byte[5], m -> IterationControl.STOP);

        assertThat(engine.queries()).isEqualTo(1);
        assertThat(count(MetricNames.ITERATIONS_STOPPED)).isEqualTo(1);
        assertThat(count(MetricNames.ITERATIONS_MATCHES_EMITTED)).isEqualTo(1);
    }

    @Test
    void testCaptureMetrics() {
        InstrumentedMatcher<ArrayCaptures> matcher = new InstrumentedMatcher<>(new AssignmentMatcher(), "assign", config);
        byte[] haystack = bytes("a=1 bb");
        ArrayCaptures caps = matcher.newCaptures();

        matcher.capturesIter(haystack, caps, c -> IterationControl.CONTINUE);

        assertThat(count(MetricNames.CAPTURES_ALLOCATED)).isEqualTo(1);
        // a=1, bb, then one miss at the end of the haystack
        assertThat(count(MetricNames.QUERIES_CAPTURES)).isEqualTo(3);
        assertThat(count(MetricNames.QUERIES_MATCHED)).isEqualTo(2);
        assertThat(count(MetricNames.QUERIES_FIND)).isZero();
        assertThat(timerCount(MetricNames.QUERIES_CAPTURES_LATENCY)).isEqualTo(3);
        assertThat(count(MetricNames.ITERATIONS_MATCHES_EMITTED)).isEqualTo(2);
    }

    @Test
    void testSlowQueryDetectedWithoutLatencyTimers() {
        MatcherConfig slowConfig = MatcherConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, PREFIX))
            .slowQueryThresholdMicros(1_000)
            .build();
        Matcher<NoCaptures> sleepy = new Matcher<>() {
            @Override
            public Optional<Match> findAt(byte[] haystack, int at) {
                try {
                    Thread.sleep(5);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new MatcherException("interrupted", e);
                }
                return Optional.empty();
            }

            @Override
            public NoCaptures newCaptures() {
                return NoCaptures.INSTANCE;
            }
        };
        InstrumentedMatcher<NoCaptures> matcher = new InstrumentedMatcher<>(sleepy, "sleepy", slowConfig);

        assertThat(matcher.find(new byte[1])).isEmpty();

        assertThat(count(MetricNames.QUERIES_SLOW)).isEqualTo(1);
        assertThat(registry.getTimers()).isEmpty();
    }

    @Test
    void testDefaultConfigRecordsNothing() {
        ScriptedMatcher engine = new ScriptedMatcher(new Match(1, 3));
        InstrumentedMatcher<ArrayCaptures> matcher = new InstrumentedMatcher<>(engine, "plain", MatcherConfig.DEFAULT);

        assertThat(findAll(matcher, new byte[5])).containsExactly(new Match(1, 3));
        assertThat(registry.getMetrics()).isEmpty();
    }

    @Test
    void testNullArgumentsRejected() {
        ScriptedMatcher engine = new ScriptedMatcher();
        assertThatNullPointerException().isThrownBy(() -> new InstrumentedMatcher<>(null, "x", config));
        assertThatNullPointerException().isThrownBy(() -> new InstrumentedMatcher<>(engine, null, config));
        assertThatNullPointerException().isThrownBy(() -> new InstrumentedMatcher<>(engine, "x", null));
    }
}
