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

/**
 * Metric name constants for matcher instrumentation.
 *
 * <p>Recorded by {@link com.axonops.libmatcher.instrument.InstrumentedMatcher} through the
 * configured {@link MatcherMetricsRegistry}. Names are relative; the registry adapter adds its
 * prefix (for Dropwizard, {@code com.axonops.libmatcher} unless configured otherwise).
 *
 * <h2>Metric Categories</h2>
 *
 * <ul>
 *   <li><b>Queries (7 metrics)</b> - Single engine lookups, their outcome and latency
 *   <li><b>Iteration (4 metrics)</b> - Whole scans driven by findIter / capturesIter
 *   <li><b>Captures (1 metric)</b> - Capture buffers allocated
 *   <li><b>Errors (2 metrics)</b> - Engine failures versus sink failures
 * </ul>
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 * </ul>
 *
 * <h2>Monitoring Recommendations</h2>
 *
 * <ul>
 *   <li><b>Empty-match ratio:</b> QUERIES_MATCHED_EMPTY / QUERIES_MATCHED - a high ratio usually
 *       means a pattern that can match the empty string
 *   <li><b>Slow queries:</b> QUERIES_SLOW should stay at zero; non-zero values point at engines
 *       with pathological inputs (e.g. backtracking)
 *   <li><b>Errors:</b> ERRORS_ENGINE should be zero; ERRORS_SINK reflects the caller's own handler
 * </ul>
 *
 * @since 1.0.0
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Query Metrics (7)
  // ========================================

  /**
   * Total findAt queries sent to the engine.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Incremented:</b> On every {@code findAt}, including those issued by iteration
   */
  public static final String QUERIES_FIND = "queries.find.total.count";

  /**
   * Total capturesAt queries sent to the engine.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String QUERIES_CAPTURES = "queries.captures.total.count";

  /**
   * Queries (find or captures) that returned a match.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String QUERIES_MATCHED = "queries.matched.total.count";

  /**
   * Queries that returned a zero-width match.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> Subset of QUERIES_MATCHED
   */
  public static final String QUERIES_MATCHED_EMPTY = "queries.matched.empty.total.count";

  /**
   * findAt latency.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   *
   * <p><b>Recorded:</b> Only when latency timing is enabled in MatcherConfig
   */
  public static final String QUERIES_FIND_LATENCY = "queries.find.latency";

  /**
   * capturesAt latency.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   *
   * <p><b>Recorded:</b> Only when latency timing is enabled in MatcherConfig
   */
  public static final String QUERIES_CAPTURES_LATENCY = "queries.captures.latency";

  /**
   * Queries slower than the configured slow-query threshold.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Incremented:</b> Alongside a WARN log line, only when the threshold is non-zero
   */
  public static final String QUERIES_SLOW = "queries.slow.total.count";

  // ========================================
  // Iteration Metrics (4)
  // ========================================

  /**
   * Scans started (findIter, capturesIter and their fallible forms).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ITERATIONS = "iterations.total.count";

  /**
   * Matches handed to iteration sinks.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> Lower than QUERIES_MATCHED when duplicate empty matches were skipped
   */
  public static final String ITERATIONS_MATCHES_EMITTED = "iterations.matches.emitted.total.count";

  /**
   * Scans ended early because the sink returned STOP.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ITERATIONS_STOPPED = "iterations.stopped.total.count";

  /**
   * Whole-scan latency, from the first engine query to the end of the scan.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   *
   * <p><b>Recorded:</b> Only when latency timing is enabled; includes time spent in the sink
   */
  public static final String ITERATIONS_LATENCY = "iterations.latency";

  // ========================================
  // Captures Metrics (1)
  // ========================================

  /**
   * Captures buffers allocated through newCaptures.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> Should grow with thread count, not with query count; steady growth
   * means callers are not reusing their captures
   */
  public static final String CAPTURES_ALLOCATED = "captures.allocated.total.count";

  // ========================================
  // Error Metrics (2)
  // ========================================

  /**
   * Engine failures (MatcherException thrown by the wrapped engine).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_ENGINE = "errors.engine.total.count";

  /**
   * Failures thrown by a fallible iteration sink.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_SINK = "errors.sink.total.count";
}
