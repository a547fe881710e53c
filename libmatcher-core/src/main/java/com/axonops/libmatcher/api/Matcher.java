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

package com.axonops.libmatcher.api;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A configured matching engine searching byte buffers.
 *
 * <p>Engine adapters (literal search, regex, automata) implement {@link #findAt} and {@link
 * #newCaptures}, plus {@link #capturesAt}, {@link #captureCount} and {@link #captureIndex} when
 * they support capture groups. Every iteration method is provided on top of those operations, so
 * higher-level tools can enumerate matches the same way whatever engine they are given.
 *
 * <p><strong>Thread Safety:</strong> a Matcher is immutable after construction and carries no
 * per-search state; it CAN be shared between threads. The {@link Captures} passed to capture
 * queries is per-search scratch space and must NOT be shared between concurrent searches.
 *
 * <pre>{@code
 * Matcher<ArrayCaptures> matcher = ...;   // shared
 *
 * matcher.findIter(haystack, m -> {
 *     System.out.println(m.start() + ".." + m.end());
 *     return IterationControl.CONTINUE;
 * });
 *
 * ArrayCaptures caps = matcher.newCaptures();   // one per thread
 * int key = matcher.captureIndex("key").orElseThrow();
 * matcher.capturesIter(haystack, caps, c -> {
 *     c.get(key).ifPresent(k -> emit(k.copyOf(haystack)));
 *     return IterationControl.CONTINUE;
 * });
 * }</pre>
 *
 * <p>Engine failures surface as {@link MatcherException}. Failures of a fallible sink surface as
 * the sink's own exception type, so the two can be caught separately:
 *
 * <pre>{@code
 * try {
 *     matcher.tryFindIter(haystack, m -> {
 *         writer.write(m.copyOf(haystack));   // may throw IOException
 *         return IterationControl.CONTINUE;
 *     });
 * } catch (IOException e) {
 *     // our handler failed
 * } catch (MatcherException e) {
 *     // the engine failed
 * }
 * }</pre>
 *
 * @param <C> the engine's captures type
 * @since 1.0.0
 */
public interface Matcher<C extends Captures> {

  /**
   * Finds the first match starting at or after {@code at}.
   *
   * <p>Implementations must never return a match whose start is before {@code at}.
   *
   * @param haystack the bytes to search
   * @param at offset to start searching from
   * @return the match, or empty if there is none
   * @throws MatcherException if the engine fails
   */
  Optional<Match> findAt(byte[] haystack, int at);

  /**
   * Allocates captures sized for this matcher's groups. Callers reuse the result across queries.
   *
   * @throws MatcherException if the engine fails
   */
  C newCaptures();

  /**
   * Number of capture slots including the overall match, or 0 if this matcher does not support
   * capture groups.
   */
  default int captureCount() {
    return 0;
  }

  /**
   * Slot index of the group called {@code name}.
   *
   * @return the index, or empty if there is no such group or groups are not supported
   */
  default OptionalInt captureIndex(String name) {
    return OptionalInt.empty();
  }

  /**
   * Same as {@code findAt(haystack, 0)}.
   */
  default Optional<Match> find(byte[] haystack) {
    return findAt(haystack, 0);
  }

  /**
   * Finds the first match starting at or after {@code at} and writes it, with its groups, into
   * {@code captures}. Slot 0 always equals the overall match after a successful query.
   *
   * <p>The default reports no match, for engines without capture support.
   *
   * @return true if a match was found
   * @throws MatcherException if the engine fails
   */
  default boolean capturesAt(byte[] haystack, int at, C captures) {
    return false;
  }

  // ========== Match iteration ==========

  /** Calls {@code sink} for every successive non-overlapping match in {@code haystack}. */
  default void findIter(byte[] haystack, MatchSink sink) {
    findIterAt(haystack, 0, sink);
  }

  /**
   * Calls {@code sink} for every successive non-overlapping match at or after {@code at}, in
   * order, until the matches run out or {@code sink} returns {@link IterationControl#STOP}.
   *
   * @throws MatcherException if the engine fails
   * @throws IllegalArgumentException if {@code at} is negative
   */
  default void findIterAt(byte[] haystack, int at, MatchSink sink) {
    Objects.requireNonNull(sink, "sink cannot be null");
    this.<RuntimeException>tryFindIterAt(haystack, at, sink::matched);
  }

  /** Fallible form of {@link #findIter}. */
  default <E extends Exception> void tryFindIter(byte[] haystack, FallibleMatchSink<E> sink)
      throws E {
    tryFindIterAt(haystack, 0, sink);
  }

  /**
   * Fallible form of {@link #findIterAt}: an exception from {@code sink} aborts the scan and is
   * rethrown as is.
   *
   * @throws E if {@code sink} fails
   * @throws MatcherException if the engine fails
   */
  default <E extends Exception> void tryFindIterAt(
      byte[] haystack, int at, FallibleMatchSink<E> sink) throws E {
    MatchIteration.findAll(this, haystack, at, sink);
  }

  // ========== Capture iteration ==========

  /** Calls {@code sink} with the captures of every successive match in {@code haystack}. */
  default void capturesIter(byte[] haystack, C captures, CapturesSink<C> sink) {
    capturesIterAt(haystack, 0, captures, sink);
  }

  /**
   * Like {@link #findIterAt}, but queries {@link #capturesAt} into {@code captures} and hands the
   * sink that same object for each match. Its contents are overwritten on the next step.
   *
   * @throws MatcherException if the engine fails
   */
  default void capturesIterAt(byte[] haystack, int at, C captures, CapturesSink<C> sink) {
    Objects.requireNonNull(sink, "sink cannot be null");
    this.<RuntimeException>tryCapturesIterAt(haystack, at, captures, sink::matched);
  }

  /** Fallible form of {@link #capturesIter}. */
  default <E extends Exception> void tryCapturesIter(
      byte[] haystack, C captures, FallibleCapturesSink<C, E> sink) throws E {
    tryCapturesIterAt(haystack, 0, captures, sink);
  }

  /**
   * Fallible form of {@link #capturesIterAt}.
   *
   * @throws E if {@code sink} fails
   * @throws MatcherException if the engine fails
   */
  default <E extends Exception> void tryCapturesIterAt(
      byte[] haystack, int at, C captures, FallibleCapturesSink<C, E> sink) throws E {
    MatchIteration.capturesAll(this, haystack, at, captures, sink);
  }
}
