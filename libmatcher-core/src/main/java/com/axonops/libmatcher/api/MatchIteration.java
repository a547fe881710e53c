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

/**
 * Match enumeration shared by every {@link Matcher} through its default methods.
 *
 * <p>Both algorithms are built only on the single-lookup operations. The search offset advances
 * to the end of each non-empty match, so matches may abut but never overlap. After an empty match
 * the offset advances one byte past it, so the same empty match cannot be found twice and the scan
 * always terminates. An empty match whose end equals the end of the previously emitted match is
 * skipped; this drops the spurious empty match engines report right after a non-empty match.
 */
final class MatchIteration {

  private MatchIteration() {
    // Utility class
  }

  static <E extends Exception> void findAll(
      Matcher<?> matcher, byte[] haystack, int at, FallibleMatchSink<E> sink) throws E {
    Objects.requireNonNull(haystack, "haystack cannot be null");
    Objects.requireNonNull(sink, "sink cannot be null");
    Cursor cursor = new Cursor(at);

    while (!cursor.exhausted(haystack)) {
      Optional<Match> found = matcher.findAt(haystack, cursor.searchFrom());
      if (found.isEmpty()) {
        return;
      }
      Match match = found.get();
      if (!cursor.advance(match)) {
        continue;
      }
      if (control(sink.matched(match)) == IterationControl.STOP) {
        return;
      }
    }
  }

  static <C extends Captures, E extends Exception> void capturesAll(
      Matcher<C> matcher, byte[] haystack, int at, C captures, FallibleCapturesSink<C, E> sink)
      throws E {
    Objects.requireNonNull(haystack, "haystack cannot be null");
    Objects.requireNonNull(captures, "captures cannot be null");
    Objects.requireNonNull(sink, "sink cannot be null");
    Cursor cursor = new Cursor(at);

    while (!cursor.exhausted(haystack)) {
      if (!matcher.capturesAt(haystack, cursor.searchFrom(), captures)) {
        return;
      }
      if (!cursor.advance(captures.asMatch())) {
        continue;
      }
      if (control(sink.matched(captures)) == IterationControl.STOP) {
        return;
      }
    }
  }

  private static IterationControl control(IterationControl returned) {
    return Objects.requireNonNull(returned, "sink returned null instead of CONTINUE or STOP");
  }

  /** Scan position shared by both algorithms. */
  private static final class Cursor {
    private static final int NONE = -1;

    private int lastEnd;
    private int lastMatch = NONE;

    Cursor(int at) {
      if (at < 0) {
        throw new IllegalArgumentException("search offset " + at + " is negative");
      }
      this.lastEnd = at;
    }

    boolean exhausted(byte[] haystack) {
      return lastEnd > haystack.length;
    }

    int searchFrom() {
      return lastEnd;
    }

    /**
     * Moves past {@code match}.
     *
     * @return true if the match should be handed to the sink
     */
    boolean advance(Match match) {
      if (match.start() < lastEnd) {
        throw new IllegalStateException(
            "libmatcher: Engine returned " + match + " starting before search offset " + lastEnd);
      }
      if (match.isEmpty()) {
        lastEnd = Math.addExact(match.end(), 1);
        if (match.end() == lastMatch) {
          return false;
        }
      } else {
        lastEnd = match.end();
      }
      lastMatch = match.end();
      return true;
    }
  }
}
