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

import java.io.ByteArrayOutputStream;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * Capture groups of a single match: an indexable collection of optional {@link Match} slots.
 *
 * <p>Slot 0 is the overall match and is populated whenever any group matched. Slots 1 and up hold
 * the engine's numbered or named groups and are absent when the group did not participate in the
 * match.
 *
 * <p>A {@code Captures} is caller-owned scratch space. Callers allocate one through {@link
 * Matcher#newCaptures()} and reuse it across queries; the matcher only writes into it during
 * {@link Matcher#capturesAt} and never keeps a reference. It is NOT thread-safe: use one instance
 * per in-flight search.
 *
 * @since 1.0.0
 */
public interface Captures {

  /**
   * Number of slots, including slot 0.
   */
  int size();

  /**
   * Gets the span of slot {@code index}.
   *
   * @param index slot index (0 = overall match)
   * @return the span, or empty if the group did not participate or {@code index} is not a slot
   */
  Optional<Match> get(int index);

  /**
   * Gets the overall match (slot 0).
   *
   * @throws IllegalStateException if slot 0 has not been populated by a successful query
   */
  default Match asMatch() {
    return get(0).orElseThrow(() -> new IllegalStateException("libmatcher: Captures slot 0 is not set"));
  }

  default boolean isEmpty() {
    return size() == 0;
  }

  /**
   * Expands {@code replacement} against this capture set into {@code dst}.
   *
   * <p>The substitution syntax and algorithm belong to {@code interpolator}; this method only hands
   * it the match state.
   *
   * @param interpolator the substitution implementation
   * @param nameToIndex resolves a group name to its slot index, empty if unknown
   * @param haystack the buffer the captures index into
   * @param replacement the replacement template
   * @param dst receives the substituted bytes
   * @throws InterpolationException if the template names a group {@code nameToIndex} cannot resolve
   */
  default void interpolate(
      Interpolator interpolator,
      Function<String, OptionalInt> nameToIndex,
      byte[] haystack,
      byte[] replacement,
      ByteArrayOutputStream dst) {
    Objects.requireNonNull(interpolator, "interpolator cannot be null");
    interpolator.interpolate(this, nameToIndex, haystack, replacement, dst);
  }
}
