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

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Array-backed {@link Captures} that engine adapters can fill in place.
 *
 * <p>Offsets are stored as {@code [start0, end0, start1, end1, ...]} with {@code -1} marking an
 * unset slot, so reusing one instance across queries allocates nothing beyond the returned
 * {@link Match} values.
 *
 * <pre>{@code
 * // inside an engine's capturesAt(...)
 * caps.clear();
 * caps.set(0, matchStart, matchEnd);
 * caps.set(1, keyStart, keyEnd);   // slot 2 stays absent
 * return true;
 * }</pre>
 *
 * <p>NOT thread-safe.
 *
 * @since 1.0.0
 */
public final class ArrayCaptures implements Captures {

  private static final int UNSET = -1;

  private final int[] offsets;

  /**
   * Creates captures with {@code slots} slots, all unset.
   *
   * @param slots number of slots including slot 0
   * @throws IllegalArgumentException if {@code slots} is negative
   */
  public ArrayCaptures(int slots) {
    if (slots < 0) {
      throw new IllegalArgumentException("slots must be non-negative: " + slots);
    }
    this.offsets = new int[slots * 2];
    Arrays.fill(offsets, UNSET);
  }

  @Override
  public int size() {
    return offsets.length / 2;
  }

  @Override
  public Optional<Match> get(int index) {
    if (index < 0 || index >= size()) {
      return Optional.empty();
    }
    int start = offsets[index * 2];
    if (start == UNSET) {
      return Optional.empty();
    }
    return Optional.of(new Match(start, offsets[index * 2 + 1]));
  }

  /**
   * Sets slot {@code index} to {@code match}.
   *
   * @throws IndexOutOfBoundsException if {@code index} is not a slot
   */
  public void set(int index, Match match) {
    Objects.requireNonNull(match, "match cannot be null");
    set(index, match.start(), match.end());
  }

  /**
   * Sets slot {@code index} to {@code [start, end)}.
   *
   * @throws IndexOutOfBoundsException if {@code index} is not a slot
   * @throws IllegalArgumentException if the offsets do not form a valid span
   */
  public void set(int index, int start, int end) {
    Objects.checkIndex(index, size());
    if (start < 0 || start > end) {
      throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
    }
    offsets[index * 2] = start;
    offsets[index * 2 + 1] = end;
  }

  /**
   * Marks slot {@code index} as not participating.
   *
   * @throws IndexOutOfBoundsException if {@code index} is not a slot
   */
  public void clear(int index) {
    Objects.checkIndex(index, size());
    offsets[index * 2] = UNSET;
    offsets[index * 2 + 1] = UNSET;
  }

  /** Marks every slot as not participating. */
  public void clear() {
    Arrays.fill(offsets, UNSET);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("ArrayCaptures{");
    for (int i = 0; i < size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(i).append('=');
      int start = offsets[i * 2];
      if (start == UNSET) {
        sb.append("none");
      } else {
        sb.append('[').append(start).append(", ").append(offsets[i * 2 + 1]).append(')');
      }
    }
    return sb.append('}').toString();
  }
}
