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

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;

/**
 * A half-open byte range {@code [start, end)} identifying where a match occurred in a haystack.
 *
 * <p>Offsets are raw byte positions. A {@code Match} never owns the bytes it indexes: {@link
 * #slice(byte[])} returns a view over the caller's buffer, {@link #copyOf(byte[])} is the explicit
 * copy.
 *
 * <p>Every constructor and mutator enforces {@code 0 <= start <= end}. A violation is a programming
 * error in the caller or the engine and is reported with {@link IllegalArgumentException}, not as a
 * recoverable matcher error.
 *
 * <pre>{@code
 * Match m = new Match(1, 3);
 * m.length();            // 2
 * m.offset(10);          // Match[start=11, end=13]
 * m.slice(haystack);     // ByteBuffer view over haystack[1..3)
 * }</pre>
 *
 * @param start inclusive start offset
 * @param end exclusive end offset
 * @since 1.0.0
 */
public record Match(int start, int end) {

  public Match {
    if (start < 0) {
      throw new IllegalArgumentException("start " + start + " is negative");
    }
    if (start > end) {
      throw new IllegalArgumentException(start + " is not <= " + end);
    }
  }

  /**
   * Creates a zero-width match at the given offset.
   *
   * @param offset position of the empty match
   * @return {@code [offset, offset)}
   */
  public static Match zero(int offset) {
    return new Match(offset, offset);
  }

  /**
   * Returns a copy of this match with a new start.
   *
   * @throws IllegalArgumentException if {@code start > end()}
   */
  public Match withStart(int start) {
    return new Match(start, end);
  }

  /**
   * Returns a copy of this match with a new end.
   *
   * @throws IllegalArgumentException if {@code end < start()}
   */
  public Match withEnd(int end) {
    if (end < start) {
      throw new IllegalArgumentException(end + " is not >= " + start);
    }
    return new Match(start, end);
  }

  /**
   * Shifts both ends of this match by {@code amount}.
   *
   * <p>Used by callers that search a sub-slice of a larger buffer and need to translate the result
   * back into the coordinates of the whole buffer.
   *
   * @param amount non-negative number of bytes to shift by
   * @return the shifted match
   * @throws IllegalArgumentException if {@code amount} is negative
   * @throws ArithmeticException if either end overflows
   */
  public Match offset(int amount) {
    if (amount < 0) {
      throw new IllegalArgumentException("offset amount " + amount + " is negative");
    }
    return new Match(Math.addExact(start, amount), Math.addExact(end, amount));
  }

  /** Number of bytes covered, {@code end - start}. */
  public int length() {
    return end - start;
  }

  /** True for a zero-width match. */
  public boolean isEmpty() {
    return start == end;
  }

  /**
   * Returns a view of the matched bytes. The view shares {@code haystack}; writes through it are
   * visible in the original array.
   *
   * @throws IndexOutOfBoundsException if this match lies outside {@code haystack}
   */
  public ByteBuffer slice(byte[] haystack) {
    Objects.requireNonNull(haystack, "haystack cannot be null");
    Objects.checkFromToIndex(start, end, haystack.length);
    return ByteBuffer.wrap(haystack, start, length()).slice();
  }

  /**
   * Returns a view of the matched bytes of a buffer, relative to the buffer's position zero. The
   * source buffer's position and limit are not modified.
   *
   * @throws IndexOutOfBoundsException if this match lies outside {@code haystack}'s capacity
   */
  public ByteBuffer slice(ByteBuffer haystack) {
    Objects.requireNonNull(haystack, "haystack cannot be null");
    Objects.checkFromToIndex(start, end, haystack.capacity());
    return haystack.duplicate().clear().position(start).limit(end).slice();
  }

  /**
   * Copies the matched bytes out of {@code haystack}.
   *
   * @throws IndexOutOfBoundsException if this match lies outside {@code haystack}
   */
  public byte[] copyOf(byte[] haystack) {
    Objects.requireNonNull(haystack, "haystack cannot be null");
    Objects.checkFromToIndex(start, end, haystack.length);
    return Arrays.copyOfRange(haystack, start, end);
  }
}
