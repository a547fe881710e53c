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
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * Replacement-template expansion over a {@link Captures}.
 *
 * <p>Implementations resolve group references in {@code replacement} with {@code nameToIndex},
 * copy the referenced spans of {@code haystack} and write the complete result to {@code dst}.
 * Typically {@code nameToIndex} is {@link Matcher#captureIndex(String)} of the matcher that filled
 * the captures.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface Interpolator {

  /**
   * @throws InterpolationException if a referenced name cannot be resolved
   */
  void interpolate(
      Captures captures,
      Function<String, OptionalInt> nameToIndex,
      byte[] haystack,
      byte[] replacement,
      ByteArrayOutputStream dst);
}
