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

/**
 * Receives each match found by {@link Matcher#tryFindIter} and may fail.
 *
 * <p>An exception thrown here aborts the scan and reaches the caller as {@code E}, separate from
 * the engine's {@link MatcherException}.
 *
 * @param <E> the sink's own failure type
 * @since 1.0.0
 */
@FunctionalInterface
public interface FallibleMatchSink<E extends Exception> {

  IterationControl matched(Match match) throws E;
}
