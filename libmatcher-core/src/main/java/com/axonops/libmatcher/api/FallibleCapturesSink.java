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
 * Fallible counterpart of {@link CapturesSink}, used by {@link Matcher#tryCapturesIter}.
 *
 * @param <C> the engine's captures type
 * @param <E> the sink's own failure type
 * @since 1.0.0
 */
@FunctionalInterface
public interface FallibleCapturesSink<C extends Captures, E extends Exception> {

  IterationControl matched(C captures) throws E;
}
