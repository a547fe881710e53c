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
 * Receives the capture set of each match found by {@link Matcher#capturesIter}.
 *
 * <p>The captures object is the caller's reused buffer. It is only valid for the duration of the
 * call; copy out any {@link Match} that must outlive it.
 *
 * @param <C> the engine's captures type
 * @since 1.0.0
 */
@FunctionalInterface
public interface CapturesSink<C extends Captures> {

  IterationControl matched(C captures);
}
