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
 * Failure reported by a matching engine.
 *
 * <p>Engines throw this (or a subclass carrying engine-specific detail) from {@link
 * Matcher#findAt}, {@link Matcher#newCaptures} and {@link Matcher#capturesAt}. Iteration never
 * retries: the exception aborts the scan and reaches the caller unchanged.
 *
 * <p>"No match" is not an error and is never reported through this type.
 *
 * @since 1.0.0
 */
public class MatcherException extends RuntimeException {

  public MatcherException(String message) {
    super("libmatcher: Engine error: " + message);
  }

  public MatcherException(String message, Throwable cause) {
    super("libmatcher: Engine error: " + message, cause);
  }
}
