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

import java.util.Optional;

/**
 * Captures for engines without capture-group support. Has no slots.
 *
 * @since 1.0.0
 */
public final class NoCaptures implements Captures {

  /** Singleton instance - use this instead of creating new instances. */
  public static final NoCaptures INSTANCE = new NoCaptures();

  private NoCaptures() {}

  @Override
  public int size() {
    return 0;
  }

  @Override
  public Optional<Match> get(int index) {
    return Optional.empty();
  }

  @Override
  public String toString() {
    return "NoCaptures";
  }
}
