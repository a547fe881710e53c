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
 * Thrown by an {@link Interpolator} when a replacement template references a capture group that
 * the name resolver cannot map to a slot.
 *
 * @since 1.0.0
 */
public final class InterpolationException extends RuntimeException {

  private final String groupName;

  public InterpolationException(String groupName) {
    super("libmatcher: Unknown capture group in replacement: " + groupName);
    this.groupName = groupName;
  }

  public String getGroupName() {
    return groupName;
  }
}
