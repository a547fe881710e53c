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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ArrayCaptures and NoCaptures.
 */
@DisplayName("Captures")
class CapturesTest {

    private ArrayCaptures caps;

    @BeforeEach
    void setUp() {
        caps = new ArrayCaptures(3);
    }

    @Test
    @DisplayName("new captures have every slot absent")
    void newCaptures_allAbsent() {
        assertThat(caps.size()).isEqualTo(3);
        assertThat(caps.isEmpty()).isFalse();
        assertThat(caps.get(0)).isEmpty();
        assertThat(caps.get(1)).isEmpty();
        assertThat(caps.get(2)).isEmpty();
    }

    @Test
    @DisplayName("set and get round through slots independently")
    void setAndGet() {
        caps.set(0, new Match(0, 5));
        caps.set(2, 3, 5);

        assertThat(caps.get(0)).contains(new Match(0, 5));
        assertThat(caps.get(1)).isEmpty();
        assertThat(caps.get(2)).contains(new Match(3, 5));
        assertThat(caps.asMatch()).isEqualTo(new Match(0, 5));
    }

    @Test
    @DisplayName("get outside the slot range is absent, not a fault")
    void get_outOfRange_absent() {
        caps.set(0, 0, 1);
        assertThat(caps.get(3)).isEmpty();
        assertThat(caps.get(-1)).isEmpty();
        assertThat(caps.get(Integer.MAX_VALUE)).isEmpty();
    }

    @Test
    @DisplayName("asMatch faults while slot 0 is unset")
    void asMatch_unset_faults() {
        caps.set(1, 0, 1);
        assertThatIllegalStateException().isThrownBy(() -> caps.asMatch()).withMessageContaining("slot 0");
    }

    @Test
    @DisplayName("clear resets one slot or all of them")
    void clear() {
        caps.set(0, 0, 4);
        caps.set(1, 0, 2);
        caps.set(2, 2, 4);

        caps.clear(1);
        assertThat(caps.get(1)).isEmpty();
        assertThat(caps.get(2)).contains(new Match(2, 4));

        caps.clear();
        assertThat(caps.get(0)).isEmpty();
        assertThat(caps.get(2)).isEmpty();
    }

    @Test
    @DisplayName("writes outside the slot range or with bad spans fault")
    void set_invalid_faults() {
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> caps.set(3, 0, 1));
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> caps.clear(-1));
        assertThatIllegalArgumentException().isThrownBy(() -> caps.set(0, 4, 2));
        assertThatIllegalArgumentException().isThrownBy(() -> caps.set(0, -1, 2));
        assertThatIllegalArgumentException().isThrownBy(() -> new ArrayCaptures(-1));
    }

    @Test
    @DisplayName("zero-width spans are stored as present")
    void set_emptySpan_present() {
        caps.set(1, Match.zero(4));
        assertThat(caps.get(1)).contains(Match.zero(4));
    }

    @Test
    @DisplayName("toString lists every slot")
    void toString_listsSlots() {
        caps.set(0, 1, 3);
        assertThat(caps).hasToString("ArrayCaptures{0=[1, 3), 1=none, 2=none}");
    }

    @Test
    @DisplayName("NoCaptures has no slots")
    void noCaptures_empty() {
        assertThat(NoCaptures.INSTANCE.size()).isZero();
        assertThat(NoCaptures.INSTANCE.isEmpty()).isTrue();
        assertThat(NoCaptures.INSTANCE.get(0)).isEmpty();
        assertThatIllegalStateException().isThrownBy(NoCaptures.INSTANCE::asMatch);
        assertThat(new ArrayCaptures(0).isEmpty()).isTrue();
    }
}
