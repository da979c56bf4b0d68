/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.conveyor.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ChecksumCalculator Tests")
class ChecksumCalculatorTest {

    private static final String ABC_SHA256 = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @Test
    @DisplayName("Digest of a known input")
    void testKnownDigest() {
        assertThat(ChecksumCalculator.sha256Hex("abc".getBytes(StandardCharsets.US_ASCII))).isEqualTo(ABC_SHA256);
    }

    @Test
    @DisplayName("Digest of an empty payload")
    void testEmptyDigest() {
        assertThat(ChecksumCalculator.sha256Hex(new byte[0]))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    @DisplayName("One changed byte changes the digest")
    void testSensitivity() {
        byte[] data = new byte[1024 * 1024];
        Arrays.fill(data, (byte) 7);
        String original = ChecksumCalculator.sha256Hex(data);
        data[data.length - 1] = 8;

        assertThat(ChecksumCalculator.sha256Hex(data)).hasSize(64).isNotEqualTo(original);
    }

    @Test
    @DisplayName("Comparison ignores case and accepts a missing expectation")
    void testMatches() {
        assertThat(ChecksumCalculator.matches(ABC_SHA256.toUpperCase(), ABC_SHA256)).isTrue();
        assertThat(ChecksumCalculator.matches(null, ABC_SHA256)).isTrue();
        assertThat(ChecksumCalculator.matches("00", ABC_SHA256)).isFalse();
    }
}
