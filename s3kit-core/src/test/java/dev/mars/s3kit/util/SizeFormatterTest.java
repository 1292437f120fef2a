package dev.mars.s3kit.util;

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


import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SizeFormatterTest {

    @ParameterizedTest
    @CsvSource({
            "-1, unknown",
            "0, 0 B",
            "1023, 1023 B",
            "1024, 1.00 KiB",
            "1536, 1.50 KiB",
            "157286400, 150.00 MiB",
            "5368709120, 5.00 GiB"
    })
    void testFormatBytes(long bytes, String expected) {
        assertEquals(expected, SizeFormatter.formatBytes(bytes));
    }

    @Test
    void testFormatRate() {
        assertEquals("0 B/s", SizeFormatter.formatRate(0));
        assertEquals("2.00 MiB/s", SizeFormatter.formatRate(2 * 1024 * 1024));
    }

    @Test
    void testFormatDuration() {
        assertEquals("250ms", SizeFormatter.formatDuration(Duration.ofMillis(250)));
        assertEquals("1.5s", SizeFormatter.formatDuration(Duration.ofMillis(1500)));
        assertEquals("1m 30s", SizeFormatter.formatDuration(Duration.ofSeconds(90)));
        assertEquals("2h 5m", SizeFormatter.formatDuration(Duration.ofMinutes(125)));
    }
}
