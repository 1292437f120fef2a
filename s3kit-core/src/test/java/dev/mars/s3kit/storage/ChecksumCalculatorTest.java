package dev.mars.s3kit.storage;

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
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

class ChecksumCalculatorTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaultAlgorithm() {
        ChecksumCalculator calculator = new ChecksumCalculator();
        assertEquals("SHA-256", calculator.getAlgorithm());
    }

    @Test
    void testUnsupportedAlgorithm() {
        assertThrows(IllegalArgumentException.class, () -> new ChecksumCalculator("INVALID"));
    }

    @Test
    void testUpdateWithOffsetAndLength() {
        ChecksumCalculator calculator = new ChecksumCalculator();
        byte[] data = "Hello, World! Extra data".getBytes(StandardCharsets.UTF_8);
        calculator.update(data, 0, 13);

        ChecksumCalculator calculator2 = new ChecksumCalculator();
        calculator2.update("Hello, World!".getBytes(StandardCharsets.UTF_8));

        assertEquals(calculator2.getChecksum(), calculator.getChecksum());
    }

    @Test
    void testMd5Base64() {
        assertEquals("ZajifYh5KDgxtmS9i38K1A==",
                ChecksumCalculator.md5Base64("Hello, World!".getBytes(StandardCharsets.UTF_8)));
        assertEquals("1B2M2Y8AsgTpgAmY7PhCfg==", ChecksumCalculator.md5Base64(new byte[0]));
    }

    @Test
    void testMd5Base64OfFileRange() throws IOException {
        Path testFile = tempDir.resolve("test.txt");
        Files.write(testFile, "Hello, World!".getBytes(StandardCharsets.UTF_8));

        try (FileChannel channel = FileChannel.open(testFile, StandardOpenOption.READ)) {
            assertEquals("ZajifYh5KDgxtmS9i38K1A==", ChecksumCalculator.md5Base64(channel, 0, 13));
            assertEquals("5QlGXvUTFUmI4IjWrTwhvw==", ChecksumCalculator.md5Base64(channel, 7, 6));
        }
    }

    @Test
    void testMd5Base64PastEndOfFile() throws IOException {
        Path testFile = tempDir.resolve("short.txt");
        Files.write(testFile, "abc".getBytes(StandardCharsets.UTF_8));

        try (FileChannel channel = FileChannel.open(testFile, StandardOpenOption.READ)) {
            assertThrows(IOException.class, () -> ChecksumCalculator.md5Base64(channel, 0, 10));
        }
    }

    @Test
    void testCalculateFileChecksumWithAlgorithm() throws IOException {
        Path testFile = tempDir.resolve("test.txt");
        Files.write(testFile, "Hello, World!".getBytes(StandardCharsets.UTF_8));

        String sha256 = ChecksumCalculator.calculateFileChecksum(testFile);
        String md5 = ChecksumCalculator.calculateFileChecksum(testFile, ChecksumCalculator.MD5);

        assertEquals(64, sha256.length());
        assertEquals("65a8e27d8879283831b664bd8b7f0ad4", md5);
    }
}
