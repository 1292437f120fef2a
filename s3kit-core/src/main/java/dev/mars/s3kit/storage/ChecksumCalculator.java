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


import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Incremental message digest with hex and base64 output.
 *
 * <p>Uploads send each part's MD5 as base64 in {@code Content-MD5}; the static helpers
 * compute that digest directly from a byte range of a file with positional reads, so
 * several workers can share one channel.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ChecksumCalculator {

    public static final String MD5 = "MD5";
    public static final String SHA_256 = "SHA-256";

    private static final int BUFFER_SIZE = 64 * 1024;

    private final MessageDigest digest;
    private final String algorithm;

    public ChecksumCalculator() {
        this(SHA_256);
    }

    public ChecksumCalculator(String algorithm) {
        this.algorithm = algorithm;
        try {
            this.digest = MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unsupported checksum algorithm: " + algorithm, e);
        }
    }

    public void update(byte[] data) {
        digest.update(data);
    }

    public void update(byte[] data, int offset, int length) {
        digest.update(data, offset, length);
    }

    /**
     * Finishes the digest and returns it as lower-case hex. The calculator is reset.
     */
    public String getChecksum() {
        return bytesToHex(digest.digest());
    }

    /**
     * Finishes the digest and returns it base64 encoded. The calculator is reset.
     */
    public String getBase64Checksum() {
        return Base64.getEncoder().encodeToString(digest.digest());
    }

    public void reset() {
        digest.reset();
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public static String md5Base64(byte[] data) {
        ChecksumCalculator calculator = new ChecksumCalculator(MD5);
        calculator.update(data);
        return calculator.getBase64Checksum();
    }

    /**
     * Base64 MD5 of {@code length} bytes starting at {@code position}.
     */
    public static String md5Base64(FileChannel channel, long position, long length) throws IOException {
        ChecksumCalculator calculator = new ChecksumCalculator(MD5);
        ByteBuffer buffer = ByteBuffer.allocate((int) Math.min(BUFFER_SIZE, Math.max(1, length)));
        long offset = position;
        long remaining = length;
        while (remaining > 0) {
            buffer.clear();
            if (remaining < buffer.capacity()) {
                buffer.limit((int) remaining);
            }
            int read = channel.read(buffer, offset);
            if (read < 0) {
                throw new IOException("Unexpected end of file at offset " + offset);
            }
            calculator.update(buffer.array(), 0, read);
            offset += read;
            remaining -= read;
        }
        return calculator.getBase64Checksum();
    }

    public static String calculateFileChecksum(Path filePath) throws IOException {
        return calculateFileChecksum(filePath, SHA_256);
    }

    public static String calculateFileChecksum(Path filePath, String algorithm) throws IOException {
        ChecksumCalculator calculator = new ChecksumCalculator(algorithm);
        try (InputStream inputStream = Files.newInputStream(filePath)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int bytesRead;
            while ((bytesRead = inputStream.read(buffer)) != -1) {
                calculator.update(buffer, 0, bytesRead);
            }
        }
        return calculator.getChecksum();
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }

    @Override
    public String toString() {
        return "ChecksumCalculator{algorithm='" + algorithm + "'}";
    }
}
