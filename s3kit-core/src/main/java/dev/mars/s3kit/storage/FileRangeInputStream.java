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

/**
 * Reads a fixed byte range of a file through positional reads.
 *
 * <p>The channel position is never touched, so any number of these streams may read
 * from the same channel concurrently. Closing the stream does not close the channel.</p>
 */
public class FileRangeInputStream extends InputStream {

    private final FileChannel channel;
    private final long end;
    private long position;

    /**
     * @param start first byte, inclusive
     * @param length number of bytes to expose
     */
    public FileRangeInputStream(FileChannel channel, long start, long length) {
        if (start < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid range: start=" + start + ", length=" + length);
        }
        this.channel = channel;
        this.position = start;
        this.end = start + length;
    }

    @Override
    public int read() throws IOException {
        byte[] single = new byte[1];
        int n = read(single, 0, 1);
        return n < 0 ? -1 : single[0] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        long remaining = end - position;
        if (remaining <= 0) {
            return -1;
        }
        int toRead = (int) Math.min(len, remaining);
        int read = channel.read(ByteBuffer.wrap(b, off, toRead), position);
        if (read < 0) {
            throw new IOException("File is shorter than expected: EOF at " + position + ", range ends at " + end);
        }
        position += read;
        return read;
    }

    @Override
    public int available() {
        return (int) Math.min(Integer.MAX_VALUE, end - position);
    }

    public long remaining() {
        return end - position;
    }
}
