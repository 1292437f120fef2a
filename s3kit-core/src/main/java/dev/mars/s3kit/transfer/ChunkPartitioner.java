package dev.mars.s3kit.transfer;

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


import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fixed-size partitioning of a byte count into contiguous chunks.
 *
 * <p>The ranges returned tile {@code [0, totalSize)} exactly: every chunk but the last
 * has {@code chunkSize} bytes and the last one holds the remainder. A size of zero
 * yields no chunks.</p>
 */
public final class ChunkPartitioner {

    /** S3 rejects uploads with more parts than this. */
    public static final int MAX_PARTS = 10000;

    private ChunkPartitioner() {
    }

    public static List<ChunkRange> partition(long totalSize, long chunkSize) {
        if (totalSize < 0) {
            throw new IllegalArgumentException("Total size must not be negative: " + totalSize);
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        if (totalSize == 0) {
            return Collections.emptyList();
        }
        long count = chunkCount(totalSize, chunkSize);
        if (count > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too many chunks: " + count);
        }
        List<ChunkRange> ranges = new ArrayList<>((int) count);
        long start = 0;
        int index = 0;
        while (start < totalSize) {
            long end = Math.min(start + chunkSize, totalSize) - 1;
            ranges.add(new ChunkRange(index++, start, end));
            start = end + 1;
        }
        return ranges;
    }

    public static long chunkCount(long totalSize, long chunkSize) {
        return totalSize == 0 ? 0 : (totalSize + chunkSize - 1) / chunkSize;
    }

    /**
     * Clamps a requested chunk size to the minimum, then grows it if needed so the
     * number of chunks stays within {@code maxChunks}.
     */
    public static long effectiveChunkSize(long requested, long minimum, long totalSize, int maxChunks) {
        long size = Math.max(requested, minimum);
        if (maxChunks > 0 && chunkCount(totalSize, size) > maxChunks) {
            size = (totalSize + maxChunks - 1) / maxChunks;
        }
        return size;
    }
}
