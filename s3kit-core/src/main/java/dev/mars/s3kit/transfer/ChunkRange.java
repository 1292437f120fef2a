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


import java.util.Objects;

/**
 * Inclusive byte range {@code [start, end]} of chunk {@code index}.
 */
public final class ChunkRange {

    private final int index;
    private final long start;
    private final long end;

    public ChunkRange(int index, long start, long end) {
        if (index < 0 || start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid chunk range " + index + ": " + start + "-" + end);
        }
        this.index = index;
        this.start = start;
        this.end = end;
    }

    public int getIndex() { return index; }
    public long getStart() { return start; }
    public long getEnd() { return end; }

    public long length() {
        return end - start + 1;
    }

    /**
     * S3 part number of this chunk.
     */
    public int partNumber() {
        return index + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChunkRange that = (ChunkRange) o;
        return index == that.index && start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, start, end);
    }

    @Override
    public String toString() {
        return "ChunkRange{" + index + ": " + start + "-" + end + '}';
    }
}
