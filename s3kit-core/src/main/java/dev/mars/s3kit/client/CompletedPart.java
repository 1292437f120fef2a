package dev.mars.s3kit.client;

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
 * A part number and the ETag the server returned for it, as listed in the
 * completion request of a multipart upload.
 */
public final class CompletedPart implements Comparable<CompletedPart> {

    private final int partNumber;
    private final String eTag;

    public CompletedPart(int partNumber, String eTag) {
        if (partNumber < 1 || partNumber > 10000) {
            throw new IllegalArgumentException("Part number must be between 1 and 10000: " + partNumber);
        }
        this.partNumber = partNumber;
        this.eTag = Objects.requireNonNull(eTag, "ETag cannot be null");
    }

    public int getPartNumber() { return partNumber; }
    public String getETag() { return eTag; }

    @Override
    public int compareTo(CompletedPart other) {
        return Integer.compare(partNumber, other.partNumber);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CompletedPart that = (CompletedPart) o;
        return partNumber == that.partNumber && eTag.equals(that.eTag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partNumber, eTag);
    }

    @Override
    public String toString() {
        return "CompletedPart{" + partNumber + ", " + eTag + '}';
    }
}
