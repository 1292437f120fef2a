package dev.mars.s3kit.core;

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


import java.time.Instant;
import java.util.Objects;

/**
 * A bucket as reported by {@code ListBuckets}.
 */
public final class BucketDescriptor {

    private final String name;
    private final Instant creationDate;

    public BucketDescriptor(String name, Instant creationDate) {
        this.name = Objects.requireNonNull(name, "Bucket name cannot be null");
        this.creationDate = creationDate;
    }

    public String getName() { return name; }
    public Instant getCreationDate() { return creationDate; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BucketDescriptor that = (BucketDescriptor) o;
        return name.equals(that.name) && Objects.equals(creationDate, that.creationDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, creationDate);
    }

    @Override
    public String toString() {
        return "BucketDescriptor{name='" + name + "', creationDate=" + creationDate + '}';
    }
}
