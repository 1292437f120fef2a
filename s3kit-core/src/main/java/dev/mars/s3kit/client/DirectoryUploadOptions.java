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


import java.nio.file.Path;
import java.util.function.Predicate;

/**
 * How a local directory is turned into object keys.
 *
 * <p>Depth counts the directories between the root and a file: files directly in the
 * root have depth 0. A {@code maxDepth} of 0 means no limit. With {@code flatten} every
 * file is keyed by its name alone, so equally named files in different directories
 * overwrite each other.</p>
 */
public final class DirectoryUploadOptions {

    private final boolean recursive;
    private final int maxDepth;
    private final boolean flatten;
    private final Predicate<Path> filter;

    private DirectoryUploadOptions(Builder builder) {
        this.recursive = builder.recursive;
        this.maxDepth = builder.maxDepth;
        this.flatten = builder.flatten;
        this.filter = builder.filter;
    }

    public static DirectoryUploadOptions topLevelOnly() {
        return builder().build();
    }

    public static DirectoryUploadOptions recursive() {
        return builder().recursive(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isRecursive() { return recursive; }
    public int getMaxDepth() { return maxDepth; }
    public boolean isFlatten() { return flatten; }
    /** Applied to each regular file; files it rejects are skipped. */
    public Predicate<Path> getFilter() { return filter; }

    /** Depth argument for {@link java.nio.file.Files#walk(Path, int, java.nio.file.FileVisitOption...)}. */
    int walkDepth() {
        if (!recursive) {
            return 1;
        }
        return maxDepth == 0 ? Integer.MAX_VALUE : maxDepth + 1;
    }

    public static final class Builder {
        private boolean recursive;
        private int maxDepth;
        private boolean flatten;
        private Predicate<Path> filter = path -> true;

        private Builder() {
        }

        public Builder recursive(boolean recursive) {
            this.recursive = recursive;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            if (maxDepth < 0) {
                throw new IllegalArgumentException("Max depth must not be negative: " + maxDepth);
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder flatten(boolean flatten) {
            this.flatten = flatten;
            return this;
        }

        public Builder filter(Predicate<Path> filter) {
            this.filter = filter != null ? filter : path -> true;
            return this;
        }

        /** Skips files matching the given predicate, on top of any filter already set. */
        public Builder exclude(Predicate<Path> exclusion) {
            this.filter = this.filter.and(exclusion.negate());
            return this;
        }

        public DirectoryUploadOptions build() {
            return new DirectoryUploadOptions(this);
        }
    }
}
