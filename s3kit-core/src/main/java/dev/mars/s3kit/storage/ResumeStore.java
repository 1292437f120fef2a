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


import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.s3kit.config.S3KitConfiguration;
import dev.mars.s3kit.core.TransferDirection;
import dev.mars.s3kit.signer.SigningUtils;
import dev.mars.s3kit.transfer.TransferState;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persists {@link TransferState} records as JSON files in a local directory.
 *
 * <p>One file exists per (bucket, key, local path, direction). File names are built
 * from sanitized bucket and key names plus a SHA-256 prefix of the full identity, so
 * they stay readable while never colliding. Writes go to a temporary file that is then
 * moved over the target atomically; a crash never leaves a half-written record.</p>
 *
 * <p>Unreadable records are logged and treated as absent.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ResumeStore {
    private static final Logger logger = Logger.getLogger(ResumeStore.class.getName());

    public static final String FILE_SUFFIX = ".s3kit-resume.json";

    private static final int HASH_PREFIX_LENGTH = 16;
    private static final int MAX_NAME_PART = 40;

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ResumeStore(S3KitConfiguration configuration) {
        this(configuration.getResumeDirectory(), Clock.systemUTC());
    }

    public ResumeStore(Path directory) {
        this(directory, Clock.systemUTC());
    }

    public ResumeStore(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Writes a snapshot of {@code state}, replacing any earlier record for the same transfer.
     */
    public void save(TransferState state) throws IOException {
        Files.createDirectories(directory);
        Path target = resolveFile(state.getBucket(), state.getKey(), state.getLocalPath(), state.getDirection());
        Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), state.snapshot());
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        logger.fine("Saved resume record " + target.getFileName());
    }

    public Optional<TransferState> load(String bucket, String key, Path localPath, TransferDirection direction) {
        return read(resolveFile(bucket, key, localPath, direction));
    }

    public boolean delete(TransferState state) {
        return delete(state.getBucket(), state.getKey(), state.getLocalPath(), state.getDirection());
    }

    public boolean delete(String bucket, String key, Path localPath, TransferDirection direction) {
        Path file = resolveFile(bucket, key, localPath, direction);
        try {
            boolean deleted = Files.deleteIfExists(file);
            if (deleted) {
                logger.fine("Deleted resume record " + file.getFileName());
            }
            return deleted;
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to delete resume record " + file, e);
            return false;
        }
    }

    /**
     * All readable records in the store.
     */
    public List<TransferState> list() throws IOException {
        List<TransferState> states = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return states;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + FILE_SUFFIX)) {
            for (Path file : files) {
                read(file).ifPresent(states::add);
            }
        }
        return states;
    }

    /**
     * Deletes records last updated before {@code now - maxAge}, and unreadable records
     * whose file is that old.
     *
     * @return the number of files removed
     */
    public int cleanupOlderThan(Duration maxAge) throws IOException {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        Instant now = clock.instant();
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + FILE_SUFFIX)) {
            for (Path file : files) {
                Optional<TransferState> state = read(file);
                boolean stale = state.isPresent()
                        ? state.get().isOlderThan(maxAge, now)
                        : Files.getLastModifiedTime(file).toInstant().plus(maxAge).isBefore(now);
                if (stale && Files.deleteIfExists(file)) {
                    removed++;
                }
            }
        }
        if (removed > 0) {
            logger.info("Removed " + removed + " stale resume records from " + directory);
        }
        return removed;
    }

    /**
     * Location of the record for the given identity. The file need not exist.
     */
    public Path resolveFile(String bucket, String key, Path localPath, TransferDirection direction) {
        String absolutePath = localPath.toAbsolutePath().normalize().toString();
        String identity = bucket + "|" + key + "|" + absolutePath + "|" + direction.name();
        String hash = SigningUtils.sha256Hex(identity).substring(0, HASH_PREFIX_LENGTH);

        String keyName = key;
        int slash = keyName.lastIndexOf('/', keyName.length() - 2);
        if (slash >= 0) {
            keyName = keyName.substring(slash + 1);
        }
        String name = safeName(bucket) + "_" + safeName(keyName) + "_"
                + direction.name().toLowerCase(Locale.ROOT) + "_" + hash + FILE_SUFFIX;
        return directory.resolve(name);
    }

    private Optional<TransferState> read(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            TransferState state = objectMapper.readValue(file.toFile(), TransferState.class);
            if (!state.isConsistent()) {
                logger.warning("Ignoring inconsistent resume record " + file.getFileName());
                return Optional.empty();
            }
            return Optional.of(state);
        } catch (IOException e) {
            logger.warning("Ignoring unreadable resume record " + file.getFileName() + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    static String safeName(String value) {
        StringBuilder out = new StringBuilder(Math.min(value.length(), MAX_NAME_PART));
        for (int i = 0; i < value.length() && out.length() < MAX_NAME_PART; i++) {
            char c = value.charAt(i);
            out.append(Character.isLetterOrDigit(c) || c == '-' || c == '.' ? c : '_');
        }
        return out.length() == 0 ? "_" : out.toString();
    }
}
