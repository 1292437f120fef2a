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


import dev.mars.s3kit.config.S3KitConfiguration;
import dev.mars.s3kit.core.BatchUploadResult;
import dev.mars.s3kit.core.BucketDescriptor;
import dev.mars.s3kit.core.DownloadResult;
import dev.mars.s3kit.core.ObjectDescriptor;
import dev.mars.s3kit.core.StorageStats;
import dev.mars.s3kit.core.UploadResult;
import dev.mars.s3kit.core.exceptions.S3KitException;
import dev.mars.s3kit.core.exceptions.TransferException;
import dev.mars.s3kit.storage.ResumeStore;
import dev.mars.s3kit.transfer.MultipartDownloadManager;
import dev.mars.s3kit.transfer.MultipartUploadManager;
import dev.mars.s3kit.transfer.ProgressCollector;
import dev.mars.s3kit.transfer.TransferOptions;
import dev.mars.s3kit.transfer.TransferState;
import dev.mars.s3kit.util.ContentTypes;
import dev.mars.s3kit.util.SizeFormatter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * High level client: bucket and object operations plus resumable file transfers.
 *
 * <p>The blocking transfer methods run on the caller's thread and fan chunks out to
 * their own workers. The {@code Async} variants run the same call on a small pool, so
 * the caller can drain a {@link ProgressCollector} while waiting.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class S3KitClient implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(S3KitClient.class.getName());

    private final S3StorageClient storage;
    private final ResumeStore resumeStore;
    private final S3KitConfiguration configuration;
    private final MultipartUploadManager uploadManager;
    private final MultipartDownloadManager downloadManager;
    private final ExecutorService transferExecutor;

    public S3KitClient(S3StorageClient storage, ResumeStore resumeStore, S3KitConfiguration configuration) {
        this(storage, resumeStore, configuration,
                new MultipartUploadManager(storage, resumeStore, configuration),
                new MultipartDownloadManager(storage, resumeStore, configuration));
    }

    S3KitClient(S3StorageClient storage, ResumeStore resumeStore, S3KitConfiguration configuration,
                MultipartUploadManager uploadManager, MultipartDownloadManager downloadManager) {
        this.storage = storage;
        this.resumeStore = resumeStore;
        this.configuration = configuration;
        this.uploadManager = uploadManager;
        this.downloadManager = downloadManager;
        AtomicInteger counter = new AtomicInteger();
        this.transferExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "s3kit-transfer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public S3StorageClient storage() {
        return storage;
    }

    public S3KitConfiguration getConfiguration() {
        return configuration;
    }

    public List<BucketDescriptor> listBuckets() throws S3KitException {
        return storage.listBuckets();
    }

    public List<ObjectDescriptor> listObjects(String bucket, String prefix, boolean recursive) throws S3KitException {
        return storage.listObjects(bucket, prefix, recursive, 0);
    }

    /**
     * Object counts and sizes for every bucket, counting at most
     * {@code maxObjectsPerBucket} objects per bucket (0 for no limit).
     */
    public StorageStats getStats(int maxObjectsPerBucket) throws S3KitException {
        return storage.getStats(maxObjectsPerBucket);
    }

    public UploadResult uploadFile(String bucket, String key, Path file) throws S3KitException {
        return uploadFile(bucket, key, file, TransferOptions.defaults(), null);
    }

    public UploadResult uploadFile(String bucket, String key, Path file, TransferOptions options,
                                   ProgressCollector collector) throws S3KitException {
        return uploadManager.upload(bucket, key, file, options, collector);
    }

    public CompletableFuture<UploadResult> uploadFileAsync(String bucket, String key, Path file,
                                                           TransferOptions options, ProgressCollector collector) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return uploadManager.upload(bucket, key, file, options, collector);
            } catch (S3KitException e) {
                throw new CompletionException(e);
            }
        }, transferExecutor);
    }

    /**
     * Uploads each file under {@code prefix/<file name>}, one after the other.
     *
     * <p>All files share {@code options}, including its context, so pausing or cancelling
     * it applies to the whole collection. A file without an explicit content type gets one
     * from its extension. A failing file is recorded in the result and the next one is
     * uploaded.</p>
     *
     * @param prefix key prefix, may be null or empty for the bucket root
     */
    public BatchUploadResult uploadFiles(String bucket, String prefix, List<Path> files, TransferOptions options,
                                         ProgressCollector collector) {
        if (bucket == null || files == null) {
            throw new IllegalArgumentException("Bucket and files are required");
        }
        List<KeyedFile> keyed = new ArrayList<>();
        for (Path file : files) {
            keyed.add(new KeyedFile(file, joinKey(prefix, file.getFileName().toString())));
        }
        return uploadAll(bucket, keyed, options, collector);
    }

    /**
     * Uploads the regular files of a directory, keyed by their path relative to
     * {@code directory} below {@code prefix}, or by file name alone when flattened.
     *
     * @throws TransferException when the directory cannot be read
     * @see #uploadFiles
     */
    public BatchUploadResult uploadDirectory(String bucket, String prefix, Path directory,
                                             DirectoryUploadOptions layout, TransferOptions options,
                                             ProgressCollector collector) throws S3KitException {
        if (bucket == null || directory == null) {
            throw new IllegalArgumentException("Bucket and directory are required");
        }
        DirectoryUploadOptions walk = layout != null ? layout : DirectoryUploadOptions.topLevelOnly();
        if (!Files.isDirectory(directory)) {
            throw new TransferException(null, "Source is not a directory: " + directory);
        }

        List<Path> files;
        try (Stream<Path> paths = Files.walk(directory, walk.walkDepth())) {
            files = paths.filter(Files::isRegularFile)
                    .filter(walk.getFilter())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new TransferException(null, "Cannot list directory " + directory, e);
        }
        logger.fine("Found " + files.size() + " files to upload in " + directory);

        List<KeyedFile> keyed = new ArrayList<>();
        for (Path file : files) {
            String name = walk.isFlatten() ? file.getFileName().toString() : relativeKey(directory, file);
            keyed.add(new KeyedFile(file, joinKey(prefix, name)));
        }
        return uploadAll(bucket, keyed, options, collector);
    }

    public CompletableFuture<BatchUploadResult> uploadDirectoryAsync(String bucket, String prefix, Path directory,
                                                                     DirectoryUploadOptions layout,
                                                                     TransferOptions options,
                                                                     ProgressCollector collector) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return uploadDirectory(bucket, prefix, directory, layout, options, collector);
            } catch (S3KitException e) {
                throw new CompletionException(e);
            }
        }, transferExecutor);
    }

    private BatchUploadResult uploadAll(String bucket, List<KeyedFile> files, TransferOptions options,
                                        ProgressCollector collector) {
        TransferOptions base = options != null ? options : TransferOptions.defaults();
        BatchUploadResult.Builder batch = BatchUploadResult.builder(bucket);
        logger.info("Uploading " + files.size() + " files to bucket " + bucket);

        for (int i = 0; i < files.size(); i++) {
            KeyedFile entry = files.get(i);
            if (base.getContext().isCancelled()) {
                logger.info("Upload of file collection cancelled after " + i + " of " + files.size() + " files");
                batch.cancelled(true);
                break;
            }
            TransferOptions perFile = base.getContentType() != null
                    ? base
                    : base.toBuilder().contentType(ContentTypes.forFile(entry.file)).build();
            try {
                UploadResult result = uploadManager.upload(bucket, entry.key, entry.file, perFile, collector);
                batch.result(result);
                logger.fine(String.format("File %d of %d: %s -> %s %s", i + 1, files.size(), entry.file,
                        entry.key, result.getFinalPhase()));
            } catch (S3KitException e) {
                logger.log(Level.WARNING, "Failed to upload " + entry.file + " to " + bucket + "/" + entry.key, e);
                batch.error(entry.file, e);
            }
        }

        BatchUploadResult result = batch.build();
        logger.info(String.format("Uploaded %d of %d files (%s) to bucket %s", result.getSuccessCount(),
                result.getFileCount(), SizeFormatter.formatBytes(result.getTotalBytes()), bucket));
        return result;
    }

    private static String relativeKey(Path root, Path file) {
        Path relative = root.relativize(file);
        List<String> parts = new ArrayList<>();
        for (Path part : relative) {
            parts.add(part.toString());
        }
        return String.join("/", parts);
    }

    static String joinKey(String prefix, String name) {
        if (prefix == null) {
            return name;
        }
        String trimmed = prefix.trim().replace('\\', '/');
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? name : trimmed + "/" + name;
    }

    private static final class KeyedFile {
        final Path file;
        final String key;

        KeyedFile(Path file, String key) {
            this.file = file;
            this.key = key;
        }
    }

    public DownloadResult downloadFile(String bucket, String key, Path destination) throws S3KitException {
        return downloadFile(bucket, key, destination, TransferOptions.defaults(), null);
    }

    public DownloadResult downloadFile(String bucket, String key, Path destination, TransferOptions options,
                                       ProgressCollector collector) throws S3KitException {
        return downloadManager.download(bucket, key, destination, options, collector);
    }

    public CompletableFuture<DownloadResult> downloadFileAsync(String bucket, String key, Path destination,
                                                               TransferOptions options, ProgressCollector collector) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return downloadManager.download(bucket, key, destination, options, collector);
            } catch (S3KitException e) {
                throw new CompletionException(e);
            }
        }, transferExecutor);
    }

    /**
     * Aborts the interrupted multipart upload of {@code file} to {@code bucket/key}, if any.
     */
    public boolean abortUpload(String bucket, String key, Path file) throws S3KitException {
        return uploadManager.abort(bucket, key, file);
    }

    /**
     * Interrupted transfers that can still be resumed.
     */
    public List<TransferState> listResumableTransfers() throws IOException {
        return resumeStore.list();
    }

    /**
     * Deletes resume records older than the configured maximum age.
     */
    public int cleanupResumeData() throws IOException {
        return resumeStore.cleanupOlderThan(configuration.getResumeMaxAge());
    }

    @Override
    public void close() {
        transferExecutor.shutdown();
        try {
            if (!transferExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warning("Transfers still running at close, interrupting them");
                transferExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            transferExecutor.shutdownNow();
        }
    }
}
