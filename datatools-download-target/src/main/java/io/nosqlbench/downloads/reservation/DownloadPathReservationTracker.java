package io.nosqlbench.downloads.reservation;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.downloads.item.DownloadItem;
import io.nosqlbench.downloads.item.DownloadItemObserver;
import io.nosqlbench.downloads.item.DownloadState;
import io.nosqlbench.downloads.naming.SafeFileNames;
import io.nosqlbench.downloads.target.ConflictAction;
import io.nosqlbench.downloads.target.IntermediatePaths;
import io.nosqlbench.downloads.target.PathReservation;
import io.nosqlbench.downloads.target.PathValidationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/// Reserves target paths so that concurrent downloads never write to the same file.
///
/// A single tracker is shared by every download. Reservations are keyed by download id
/// and released when the download completes, is canceled, or is destroyed. All
/// reservation requests are serialized on the tracker, including the file system probes
/// they make.
public class DownloadPathReservationTracker {
    private static final Logger logger = LogManager.getLogger(DownloadPathReservationTracker.class);

    /// Largest number tried when appending ` (n)` to a conflicting name.
    public static final int MAX_UNIQUE_FILES = 100;

    private final Path fallbackDirectory;
    private final int maxFilenameLength;
    private final Map<Long, Path> reservations = new HashMap<>();
    private final Set<Long> tracked = new HashSet<>();

    /// @param fallbackDirectory directory used when the requested one is not writable
    /// @param maxFilenameLength longest file name the file system accepts
    public DownloadPathReservationTracker(Path fallbackDirectory, int maxFilenameLength) {
        this.fallbackDirectory = Objects.requireNonNull(fallbackDirectory, "fallbackDirectory");
        if (maxFilenameLength < 1) {
            throw new IllegalArgumentException("maxFilenameLength must be positive: " + maxFilenameLength);
        }
        this.maxFilenameLength = maxFilenameLength;
    }

    /// Reserves a path for a live download on the given executor, and releases the
    /// reservation automatically when the download finishes.
    /// @param item the download
    /// @param target the requested path
    /// @param createDirectory whether a missing parent directory may be created
    /// @param conflictAction how an existing file is handled
    /// @param executor runs the blocking file system work
    /// @return the reservation
    public CompletableFuture<PathReservation> reserveAsync(DownloadItem item, Path target, boolean createDirectory,
                                                           ConflictAction conflictAction, Executor executor) {
        trackLifetime(item);
        return CompletableFuture.supplyAsync(
            () -> reserve(item.id(), item.request().url(), target, createDirectory, conflictAction), executor);
    }

    /// Reserves a path for a download.
    /// @param downloadId the download
    /// @param sourceUrl the URL being downloaded
    /// @param target the requested absolute path
    /// @param createDirectory whether a missing parent directory may be created
    /// @param conflictAction how an existing file is handled
    /// @return the outcome and the reserved path
    public synchronized PathReservation reserve(long downloadId, URI sourceUrl, Path target, boolean createDirectory,
                                                ConflictAction conflictAction) {
        if (!target.isAbsolute() || target.getFileName() == null) {
            throw new IllegalArgumentException("target must be an absolute file path: " + target);
        }
        Path path = target.normalize();
        PathValidationResult result = PathValidationResult.SUCCESS;

        Path directory = path.getParent();
        if (createDirectory && !Files.isDirectory(directory)) {
            try {
                Files.createDirectories(directory);
            } catch (IOException e) {
                logger.warn("Could not create download directory {}: {}", directory, e.getMessage());
            }
        }
        if (!isWritableDirectory(directory)) {
            Path fallback = fallbackDirectory.toAbsolutePath().normalize();
            if (fallback.equals(directory) || !isWritableDirectory(fallback)) {
                logger.debug("No writable directory for download {} at {}", downloadId, path);
                return record(downloadId, new PathReservation(PathValidationResult.PATH_NOT_WRITABLE, path));
            }
            logger.debug("Download {} falls back from {} to {}", downloadId, directory, fallback);
            path = fallback.resolve(path.getFileName());
            result = PathValidationResult.PATH_NOT_WRITABLE;
        }

        String name = path.getFileName().toString();
        Optional<String> fitted = SafeFileNames.truncate(name, maxFilenameLength);
        if (fitted.isEmpty()) {
            return record(downloadId, new PathReservation(PathValidationResult.NAME_TOO_LONG, path));
        }
        path = path.resolveSibling(fitted.get());

        if (isSameAsSource(sourceUrl, path)) {
            return record(downloadId, new PathReservation(PathValidationResult.SAME_AS_SOURCE, path));
        }

        boolean conflict = switch (conflictAction) {
            case OVERWRITE -> isReservedByOther(path, downloadId);
            case UNIQUIFY, PROMPT -> isInUse(path, downloadId);
        };
        if (conflict) {
            if (conflictAction == ConflictAction.PROMPT) {
                return record(downloadId, new PathReservation(PathValidationResult.CONFLICT, path));
            }
            Optional<Path> unique = uniquePath(path, downloadId);
            if (unique.isEmpty()) {
                logger.debug("No unique name left for {} after {} attempts", path, MAX_UNIQUE_FILES);
                return record(downloadId, new PathReservation(PathValidationResult.CONFLICT, path));
            }
            path = unique.get();
            if (result == PathValidationResult.SUCCESS) {
                result = PathValidationResult.SUCCESS_RESOLVED_CONFLICT;
            }
        }
        return record(downloadId, new PathReservation(result, path));
    }

    /// Drops the reservation of a download.
    /// @param downloadId the download
    public synchronized void release(long downloadId) {
        Path released = reservations.remove(downloadId);
        if (released != null) {
            logger.debug("Released {} held by download {}", released, downloadId);
        }
    }

    /// @param path a path
    /// @return true if any download holds a reservation on the path
    public synchronized boolean isReserved(Path path) {
        return reservations.containsValue(path.normalize());
    }

    /// @return a copy of the current reservations by download id
    public synchronized Map<Long, Path> reservations() {
        return Map.copyOf(reservations);
    }

    private synchronized void trackLifetime(DownloadItem item) {
        if (!tracked.add(item.id())) {
            return;
        }
        item.addObserver(new DownloadItemObserver() {
            @Override
            public void onDownloadUpdated(DownloadItem updated) {
                DownloadState state = updated.state();
                if (state == DownloadState.COMPLETE || state == DownloadState.CANCELLED) {
                    updated.removeObserver(this);
                    untrack(updated.id());
                    return;
                }
                updated.targetPath().ifPresent(path -> updateReservation(updated.id(), path));
            }

            @Override
            public void onDownloadDestroyed(DownloadItem destroyed) {
                untrack(destroyed.id());
            }
        });
    }

    private synchronized void untrack(long downloadId) {
        tracked.remove(downloadId);
        release(downloadId);
    }

    private synchronized void updateReservation(long downloadId, Path path) {
        Path current = reservations.get(downloadId);
        if (current != null && !current.equals(path.normalize())) {
            reservations.put(downloadId, path.normalize());
        }
    }

    private PathReservation record(long downloadId, PathReservation reservation) {
        reservations.put(downloadId, reservation.path());
        logger.debug("Download {} holds {} ({})", downloadId, reservation.path(), reservation.result());
        return reservation;
    }

    private Optional<Path> uniquePath(Path path, long downloadId) {
        String name = path.getFileName().toString();
        String base = SafeFileNames.baseName(name);
        String extension = SafeFileNames.extension(name).map(e -> "." + e).orElse("");
        for (int i = 1; i <= MAX_UNIQUE_FILES; i++) {
            String suffix = " (" + i + ")";
            int room = maxFilenameLength - suffix.length() - extension.length();
            if (room <= 0) {
                return Optional.empty();
            }
            String candidateName = base.substring(0, Math.min(room, base.length())) + suffix + extension;
            Path candidate = path.resolveSibling(candidateName);
            if (!isInUse(candidate, downloadId)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private boolean isInUse(Path path, long downloadId) {
        return isReservedByOther(path, downloadId)
            || Files.exists(path)
            || Files.exists(IntermediatePaths.crdownloadPath(path));
    }

    private boolean isReservedByOther(Path path, long downloadId) {
        for (Map.Entry<Long, Path> entry : reservations.entrySet()) {
            if (entry.getKey() != downloadId && entry.getValue().equals(path)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isWritableDirectory(Path directory) {
        return directory != null && Files.isDirectory(directory) && Files.isWritable(directory);
    }

    private static boolean isSameAsSource(URI sourceUrl, Path path) {
        if (sourceUrl == null || !"file".equalsIgnoreCase(sourceUrl.getScheme())) {
            return false;
        }
        try {
            return Path.of(sourceUrl).toAbsolutePath().normalize().equals(path);
        } catch (IllegalArgumentException | FileSystemNotFoundException e) {
            logger.debug("Cannot compare file URL {} with {}: {}", sourceUrl, path, e.getMessage());
            return false;
        }
    }
}
