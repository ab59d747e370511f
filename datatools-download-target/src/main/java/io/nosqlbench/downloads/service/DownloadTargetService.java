package io.nosqlbench.downloads.service;

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

import io.nosqlbench.downloads.config.DownloadPrefs;
import io.nosqlbench.downloads.config.DownloadTargetSettings;
import io.nosqlbench.downloads.confirm.ConfirmationStrategy;
import io.nosqlbench.downloads.confirm.DesktopConfirmationStrategy;
import io.nosqlbench.downloads.confirm.DownloadLocationDialog;
import io.nosqlbench.downloads.confirm.FilePicker;
import io.nosqlbench.downloads.confirm.MobileConfirmationStrategy;
import io.nosqlbench.downloads.history.VisitHistory;
import io.nosqlbench.downloads.item.DownloadItem;
import io.nosqlbench.downloads.local.LocalPathResolver;
import io.nosqlbench.downloads.local.MappedLocalPathResolver;
import io.nosqlbench.downloads.reservation.DownloadPathReservationTracker;
import io.nosqlbench.downloads.safety.BrowserMimeSupport;
import io.nosqlbench.downloads.safety.DownloadBlockingPolicy;
import io.nosqlbench.downloads.safety.DownloadUrlChecker;
import io.nosqlbench.downloads.safety.InsecureDownloadClassifier;
import io.nosqlbench.downloads.target.DeterminerEnvironment;
import io.nosqlbench.downloads.target.TargetDeterminer;
import io.nosqlbench.downloads.target.TargetDeterminerDelegate;
import io.nosqlbench.downloads.target.TargetDeterminerObserver;
import io.nosqlbench.downloads.target.TargetInfo;
import io.nosqlbench.downloads.target.TargetResolution;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/// Entry point for resolving download targets.
///
/// The service owns every running [TargetDeterminer], keyed by download id, and hands the
/// caller a future for the outcome instead. One resolution per download may run at a time.
/// Once a determiner delivers its outcome the service applies the download restriction
/// policy, records the paths and danger type on the item, and drops the determiner.
///
/// ```java
/// try (DownloadTargetService service = DownloadTargetService.builder(settings)
///     .filePicker(picker)
///     .build()) {
///     TargetResolution resolution = service.determineTarget(item).get();
/// }
/// ```
public class DownloadTargetService implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(DownloadTargetService.class);

    private static final FilePicker NO_PICKER = (item, suggested, reason) ->
        CompletableFuture.completedFuture(Optional.empty());

    private final DownloadTargetSettings settings;
    private final DownloadPrefs prefs;
    private final DownloadPathReservationTracker reservations;
    private final TargetDeterminerDelegate delegate;
    private final DeterminerEnvironment environment;
    private final DownloadBlockingPolicy blockingPolicy;
    private final List<ExecutorService> ownedExecutors;
    private final Map<Long, InFlight> inFlight = new ConcurrentHashMap<>();

    private DownloadTargetService(Builder b) {
        this.settings = b.settings;
        this.prefs = new DownloadPrefs(settings);
        this.ownedExecutors = new ArrayList<>();

        Executor sequence = b.sequence;
        if (sequence == null) {
            ExecutorService owned = Executors.newSingleThreadExecutor(namedThreads("download-target-sequence"));
            ownedExecutors.add(owned);
            sequence = owned;
        }
        Executor blocking = b.blocking;
        if (blocking == null) {
            ExecutorService owned = Executors.newCachedThreadPool(namedThreads("download-target-blocking"));
            ownedExecutors.add(owned);
            blocking = owned;
        }

        this.reservations = new DownloadPathReservationTracker(settings.downloadDirectory(),
            settings.maxFilenameLength());
        ConfirmationStrategy confirmation = b.confirmation;
        if (confirmation == null) {
            confirmation = switch (settings.platform()) {
                case DESKTOP -> new DesktopConfirmationStrategy(b.filePicker == null ? NO_PICKER : b.filePicker);
                case MOBILE -> new MobileConfirmationStrategy(b.locationDialog, prefs, reservations, blocking);
            };
        }

        DefaultTargetDeterminerDelegate.Builder delegateBuilder = DefaultTargetDeterminerDelegate.builder()
            .insecureDownloads(new InsecureDownloadClassifier(settings))
            .reservations(reservations)
            .confirmation(confirmation)
            .localPaths(b.localPaths == null ? new MappedLocalPathResolver(settings.virtualRoots()) : b.localPaths)
            .mimeSupport(new BrowserMimeSupport(settings.openPdfInBrowser()))
            .urlChecker(b.urlChecker)
            .history(b.history)
            .blockingExecutor(blocking);
        b.filenameHooks.forEach(delegateBuilder::filenameHook);
        this.delegate = delegateBuilder.build();

        this.environment = DeterminerEnvironment.of(prefs, confirmation.defaultConflictAction(), sequence)
            .withClock(b.clock)
            .withObserver(b.observer);
        this.blockingPolicy = new DownloadBlockingPolicy(settings);
        logger.debug("Download target service ready: platform={} directory={}", settings.platform(),
            settings.downloadDirectory());
    }

    public static Builder builder(DownloadTargetSettings settings) {
        return new Builder(settings);
    }

    /// Starts resolving the target of a download.
    /// @param item the download
    /// @return the outcome; failed with [IllegalStateException] if the download is already being resolved
    public CompletableFuture<TargetResolution> determineTarget(DownloadItem item) {
        CompletableFuture<TargetResolution> result = new CompletableFuture<>();
        InFlight entry = new InFlight(result);
        if (inFlight.putIfAbsent(item.id(), entry) != null) {
            return CompletableFuture.failedFuture(
                new IllegalStateException("download " + item.id() + " is already being resolved"));
        }
        logger.debug("Resolving target of download {} from {}", item.id(), item.request().url());
        try {
            entry.determiner = TargetDeterminer.start(item, delegate, environment,
                resolution -> targetDetermined(item, entry, resolution));
        } catch (RuntimeException e) {
            inFlight.remove(item.id(), entry);
            result.completeExceptionally(e);
        }
        return result;
    }

    private void targetDetermined(DownloadItem item, InFlight entry, TargetResolution resolution) {
        inFlight.remove(item.id(), entry);
        TargetResolution applied = blockingPolicy.apply(item.request(), resolution);
        TargetInfo info = applied.info();
        if (applied.succeeded()) {
            item.setDangerType(info.dangerType());
            item.setPaths(info.targetPath(), info.intermediatePath());
        } else {
            reservations.release(item.id());
        }
        logger.debug("Download {} target determined: {} -> {}", item.id(), info.interruptReason(),
            info.targetPath());
        entry.result.complete(applied);
    }

    /// @return ids of downloads whose target is being resolved
    public Set<Long> inFlight() {
        return Set.copyOf(inFlight.keySet());
    }

    /// Cancels every running resolution. Their futures complete with a canceled outcome.
    public void shutdown() {
        inFlight.values().forEach(entry -> {
            TargetDeterminer determiner = entry.determiner;
            if (determiner != null) {
                determiner.cancel();
            }
        });
    }

    public DownloadPrefs prefs() {
        return prefs;
    }

    public DownloadTargetSettings settings() {
        return settings;
    }

    public DownloadPathReservationTracker reservations() {
        return reservations;
    }

    @Override
    public void close() {
        shutdown();
        for (ExecutorService executor : ownedExecutors) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class InFlight {
        private final CompletableFuture<TargetResolution> result;
        private volatile TargetDeterminer determiner;

        private InFlight(CompletableFuture<TargetResolution> result) {
            this.result = result;
        }
    }

    public static final class Builder {
        private final DownloadTargetSettings settings;
        private ConfirmationStrategy confirmation;
        private FilePicker filePicker;
        private DownloadLocationDialog locationDialog;
        private final List<FilenameHook> filenameHooks = new ArrayList<>();
        private LocalPathResolver localPaths;
        private DownloadUrlChecker urlChecker = DownloadUrlChecker.ALLOW_ALL;
        private VisitHistory history;
        private Executor sequence;
        private Executor blocking;
        private Clock clock = Clock.systemDefaultZone();
        private TargetDeterminerObserver observer = TargetDeterminerObserver.NONE;

        private Builder(DownloadTargetSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings");
        }

        /// Overrides the confirmation strategy chosen from the configured platform.
        public Builder confirmation(ConfirmationStrategy strategy) {
            this.confirmation = strategy;
            return this;
        }

        /// File picker of the desktop strategy. Without one, every prompt is canceled.
        public Builder filePicker(FilePicker picker) {
            this.filePicker = picker;
            return this;
        }

        /// Location dialog of the mobile strategy. Without one, only preference prompts proceed.
        public Builder locationDialog(DownloadLocationDialog dialog) {
            this.locationDialog = dialog;
            return this;
        }

        public Builder filenameHook(FilenameHook hook) {
            this.filenameHooks.add(Objects.requireNonNull(hook));
            return this;
        }

        public Builder localPaths(LocalPathResolver resolver) {
            this.localPaths = resolver;
            return this;
        }

        public Builder urlChecker(DownloadUrlChecker checker) {
            this.urlChecker = Objects.requireNonNull(checker);
            return this;
        }

        public Builder history(VisitHistory history) {
            this.history = history;
            return this;
        }

        /// The executor resolutions run on. It must run one task at a time.
        public Builder sequence(Executor executor) {
            this.sequence = executor;
            return this;
        }

        public Builder blockingExecutor(Executor executor) {
            this.blocking = executor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public Builder observer(TargetDeterminerObserver observer) {
            this.observer = Objects.requireNonNull(observer);
            return this;
        }

        public DownloadTargetService build() {
            return new DownloadTargetService(this);
        }
    }
}
