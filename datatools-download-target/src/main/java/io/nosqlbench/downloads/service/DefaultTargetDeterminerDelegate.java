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

import io.nosqlbench.downloads.confirm.ConfirmationStrategy;
import io.nosqlbench.downloads.history.VisitHistory;
import io.nosqlbench.downloads.item.DangerType;
import io.nosqlbench.downloads.item.DownloadItem;
import io.nosqlbench.downloads.item.InsecureDownloadStatus;
import io.nosqlbench.downloads.local.LocalPathResolver;
import io.nosqlbench.downloads.naming.MimeTypes;
import io.nosqlbench.downloads.reservation.DownloadPathReservationTracker;
import io.nosqlbench.downloads.safety.BrowserMimeSupport;
import io.nosqlbench.downloads.safety.DownloadUrlChecker;
import io.nosqlbench.downloads.safety.InsecureDownloadClassifier;
import io.nosqlbench.downloads.target.ConfirmationOutcome;
import io.nosqlbench.downloads.target.ConfirmationReason;
import io.nosqlbench.downloads.target.ConflictAction;
import io.nosqlbench.downloads.target.FilenameSuggestion;
import io.nosqlbench.downloads.target.LocalPathResult;
import io.nosqlbench.downloads.target.PathReservation;
import io.nosqlbench.downloads.target.TargetDeterminerDelegate;
import io.nosqlbench.downloads.target.VisitCountResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/// The standard collaborators of a target determiner, wired from the library's own
/// components. File system work runs on the blocking executor.
public class DefaultTargetDeterminerDelegate implements TargetDeterminerDelegate {
    private static final Logger logger = LogManager.getLogger(DefaultTargetDeterminerDelegate.class);

    private final InsecureDownloadClassifier insecureDownloads;
    private final List<FilenameHook> filenameHooks;
    private final DownloadPathReservationTracker reservations;
    private final ConfirmationStrategy confirmation;
    private final LocalPathResolver localPaths;
    private final BrowserMimeSupport mimeSupport;
    private final DownloadUrlChecker urlChecker;
    private final VisitHistory history;
    private final Executor blockingExecutor;

    private DefaultTargetDeterminerDelegate(Builder b) {
        this.insecureDownloads = Objects.requireNonNull(b.insecureDownloads, "insecureDownloads");
        this.filenameHooks = List.copyOf(b.filenameHooks);
        this.reservations = Objects.requireNonNull(b.reservations, "reservations");
        this.confirmation = Objects.requireNonNull(b.confirmation, "confirmation");
        this.localPaths = Objects.requireNonNull(b.localPaths, "localPaths");
        this.mimeSupport = Objects.requireNonNull(b.mimeSupport, "mimeSupport");
        this.urlChecker = Objects.requireNonNull(b.urlChecker, "urlChecker");
        this.history = b.history;
        this.blockingExecutor = Objects.requireNonNull(b.blockingExecutor, "blockingExecutor");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public CompletionStage<InsecureDownloadStatus> getInsecureDownloadStatus(DownloadItem item, Path virtualPath) {
        return CompletableFuture.completedFuture(insecureDownloads.classify(item.request(), virtualPath));
    }

    /// Hooks are asked in registration order; the last one with a suggestion wins.
    @Override
    public CompletionStage<FilenameSuggestion> notifyCollaborators(DownloadItem item, Path virtualPath) {
        FilenameSuggestion winner = FilenameSuggestion.none();
        for (FilenameHook hook : filenameHooks) {
            Optional<FilenameSuggestion> suggestion = hook.suggest(item, virtualPath);
            if (suggestion.isPresent()) {
                winner = suggestion.get();
            }
        }
        return CompletableFuture.completedFuture(winner);
    }

    @Override
    public CompletionStage<PathReservation> reserveVirtualPath(DownloadItem item, Path virtualPath,
                                                               boolean createDirectory, ConflictAction conflictAction) {
        return reservations.reserveAsync(item, virtualPath, createDirectory, conflictAction, blockingExecutor);
    }

    @Override
    public CompletionStage<ConfirmationOutcome> requestConfirmation(DownloadItem item, Path suggestedPath,
                                                                    ConfirmationReason reason) {
        logger.debug("Download {} needs confirmation ({}) of {}", item.id(), reason, suggestedPath);
        return confirmation.requestConfirmation(item, suggestedPath, reason);
    }

    @Override
    public CompletionStage<LocalPathResult> determineLocalPath(DownloadItem item, Path virtualPath) {
        return CompletableFuture.supplyAsync(() -> localPaths.resolve(item, virtualPath), blockingExecutor);
    }

    @Override
    public CompletionStage<String> getFileMimeType(Path localPath) {
        return CompletableFuture.supplyAsync(() -> MimeTypes.sniff(localPath), blockingExecutor);
    }

    @Override
    public CompletionStage<Boolean> isHandledSafelyByBrowser(DownloadItem item, Path localPath, String mimeType) {
        return CompletableFuture.completedFuture(mimeSupport.isHandledSafely(mimeType));
    }

    @Override
    public CompletionStage<DangerType> checkDownloadUrl(DownloadItem item, Path virtualPath) {
        return CompletableFuture.supplyAsync(() -> urlChecker.check(item.request()), blockingExecutor);
    }

    @Override
    public boolean hasVisitHistory() {
        return history != null;
    }

    @Override
    public CompletionStage<VisitCountResult> visibleVisitCountToHost(URI referrer) {
        if (history == null) {
            return CompletableFuture.completedFuture(VisitCountResult.failed());
        }
        return history.visibleVisitCountToHost(referrer);
    }

    public static final class Builder {
        private InsecureDownloadClassifier insecureDownloads;
        private final List<FilenameHook> filenameHooks = new ArrayList<>();
        private DownloadPathReservationTracker reservations;
        private ConfirmationStrategy confirmation;
        private LocalPathResolver localPaths = LocalPathResolver.IDENTITY;
        private BrowserMimeSupport mimeSupport = new BrowserMimeSupport(true);
        private DownloadUrlChecker urlChecker = DownloadUrlChecker.ALLOW_ALL;
        private VisitHistory history;
        private Executor blockingExecutor;

        private Builder() {
        }

        public Builder insecureDownloads(InsecureDownloadClassifier classifier) {
            this.insecureDownloads = classifier;
            return this;
        }

        public Builder filenameHook(FilenameHook hook) {
            this.filenameHooks.add(Objects.requireNonNull(hook));
            return this;
        }

        public Builder reservations(DownloadPathReservationTracker tracker) {
            this.reservations = tracker;
            return this;
        }

        public Builder confirmation(ConfirmationStrategy strategy) {
            this.confirmation = strategy;
            return this;
        }

        public Builder localPaths(LocalPathResolver resolver) {
            this.localPaths = resolver;
            return this;
        }

        public Builder mimeSupport(BrowserMimeSupport support) {
            this.mimeSupport = support;
            return this;
        }

        public Builder urlChecker(DownloadUrlChecker checker) {
            this.urlChecker = checker;
            return this;
        }

        /// @param history visit history, or null if none is kept
        public Builder history(VisitHistory history) {
            this.history = history;
            return this;
        }

        public Builder blockingExecutor(Executor executor) {
            this.blockingExecutor = executor;
            return this;
        }

        public DefaultTargetDeterminerDelegate build() {
            return new DefaultTargetDeterminerDelegate(this);
        }
    }
}
