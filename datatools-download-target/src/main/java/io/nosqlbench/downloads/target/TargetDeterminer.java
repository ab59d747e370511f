package io.nosqlbench.downloads.target;

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

import io.nosqlbench.downloads.item.DangerType;
import io.nosqlbench.downloads.item.DownloadItem;
import io.nosqlbench.downloads.item.DownloadItemObserver;
import io.nosqlbench.downloads.item.DownloadRequest;
import io.nosqlbench.downloads.item.DownloadSource;
import io.nosqlbench.downloads.item.InsecureDownloadStatus;
import io.nosqlbench.downloads.item.InterruptReason;
import io.nosqlbench.downloads.item.PageTransition;
import io.nosqlbench.downloads.item.TargetDisposition;
import io.nosqlbench.downloads.naming.SafeFileNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Function;

/// Determines where a download is written and how it is classified.
///
/// A determiner runs the states of [TargetResolutionState] in order, once, for one
/// download. Each state either continues inline or suspends on a collaborator of the
/// [TargetDeterminerDelegate]; the collaborator's answer resumes the loop on the
/// determiner's sequence executor. Whatever happens, the completion callback receives
/// exactly one [TargetResolution], always posted to the sequence.
///
/// Destroying the [DownloadItem] while a state is suspended ends the resolution with
/// [InterruptReason#USER_CANCELED]. Answers that arrive after the outcome has been
/// delivered are ignored.
///
/// All methods other than [#start] and [#cancel] must be called on the sequence.
public final class TargetDeterminer {
    private static final Logger logger = LogManager.getLogger(TargetDeterminer.class);

    private final DownloadItem item;
    private final DownloadRequest request;
    private final TargetDeterminerDelegate delegate;
    private final DeterminerEnvironment env;
    private final Consumer<TargetResolution> callback;
    private final ResolutionState rs;
    private final boolean isResumption;
    private final boolean hasPromptedForPath;
    private final DownloadItemObserver destructionObserver = new DownloadItemObserver() {
        @Override
        public void onDownloadDestroyed(DownloadItem destroyed) {
            env.sequence().execute(TargetDeterminer.this::onDownloadDestroyed);
        }
    };

    private TargetResolutionState nextState = TargetResolutionState.GENERATE_TARGET_PATH;
    private TargetResolutionState currentState = TargetResolutionState.NONE;
    private PendingStep<?> pending;
    private boolean finished;
    private boolean checkingDialogConfirmedPath;

    private TargetDeterminer(DownloadItem item, TargetDeterminerDelegate delegate, DeterminerEnvironment env,
                             Consumer<TargetResolution> callback) {
        this.item = Objects.requireNonNull(item, "item");
        this.request = item.request();
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.env = Objects.requireNonNull(env, "env");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.rs = new ResolutionState(item.dangerType(), env.defaultConflictAction());

        Optional<Path> initialVirtualPath = item.targetPath();
        initialVirtualPath.ifPresent(path -> {
            if (!path.isAbsolute()) {
                throw new IllegalArgumentException("download " + item.id() + " has a relative target path " + path);
            }
            rs.setVirtualPath(path);
        });
        this.isResumption = request.lastInterruptReason() != InterruptReason.NONE && initialVirtualPath.isPresent();
        this.hasPromptedForPath = isResumption && request.targetDisposition() == TargetDisposition.PROMPT;
    }

    /// Starts resolving the target of a download. The first states run on the sequence.
    /// @param item the download
    /// @param delegate the collaborators
    /// @param env preferences, policies and the sequence executor
    /// @param callback receives the outcome exactly once, on the sequence
    /// @return the running determiner
    public static TargetDeterminer start(DownloadItem item, TargetDeterminerDelegate delegate,
                                         DeterminerEnvironment env, Consumer<TargetResolution> callback) {
        TargetDeterminer determiner = new TargetDeterminer(item, delegate, env, callback);
        item.addObserver(determiner.destructionObserver);
        env.sequence().execute(determiner::begin);
        return determiner;
    }

    /// Ends the resolution as canceled unless it has already finished. Safe to call from
    /// any thread.
    public void cancel() {
        env.sequence().execute(() -> {
            if (!finished) {
                logger.debug("Canceling target resolution of download {}", item.id());
                finish(InterruptReason.USER_CANCELED, CancelReason.DOWNLOAD_DESTROYED);
            }
        });
    }

    public long downloadId() {
        return item.id();
    }

    public boolean isFinished() {
        return finished;
    }

    /// @return the current resolution state
    public ResolutionSnapshot snapshot() {
        return rs.snapshot(nextState);
    }

    PendingStep<?> pendingStep() {
        return pending;
    }

    private void begin() {
        if (item.isDestroyed()) {
            onDownloadDestroyed();
            return;
        }
        guarded(currentState, this::doLoop);
    }

    private void doLoop() {
        StepResult result;
        do {
            if (finished) {
                return;
            }
            currentState = nextState;
            nextState = TargetResolutionState.NONE;
            env.observer().onStateEntered(currentState, rs.snapshot(currentState));
            result = runState(currentState);
        } while (result == StepResult.CONTINUE);

        if (result == StepResult.COMPLETE && !finished) {
            finish(InterruptReason.NONE, null);
        }
    }

    private StepResult runState(TargetResolutionState state) {
        return switch (state) {
            case GENERATE_TARGET_PATH -> doGenerateTargetPath();
            case SET_INSECURE_DOWNLOAD_STATUS -> doSetInsecureDownloadStatus();
            case NOTIFY_COLLABORATORS -> doNotifyCollaborators();
            case RESERVE_VIRTUAL_PATH -> doReserveVirtualPath();
            case PROMPT_USER_FOR_DOWNLOAD_PATH -> doPromptUserForDownloadPath();
            case DETERMINE_LOCAL_PATH -> doDetermineLocalPath();
            case DETERMINE_MIME_TYPE -> doDetermineMimeType();
            case DETERMINE_IF_HANDLED_SAFELY_BY_BROWSER -> doDetermineIfHandledSafely();
            case CHECK_DOWNLOAD_URL -> doCheckDownloadUrl();
            case CHECK_VISITED_REFERRER_BEFORE -> doCheckVisitedReferrerBefore();
            case DETERMINE_INTERMEDIATE_PATH -> doDetermineIntermediatePath();
            case NONE -> throw new IllegalStateException("download " + item.id() + " has no state to run");
        };
    }

    private StepResult doGenerateTargetPath() {
        nextState = TargetResolutionState.SET_INSECURE_DOWNLOAD_STATUS;
        Optional<Path> forcedPath = request.forcedPath();

        if (request.isTransient()) {
            if (forcedPath.isPresent()) {
                rs.setVirtualPath(forcedPath.get());
                rs.setConflictAction(ConflictAction.OVERWRITE);
            } else if (rs.virtualPath() == null) {
                return cancel(InterruptReason.USER_CANCELED, CancelReason.NO_VALID_PATH);
            }
        } else if (rs.virtualPath() != null && hasPromptedForPath && forcedPath.isEmpty()) {
            // resumed after the user picked this path; reuse the choice
            rs.setConfirmationReason(
                ConfirmationPolicy.needsConfirmation(request, rs.virtualPath(), isResumption, env.prefs()));
            rs.setConflictAction(ConflictAction.OVERWRITE);
        } else if (forcedPath.isEmpty()) {
            Path filename = Path.of(env.filenames().fileNameFor(request));
            ConfirmationReason reason =
                ConfirmationPolicy.needsConfirmation(request, filename, isResumption, env.prefs());
            rs.setConfirmationReason(reason);
            Path directory = reason != ConfirmationReason.NONE
                ? env.prefs().saveFilePath() : env.prefs().downloadPath();
            rs.setVirtualPath(directory.resolve(filename));
            rs.setShouldNotifyCollaborators(true);
        } else {
            rs.setConflictAction(ConflictAction.OVERWRITE);
            rs.setVirtualPath(forcedPath.get());
        }
        logger.debug("Download {} generated virtual path {}", item.id(), rs.virtualPath());
        return StepResult.CONTINUE;
    }

    private StepResult doSetInsecureDownloadStatus() {
        nextState = TargetResolutionState.NOTIFY_COLLABORATORS;
        return await(delegate.getInsecureDownloadStatus(item, rs.virtualPath()), status -> {
            rs.setInsecureDownloadStatus(status);
            if (status == InsecureDownloadStatus.SILENT_BLOCK) {
                return cancel(InterruptReason.FILE_BLOCKED, CancelReason.INSECURE_DOWNLOAD);
            }
            return StepResult.CONTINUE;
        });
    }

    private StepResult doNotifyCollaborators() {
        nextState = TargetResolutionState.RESERVE_VIRTUAL_PATH;
        if (!rs.shouldNotifyCollaborators() || !item.isInProgress()) {
            return StepResult.CONTINUE;
        }
        return await(delegate.notifyCollaborators(item, rs.virtualPath()), this::notifyCollaboratorsDone);
    }

    private StepResult notifyCollaboratorsDone(FilenameSuggestion suggestion) {
        if (isFileUrl(request.url())) {
            logger.debug("Ignoring collaborator suggestion {} for local file {}", suggestion, request.url());
            return StepResult.CONTINUE;
        }
        if (suggestion.hasFilename()) {
            suggestedPath(suggestion.filename()).ifPresent(path -> {
                rs.setVirtualPath(path);
                rs.setCreateTargetDirectory(true);
            });
        }
        if (suggestion.conflictAction() != ConflictAction.UNIQUIFY) {
            rs.setConflictAction(suggestion.conflictAction());
        }
        return StepResult.CONTINUE;
    }

    /// Places a suggested relative name under the download directory. The extension is
    /// corrected from the MIME type only when the suggestion changes it.
    private Optional<Path> suggestedPath(String suggestion) {
        List<String> segments = new ArrayList<>();
        for (String segment : suggestion.split("[/\\\\]")) {
            String safe = SafeFileNames.sanitize(segment, '_');
            if (!safe.isEmpty()) {
                segments.add(safe);
            }
        }
        if (segments.isEmpty()) {
            logger.debug("Filename suggestion '{}' has no usable name", suggestion);
            return Optional.empty();
        }
        String name = segments.remove(segments.size() - 1);
        String previousExtension = SafeFileNames.extension(fileName(rs.virtualPath())).orElse("");
        String newExtension = SafeFileNames.extension(name).orElse("");
        boolean keepExtension = newExtension.isEmpty() || newExtension.equalsIgnoreCase(previousExtension);
        name = SafeFileNames.generateSafeFileName(name, request.mimeType(), !keepExtension);

        Path path = env.prefs().downloadPath();
        for (String segment : segments) {
            path = path.resolve(segment);
        }
        return Optional.of(path.resolve(name));
    }

    private StepResult doReserveVirtualPath() {
        nextState = TargetResolutionState.PROMPT_USER_FOR_DOWNLOAD_PATH;
        if (!item.isInProgress()) {
            return StepResult.CONTINUE;
        }
        return await(delegate.reserveVirtualPath(item, rs.virtualPath(), rs.createTargetDirectory(),
            rs.conflictAction()), this::reserveVirtualPathDone);
    }

    private StepResult reserveVirtualPathDone(PathReservation reservation) {
        logger.debug("Download {} reserved {} ({})", item.id(), reservation.path(), reservation.result());
        if (request.isTransient()) {
            if (!reservation.result().isSuccess()) {
                return cancel(InterruptReason.USER_CANCELED, CancelReason.FAILED_PATH_RESERVATION);
            }
            return StepResult.CONTINUE;
        }
        rs.setVirtualPath(reservation.path());
        switch (reservation.result()) {
            case PATH_NOT_WRITABLE -> rs.setConfirmationReason(ConfirmationReason.PATH_NOT_WRITABLE);
            case NAME_TOO_LONG -> rs.setConfirmationReason(ConfirmationReason.NAME_TOO_LONG);
            case CONFLICT -> rs.setConfirmationReason(ConfirmationReason.TARGET_CONFLICT);
            default -> {
            }
        }
        return StepResult.CONTINUE;
    }

    private StepResult doPromptUserForDownloadPath() {
        nextState = TargetResolutionState.DETERMINE_LOCAL_PATH;
        if (!item.isInProgress()) {
            return StepResult.CONTINUE;
        }
        // a path confirmed in the dialog that reserved cleanly needs no second prompt
        if (checkingDialogConfirmedPath && (rs.confirmationReason() == ConfirmationReason.NONE
            || rs.confirmationReason() == ConfirmationReason.PREFERENCE)) {
            checkingDialogConfirmedPath = false;
            return StepResult.CONTINUE;
        }
        if (rs.confirmationReason() == ConfirmationReason.NONE) {
            return StepResult.CONTINUE;
        }
        return await(delegate.requestConfirmation(item, rs.virtualPath(), rs.confirmationReason()),
            this::requestConfirmationDone);
    }

    private StepResult requestConfirmationDone(ConfirmationOutcome outcome) {
        checkingDialogConfirmedPath = false;
        if (outcome.result() == ConfirmationResult.CANCELED) {
            return cancel(InterruptReason.USER_CANCELED, CancelReason.TARGET_CONFIRMATION_RESULT);
        }
        // without a prompt the user has not consented to this path
        if (outcome.result() == ConfirmationResult.CONTINUE_WITHOUT_CONFIRMATION) {
            rs.setConfirmationReason(ConfirmationReason.NONE);
        }
        rs.setVirtualPath(outcome.selectedPath());
        if (outcome.result() == ConfirmationResult.CONFIRMED_WITH_DIALOG) {
            // reserve the dialog's choice before using it
            checkingDialogConfirmedPath = true;
            if (rs.confirmationReason() != ConfirmationReason.PREFERENCE) {
                rs.setConfirmationReason(ConfirmationReason.NONE);
            }
            nextState = TargetResolutionState.RESERVE_VIRTUAL_PATH;
        }
        env.prefs().setSaveFilePath(rs.virtualPath().getParent());
        return StepResult.CONTINUE;
    }

    private StepResult doDetermineLocalPath() {
        nextState = TargetResolutionState.DETERMINE_MIME_TYPE;
        return await(delegate.determineLocalPath(item, rs.virtualPath()), result -> {
            if (result.isEmpty()) {
                return cancel(InterruptReason.FILE_FAILED, CancelReason.EMPTY_LOCAL_PATH);
            }
            rs.setLocalPath(result.localPath());
            return StepResult.CONTINUE;
        });
    }

    private StepResult doDetermineMimeType() {
        nextState = TargetResolutionState.DETERMINE_IF_HANDLED_SAFELY_BY_BROWSER;
        if (!rs.virtualPath().equals(rs.localPath())) {
            return StepResult.CONTINUE;
        }
        return await(delegate.getFileMimeType(rs.localPath()), mimeType -> {
            rs.setMimeType(mimeType);
            return StepResult.CONTINUE;
        });
    }

    private StepResult doDetermineIfHandledSafely() {
        nextState = TargetResolutionState.CHECK_DOWNLOAD_URL;
        if (rs.mimeType().isEmpty()) {
            return StepResult.CONTINUE;
        }
        return await(delegate.isHandledSafelyByBrowser(item, rs.localPath(), rs.mimeType()), handledSafely -> {
            rs.setFiletypeHandledSafely(Boolean.TRUE.equals(handledSafely));
            return StepResult.CONTINUE;
        });
    }

    private StepResult doCheckDownloadUrl() {
        nextState = TargetResolutionState.CHECK_VISITED_REFERRER_BEFORE;
        if (rs.dangerType() == DangerType.USER_VALIDATED) {
            return StepResult.CONTINUE;
        }
        return await(delegate.checkDownloadUrl(item, rs.virtualPath()), dangerType -> {
            rs.setDangerType(Objects.requireNonNull(dangerType, "danger type"));
            return StepResult.CONTINUE;
        });
    }

    private StepResult doCheckVisitedReferrerBefore() {
        nextState = TargetResolutionState.DETERMINE_INTERMEDIATE_PATH;
        if (!rs.dangerType().dependsOnFileType()) {
            return StepResult.CONTINUE;
        }
        // assume no prior visits first; only a gesture-dependent level needs history
        rs.setDangerLevel(dangerLevel(ReferrerVisits.NO_VISITS_TO_REFERRER));
        if (rs.dangerLevel() == DangerLevel.NOT_DANGEROUS) {
            return StepResult.CONTINUE;
        }
        Optional<URI> referrer = request.referrerUrl().filter(TargetDeterminer::isValidReferrer);
        if (rs.dangerLevel() == DangerLevel.ALLOW_ON_USER_GESTURE && delegate.hasVisitHistory()
            && referrer.isPresent()) {
            return await(delegate.visibleVisitCountToHost(referrer.get()), visits -> {
                rs.setDangerLevel(dangerLevel(ReferrerVisits.fromHistory(visits, env.clock())));
                markDangerousFileIfNeeded();
                return StepResult.CONTINUE;
            });
        }
        markDangerousFileIfNeeded();
        return StepResult.CONTINUE;
    }

    private void markDangerousFileIfNeeded() {
        if (rs.dangerLevel() != DangerLevel.NOT_DANGEROUS && rs.dangerType() == DangerType.NOT_DANGEROUS) {
            rs.setDangerType(DangerType.DANGEROUS_FILE);
        }
    }

    private StepResult doDetermineIntermediatePath() {
        nextState = TargetResolutionState.NONE;
        IntermediatePaths.Choice choice = new IntermediatePaths.Choice(
            rs.virtualPath(),
            rs.localPath(),
            rs.dangerType(),
            request.forcedPath().isPresent(),
            request.isTransient(),
            isResumption,
            item.fullPath(),
            env.prefs().settings().unconfirmedPrefix());
        rs.setIntermediatePath(IntermediatePaths.choose(choice, env.unconfirmedNumbers()));
        return StepResult.COMPLETE;
    }

    private DangerLevel dangerLevel(ReferrerVisits visits) {
        boolean userApprovedPath = hasPromptedForPath
            || rs.confirmationReason() != ConfirmationReason.NONE
            || (request.forcedPath().isPresent() && request.source() != DownloadSource.DRAG_AND_DROP);
        boolean autoOpenWithGesture = request.hasUserGesture() && env.prefs().isAutoOpenEnabled(rs.virtualPath());
        return env.dangerClassifier().classify(new DangerClassifier.Query(
            fileName(rs.virtualPath()),
            userApprovedPath,
            autoOpenWithGesture,
            request.hasTransition(PageTransition.FROM_ADDRESS_BAR),
            request.hasUserGesture(),
            visits));
    }

    /// Registers the next collaborator answer as the only one this determiner accepts, then
    /// issues the call. The answer may arrive before this method returns.
    private <T> StepResult await(CompletionStage<T> stage, Function<T, StepResult> handler) {
        PendingStep<T> step = new PendingStep<>(this, currentState, handler);
        pending = step;
        logger.debug("Download {} suspended in {}", item.id(), currentState);
        env.observer().onSuspended(currentState);
        stage.whenCompleteAsync(step, env.sequence());
        return StepResult.SUSPEND;
    }

    <T> void resume(PendingStep<T> step, T value, Throwable error) {
        if (finished) {
            logger.debug("Dropping {} answer for download {}; resolution already finished", step.state(),
                item.id());
            return;
        }
        if (pending != step) {
            throw new IllegalStateException("Answer for " + step.state() + " of download " + item.id()
                + " arrived while " + (pending == null ? "nothing" : pending.state()) + " is awaited");
        }
        pending = null;
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause() : error;
            logger.warn("Collaborator failed in {} for download {}: {}", step.state(), item.id(),
                cause.toString(), cause);
            finish(InterruptReason.FILE_FAILED, CancelReason.COLLABORATOR_FAILURE);
            return;
        }
        if (value == null) {
            logger.warn("Collaborator answered nothing in {} for download {}", step.state(), item.id());
            finish(InterruptReason.FILE_FAILED, CancelReason.COLLABORATOR_FAILURE);
            return;
        }
        logger.debug("Download {} resumed after {}", item.id(), step.state());
        guarded(step.state(), () -> {
            if (step.handle(value) == StepResult.CONTINUE) {
                doLoop();
            }
        });
    }

    /// Runs state work so that a failure in it ends the resolution instead of escaping
    /// into the executor.
    private void guarded(TargetResolutionState state, Runnable work) {
        try {
            work.run();
        } catch (RuntimeException e) {
            logger.error("Target resolution of download {} failed in {}: {}", item.id(),
                currentState == TargetResolutionState.NONE ? state : currentState, e.toString(), e);
            if (!finished) {
                finish(InterruptReason.FILE_FAILED, CancelReason.COLLABORATOR_FAILURE);
            }
        }
    }

    private void onDownloadDestroyed() {
        if (finished) {
            return;
        }
        logger.debug("Download {} destroyed while {} was pending", item.id(),
            pending == null ? nextState : pending.state());
        finish(InterruptReason.USER_CANCELED, CancelReason.DOWNLOAD_DESTROYED);
    }

    private StepResult cancel(InterruptReason reason, CancelReason cancelReason) {
        finish(reason, cancelReason);
        return StepResult.COMPLETE;
    }

    private void finish(InterruptReason reason, CancelReason cancelReason) {
        finished = true;
        pending = null;
        nextState = TargetResolutionState.NONE;
        item.removeObserver(destructionObserver);

        TargetDisposition disposition = hasPromptedForPath || rs.confirmationReason() != ConfirmationReason.NONE
            ? TargetDisposition.PROMPT : TargetDisposition.OVERWRITE;
        TargetInfo info = new TargetInfo(
            rs.localPath(),
            rs.intermediatePath(),
            rs.mimeType(),
            rs.filetypeHandledSafely(),
            disposition,
            rs.dangerType(),
            reason,
            rs.insecureDownloadStatus());
        TargetResolution resolution = new TargetResolution(info, rs.dangerLevel());

        if (cancelReason != null) {
            logger.info("Target resolution of download {} ended with {} ({})", item.id(), reason, cancelReason);
        } else {
            logger.debug("Download {} resolved: virtual={} local={} intermediate={} confirmation={} danger={}/{}",
                item.id(), rs.virtualPath(), rs.localPath(), rs.intermediatePath(), rs.confirmationReason(),
                rs.dangerType(), rs.dangerLevel());
        }
        env.observer().onCompleted(rs.snapshot(TargetResolutionState.NONE), resolution);
        env.sequence().execute(() -> callback.accept(resolution));
    }

    private static boolean isFileUrl(URI url) {
        return "file".equalsIgnoreCase(url.getScheme());
    }

    private static boolean isValidReferrer(URI referrer) {
        return referrer.getScheme() != null && referrer.getHost() != null && !referrer.getHost().isEmpty();
    }

    private static String fileName(Path path) {
        Path name = path == null ? null : path.getFileName();
        return name == null ? "" : name.toString();
    }
}
