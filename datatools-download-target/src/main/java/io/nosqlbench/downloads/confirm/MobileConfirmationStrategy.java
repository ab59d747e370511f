package io.nosqlbench.downloads.confirm;

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
import io.nosqlbench.downloads.item.DownloadItem;
import io.nosqlbench.downloads.reservation.DownloadPathReservationTracker;
import io.nosqlbench.downloads.target.ConfirmationOutcome;
import io.nosqlbench.downloads.target.ConfirmationReason;
import io.nosqlbench.downloads.target.ConfirmationResult;
import io.nosqlbench.downloads.target.ConflictAction;
import io.nosqlbench.downloads.target.PathReservation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/// Mobile confirmation: "save as" requests are not prompted again, name conflicts are
/// resolved by picking a unique name, and everything else shows a location dialog that
/// explains the problem.
///
/// Without a dialog (no window to show it in) a conflict continues with its unique name,
/// a preference prompt proceeds, and every other reason cancels. A path picked in the
/// dialog is answered as [ConfirmationResult#CONFIRMED_WITH_DIALOG] so that it is reserved
/// again before use.
public class MobileConfirmationStrategy implements ConfirmationStrategy {
    private static final Logger logger = LogManager.getLogger(MobileConfirmationStrategy.class);

    private final DownloadLocationDialog dialog;
    private final DownloadPrefs prefs;
    private final DownloadPathReservationTracker reservations;
    private final Executor blockingExecutor;

    /// @param dialog the location dialog, or null when none can be shown
    /// @param prefs the download preferences
    /// @param reservations reserves unique names for conflicting downloads
    /// @param blockingExecutor runs reservation file system work
    public MobileConfirmationStrategy(DownloadLocationDialog dialog, DownloadPrefs prefs,
                                      DownloadPathReservationTracker reservations, Executor blockingExecutor) {
        this.dialog = dialog;
        this.prefs = Objects.requireNonNull(prefs, "prefs");
        this.reservations = Objects.requireNonNull(reservations, "reservations");
        this.blockingExecutor = Objects.requireNonNull(blockingExecutor, "blockingExecutor");
    }

    @Override
    public ConflictAction defaultConflictAction() {
        return ConflictAction.PROMPT;
    }

    @Override
    public CompletionStage<ConfirmationOutcome> requestConfirmation(DownloadItem item, Path suggestedPath,
                                                                    ConfirmationReason reason) {
        if (reason == ConfirmationReason.SAVE_AS) {
            return CompletableFuture.completedFuture(ConfirmationOutcome.continueWithoutConfirmation(suggestedPath));
        }
        if (reason == ConfirmationReason.TARGET_CONFLICT) {
            return reservations.reserveAsync(item, suggestedPath, true, ConflictAction.UNIQUIFY, blockingExecutor)
                .thenCompose(reservation -> uniqueNameReserved(item, reservation));
        }
        if (dialog == null) {
            if (reason == ConfirmationReason.PREFERENCE) {
                return CompletableFuture.completedFuture(
                    ConfirmationOutcome.continueWithoutConfirmation(suggestedPath));
            }
            logger.info("Canceling download {}: no dialog to resolve {}", item.id(), reason);
            return CompletableFuture.completedFuture(ConfirmationOutcome.canceled());
        }
        return showDialog(item, DownloadLocationDialog.Type.forReason(reason), suggestedPath);
    }

    private CompletionStage<ConfirmationOutcome> uniqueNameReserved(DownloadItem item, PathReservation reservation) {
        if (!reservation.result().isSuccess()) {
            logger.info("No unique name for download {} at {}", item.id(), reservation.path());
            return CompletableFuture.completedFuture(ConfirmationOutcome.canceled());
        }
        if (prefs.promptForDownload()) {
            if (dialog != null) {
                return showDialog(item, DownloadLocationDialog.Type.NAME_CONFLICT, reservation.path());
            }
            logger.info("No dialog to confirm {} for download {}; using it as is", reservation.path(), item.id());
        }
        return CompletableFuture.completedFuture(
            ConfirmationOutcome.continueWithoutConfirmation(reservation.path()));
    }

    private CompletionStage<ConfirmationOutcome> showDialog(DownloadItem item, DownloadLocationDialog.Type type,
                                                            Path suggestedPath) {
        return dialog.show(item, type, suggestedPath)
            .thenApply(chosen -> chosen.map(ConfirmationOutcome::confirmedWithDialog)
                .orElseGet(ConfirmationOutcome::canceled));
    }
}
