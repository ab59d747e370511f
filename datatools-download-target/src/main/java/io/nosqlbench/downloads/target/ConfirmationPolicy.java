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

import io.nosqlbench.downloads.config.DownloadPrefs;
import io.nosqlbench.downloads.item.DownloadRequest;
import io.nosqlbench.downloads.item.TargetDisposition;

import java.nio.file.Path;

/// Decides whether the user has to confirm a download's target before it is written.
public final class ConfirmationPolicy {

    private ConfirmationPolicy() {
    }

    /// The first matching rule wins:
    ///
    /// - transient downloads are never confirmed
    /// - resumed downloads are confirmed only when the previous attempt failed on the file system
    /// - forced paths are not confirmed
    /// - a managed download directory is not confirmed unless a DLP rule blocks it
    /// - an explicit "save as" request is confirmed
    /// - automatically opened types are not confirmed
    /// - the "ask where to save" preference is honoured
    /// - otherwise confirm only when a DLP rule blocks the download directory
    ///
    /// @param request the download
    /// @param candidate the candidate target path
    /// @param isResumption whether the download resumes an interrupted attempt
    /// @param prefs the download preferences
    /// @return the reason the user must confirm, or [ConfirmationReason#NONE]
    public static ConfirmationReason needsConfirmation(DownloadRequest request, Path candidate,
                                                       boolean isResumption, DownloadPrefs prefs) {
        if (request.isTransient()) {
            return ConfirmationReason.NONE;
        }
        if (isResumption) {
            return switch (request.lastInterruptReason()) {
                case FILE_ACCESS_DENIED -> ConfirmationReason.PATH_NOT_WRITABLE;
                case FILE_TOO_LARGE, FILE_NO_SPACE -> ConfirmationReason.TARGET_NO_SPACE;
                default -> ConfirmationReason.NONE;
            };
        }
        if (request.forcedPath().isPresent()) {
            return ConfirmationReason.NONE;
        }
        boolean dlpBlocked = prefs.isDownloadDlpBlocked(prefs.downloadPath());
        if (prefs.isDownloadPathManaged() && !dlpBlocked) {
            return ConfirmationReason.NONE;
        }
        if (request.targetDisposition() == TargetDisposition.PROMPT) {
            return ConfirmationReason.SAVE_AS;
        }
        if (prefs.isAutoOpenEnabled(candidate)) {
            return ConfirmationReason.NONE;
        }
        if (prefs.promptForDownload()) {
            return ConfirmationReason.PREFERENCE;
        }
        return dlpBlocked ? ConfirmationReason.DLP_BLOCKED : ConfirmationReason.NONE;
    }
}
