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
import io.nosqlbench.downloads.item.InsecureDownloadStatus;

import java.net.URI;
import java.nio.file.Path;
import java.util.concurrent.CompletionStage;

/// Collaborators consulted by a [TargetDeterminer].
///
/// Every call is one-shot. Implementations may complete the returned stage immediately or
/// at any later time and on any thread; the determiner moves the continuation back onto its
/// own sequence. A stage completed exceptionally ends the resolution with a file failure.
public interface TargetDeterminerDelegate {

    /// Classifies whether the download is delivered over an insecure transport.
    CompletionStage<InsecureDownloadStatus> getInsecureDownloadStatus(DownloadItem item, Path virtualPath);

    /// Lets external hooks replace the generated file name.
    CompletionStage<FilenameSuggestion> notifyCollaborators(DownloadItem item, Path virtualPath);

    /// Reserves a path for the download so concurrent downloads do not collide.
    /// @param createDirectory whether the parent directory may be created
    /// @param conflictAction how an existing file at the path is handled
    CompletionStage<PathReservation> reserveVirtualPath(DownloadItem item, Path virtualPath,
                                                        boolean createDirectory, ConflictAction conflictAction);

    /// Asks the user to confirm, or choose, the target path.
    CompletionStage<ConfirmationOutcome> requestConfirmation(DownloadItem item, Path suggestedPath,
                                                             ConfirmationReason reason);

    /// Translates a virtual path into a local file path.
    CompletionStage<LocalPathResult> determineLocalPath(DownloadItem item, Path virtualPath);

    /// Sniffs the MIME type of a local path. May block, so implementations run it off the
    /// determiner's sequence.
    CompletionStage<String> getFileMimeType(Path localPath);

    /// @return whether the browser would render content of this type itself
    CompletionStage<Boolean> isHandledSafelyByBrowser(DownloadItem item, Path localPath, String mimeType);

    /// Checks the reputation of the download URL.
    CompletionStage<DangerType> checkDownloadUrl(DownloadItem item, Path virtualPath);

    /// @return true if [#visibleVisitCountToHost] can answer at all
    default boolean hasVisitHistory() {
        return true;
    }

    /// Looks up prior visible visits to the host of the referrer.
    CompletionStage<VisitCountResult> visibleVisitCountToHost(URI referrer);
}
