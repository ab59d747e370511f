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
import io.nosqlbench.downloads.item.InsecureDownloadStatus;

import java.nio.file.Path;

/// Immutable copy of a determiner's [ResolutionState] at one point in time.
///
/// @param state the state about to run, or [TargetResolutionState#NONE] once finished
/// @param virtualPath the candidate path, or null before it is generated
/// @param localPath the substituted local path, or null
/// @param intermediatePath the intermediate path, or null before the final step
/// @param mimeType the sniffed MIME type, or ""
/// @param dangerType the accumulated danger type
/// @param dangerLevel the accumulated file type danger level
/// @param confirmationReason why the user must confirm the path
/// @param conflictAction how path conflicts are handled
/// @param shouldNotifyCollaborators whether the filename hooks will run
/// @param createTargetDirectory whether the reservation creates the directory
/// @param filetypeHandledSafely whether the browser renders the type itself
/// @param insecureDownloadStatus outcome of the insecure transport classification
public record ResolutionSnapshot(
    TargetResolutionState state,
    Path virtualPath,
    Path localPath,
    Path intermediatePath,
    String mimeType,
    DangerType dangerType,
    DangerLevel dangerLevel,
    ConfirmationReason confirmationReason,
    ConflictAction conflictAction,
    boolean shouldNotifyCollaborators,
    boolean createTargetDirectory,
    boolean filetypeHandledSafely,
    InsecureDownloadStatus insecureDownloadStatus
) {
}
