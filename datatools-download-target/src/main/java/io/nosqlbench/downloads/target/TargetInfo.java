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
import io.nosqlbench.downloads.item.InterruptReason;
import io.nosqlbench.downloads.item.TargetDisposition;

import java.nio.file.Path;
import java.util.Optional;

/// Everything the download engine needs to write a download to its destination.
///
/// On a canceled or failed resolution [#interruptReason()] is not [InterruptReason#NONE]
/// and the paths reflect whatever had been determined when the pipeline stopped; they may
/// be null.
///
/// @param targetPath final path of the completed download
/// @param intermediatePath path written while bytes are arriving
/// @param mimeType MIME type sniffed from the file, or ""
/// @param isFiletypeHandledSafely true if the browser can render the type itself
/// @param targetDisposition whether the user chose, or confirmed, the path
/// @param dangerType the security verdict
/// @param interruptReason [InterruptReason#NONE] on success
/// @param insecureDownloadStatus outcome of the insecure transport classification
public record TargetInfo(
    Path targetPath,
    Path intermediatePath,
    String mimeType,
    boolean isFiletypeHandledSafely,
    TargetDisposition targetDisposition,
    DangerType dangerType,
    InterruptReason interruptReason,
    InsecureDownloadStatus insecureDownloadStatus
) {

    public Optional<Path> target() {
        return Optional.ofNullable(targetPath);
    }

    public Optional<Path> intermediate() {
        return Optional.ofNullable(intermediatePath);
    }

    /// A copy interrupted as blocked by policy. A dangerous type would take precedence over
    /// the block in the UI, so the danger type is cleared.
    /// @return the blocked copy
    public TargetInfo blocked() {
        return new TargetInfo(targetPath, intermediatePath, mimeType, isFiletypeHandledSafely, targetDisposition,
            DangerType.NOT_DANGEROUS, InterruptReason.FILE_BLOCKED, insecureDownloadStatus);
    }
}
