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
import java.util.Objects;

/// Mutable working state of a single [TargetDeterminer].
///
/// Only the owning determiner writes to it, and only from its sequence. The setters
/// enforce the path invariants: a virtual path is always absolute, and the intermediate
/// path is assigned once.
final class ResolutionState {

    private Path virtualPath;
    private Path localPath;
    private Path intermediatePath;
    private String mimeType = "";
    private DangerType dangerType;
    private DangerLevel dangerLevel = DangerLevel.NOT_DANGEROUS;
    private ConfirmationReason confirmationReason = ConfirmationReason.NONE;
    private ConflictAction conflictAction;
    private boolean shouldNotifyCollaborators;
    private boolean createTargetDirectory;
    private boolean filetypeHandledSafely;
    private InsecureDownloadStatus insecureDownloadStatus = InsecureDownloadStatus.UNKNOWN;

    ResolutionState(DangerType dangerType, ConflictAction conflictAction) {
        this.dangerType = Objects.requireNonNull(dangerType, "dangerType");
        this.conflictAction = Objects.requireNonNull(conflictAction, "conflictAction");
    }

    Path virtualPath() {
        return virtualPath;
    }

    void setVirtualPath(Path path) {
        if (path == null || !path.isAbsolute()) {
            throw new IllegalStateException("virtual path must be absolute: " + path);
        }
        this.virtualPath = path.normalize();
    }

    Path localPath() {
        return localPath;
    }

    void setLocalPath(Path localPath) {
        this.localPath = localPath;
    }

    Path intermediatePath() {
        return intermediatePath;
    }

    void setIntermediatePath(Path path) {
        if (intermediatePath != null) {
            throw new IllegalStateException("intermediate path already set to " + intermediatePath);
        }
        this.intermediatePath = Objects.requireNonNull(path, "intermediate path");
    }

    String mimeType() {
        return mimeType;
    }

    void setMimeType(String mimeType) {
        this.mimeType = mimeType == null ? "" : mimeType;
    }

    DangerType dangerType() {
        return dangerType;
    }

    void setDangerType(DangerType dangerType) {
        this.dangerType = Objects.requireNonNull(dangerType);
    }

    DangerLevel dangerLevel() {
        return dangerLevel;
    }

    void setDangerLevel(DangerLevel dangerLevel) {
        this.dangerLevel = Objects.requireNonNull(dangerLevel);
    }

    ConfirmationReason confirmationReason() {
        return confirmationReason;
    }

    void setConfirmationReason(ConfirmationReason reason) {
        this.confirmationReason = Objects.requireNonNull(reason);
    }

    ConflictAction conflictAction() {
        return conflictAction;
    }

    void setConflictAction(ConflictAction conflictAction) {
        this.conflictAction = Objects.requireNonNull(conflictAction);
    }

    boolean shouldNotifyCollaborators() {
        return shouldNotifyCollaborators;
    }

    void setShouldNotifyCollaborators(boolean notify) {
        this.shouldNotifyCollaborators = notify;
    }

    boolean createTargetDirectory() {
        return createTargetDirectory;
    }

    void setCreateTargetDirectory(boolean create) {
        this.createTargetDirectory = create;
    }

    boolean filetypeHandledSafely() {
        return filetypeHandledSafely;
    }

    void setFiletypeHandledSafely(boolean handledSafely) {
        this.filetypeHandledSafely = handledSafely;
    }

    InsecureDownloadStatus insecureDownloadStatus() {
        return insecureDownloadStatus;
    }

    void setInsecureDownloadStatus(InsecureDownloadStatus status) {
        this.insecureDownloadStatus = Objects.requireNonNull(status);
    }

    ResolutionSnapshot snapshot(TargetResolutionState state) {
        return new ResolutionSnapshot(state, virtualPath, localPath, intermediatePath, mimeType, dangerType,
            dangerLevel, confirmationReason, conflictAction, shouldNotifyCollaborators, createTargetDirectory,
            filetypeHandledSafely, insecureDownloadStatus);
    }
}
