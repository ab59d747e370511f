package io.nosqlbench.downloads.item;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/// A live download, owned by the download engine.
///
/// The item wraps its immutable [DownloadRequest] with the mutable state the engine and
/// target resolution share: the lifecycle [DownloadState], the current [DangerType], and
/// the target and intermediate paths once they are known. Interested parties register a
/// [DownloadItemObserver]; [#destroy()] notifies them exactly once.
public class DownloadItem {
    private static final Logger logger = LogManager.getLogger(DownloadItem.class);

    private final long id;
    private final DownloadRequest request;
    private final List<DownloadItemObserver> observers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean destroyed = new AtomicBoolean(false);

    private volatile DownloadState state = DownloadState.IN_PROGRESS;
    private volatile DangerType dangerType;
    private volatile Path targetPath;
    private volatile Path fullPath;

    public DownloadItem(long id, DownloadRequest request) {
        this.id = id;
        this.request = Objects.requireNonNull(request, "request");
        this.dangerType = request.dangerType();
        this.targetPath = request.targetPath().orElse(null);
        this.fullPath = request.fullPath().orElse(null);
    }

    public long id() {
        return id;
    }

    public DownloadRequest request() {
        return request;
    }

    public DownloadState state() {
        return state;
    }

    public boolean isInProgress() {
        return state == DownloadState.IN_PROGRESS;
    }

    public DangerType dangerType() {
        return dangerType;
    }

    public void setDangerType(DangerType dangerType) {
        this.dangerType = Objects.requireNonNull(dangerType);
    }

    public Optional<Path> targetPath() {
        return Optional.ofNullable(targetPath);
    }

    /// @return the file bytes are currently written to
    public Optional<Path> fullPath() {
        return Optional.ofNullable(fullPath);
    }

    /// Records the outcome of target resolution on the item.
    /// @param target the final target path
    /// @param intermediate the path bytes are written to until completion
    public void setPaths(Path target, Path intermediate) {
        this.targetPath = target;
        this.fullPath = intermediate;
        notifyUpdated();
    }

    /// Moves the item to a new state and notifies observers.
    /// @param newState the state to enter
    public void setState(DownloadState newState) {
        if (destroyed.get()) {
            throw new IllegalStateException("download " + id + " has been destroyed");
        }
        this.state = Objects.requireNonNull(newState);
        notifyUpdated();
    }

    public boolean isDestroyed() {
        return destroyed.get();
    }

    public void addObserver(DownloadItemObserver observer) {
        observers.add(Objects.requireNonNull(observer));
    }

    public void removeObserver(DownloadItemObserver observer) {
        observers.remove(observer);
    }

    /// Destroys the item. Observers receive [DownloadItemObserver#onDownloadDestroyed]
    /// once; later calls do nothing.
    public void destroy() {
        if (!destroyed.compareAndSet(false, true)) {
            return;
        }
        logger.debug("Destroying download {}", id);
        for (DownloadItemObserver observer : observers) {
            observer.onDownloadDestroyed(this);
        }
        observers.clear();
    }

    private void notifyUpdated() {
        for (DownloadItemObserver observer : observers) {
            observer.onDownloadUpdated(this);
        }
    }

    @Override
    public String toString() {
        return "DownloadItem{id=" + id + ", state=" + state + ", url=" + request.url() + '}';
    }
}
