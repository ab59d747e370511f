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

/// Lifecycle state of a download as seen by the download engine.
///
/// Target resolution only prompts, notifies filename hooks and reserves paths while a
/// download is [#IN_PROGRESS]; an interrupted download gets its prompt once it resumes.
public enum DownloadState {
    /// Bytes are arriving, or are about to
    IN_PROGRESS,
    /// Interrupted, possibly resumable later
    INTERRUPTED,
    /// All bytes written and the file renamed to its target
    COMPLETE,
    /// Canceled by the user or the engine
    CANCELLED
}
