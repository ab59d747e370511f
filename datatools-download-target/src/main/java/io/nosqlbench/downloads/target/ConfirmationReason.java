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

/// Why the user has to confirm, or pick, the location of a download.
public enum ConfirmationReason {
    /// No confirmation needed
    NONE,
    /// The user asked for "Save As"
    SAVE_AS,
    /// The target exists and the conflict could not be resolved automatically
    TARGET_CONFLICT,
    /// The user wants to be asked for every download
    PREFERENCE,
    /// The file name is too long for the target filesystem
    NAME_TOO_LONG,
    /// The target location ran out of space
    TARGET_NO_SPACE,
    /// The target directory cannot be written
    PATH_NOT_WRITABLE,
    /// A data leak prevention rule requires the user to choose
    DLP_BLOCKED
}
