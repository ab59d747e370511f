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

/// Why target resolution ended early. Logged with the outcome.
public enum CancelReason {
    /// A transient download arrived without any usable path
    NO_VALID_PATH,
    /// The insecure download classification asked for a silent block
    INSECURE_DOWNLOAD,
    /// Reserving the path of a transient download failed
    FAILED_PATH_RESERVATION,
    /// The user declined the location prompt
    TARGET_CONFIRMATION_RESULT,
    /// No local path could be substituted for the virtual path
    EMPTY_LOCAL_PATH,
    /// The download went away while its target was being determined
    DOWNLOAD_DESTROYED,
    /// A collaborator failed with an exception
    COLLABORATOR_FAILURE
}
