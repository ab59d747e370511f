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

/// Reason a download was interrupted, or [#NONE].
///
/// Target resolution reports one of these in its outcome; a resumed download also
/// carries the reason it was last interrupted with.
public enum InterruptReason {
    NONE(false),
    FILE_FAILED(true),
    FILE_ACCESS_DENIED(true),
    FILE_NO_SPACE(true),
    FILE_NAME_TOO_LONG(true),
    FILE_TOO_LARGE(true),
    FILE_VIRUS_INFECTED(false),
    FILE_TRANSIENT_ERROR(true),
    FILE_BLOCKED(false),
    FILE_SECURITY_CHECK_FAILED(false),
    NETWORK_FAILED(true),
    NETWORK_TIMEOUT(true),
    NETWORK_DISCONNECTED(true),
    SERVER_FAILED(true),
    USER_CANCELED(false),
    USER_SHUTDOWN(true),
    CRASH(true);

    private final boolean resumable;

    InterruptReason(boolean resumable) {
        this.resumable = resumable;
    }

    /// @return true if a download interrupted for this reason may be resumed
    public boolean isResumable() {
        return resumable;
    }
}
