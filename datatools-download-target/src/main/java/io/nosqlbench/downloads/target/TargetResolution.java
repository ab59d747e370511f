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

import io.nosqlbench.downloads.item.InterruptReason;

import java.util.Objects;

/// Final outcome of target resolution: the [TargetInfo] for the engine and the file type
/// [DangerLevel], which is kept apart because it only feeds UI decisions.
///
/// @param info the target information
/// @param dangerLevel the file type danger level
public record TargetResolution(TargetInfo info, DangerLevel dangerLevel) {

    public TargetResolution {
        Objects.requireNonNull(info, "info");
        Objects.requireNonNull(dangerLevel, "dangerLevel");
    }

    /// @return true if the download may proceed to its target
    public boolean succeeded() {
        return info.interruptReason() == InterruptReason.NONE;
    }

    /// @return true if the user, or the download's destruction, canceled the download
    public boolean canceled() {
        return info.interruptReason() == InterruptReason.USER_CANCELED;
    }
}
