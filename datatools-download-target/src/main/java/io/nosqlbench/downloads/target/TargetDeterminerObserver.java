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

/// Receives progress notifications from a [TargetDeterminer]. Calls arrive on the
/// determiner's sequence.
public interface TargetDeterminerObserver {

    TargetDeterminerObserver NONE = new TargetDeterminerObserver() {
    };

    /// Called just before a state runs.
    /// @param state the state being entered
    /// @param snapshot the resolution state on entry
    default void onStateEntered(TargetResolutionState state, ResolutionSnapshot snapshot) {
    }

    /// Called when a state suspends on a collaborator.
    /// @param state the state that issued the call
    default void onSuspended(TargetResolutionState state) {
    }

    /// Called once, when the outcome has been determined and is about to be delivered.
    /// @param snapshot the final resolution state
    /// @param resolution the outcome
    default void onCompleted(ResolutionSnapshot snapshot, TargetResolution resolution) {
    }
}
