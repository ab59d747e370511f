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

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/// The one outstanding collaborator call of a [TargetDeterminer].
///
/// A determiner holds at most one pending step. Completing it hands the value back to the
/// determiner, which accepts it only while this step is still the one it awaits.
///
/// @param <T> the type of the collaborator's answer
final class PendingStep<T> implements BiConsumer<T, Throwable> {

    private final TargetDeterminer determiner;
    private final TargetResolutionState state;
    private final Function<T, StepResult> handler;

    PendingStep(TargetDeterminer determiner, TargetResolutionState state, Function<T, StepResult> handler) {
        this.determiner = Objects.requireNonNull(determiner);
        this.state = Objects.requireNonNull(state);
        this.handler = Objects.requireNonNull(handler);
    }

    /// @return the state that issued the call
    TargetResolutionState state() {
        return state;
    }

    @Override
    public void accept(T value, Throwable error) {
        determiner.resume(this, value, error);
    }

    void deliver(T value) {
        accept(value, null);
    }

    StepResult handle(T value) {
        return handler.apply(value);
    }

    @Override
    public String toString() {
        return "PendingStep{" + state + "}";
    }
}
