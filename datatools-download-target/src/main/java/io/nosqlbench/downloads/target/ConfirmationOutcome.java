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

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/// The user's answer to a confirmation request, with the path they settled on.
///
/// @param result the kind of answer
/// @param selectedPath the chosen path; null only when canceled
public record ConfirmationOutcome(ConfirmationResult result, Path selectedPath) {

    public ConfirmationOutcome {
        Objects.requireNonNull(result, "result");
        if (result != ConfirmationResult.CANCELED && selectedPath == null) {
            throw new IllegalArgumentException(result + " requires a selected path");
        }
    }

    public static ConfirmationOutcome confirmed(Path path) {
        return new ConfirmationOutcome(ConfirmationResult.CONFIRMED, path);
    }

    public static ConfirmationOutcome confirmedWithDialog(Path path) {
        return new ConfirmationOutcome(ConfirmationResult.CONFIRMED_WITH_DIALOG, path);
    }

    public static ConfirmationOutcome continueWithoutConfirmation(Path path) {
        return new ConfirmationOutcome(ConfirmationResult.CONTINUE_WITHOUT_CONFIRMATION, path);
    }

    public static ConfirmationOutcome canceled() {
        return new ConfirmationOutcome(ConfirmationResult.CANCELED, null);
    }

    public Optional<Path> path() {
        return Optional.ofNullable(selectedPath);
    }
}
