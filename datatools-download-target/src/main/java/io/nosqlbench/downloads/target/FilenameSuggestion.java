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

/// A filename override offered by an external hook (for example a browser extension)
/// when it is notified of a generated target path.
///
/// @param filename relative file name to use instead of the generated one, or "" to keep it
/// @param conflictAction how the hook wants name conflicts handled; [ConflictAction#UNIQUIFY] leaves the current action alone
public record FilenameSuggestion(String filename, ConflictAction conflictAction) {

    public FilenameSuggestion {
        filename = filename == null ? "" : filename;
        Objects.requireNonNull(conflictAction, "conflictAction");
    }

    /// @return a suggestion that changes nothing
    public static FilenameSuggestion none() {
        return new FilenameSuggestion("", ConflictAction.UNIQUIFY);
    }

    public boolean hasFilename() {
        return !filename.isEmpty();
    }
}
