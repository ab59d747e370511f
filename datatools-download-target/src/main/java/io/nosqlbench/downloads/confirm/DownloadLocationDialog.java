package io.nosqlbench.downloads.confirm;

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

import io.nosqlbench.downloads.item.DownloadItem;
import io.nosqlbench.downloads.target.ConfirmationReason;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/// The mobile download location dialog, which explains why a location is needed and lets
/// the user edit the suggested one.
@FunctionalInterface
public interface DownloadLocationDialog {

    enum Type {
        /// Plain "download to" prompt
        DEFAULT,
        /// The location has no space left
        LOCATION_FULL,
        /// The location is missing or read-only
        LOCATION_NOT_FOUND,
        /// A file with this name already exists
        NAME_CONFLICT,
        /// The name is too long for the location
        NAME_TOO_LONG;

        public static Type forReason(ConfirmationReason reason) {
            return switch (reason) {
                case TARGET_NO_SPACE -> LOCATION_FULL;
                case PATH_NOT_WRITABLE -> LOCATION_NOT_FOUND;
                case NAME_TOO_LONG -> NAME_TOO_LONG;
                case TARGET_CONFLICT -> NAME_CONFLICT;
                default -> DEFAULT;
            };
        }
    }

    /// @param item the download
    /// @param type which message the dialog shows
    /// @param suggestedPath the preselected path
    /// @return the accepted path, or empty if the user canceled
    CompletionStage<Optional<Path>> show(DownloadItem item, Type type, Path suggestedPath);
}
