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

/// A "save as" file chooser.
@FunctionalInterface
public interface FilePicker {

    /// @param item the download being saved
    /// @param suggestedPath the preselected path
    /// @param reason why the picker is shown
    /// @return the chosen absolute path, or empty if the user dismissed the picker
    CompletionStage<Optional<Path>> pick(DownloadItem item, Path suggestedPath, ConfirmationReason reason);
}
