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
import io.nosqlbench.downloads.target.ConfirmationOutcome;
import io.nosqlbench.downloads.target.ConfirmationReason;
import io.nosqlbench.downloads.target.ConflictAction;

import java.nio.file.Path;
import java.util.concurrent.CompletionStage;

/// Platform specific way of asking the user where a download should go.
public interface ConfirmationStrategy {

    /// @return the conflict handling for generated paths on this platform
    ConflictAction defaultConflictAction();

    /// Asks the user to confirm or change a download's target.
    /// @param item the download
    /// @param suggestedPath the path proposed to the user
    /// @param reason why confirmation is needed; never [ConfirmationReason#NONE]
    /// @return the user's answer
    CompletionStage<ConfirmationOutcome> requestConfirmation(DownloadItem item, Path suggestedPath,
                                                             ConfirmationReason reason);
}
