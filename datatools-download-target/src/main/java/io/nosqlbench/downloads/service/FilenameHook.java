package io.nosqlbench.downloads.service;

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
import io.nosqlbench.downloads.target.FilenameSuggestion;

import java.nio.file.Path;
import java.util.Optional;

/// An external party, such as a browser extension, that may rename downloads.
@FunctionalInterface
public interface FilenameHook {

    /// @param item the download
    /// @param generatedPath the path generated for it
    /// @return a suggestion, or empty to leave the download alone
    Optional<FilenameSuggestion> suggest(DownloadItem item, Path generatedPath);
}
