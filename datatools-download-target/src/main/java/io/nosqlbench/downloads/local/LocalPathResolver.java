package io.nosqlbench.downloads.local;

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
import io.nosqlbench.downloads.target.LocalPathResult;

import java.nio.file.Path;

/// Turns a virtual target path into the local file that backs it.
@FunctionalInterface
public interface LocalPathResolver {

    /// Every virtual path is already local.
    LocalPathResolver IDENTITY = (item, virtualPath) -> LocalPathResult.of(virtualPath);

    /// May touch the file system.
    /// @param item the download
    /// @param virtualPath the virtual target
    /// @return the local path, or [LocalPathResult#failed()]
    LocalPathResult resolve(DownloadItem item, Path virtualPath);
}
