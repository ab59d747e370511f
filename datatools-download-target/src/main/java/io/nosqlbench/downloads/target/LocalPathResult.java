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
import java.util.Optional;

/// The local file backing a virtual target path.
///
/// @param localPath the concrete path, or null if no local path could be provided
/// @param displayName the name to show the user for the file
public record LocalPathResult(Path localPath, String displayName) {

    public static LocalPathResult of(Path localPath) {
        Path name = localPath.getFileName();
        return new LocalPathResult(localPath, name == null ? "" : name.toString());
    }

    /// @return a result signalling that substitution failed
    public static LocalPathResult failed() {
        return new LocalPathResult(null, "");
    }

    public Optional<Path> path() {
        return Optional.ofNullable(localPath);
    }

    public boolean isEmpty() {
        return localPath == null;
    }
}
