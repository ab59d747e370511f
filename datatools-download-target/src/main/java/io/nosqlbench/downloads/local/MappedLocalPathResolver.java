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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/// Resolves paths under configured virtual roots (for example a synced drive) to a local
/// cache directory, creating the cache directories as needed. Paths outside every root
/// are already local.
public class MappedLocalPathResolver implements LocalPathResolver {
    private static final Logger logger = LogManager.getLogger(MappedLocalPathResolver.class);

    private final Map<Path, Path> roots = new LinkedHashMap<>();

    /// @param roots virtual root to local cache directory
    public MappedLocalPathResolver(Map<Path, Path> roots) {
        roots.forEach((virtual, local) -> this.roots.put(virtual.toAbsolutePath().normalize(),
            local.toAbsolutePath().normalize()));
    }

    @Override
    public LocalPathResult resolve(DownloadItem item, Path virtualPath) {
        Path normalized = virtualPath.normalize();
        for (Map.Entry<Path, Path> root : roots.entrySet()) {
            if (!normalized.startsWith(root.getKey()) || normalized.equals(root.getKey())) {
                continue;
            }
            Path local = root.getValue().resolve(root.getKey().relativize(normalized).toString());
            try {
                Files.createDirectories(local.getParent());
            } catch (IOException e) {
                logger.error("Cannot prepare local cache for {} at {}: {}", virtualPath, local, e.toString());
                return LocalPathResult.failed();
            }
            logger.debug("Download {} virtual path {} is backed by {}", item.id(), virtualPath, local);
            return new LocalPathResult(local, normalized.getFileName().toString());
        }
        return LocalPathResult.of(virtualPath);
    }
}
