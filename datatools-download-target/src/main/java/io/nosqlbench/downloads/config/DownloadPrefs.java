package io.nosqlbench.downloads.config;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.Objects;

/// Live download preferences.
///
/// The static part comes from [DownloadTargetSettings]; the one value that changes while
/// the process runs is the directory the user last picked in a save prompt, which becomes
/// the starting directory of the next prompt.
public class DownloadPrefs {
    private static final Logger logger = LogManager.getLogger(DownloadPrefs.class);

    private final DownloadTargetSettings settings;
    private volatile Path saveFilePath;

    public DownloadPrefs(DownloadTargetSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.saveFilePath = settings.saveFileDirectory();
    }

    public DownloadTargetSettings settings() {
        return settings;
    }

    /// @return the default download directory
    public Path downloadPath() {
        return settings.downloadDirectory();
    }

    /// @return the directory last chosen in a save prompt
    public Path saveFilePath() {
        return saveFilePath;
    }

    public void setSaveFilePath(Path directory) {
        if (directory == null || !directory.isAbsolute()) {
            logger.debug("Ignoring non-absolute save directory {}", directory);
            return;
        }
        this.saveFilePath = directory;
    }

    public boolean promptForDownload() {
        return settings.promptForDownload();
    }

    public boolean isDownloadPathManaged() {
        return settings.downloadPathManaged();
    }

    /// @param path a target path
    /// @return true if files with the path's extension are opened automatically
    public boolean isAutoOpenEnabled(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && settings.isAutoOpen(name.substring(dot + 1));
    }

    /// @param directory a candidate download directory
    /// @return true if a data leak prevention rule requires a prompt before saving there
    public boolean isDownloadDlpBlocked(Path directory) {
        Path normalized = directory.toAbsolutePath().normalize();
        for (Path blocked : settings.dlpBlockedDirectories()) {
            if (normalized.startsWith(blocked)) {
                return true;
            }
        }
        return false;
    }
}
