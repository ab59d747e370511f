package io.nosqlbench.downloads.safety;

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

import io.nosqlbench.downloads.config.DownloadTargetSettings;
import io.nosqlbench.downloads.item.DangerType;
import io.nosqlbench.downloads.item.DownloadRequest;
import io.nosqlbench.downloads.target.DangerLevel;
import io.nosqlbench.downloads.target.TargetResolution;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Applies the administrator's [DownloadRestriction] to resolved downloads.
public class DownloadBlockingPolicy {
    private static final Logger logger = LogManager.getLogger(DownloadBlockingPolicy.class);

    private final DownloadTargetSettings settings;

    public DownloadBlockingPolicy(DownloadTargetSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /// @param request the download
    /// @param dangerType the resolved danger type
    /// @param dangerLevel the resolved file type danger level
    /// @return true if policy forbids the download
    public boolean shouldBlockFile(DownloadRequest request, DangerType dangerType, DangerLevel dangerLevel) {
        if (settings.allowInsecureDownloads() || !request.requiresSafetyChecks()) {
            return false;
        }
        if (dangerType.isAlwaysBlocked()) {
            return true;
        }
        boolean dangerousFileType = dangerLevel == DangerLevel.DANGEROUS;
        return switch (settings.downloadRestriction()) {
            case NONE -> false;
            case POTENTIALLY_DANGEROUS_FILES -> dangerType != DangerType.NOT_DANGEROUS || dangerousFileType;
            case DANGEROUS_FILES -> switch (dangerType) {
                case DANGEROUS_CONTENT, DANGEROUS_FILE, DANGEROUS_URL, DANGEROUS_ACCOUNT_COMPROMISE -> true;
                default -> dangerousFileType;
            };
            case MALICIOUS_FILES -> switch (dangerType) {
                case DANGEROUS_CONTENT, DANGEROUS_HOST, DANGEROUS_URL, DANGEROUS_ACCOUNT_COMPROMISE -> true;
                default -> false;
            };
            case ALL_FILES -> true;
        };
    }

    /// @param request the download
    /// @param resolution a successful resolution
    /// @return the resolution, or a blocked copy of it
    public TargetResolution apply(DownloadRequest request, TargetResolution resolution) {
        if (!resolution.succeeded()) {
            return resolution;
        }
        if (!shouldBlockFile(request, resolution.info().dangerType(), resolution.dangerLevel())) {
            return resolution;
        }
        logger.info("Download of {} blocked by {} restriction ({} / {})", request.url(),
            settings.downloadRestriction(), resolution.info().dangerType(), resolution.dangerLevel());
        return new TargetResolution(resolution.info().blocked(), resolution.dangerLevel());
    }
}
