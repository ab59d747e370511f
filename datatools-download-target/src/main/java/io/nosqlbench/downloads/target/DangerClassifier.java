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

import io.nosqlbench.downloads.naming.FileTypePolicies;

import java.util.Objects;

/// Computes the file type [DangerLevel] of a download.
public final class DangerClassifier {

    private final FileTypePolicies fileTypes;
    private final boolean allowInsecureDownloads;

    public DangerClassifier(FileTypePolicies fileTypes, boolean allowInsecureDownloads) {
        this.fileTypes = Objects.requireNonNull(fileTypes, "fileTypes");
        this.allowInsecureDownloads = allowInsecureDownloads;
    }

    /// Inputs to a classification.
    ///
    /// @param filename base name of the candidate target
    /// @param userApprovedPath the user chose or confirmed the path, or it was forced by a trusted source
    /// @param autoOpenWithGesture the type opens automatically and the user gestured
    /// @param fromAddressBar the navigation started in the address bar
    /// @param userGesture the download was started by a user gesture
    /// @param visits prior visits to the referrer
    public record Query(
        String filename,
        boolean userApprovedPath,
        boolean autoOpenWithGesture,
        boolean fromAddressBar,
        boolean userGesture,
        ReferrerVisits visits
    ) {
        public Query {
            Objects.requireNonNull(filename, "filename");
            Objects.requireNonNull(visits, "visits");
        }
    }

    public DangerLevel classify(Query query) {
        if (allowInsecureDownloads) {
            return DangerLevel.NOT_DANGEROUS;
        }
        if (query.userApprovedPath() || query.autoOpenWithGesture()) {
            return DangerLevel.NOT_DANGEROUS;
        }
        DangerLevel level = fileTypes.dangerLevel(query.filename());
        return applyPriorIntent(level, query.fromAddressBar(), query.userGesture(), query.visits());
    }

    /// Downgrades [DangerLevel#ALLOW_ON_USER_GESTURE] to [DangerLevel#NOT_DANGEROUS] when the
    /// user typed the address, or gestured on a page whose host they visited before today.
    /// Other levels are returned unchanged.
    public static DangerLevel applyPriorIntent(DangerLevel level, boolean fromAddressBar, boolean userGesture,
                                               ReferrerVisits visits) {
        if (level == DangerLevel.ALLOW_ON_USER_GESTURE
            && (fromAddressBar || (userGesture && visits == ReferrerVisits.VISITED_REFERRER))) {
            return DangerLevel.NOT_DANGEROUS;
        }
        return level;
    }

    public FileTypePolicies fileTypes() {
        return fileTypes;
    }
}
