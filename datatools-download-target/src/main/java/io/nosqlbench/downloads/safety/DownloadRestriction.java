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

import java.util.Locale;

/// Administrator policy deciding which downloads are blocked outright once their danger
/// is known.
public enum DownloadRestriction {
    /// Nothing is blocked by policy
    NONE,
    /// Files flagged dangerous by type, URL, content or host are blocked
    DANGEROUS_FILES,
    /// Anything not plainly safe is blocked
    POTENTIALLY_DANGEROUS_FILES,
    /// Every download is blocked
    ALL_FILES,
    /// Only files known to be malicious are blocked
    MALICIOUS_FILES;

    /// Parses a configuration value such as `dangerous_files` or `DANGEROUS-FILES`.
    /// @param value the configured value
    /// @return the restriction
    /// @throws IllegalArgumentException if the value names no restriction
    public static DownloadRestriction parse(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown download restriction '" + value + "'", e);
        }
    }
}
