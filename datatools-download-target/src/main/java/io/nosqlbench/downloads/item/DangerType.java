package io.nosqlbench.downloads.item;

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

import java.util.EnumSet;
import java.util.Set;

/// Security verdict attached to a download.
///
/// Target resolution starts from the type already on the item, refines it from the URL
/// reputation check and the file type danger level, and hands the result back with the
/// target.
public enum DangerType {
    NOT_DANGEROUS,
    DANGEROUS_FILE,
    DANGEROUS_URL,
    DANGEROUS_CONTENT,
    MAYBE_DANGEROUS_CONTENT,
    UNCOMMON_CONTENT,
    USER_VALIDATED,
    DANGEROUS_HOST,
    POTENTIALLY_UNWANTED,
    ALLOWLISTED_BY_POLICY,
    DANGEROUS_ACCOUNT_COMPROMISE,
    BLOCKED_PASSWORD_PROTECTED,
    BLOCKED_TOO_LARGE,
    SENSITIVE_CONTENT_BLOCK;

    private static final Set<DangerType> FILE_TYPE_DEPENDENT =
        EnumSet.of(NOT_DANGEROUS, MAYBE_DANGEROUS_CONTENT, ALLOWLISTED_BY_POLICY);

    private static final Set<DangerType> ALWAYS_BLOCKED =
        EnumSet.of(BLOCKED_PASSWORD_PROTECTED, BLOCKED_TOO_LARGE, SENSITIVE_CONTENT_BLOCK);

    /// Whether the final danger of a download with this type still depends on its file
    /// type, and thus on the user's history with the referrer.
    /// @return true for types that leave room for a file type based verdict
    public boolean dependsOnFileType() {
        return FILE_TYPE_DEPENDENT.contains(this);
    }

    /// @return true for types that block the download regardless of any restriction policy
    public boolean isAlwaysBlocked() {
        return ALWAYS_BLOCKED.contains(this);
    }
}
