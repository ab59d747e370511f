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

import io.nosqlbench.downloads.item.DangerType;
import io.nosqlbench.downloads.item.DownloadRequest;

/// Reputation check of the URLs a download came from.
@FunctionalInterface
public interface DownloadUrlChecker {

    /// A checker that trusts every URL.
    DownloadUrlChecker ALLOW_ALL = request -> DangerType.NOT_DANGEROUS;

    /// @param request the download
    /// @return the danger type of the download's URLs
    DangerType check(DownloadRequest request);
}
