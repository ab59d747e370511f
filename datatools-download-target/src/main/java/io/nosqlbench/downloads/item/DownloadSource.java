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

/// Where a download request came from.
public enum DownloadSource {
    UNKNOWN,
    NAVIGATION,
    DRAG_AND_DROP,
    FROM_RENDERER,
    EXTENSION_API,
    EXTENSION_INSTALLER,
    INTERNAL_API,
    WEB_CONTENTS_API,
    OFFLINE_PAGE,
    CONTEXT_MENU,
    RETRY
}
