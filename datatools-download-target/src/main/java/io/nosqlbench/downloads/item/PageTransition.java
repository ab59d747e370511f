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

/// Navigation transition flags attached to the request that started a download.
///
/// A request carries a set of these; the core type and the qualifiers are not
/// distinguished here since only membership tests are needed.
public enum PageTransition {
    LINK,
    TYPED,
    AUTO_BOOKMARK,
    AUTO_SUBFRAME,
    MANUAL_SUBFRAME,
    GENERATED,
    AUTO_TOPLEVEL,
    FORM_SUBMIT,
    RELOAD,
    KEYWORD,
    FORWARD_BACK,
    FROM_ADDRESS_BAR,
    HOME_PAGE,
    FROM_API
}
