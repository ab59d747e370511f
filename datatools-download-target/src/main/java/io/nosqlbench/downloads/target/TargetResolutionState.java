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

/// The ordered states of a [TargetDeterminer].
///
/// States run strictly in declaration order. Each is entered at most once, except that
/// any state may be skipped when its precondition does not hold. [#NONE] marks a
/// determiner that has no further state to run.
public enum TargetResolutionState {
    GENERATE_TARGET_PATH,
    SET_INSECURE_DOWNLOAD_STATUS,
    NOTIFY_COLLABORATORS,
    RESERVE_VIRTUAL_PATH,
    PROMPT_USER_FOR_DOWNLOAD_PATH,
    DETERMINE_LOCAL_PATH,
    DETERMINE_MIME_TYPE,
    DETERMINE_IF_HANDLED_SAFELY_BY_BROWSER,
    CHECK_DOWNLOAD_URL,
    CHECK_VISITED_REFERRER_BEFORE,
    DETERMINE_INTERMEDIATE_PATH,
    NONE
}
