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

/// The user's answer to a location confirmation.
public enum ConfirmationResult {
    /// The user picked or accepted a path
    CONFIRMED,
    /// The user picked a path in a location dialog; it is reserved again before use
    CONFIRMED_WITH_DIALOG,
    /// The user declined; the download is canceled
    CANCELED,
    /// No prompt was shown; the suggested path is used without the user's consent
    CONTINUE_WITHOUT_CONFIRMATION
}
