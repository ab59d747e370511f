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

/// Risk of a file type, independent of where the file came from.
public enum DangerLevel {
    /// Safe to save without a warning
    NOT_DANGEROUS,
    /// Risky, but commonly downloaded on purpose; allowed when the user evidently meant it
    ALLOW_ON_USER_GESTURE,
    /// Always warned about
    DANGEROUS
}
