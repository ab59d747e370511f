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

/// What a step of the [TargetDeterminer] asks the driving loop to do next.
enum StepResult {
    /// Run the next state now, in the same turn
    CONTINUE,
    /// An asynchronous request is outstanding; its callback resumes the loop
    SUSPEND,
    /// Target determination is done; deliver the outcome
    COMPLETE
}
