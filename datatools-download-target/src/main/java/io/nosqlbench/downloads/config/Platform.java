package io.nosqlbench.downloads.config;

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

/// Which confirmation flow a deployment uses.
public enum Platform {
    /// File picker for every confirmation, names uniquified on conflict
    DESKTOP,
    /// Location dialogs, conflicts prompted
    MOBILE;

    public static Platform parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
