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

/// Observer of a [DownloadItem]'s lifetime.
public interface DownloadItemObserver {

    /// Called when the item changes state.
    /// @param item the item that changed
    default void onDownloadUpdated(DownloadItem item) {
    }

    /// Called once when the item is destroyed. The item must not be used afterwards.
    /// @param item the item being destroyed
    void onDownloadDestroyed(DownloadItem item);
}
