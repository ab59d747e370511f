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

import io.nosqlbench.downloads.naming.MimeTypes;

import java.util.Set;

/// MIME types the browser renders itself, so opening such a download does not hand it
/// to another application.
public class BrowserMimeSupport {

    private static final Set<String> RENDERED_TYPES = Set.of(
        "text/html", "text/plain", "text/css", "text/csv", "text/xml", "text/markdown",
        "application/xhtml+xml", "application/json", "application/xml",
        "image/svg+xml");

    private static final Set<String> MEDIA_PREFIXES = Set.of("image/", "audio/", "video/");

    private static final String PDF = "application/pdf";

    private final boolean pdfViewerEnabled;

    public BrowserMimeSupport(boolean pdfViewerEnabled) {
        this.pdfViewerEnabled = pdfViewerEnabled;
    }

    /// @param mimeType a MIME type, possibly with parameters
    /// @return true if the browser displays content of this type itself
    public boolean isHandledSafely(String mimeType) {
        String type = MimeTypes.essence(mimeType);
        if (type.isEmpty()) {
            return false;
        }
        if (type.equals(PDF)) {
            return pdfViewerEnabled;
        }
        if (RENDERED_TYPES.contains(type)) {
            return true;
        }
        for (String prefix : MEDIA_PREFIXES) {
            if (type.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
