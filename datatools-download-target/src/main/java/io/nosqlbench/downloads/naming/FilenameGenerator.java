package io.nosqlbench.downloads.naming;

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

import io.nosqlbench.downloads.item.DownloadRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/// Produces the file name a download is saved under.
///
/// Candidates are tried in order: the `Content-Disposition` file name, the name suggested
/// by the initiator, the last segment of the URL path, the URL host, and finally the
/// configured default name. The chosen candidate is sanitized and given an extension that
/// fits its MIME type.
public class FilenameGenerator {
    private static final Logger logger = LogManager.getLogger(FilenameGenerator.class);

    private static final char REPLACEMENT = '_';
    private static final String USER_CERT_FILENAME = "user.crt";

    private final FileTypePolicies fileTypes;
    private final String defaultName;
    private final String referrerCharset;

    public FilenameGenerator(FileTypePolicies fileTypes, String defaultName, String referrerCharset) {
        this.fileTypes = Objects.requireNonNull(fileTypes, "fileTypes");
        this.defaultName = defaultName == null || defaultName.isBlank() ? "download" : defaultName;
        this.referrerCharset = referrerCharset == null ? "" : referrerCharset;
    }

    /// Picks the file name for a download request.
    ///
    /// The extension of the generated name is only replaced to match the sniffed MIME type
    /// when nothing more trustworthy named the file: no suggested name, no disposition file
    /// name, not a checked binary, and not a generic text sniff of typed content.
    /// @param request the download
    /// @return a single path component
    public String fileNameFor(DownloadRequest request) {
        String suggested = request.suggestedFilename();
        String mimeType = MimeTypes.essence(request.mimeType());
        if (suggested.isEmpty() && mimeType.equals(MimeTypes.X509_USER_CERT)) {
            return USER_CERT_FILENAME;
        }
        String disposition = request.contentDisposition();
        String generated = generate(request.url(), disposition, suggested, mimeType, false);

        if (fileTypes.isCheckedBinaryFile(generated)) {
            return generated;
        }
        if (mimeType.isEmpty() || !suggested.isEmpty()) {
            return generated;
        }
        if (ContentDisposition.parse(disposition, referrerCharset).hasFilename()) {
            return generated;
        }
        String original = MimeTypes.essence(request.originalMimeType());
        if (mimeType.equals(MimeTypes.TEXT_PLAIN) && !original.equals(MimeTypes.TEXT_PLAIN)) {
            return generated;
        }
        String replaced = generate(request.url(), disposition, suggested, mimeType, true);
        if (!replaced.equals(generated)) {
            logger.debug("Extension of {} replaced to match {}: {}", generated, mimeType, replaced);
        }
        return replaced;
    }

    /// @param url the download URL
    /// @param contentDisposition the raw disposition header, possibly empty
    /// @param suggestedName the initiator's suggested name, possibly empty
    /// @param mimeType the MIME type of the content, possibly empty
    /// @param replaceExtension whether to replace an existing extension with the MIME type's
    /// @return a sanitized single path component, never empty
    public String generate(URI url, String contentDisposition, String suggestedName, String mimeType,
                           boolean replaceExtension) {
        String name = SafeFileNames.sanitize(suggestedName, REPLACEMENT);
        if (name.isEmpty()) {
            name = SafeFileNames.sanitize(
                ContentDisposition.parse(contentDisposition, referrerCharset).filename(), REPLACEMENT);
        }
        if (name.isEmpty() && url != null) {
            name = SafeFileNames.sanitize(fromUrl(url), REPLACEMENT);
        }
        if (name.isEmpty()) {
            name = SafeFileNames.sanitize(defaultName, REPLACEMENT);
        }
        if (name.isEmpty()) {
            name = "download";
        }
        return SafeFileNames.generateSafeFileName(name, mimeType, replaceExtension);
    }

    private static String fromUrl(URI url) {
        String scheme = url.getScheme() == null ? "" : url.getScheme().toLowerCase(Locale.ROOT);
        if (scheme.equals("data") || scheme.equals("about") || scheme.equals("javascript")) {
            return "";
        }
        String path = url.getPath();
        if (path != null) {
            String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
            int slash = trimmed.lastIndexOf('/');
            String last = slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
            if (!last.isEmpty()) {
                return last;
            }
        }
        return url.getHost() == null ? "" : url.getHost();
    }
}
