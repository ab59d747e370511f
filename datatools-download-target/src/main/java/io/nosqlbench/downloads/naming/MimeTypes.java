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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/// Mapping between MIME types and file extensions, and file based MIME sniffing.
public final class MimeTypes {
    private static final Logger logger = LogManager.getLogger(MimeTypes.class);

    public static final String OCTET_STREAM = "application/octet-stream";
    public static final String TEXT_PLAIN = "text/plain";
    public static final String X509_USER_CERT = "application/x-x509-user-cert";

    // first extension listed for a type is its preferred one
    private static final Map<String, List<String>> EXTENSIONS_BY_TYPE = new LinkedHashMap<>();
    private static final Map<String, String> TYPE_BY_EXTENSION = new LinkedHashMap<>();

    static {
        register("text/plain", "txt", "text", "log");
        register("text/csv", "csv");
        register("text/tab-separated-values", "tsv");
        register("text/html", "html", "htm", "shtml", "shtm");
        register("text/css", "css");
        register("text/javascript", "js", "mjs");
        register("text/xml", "xml");
        register("text/markdown", "md");
        register("application/xhtml+xml", "xhtml", "xht", "xhtm");
        register("application/json", "json");
        register("application/pdf", "pdf");
        register("application/zip", "zip");
        register("application/gzip", "gz", "tgz");
        register("application/x-tar", "tar");
        register("application/x-7z-compressed", "7z");
        register("application/vnd.rar", "rar");
        register("application/x-bzip2", "bz2");
        register("application/x-xz", "xz");
        register("application/java-archive", "jar");
        register("application/x-msdownload", "exe", "dll");
        register("application/x-msi", "msi");
        register("application/x-apple-diskimage", "dmg");
        register("application/vnd.android.package-archive", "apk");
        register("application/vnd.debian.binary-package", "deb");
        register("application/x-rpm", "rpm");
        register("application/x-sh", "sh");
        register("application/x-x509-user-cert", "crt");
        register("application/x-x509-ca-cert", "cer", "der");
        register("application/msword", "doc");
        register("application/vnd.openxmlformats-officedocument.wordprocessingml.document", "docx");
        register("application/vnd.ms-excel", "xls");
        register("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", "xlsx");
        register("application/vnd.ms-powerpoint", "ppt");
        register("application/vnd.openxmlformats-officedocument.presentationml.presentation", "pptx");
        register("application/rtf", "rtf");
        register("application/wasm", "wasm");
        register("image/png", "png");
        register("image/jpeg", "jpg", "jpeg", "jpe", "jfif");
        register("image/gif", "gif");
        register("image/webp", "webp");
        register("image/svg+xml", "svg", "svgz");
        register("image/bmp", "bmp");
        register("image/x-icon", "ico");
        register("image/tiff", "tiff", "tif");
        register("image/avif", "avif");
        register("audio/mpeg", "mp3");
        register("audio/wav", "wav");
        register("audio/ogg", "ogg", "oga", "opus");
        register("audio/aac", "aac");
        register("audio/flac", "flac");
        register("audio/midi", "midi", "mid");
        register("video/mp4", "mp4", "m4v");
        register("video/webm", "webm");
        register("video/mpeg", "mpeg", "mpg");
        register("video/quicktime", "mov");
        register("video/x-ms-wmv", "wmv");
    }

    private MimeTypes() {
    }

    private static void register(String type, String... extensions) {
        List<String> list = new ArrayList<>(List.of(extensions));
        EXTENSIONS_BY_TYPE.put(type, Collections.unmodifiableList(list));
        for (String extension : extensions) {
            TYPE_BY_EXTENSION.putIfAbsent(extension, type);
        }
    }

    /// Strips parameters and normalizes case, e.g. "Text/HTML; charset=utf-8" becomes "text/html".
    /// @param mimeType a MIME type, possibly with parameters
    /// @return the bare lower case type, or "" for null
    public static String essence(String mimeType) {
        if (mimeType == null) {
            return "";
        }
        int semi = mimeType.indexOf(';');
        String bare = semi >= 0 ? mimeType.substring(0, semi) : mimeType;
        return bare.trim().toLowerCase(Locale.ROOT);
    }

    /// @param mimeType a MIME type
    /// @return the preferred extension for the type, without a dot
    public static Optional<String> preferredExtension(String mimeType) {
        List<String> extensions = EXTENSIONS_BY_TYPE.get(essence(mimeType));
        return extensions == null ? Optional.empty() : Optional.of(extensions.get(0));
    }

    /// @param mimeType a MIME type
    /// @return every extension registered for the type, possibly empty
    public static List<String> extensions(String mimeType) {
        return EXTENSIONS_BY_TYPE.getOrDefault(essence(mimeType), List.of());
    }

    /// @param extension an extension, with or without a leading dot
    /// @return the MIME type registered for the extension
    public static Optional<String> forExtension(String extension) {
        String e = extension.startsWith(".") ? extension.substring(1) : extension;
        return Optional.ofNullable(TYPE_BY_EXTENSION.get(e.toLowerCase(Locale.ROOT)));
    }

    /// Determines the MIME type of a file, asking the platform first and falling back to the
    /// extension table. This may touch the disk and should not run on the resolution sequence.
    /// @param file the file, which need not exist
    /// @return the MIME type, or "" if unknown
    public static String sniff(Path file) {
        try {
            String probed = Files.probeContentType(file);
            if (probed != null && !probed.isBlank()) {
                return essence(probed);
            }
        } catch (IOException e) {
            logger.debug("Content type probe failed for {}: {}", file, e.getMessage());
        }
        return SafeFileNames.extension(file.getFileName() == null ? "" : file.getFileName().toString())
            .flatMap(MimeTypes::forExtension)
            .orElse("");
    }
}
