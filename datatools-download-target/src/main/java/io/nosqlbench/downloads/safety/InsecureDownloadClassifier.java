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

import io.nosqlbench.downloads.config.DownloadTargetSettings;
import io.nosqlbench.downloads.item.DownloadRequest;
import io.nosqlbench.downloads.item.DownloadSource;
import io.nosqlbench.downloads.item.InsecureDownloadStatus;
import io.nosqlbench.downloads.item.PageTransition;
import io.nosqlbench.downloads.naming.SafeFileNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Classifies downloads delivered over insecure transports.
///
/// A download is insecure when it is not delivered over a trustworthy transport, or when
/// the page that started it is not trustworthy. It is mixed content when a secure page
/// started it and it is delivered insecurely. Mixed content is handled by extension lists
/// in the settings; other insecure downloads are blocked unless their type is usually
/// harmless.
public class InsecureDownloadClassifier {
    private static final Logger logger = LogManager.getLogger(InsecureDownloadClassifier.class);

    static final Set<String> SAFE_EXTENSIONS = Set.of(
        "txt", "css", "json", "csv", "tsv", "jpg", "jpeg", "png", "gif", "tif", "tiff", "ico", "webp", "aac",
        "midi", "ogg", "wav", "webm", "mp3", "mp4", "mpeg", "mov", "wmv");

    private static final Set<DownloadSource> EXEMPT_SOURCES = EnumSet.of(
        DownloadSource.RETRY, DownloadSource.OFFLINE_PAGE, DownloadSource.INTERNAL_API,
        DownloadSource.EXTENSION_API, DownloadSource.EXTENSION_INSTALLER);

    private static final Set<PageTransition> NEVER_MIXED_TRANSITIONS = EnumSet.of(
        PageTransition.RELOAD, PageTransition.TYPED, PageTransition.FROM_ADDRESS_BAR, PageTransition.FORWARD_BACK,
        PageTransition.AUTO_TOPLEVEL, PageTransition.AUTO_BOOKMARK, PageTransition.FROM_API);

    private static final Set<PageTransition> NEVER_INSECURE_TRANSITIONS = EnumSet.of(
        PageTransition.RELOAD, PageTransition.FROM_API);

    private static final String ANY = "*";

    private final DownloadTargetSettings settings;

    public InsecureDownloadClassifier(DownloadTargetSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /// @param request the download
    /// @param virtualPath the candidate target, which supplies the extension
    /// @return the classification
    public InsecureDownloadStatus classify(DownloadRequest request, Path virtualPath) {
        if (settings.allowInsecureDownloads()) {
            return InsecureDownloadStatus.SAFE;
        }
        Optional<URI> initiator = request.initiator().or(request::tabUrl);
        String extension = virtualPath.getFileName() == null ? ""
            : SafeFileNames.extension(virtualPath.getFileName().toString()).orElse("").toLowerCase(Locale.ROOT);

        boolean deliveredSecurely = isDeliveredSecurely(request);
        boolean insecure = !isExempt(request, NEVER_INSECURE_TRANSITIONS)
            && (initiator.filter(u -> !isOpaque(u) && !isPotentiallyTrustworthy(u)).isPresent() || !deliveredSecurely)
            && !isLocalhost(request.url());
        boolean mixed = !isExempt(request, NEVER_MIXED_TRANSITIONS)
            && initiator.filter(InsecureDownloadClassifier::isCryptographic).isPresent()
            && !deliveredSecurely;

        if (!insecure) {
            return InsecureDownloadStatus.SAFE;
        }
        logger.info("Insecure download of {} ({}mixed content)", request.url(), mixed ? "" : "not ");

        if (!mixed) {
            if (!settings.httpsFirstMode() && SAFE_EXTENSIONS.contains(extension)) {
                return InsecureDownloadStatus.SAFE;
            }
            return InsecureDownloadStatus.BLOCK;
        }
        if (!settings.mixedContentBlocking()) {
            return InsecureDownloadStatus.SAFE;
        }
        if (listed(settings.silentBlockExtensions(), extension)) {
            // explicit user actions get a visible block instead
            DownloadSource source = request.source();
            if (source == DownloadSource.CONTEXT_MENU || source == DownloadSource.WEB_CONTENTS_API) {
                return InsecureDownloadStatus.BLOCK;
            }
            return InsecureDownloadStatus.SILENT_BLOCK;
        }
        if (listed(settings.blockExtensions(), extension)) {
            return InsecureDownloadStatus.BLOCK;
        }
        if (listed(settings.warnExtensions(), extension)) {
            return InsecureDownloadStatus.WARN;
        }
        return InsecureDownloadStatus.SAFE;
    }

    private static boolean isExempt(DownloadRequest request, Set<PageTransition> transitions) {
        if (EXEMPT_SOURCES.contains(request.source())) {
            return true;
        }
        for (PageTransition transition : request.transitions()) {
            if (transitions.contains(transition)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isDeliveredSecurely(DownloadRequest request) {
        List<URI> chain = request.urlChain();
        for (int i = 0; i < chain.size() - 1; i++) {
            if (!isPotentiallyTrustworthy(chain.get(i))) {
                return false;
            }
        }
        URI url = request.url();
        String scheme = scheme(url);
        return isPotentiallyTrustworthy(url) || scheme.equals("blob") || scheme.equals("file");
    }

    private static boolean listed(Set<String> extensions, String extension) {
        return extensions.contains(ANY) || (!extension.isEmpty() && extensions.contains(extension));
    }

    static boolean isPotentiallyTrustworthy(URI url) {
        String scheme = scheme(url);
        return switch (scheme) {
            case "https", "wss", "file" -> true;
            case "http", "ws" -> isLocalhost(url);
            default -> false;
        };
    }

    private static boolean isCryptographic(URI url) {
        String scheme = scheme(url);
        return scheme.equals("https") || scheme.equals("wss");
    }

    private static boolean isOpaque(URI url) {
        String scheme = scheme(url);
        return scheme.equals("data") || scheme.equals("about") || url.isOpaque();
    }

    static boolean isLocalhost(URI url) {
        String host = url.getHost();
        if (host == null) {
            return false;
        }
        String h = host.toLowerCase(Locale.ROOT);
        if (h.startsWith("[") && h.endsWith("]")) {
            h = h.substring(1, h.length() - 1);
        }
        return h.equals("localhost") || h.endsWith(".localhost") || h.startsWith("127.")
            || h.equals("::1") || h.equals("0:0:0:0:0:0:0:1");
    }

    private static String scheme(URI url) {
        return url.getScheme() == null ? "" : url.getScheme().toLowerCase(Locale.ROOT);
    }
}
