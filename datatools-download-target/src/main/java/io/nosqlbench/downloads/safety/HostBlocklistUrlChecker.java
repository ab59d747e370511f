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

import io.nosqlbench.downloads.item.DangerType;
import io.nosqlbench.downloads.item.DownloadRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/// Flags downloads served from, or redirected through, a blocked host or any of its
/// subdomains.
public class HostBlocklistUrlChecker implements DownloadUrlChecker {
    private static final Logger logger = LogManager.getLogger(HostBlocklistUrlChecker.class);

    private final Set<String> blockedHosts;

    public HostBlocklistUrlChecker(Collection<String> blockedHosts) {
        this.blockedHosts = blockedHosts.stream()
            .map(h -> h.trim().toLowerCase(Locale.ROOT))
            .filter(h -> !h.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public DangerType check(DownloadRequest request) {
        for (URI url : request.urlChain()) {
            if (isBlocked(url)) {
                logger.info("Download {} passes through blocked host {}", request.url(), url.getHost());
                return DangerType.DANGEROUS_URL;
            }
        }
        return DangerType.NOT_DANGEROUS;
    }

    private boolean isBlocked(URI url) {
        String host = url.getHost();
        if (host == null) {
            return false;
        }
        String h = host.toLowerCase(Locale.ROOT);
        while (true) {
            if (blockedHosts.contains(h)) {
                return true;
            }
            int dot = h.indexOf('.');
            if (dot < 0) {
                return false;
            }
            h = h.substring(dot + 1);
        }
    }
}
