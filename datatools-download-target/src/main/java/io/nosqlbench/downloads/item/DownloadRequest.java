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

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// The immutable description of a download, as handed over by the download engine.
///
/// Everything target resolution needs to know about the request itself lives here:
/// where the bytes come from, what the server said about them, how the user started the
/// download, and for a resumed download where it was being written before it was
/// interrupted. Instances are created with [#builder(URI)].
public final class DownloadRequest {
    private final URI url;
    private final List<URI> urlChain;
    private final URI referrerUrl;
    private final URI tabUrl;
    private final URI initiator;
    private final String suggestedFilename;
    private final String contentDisposition;
    private final String mimeType;
    private final String originalMimeType;
    private final boolean transientDownload;
    private final DangerType dangerType;
    private final TargetDisposition targetDisposition;
    private final Path forcedPath;
    private final boolean userGesture;
    private final Set<PageTransition> transitions;
    private final DownloadSource source;
    private final InterruptReason lastInterruptReason;
    private final Path targetPath;
    private final Path fullPath;
    private final boolean requireSafetyChecks;

    private DownloadRequest(Builder builder) {
        this.url = builder.url;
        List<URI> chain = new ArrayList<>(builder.urlChain);
        if (chain.isEmpty() || !chain.get(chain.size() - 1).equals(url)) {
            chain.add(url);
        }
        this.urlChain = Collections.unmodifiableList(chain);
        this.referrerUrl = builder.referrerUrl;
        this.tabUrl = builder.tabUrl;
        this.initiator = builder.initiator;
        this.suggestedFilename = builder.suggestedFilename;
        this.contentDisposition = builder.contentDisposition;
        this.mimeType = builder.mimeType;
        this.originalMimeType = builder.originalMimeType != null ? builder.originalMimeType : builder.mimeType;
        this.transientDownload = builder.transientDownload;
        this.dangerType = builder.dangerType;
        this.targetDisposition = builder.targetDisposition;
        this.forcedPath = builder.forcedPath;
        this.userGesture = builder.userGesture;
        this.transitions = Collections.unmodifiableSet(builder.transitions.isEmpty()
            ? EnumSet.noneOf(PageTransition.class) : EnumSet.copyOf(builder.transitions));
        this.source = builder.source;
        this.lastInterruptReason = builder.lastInterruptReason;
        this.targetPath = builder.targetPath;
        this.fullPath = builder.fullPath;
        this.requireSafetyChecks = builder.requireSafetyChecks;
    }

    /// Starts a request for the given URL.
    /// @param url the final URL the bytes are fetched from
    /// @return a new builder
    public static Builder builder(URI url) {
        return new Builder(url);
    }

    /// @return the final URL of the download
    public URI url() {
        return url;
    }

    /// @return every URL visited on the way to [#url()], ending with it
    public List<URI> urlChain() {
        return urlChain;
    }

    public Optional<URI> referrerUrl() {
        return Optional.ofNullable(referrerUrl);
    }

    public Optional<URI> tabUrl() {
        return Optional.ofNullable(tabUrl);
    }

    /// @return the origin that initiated the request, when known
    public Optional<URI> initiator() {
        return Optional.ofNullable(initiator);
    }

    /// @return the filename suggested by the page (e.g. an anchor's download attribute), or ""
    public String suggestedFilename() {
        return suggestedFilename;
    }

    /// @return the raw Content-Disposition response header, or ""
    public String contentDisposition() {
        return contentDisposition;
    }

    /// @return the MIME type after network layer sniffing, or ""
    public String mimeType() {
        return mimeType;
    }

    /// @return the MIME type the server declared, or ""
    public String originalMimeType() {
        return originalMimeType;
    }

    /// @return true for downloads that are not shown to the user, such as an inline preview
    public boolean isTransient() {
        return transientDownload;
    }

    /// @return the danger type the item carried when target resolution started
    public DangerType dangerType() {
        return dangerType;
    }

    public TargetDisposition targetDisposition() {
        return targetDisposition;
    }

    /// @return the path a programmatic download must be written to, if any
    public Optional<Path> forcedPath() {
        return Optional.ofNullable(forcedPath);
    }

    public boolean hasUserGesture() {
        return userGesture;
    }

    public Set<PageTransition> transitions() {
        return transitions;
    }

    /// @param transition the flag to look for
    /// @return true if the starting navigation carried the flag
    public boolean hasTransition(PageTransition transition) {
        return transitions.contains(transition);
    }

    public DownloadSource source() {
        return source;
    }

    /// @return why the download was last interrupted; [InterruptReason#NONE] for a new download
    public InterruptReason lastInterruptReason() {
        return lastInterruptReason;
    }

    /// @return the target path chosen by an earlier resolution, for a resumed download
    public Optional<Path> targetPath() {
        return Optional.ofNullable(targetPath);
    }

    /// @return the intermediate file an interrupted download was writing to
    public Optional<Path> fullPath() {
        return Optional.ofNullable(fullPath);
    }

    /// @return false for browser internal downloads that skip safety enforcement
    public boolean requiresSafetyChecks() {
        return requireSafetyChecks;
    }

    @Override
    public String toString() {
        return "DownloadRequest{url=" + url
            + ", suggested='" + suggestedFilename + '\''
            + ", mime='" + mimeType + '\''
            + ", transient=" + transientDownload
            + ", forced=" + forcedPath
            + ", disposition=" + targetDisposition
            + ", lastReason=" + lastInterruptReason
            + '}';
    }

    /// Builder for [DownloadRequest]. Every field other than the URL is optional.
    public static final class Builder {
        private final URI url;
        private final List<URI> urlChain = new ArrayList<>();
        private URI referrerUrl;
        private URI tabUrl;
        private URI initiator;
        private String suggestedFilename = "";
        private String contentDisposition = "";
        private String mimeType = "";
        private String originalMimeType;
        private boolean transientDownload;
        private DangerType dangerType = DangerType.NOT_DANGEROUS;
        private TargetDisposition targetDisposition = TargetDisposition.OVERWRITE;
        private Path forcedPath;
        private boolean userGesture;
        private final Set<PageTransition> transitions = EnumSet.noneOf(PageTransition.class);
        private DownloadSource source = DownloadSource.NAVIGATION;
        private InterruptReason lastInterruptReason = InterruptReason.NONE;
        private Path targetPath;
        private Path fullPath;
        private boolean requireSafetyChecks = true;

        private Builder(URI url) {
            this.url = Objects.requireNonNull(url, "url");
        }

        public Builder redirectedFrom(URI... chain) {
            Collections.addAll(urlChain, chain);
            return this;
        }

        public Builder referrer(URI referrer) {
            this.referrerUrl = referrer;
            return this;
        }

        public Builder tabUrl(URI tabUrl) {
            this.tabUrl = tabUrl;
            return this;
        }

        public Builder initiator(URI initiator) {
            this.initiator = initiator;
            return this;
        }

        public Builder suggestedFilename(String name) {
            this.suggestedFilename = name == null ? "" : name;
            return this;
        }

        public Builder contentDisposition(String header) {
            this.contentDisposition = header == null ? "" : header;
            return this;
        }

        public Builder mimeType(String mimeType) {
            this.mimeType = mimeType == null ? "" : mimeType;
            return this;
        }

        public Builder originalMimeType(String mimeType) {
            this.originalMimeType = mimeType == null ? "" : mimeType;
            return this;
        }

        public Builder transientDownload(boolean isTransient) {
            this.transientDownload = isTransient;
            return this;
        }

        public Builder dangerType(DangerType dangerType) {
            this.dangerType = Objects.requireNonNull(dangerType);
            return this;
        }

        public Builder targetDisposition(TargetDisposition disposition) {
            this.targetDisposition = Objects.requireNonNull(disposition);
            return this;
        }

        public Builder forcedPath(Path path) {
            if (path != null && !path.isAbsolute()) {
                throw new IllegalArgumentException("forced path must be absolute: " + path);
            }
            this.forcedPath = path;
            return this;
        }

        public Builder userGesture(boolean gesture) {
            this.userGesture = gesture;
            return this;
        }

        public Builder transition(PageTransition... flags) {
            Collections.addAll(transitions, flags);
            return this;
        }

        public Builder source(DownloadSource source) {
            this.source = Objects.requireNonNull(source);
            return this;
        }

        /// Marks the request as the resumption of an interrupted download.
        /// @param reason the reason of the last interruption
        /// @param target the target path chosen before the interruption
        /// @param intermediate the intermediate file written before the interruption, may be null
        /// @return this builder
        public Builder resumedAfter(InterruptReason reason, Path target, Path intermediate) {
            this.lastInterruptReason = Objects.requireNonNull(reason);
            this.targetPath = target;
            this.fullPath = intermediate;
            return this;
        }

        public Builder requireSafetyChecks(boolean required) {
            this.requireSafetyChecks = required;
            return this;
        }

        public DownloadRequest build() {
            return new DownloadRequest(this);
        }
    }
}
