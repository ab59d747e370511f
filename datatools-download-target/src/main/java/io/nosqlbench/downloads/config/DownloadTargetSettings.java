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

import io.nosqlbench.downloads.safety.DownloadRestriction;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Configuration for download target resolution.
///
/// Every knob the pipeline reads lives here and is passed in explicitly; nothing is read
/// from system properties or command line switches behind the caller's back. Settings are
/// usually loaded from a YAML file such as:
///
/// ```yaml
/// download_directory: ~/Downloads
/// prompt_for_download: false
/// auto_open_extensions: [txt, pdf]
/// download_restriction: dangerous_files
/// virtual_roots:
///   /mnt/drive: ~/.cache/drive
/// ```
///
/// Keys that are absent keep the value from [#defaults()].
///
/// @param downloadDirectory default directory for new downloads
/// @param saveFileDirectory directory offered when the user is prompted, initially the last one they chose
/// @param promptForDownload ask where to save every download
/// @param downloadPathManaged the download directory is set by policy; never prompt for it
/// @param autoOpenExtensions lower case extensions the user opens automatically
/// @param allowInsecureDownloads disable insecure download blocking and file type danger checks
/// @param httpsFirstMode warn on every insecure download, even for usually harmless types
/// @param defaultFilename name used when nothing better can be derived
/// @param unconfirmedPrefix prefix of the random intermediate name of dangerous downloads
/// @param defaultCharset charset for decoding non-ASCII Content-Disposition filenames
/// @param downloadRestriction policy for blocking dangerous downloads outright
/// @param dlpBlockedDirectories directories a data leak prevention policy forbids saving to without a prompt
/// @param virtualRoots virtual directory roots mapped to the local directory that backs them
/// @param maxFilenameLength longest file name the filesystem accepts
/// @param platform which confirmation flow to use
/// @param mixedContentBlocking classify downloads from secure pages over insecure transports
/// @param silentBlockExtensions mixed content extensions that are dropped silently, "*" for all
/// @param blockExtensions mixed content extensions that are blocked, "*" for all
/// @param warnExtensions mixed content extensions that are warned about, "*" for all
/// @param openPdfInBrowser the browser renders PDF files itself
public record DownloadTargetSettings(
    Path downloadDirectory,
    Path saveFileDirectory,
    boolean promptForDownload,
    boolean downloadPathManaged,
    Set<String> autoOpenExtensions,
    boolean allowInsecureDownloads,
    boolean httpsFirstMode,
    String defaultFilename,
    String unconfirmedPrefix,
    String defaultCharset,
    DownloadRestriction downloadRestriction,
    List<Path> dlpBlockedDirectories,
    Map<Path, Path> virtualRoots,
    int maxFilenameLength,
    Platform platform,
    boolean mixedContentBlocking,
    Set<String> silentBlockExtensions,
    Set<String> blockExtensions,
    Set<String> warnExtensions,
    boolean openPdfInBrowser
) {

    public DownloadTargetSettings {
        if (downloadDirectory == null || !downloadDirectory.isAbsolute()) {
            throw new IllegalArgumentException("download_directory must be an absolute path, got: " + downloadDirectory);
        }
        if (saveFileDirectory == null) {
            saveFileDirectory = downloadDirectory;
        }
        if (maxFilenameLength < 8) {
            throw new IllegalArgumentException("max_filename_length must be at least 8, got: " + maxFilenameLength);
        }
        autoOpenExtensions = Set.copyOf(autoOpenExtensions);
        dlpBlockedDirectories = List.copyOf(dlpBlockedDirectories);
        virtualRoots = Map.copyOf(virtualRoots);
        silentBlockExtensions = Set.copyOf(silentBlockExtensions);
        blockExtensions = Set.copyOf(blockExtensions);
        warnExtensions = Set.copyOf(warnExtensions);
    }

    /// Settings for a desktop deployment saving to ~/Downloads without prompting.
    /// @return the default settings
    public static DownloadTargetSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /// Loads settings from a YAML file.
    /// @param file the YAML file
    /// @return the settings, with defaults for absent keys
    /// @throws UncheckedIOException if the file cannot be read
    /// @throws IllegalArgumentException if the file does not hold a valid mapping
    public static DownloadTargetSettings load(Path file) {
        Path expanded = expandTilde(file);
        try {
            return parse(Files.readString(expanded), expanded.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read download settings from " + expanded, e);
        }
    }

    /// Parses settings from YAML text.
    /// @param yaml the YAML document
    /// @param origin a description of where the text came from, for error messages
    /// @return the settings
    public static DownloadTargetSettings parse(String yaml, String origin) {
        Load load = new Load(LoadSettings.builder().setLabel(origin).build());
        Object document = load.loadFromString(yaml);
        if (document == null) {
            return defaults();
        }
        if (document instanceof Map<?, ?> map) {
            return fromMap(map);
        }
        throw new IllegalArgumentException("download settings in " + origin + " must be a mapping");
    }

    /// Builds settings from an already parsed mapping.
    /// @param map keys as documented on this type
    /// @return the settings
    public static DownloadTargetSettings fromMap(Map<?, ?> map) {
        Builder b = builder();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            switch (key) {
                case "download_directory" -> b.downloadDirectory(path(value));
                case "save_file_directory" -> b.saveFileDirectory(path(value));
                case "prompt_for_download" -> b.promptForDownload(bool(key, value));
                case "download_path_managed" -> b.downloadPathManaged(bool(key, value));
                case "auto_open_extensions" -> b.autoOpenExtensions(extensions(key, value));
                case "allow_insecure_downloads" -> b.allowInsecureDownloads(bool(key, value));
                case "https_first_mode" -> b.httpsFirstMode(bool(key, value));
                case "default_filename" -> b.defaultFilename(String.valueOf(value));
                case "unconfirmed_prefix" -> b.unconfirmedPrefix(String.valueOf(value));
                case "default_charset" -> b.defaultCharset(String.valueOf(value));
                case "download_restriction" -> b.downloadRestriction(DownloadRestriction.parse(String.valueOf(value)));
                case "dlp_blocked_directories" -> b.dlpBlockedDirectories(list(key, value).stream().map(DownloadTargetSettings::path).toList());
                case "virtual_roots" -> b.virtualRoots(roots(value));
                case "max_filename_length" -> b.maxFilenameLength(integer(key, value));
                case "platform" -> b.platform(Platform.parse(String.valueOf(value)));
                case "mixed_content_blocking" -> b.mixedContentBlocking(bool(key, value));
                case "silent_block_extensions" -> b.silentBlockExtensions(extensions(key, value));
                case "block_extensions" -> b.blockExtensions(extensions(key, value));
                case "warn_extensions" -> b.warnExtensions(extensions(key, value));
                case "open_pdf_in_browser" -> b.openPdfInBrowser(bool(key, value));
                default -> throw new IllegalArgumentException("unknown download setting '" + key + "'");
            }
        }
        return b.build();
    }

    /// @param extension an extension with or without the leading dot
    /// @return true if the user opens files with this extension automatically
    public boolean isAutoOpen(String extension) {
        return autoOpenExtensions.contains(normalizeExtension(extension));
    }

    static String normalizeExtension(String extension) {
        String e = extension.startsWith(".") ? extension.substring(1) : extension;
        return e.toLowerCase(Locale.ROOT);
    }

    static Path expandTilde(Path path) {
        String text = path.toString();
        if (text.equals("~") || text.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + text.substring(1));
        }
        return path;
    }

    private static Path path(Object value) {
        return expandTilde(Path.of(String.valueOf(value))).toAbsolutePath().normalize();
    }

    private static boolean bool(String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new IllegalArgumentException("download setting '" + key + "' must be true or false, got: " + value);
    }

    private static int integer(String key, Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        throw new IllegalArgumentException("download setting '" + key + "' must be a number, got: " + value);
    }

    private static List<?> list(String key, Object value) {
        if (value instanceof List<?> l) {
            return l;
        }
        throw new IllegalArgumentException("download setting '" + key + "' must be a list, got: " + value);
    }

    private static Set<String> extensions(String key, Object value) {
        Set<String> result = new LinkedHashSet<>();
        for (Object o : list(key, value)) {
            result.add(normalizeExtension(String.valueOf(o)));
        }
        return result;
    }

    private static Map<Path, Path> roots(Object value) {
        if (!(value instanceof Map<?, ?> m)) {
            throw new IllegalArgumentException("download setting 'virtual_roots' must be a mapping, got: " + value);
        }
        Map<Path, Path> result = new LinkedHashMap<>();
        m.forEach((k, v) -> result.put(path(k), path(v)));
        return result;
    }

    /// Mutable builder for [DownloadTargetSettings].
    public static final class Builder {
        private Path downloadDirectory = Path.of(System.getProperty("user.home"), "Downloads");
        private Path saveFileDirectory;
        private boolean promptForDownload;
        private boolean downloadPathManaged;
        private Set<String> autoOpenExtensions = Set.of();
        private boolean allowInsecureDownloads;
        private boolean httpsFirstMode;
        private String defaultFilename = "download";
        private String unconfirmedPrefix = "Unconfirmed";
        private String defaultCharset = "UTF-8";
        private DownloadRestriction downloadRestriction = DownloadRestriction.NONE;
        private List<Path> dlpBlockedDirectories = List.of();
        private Map<Path, Path> virtualRoots = Map.of();
        private int maxFilenameLength = 255;
        private Platform platform = Platform.DESKTOP;
        private boolean mixedContentBlocking = true;
        private Set<String> silentBlockExtensions = Set.of();
        private Set<String> blockExtensions = Set.of();
        private Set<String> warnExtensions = Set.of("*");
        private boolean openPdfInBrowser = true;

        private Builder() {
        }

        private Builder(DownloadTargetSettings s) {
            downloadDirectory = s.downloadDirectory;
            saveFileDirectory = s.saveFileDirectory;
            promptForDownload = s.promptForDownload;
            downloadPathManaged = s.downloadPathManaged;
            autoOpenExtensions = s.autoOpenExtensions;
            allowInsecureDownloads = s.allowInsecureDownloads;
            httpsFirstMode = s.httpsFirstMode;
            defaultFilename = s.defaultFilename;
            unconfirmedPrefix = s.unconfirmedPrefix;
            defaultCharset = s.defaultCharset;
            downloadRestriction = s.downloadRestriction;
            dlpBlockedDirectories = s.dlpBlockedDirectories;
            virtualRoots = s.virtualRoots;
            maxFilenameLength = s.maxFilenameLength;
            platform = s.platform;
            mixedContentBlocking = s.mixedContentBlocking;
            silentBlockExtensions = s.silentBlockExtensions;
            blockExtensions = s.blockExtensions;
            warnExtensions = s.warnExtensions;
            openPdfInBrowser = s.openPdfInBrowser;
        }

        public Builder downloadDirectory(Path dir) {
            if (saveFileDirectory == null || saveFileDirectory.equals(downloadDirectory)) {
                saveFileDirectory = dir;
            }
            this.downloadDirectory = dir;
            return this;
        }

        public Builder saveFileDirectory(Path dir) {
            this.saveFileDirectory = dir;
            return this;
        }

        public Builder promptForDownload(boolean prompt) {
            this.promptForDownload = prompt;
            return this;
        }

        public Builder downloadPathManaged(boolean managed) {
            this.downloadPathManaged = managed;
            return this;
        }

        public Builder autoOpenExtensions(Collection<String> extensions) {
            this.autoOpenExtensions = normalize(extensions);
            return this;
        }

        public Builder allowInsecureDownloads(boolean allow) {
            this.allowInsecureDownloads = allow;
            return this;
        }

        public Builder httpsFirstMode(boolean enabled) {
            this.httpsFirstMode = enabled;
            return this;
        }

        public Builder defaultFilename(String name) {
            this.defaultFilename = name;
            return this;
        }

        public Builder unconfirmedPrefix(String prefix) {
            this.unconfirmedPrefix = prefix;
            return this;
        }

        public Builder defaultCharset(String charset) {
            this.defaultCharset = charset;
            return this;
        }

        public Builder downloadRestriction(DownloadRestriction restriction) {
            this.downloadRestriction = restriction;
            return this;
        }

        public Builder dlpBlockedDirectories(List<Path> dirs) {
            this.dlpBlockedDirectories = new ArrayList<>(dirs);
            return this;
        }

        public Builder virtualRoots(Map<Path, Path> roots) {
            this.virtualRoots = new LinkedHashMap<>(roots);
            return this;
        }

        public Builder maxFilenameLength(int length) {
            this.maxFilenameLength = length;
            return this;
        }

        public Builder platform(Platform platform) {
            this.platform = platform;
            return this;
        }

        public Builder mixedContentBlocking(boolean enabled) {
            this.mixedContentBlocking = enabled;
            return this;
        }

        public Builder silentBlockExtensions(Collection<String> extensions) {
            this.silentBlockExtensions = normalize(extensions);
            return this;
        }

        public Builder blockExtensions(Collection<String> extensions) {
            this.blockExtensions = normalize(extensions);
            return this;
        }

        public Builder warnExtensions(Collection<String> extensions) {
            this.warnExtensions = normalize(extensions);
            return this;
        }

        public Builder openPdfInBrowser(boolean enabled) {
            this.openPdfInBrowser = enabled;
            return this;
        }

        private static Set<String> normalize(Collection<String> extensions) {
            Set<String> result = new LinkedHashSet<>();
            extensions.forEach(e -> result.add(normalizeExtension(e)));
            return result;
        }

        public DownloadTargetSettings build() {
            return new DownloadTargetSettings(downloadDirectory, saveFileDirectory, promptForDownload,
                downloadPathManaged, autoOpenExtensions, allowInsecureDownloads, httpsFirstMode, defaultFilename,
                unconfirmedPrefix, defaultCharset, downloadRestriction, dlpBlockedDirectories, virtualRoots,
                maxFilenameLength, platform, mixedContentBlocking, silentBlockExtensions, blockExtensions,
                warnExtensions, openPdfInBrowser);
        }
    }
}
