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

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/// Helpers that turn untrusted names into names that are safe to create on any platform.
public final class SafeFileNames {

    /// Extensions the Windows shell treats specially when a file with that suffix is opened.
    private static final Set<String> SHELL_INTEGRATED_EXTENSIONS = Set.of("lnk", "local", "url", "scf");

    private static final Set<String> RESERVED_BASE_NAMES = Set.of(
        "con", "prn", "aux", "nul", "clock$",
        "com1", "com2", "com3", "com4", "com5", "com6", "com7", "com8", "com9",
        "lpt1", "lpt2", "lpt3", "lpt4", "lpt5", "lpt6", "lpt7", "lpt8", "lpt9");

    private static final String ILLEGAL = "<>:\"/\\|?*";

    private SafeFileNames() {
    }

    /// @param name a file name
    /// @return the text after the last dot, if the dot is not the first character
    public static Optional<String> extension(String name) {
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(name.substring(dot + 1));
    }

    /// @param name a file name
    /// @return the name without its extension
    public static String baseName(String name) {
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }

    /// @param name a file name
    /// @param extension the new extension without a dot, or "" to drop it
    /// @return the name with its extension replaced
    public static String replaceExtension(String name, String extension) {
        String base = baseName(name);
        return extension.isEmpty() ? base : base + "." + extension;
    }

    /// Reduces an untrusted name to a single safe path component.
    ///
    /// Directory parts are dropped, control and reserved characters become the replacement
    /// character, and leading or trailing dots and whitespace are trimmed.
    /// @param name an untrusted name, possibly containing separators
    /// @param replacement the character used in place of illegal ones
    /// @return the sanitized name, which may be empty
    public static String sanitize(String name, char replacement) {
        if (name == null) {
            return "";
        }
        String last = name;
        int sep = Math.max(last.lastIndexOf('/'), last.lastIndexOf('\\'));
        if (sep >= 0) {
            last = last.substring(sep + 1);
        }
        StringBuilder sb = new StringBuilder(last.length());
        for (int i = 0; i < last.length(); i++) {
            char c = last.charAt(i);
            if (Character.isISOControl(c) || ILLEGAL.indexOf(c) >= 0) {
                sb.append(replacement);
            } else {
                sb.append(c);
            }
        }
        return trimDotsAndWhitespace(sb.toString());
    }

    private static String trimDotsAndWhitespace(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && (s.charAt(start) == '.' || Character.isWhitespace(s.charAt(start)))) {
            start++;
        }
        while (end > start && (s.charAt(end - 1) == '.' || Character.isWhitespace(s.charAt(end - 1)))) {
            end--;
        }
        return s.substring(start, end);
    }

    /// @param name a file name
    /// @return true if the base name is reserved by Windows regardless of extension
    public static boolean isReservedName(String name) {
        String base = name;
        int dot = base.indexOf('.');
        if (dot >= 0) {
            base = base.substring(0, dot);
        }
        return RESERVED_BASE_NAMES.contains(base.trim().toLowerCase(Locale.ROOT));
    }

    /// @param extension an extension without a dot
    /// @return true if the shell handles files with this extension specially
    public static boolean isShellIntegratedExtension(String extension) {
        String e = extension.toLowerCase(Locale.ROOT);
        return SHELL_INTEGRATED_EXTENSIONS.contains(e) || (e.startsWith("{") && e.endsWith("}"));
    }

    /// Makes a name safe to create, given the MIME type of its content.
    ///
    /// When `ignoreExtension` is set or the name has no extension, the preferred extension
    /// for the MIME type is used, if one is known. Shell integrated extensions are
    /// replaced with `download` and reserved names are prefixed with an underscore.
    /// @param name a sanitized file name
    /// @param mimeType the MIME type of the content, possibly empty
    /// @param ignoreExtension whether the current extension should be replaced
    /// @return the safe name
    public static String generateSafeFileName(String name, String mimeType, boolean ignoreExtension) {
        String result = name;
        Optional<String> current = extension(result);
        if (ignoreExtension || current.isEmpty()) {
            Optional<String> preferred = preferredExtensionFor(mimeType, current);
            if (preferred.isPresent()) {
                result = replaceExtension(result, preferred.get());
            }
        }
        Optional<String> ext = extension(result);
        if (ext.isPresent() && isShellIntegratedExtension(ext.get())) {
            result = replaceExtension(result, "download");
        }
        if (isReservedName(result)) {
            result = "_" + result;
        }
        return result;
    }

    private static Optional<String> preferredExtensionFor(String mimeType, Optional<String> current) {
        String type = MimeTypes.essence(mimeType);
        if (type.isEmpty() || type.equals(MimeTypes.OCTET_STREAM)) {
            return Optional.empty();
        }
        if (current.isPresent()
            && MimeTypes.extensions(type).contains(current.get().toLowerCase(Locale.ROOT))) {
            return current;
        }
        return MimeTypes.preferredExtension(type);
    }

    /// Shortens a name to fit a length limit, keeping its extension.
    /// @param name a file name
    /// @param maxLength the limit in characters
    /// @return the shortened name, or empty if the extension alone does not fit
    public static Optional<String> truncate(String name, int maxLength) {
        if (name.length() <= maxLength) {
            return Optional.of(name);
        }
        Optional<String> ext = extension(name);
        String suffix = ext.map(e -> "." + e).orElse("");
        int room = maxLength - suffix.length();
        if (room <= 0) {
            return Optional.empty();
        }
        String base = baseName(name);
        return Optional.of(base.substring(0, Math.min(room, base.length())) + suffix);
    }
}
