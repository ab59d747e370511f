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

import io.nosqlbench.downloads.target.DangerLevel;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Per-extension download danger ratings.
///
/// Types rated [DangerLevel#ALLOW_ON_USER_GESTURE] are safe when the user plainly asked for
/// them; [DangerLevel#DANGEROUS] types always need a warning. Checked binaries are types
/// whose content is inspected by safety checks and whose extension must not be rewritten.
public final class FileTypePolicies {

    private static final Set<String> DEFAULT_DANGEROUS = Set.of(
        "application", "cpl", "gadget", "hta", "inf", "ins", "isp", "jse", "msc", "msh", "msh1", "msh2",
        "mshxml", "mst", "pif", "ps1", "ps1xml", "ps2", "ps2xml", "psc1", "psc2", "reg", "scr", "sct",
        "shb", "vbe", "vbs", "ws", "wsc", "wsf", "wsh", "xbap", "crx");

    private static final Set<String> DEFAULT_ALLOW_ON_GESTURE = Set.of(
        "exe", "com", "bat", "cmd", "msi", "msp", "dll", "jar", "jnlp", "js", "dmg", "pkg", "mpkg", "app",
        "command", "apk", "deb", "rpm", "sh", "run", "appimage", "py", "pl", "rb", "swf", "xpi");

    private static final Set<String> DEFAULT_CHECKED_ARCHIVES_AND_DOCUMENTS = Set.of(
        "zip", "rar", "7z", "tar", "gz", "tgz", "bz2", "xz", "iso", "img", "vhd", "cab", "arj", "lzh",
        "doc", "docm", "xls", "xlsm", "ppt", "pptm", "pdf", "rtf");

    private final Map<String, DangerLevel> levels;
    private final Set<String> checkedBinaries;

    public FileTypePolicies(Map<String, DangerLevel> levels, Set<String> checkedBinaries) {
        this.levels = normalizeKeys(levels);
        Set<String> checked = new HashSet<>();
        checkedBinaries.forEach(e -> checked.add(normalize(e)));
        this.checkedBinaries = Set.copyOf(checked);
    }

    public static FileTypePolicies defaults() {
        Map<String, DangerLevel> levels = new HashMap<>();
        DEFAULT_DANGEROUS.forEach(e -> levels.put(e, DangerLevel.DANGEROUS));
        DEFAULT_ALLOW_ON_GESTURE.forEach(e -> levels.put(e, DangerLevel.ALLOW_ON_USER_GESTURE));
        Set<String> checked = new HashSet<>(levels.keySet());
        checked.addAll(DEFAULT_CHECKED_ARCHIVES_AND_DOCUMENTS);
        return new FileTypePolicies(levels, checked);
    }

    /// @param filename a file name or path string
    /// @return the danger rating of the name's extension
    public DangerLevel dangerLevel(String filename) {
        return extensionOf(filename).map(e -> levels.getOrDefault(e, DangerLevel.NOT_DANGEROUS))
            .orElse(DangerLevel.NOT_DANGEROUS);
    }

    /// @param filename a file name or path string
    /// @return true if content of this type is inspected by safety checks
    public boolean isCheckedBinaryFile(String filename) {
        return extensionOf(filename).map(checkedBinaries::contains).orElse(false);
    }

    private static Optional<String> extensionOf(String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        int sep = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        String name = sep >= 0 ? filename.substring(sep + 1) : filename;
        return SafeFileNames.extension(name).map(FileTypePolicies::normalize);
    }

    private static String normalize(String extension) {
        String e = extension.startsWith(".") ? extension.substring(1) : extension;
        return e.toLowerCase(Locale.ROOT);
    }

    private static Map<String, DangerLevel> normalizeKeys(Map<String, DangerLevel> in) {
        Map<String, DangerLevel> out = new HashMap<>();
        in.forEach((k, v) -> out.put(normalize(k), v));
        return Map.copyOf(out);
    }
}
