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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SafeFileNamesTest {

    @Test
    void testSanitize() {
        assertThat(SafeFileNames.sanitize("a/b\\c:d?.txt", '_')).isEqualTo("c_d_.txt");
        assertThat(SafeFileNames.sanitize("..hidden.. ", '_')).isEqualTo("hidden");
        assertThat(SafeFileNames.sanitize("tab\there", '-')).isEqualTo("tab-here");
        assertThat(SafeFileNames.sanitize(null, '_')).isEmpty();
    }

    @Test
    void testExtension() {
        assertThat(SafeFileNames.extension("archive.tar.gz")).contains("gz");
        assertThat(SafeFileNames.extension(".bashrc")).isEmpty();
        assertThat(SafeFileNames.extension("trailing.")).isEmpty();
        assertThat(SafeFileNames.replaceExtension("notes.md", "txt")).isEqualTo("notes.txt");
        assertThat(SafeFileNames.replaceExtension("notes.md", "")).isEqualTo("notes");
    }

    @Test
    void testReservedAndShellIntegratedNames() {
        assertThat(SafeFileNames.isReservedName("CON.txt")).isTrue();
        assertThat(SafeFileNames.isReservedName("console.txt")).isFalse();
        assertThat(SafeFileNames.generateSafeFileName("con.txt", "", false)).isEqualTo("_con.txt");
        assertThat(SafeFileNames.generateSafeFileName("shortcut.lnk", "", false)).isEqualTo("shortcut.download");
        assertThat(SafeFileNames.isShellIntegratedExtension("{20D04FE0-3AEA-1069-A2D8-08002B30309D}")).isTrue();
    }

    @Test
    void testMimeTypeExtension() {
        assertThat(SafeFileNames.generateSafeFileName("page", "text/html; charset=utf-8", false)).isEqualTo("page.html");
        assertThat(SafeFileNames.generateSafeFileName("image.jpeg", "image/jpeg", true)).isEqualTo("image.jpeg");
        assertThat(SafeFileNames.generateSafeFileName("blob", "application/octet-stream", true)).isEqualTo("blob");
    }

    @Test
    void testTruncateKeepsExtension() {
        assertThat(SafeFileNames.truncate("abcdefghij.txt", 8)).contains("abcd.txt");
        assertThat(SafeFileNames.truncate("short.txt", 64)).contains("short.txt");
        assertThat(SafeFileNames.truncate("a.verylongextension", 5)).isEmpty();
    }
}
