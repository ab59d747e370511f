package io.nosqlbench.downloads.local;

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

import io.nosqlbench.downloads.item.DownloadItem;
import io.nosqlbench.downloads.item.DownloadRequest;
import io.nosqlbench.downloads.target.LocalPathResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MappedLocalPathResolverTest {

    @TempDir
    Path tempDir;

    private final DownloadItem item =
        new DownloadItem(7, DownloadRequest.builder(URI.create("https://example.com/a.pdf")).build());

    @Test
    void testVirtualPathUnderRootIsBackedByCache() {
        Path virtualRoot = tempDir.resolve("drive");
        Path cache = tempDir.resolve("cache");
        MappedLocalPathResolver resolver = new MappedLocalPathResolver(Map.of(virtualRoot, cache));

        LocalPathResult result = resolver.resolve(item, virtualRoot.resolve("docs/a.pdf"));

        assertThat(result.localPath()).isEqualTo(cache.resolve("docs/a.pdf"));
        assertThat(result.displayName()).isEqualTo("a.pdf");
        assertThat(cache.resolve("docs")).isDirectory();
    }

    @Test
    void testPathOutsideRootsIsAlreadyLocal() {
        MappedLocalPathResolver resolver =
            new MappedLocalPathResolver(Map.of(tempDir.resolve("drive"), tempDir.resolve("cache")));
        Path plain = tempDir.resolve("Downloads/a.pdf");

        assertThat(resolver.resolve(item, plain)).isEqualTo(LocalPathResult.of(plain));
        assertThat(resolver.resolve(item, tempDir.resolve("drive")).localPath()).isEqualTo(tempDir.resolve("drive"));
    }

    @Test
    void testUnpreparableCacheFails() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
        MappedLocalPathResolver resolver = new MappedLocalPathResolver(Map.of(tempDir.resolve("drive"), blocker));

        assertThat(resolver.resolve(item, tempDir.resolve("drive/docs/a.pdf")).isEmpty()).isTrue();
    }

    @Test
    void testIdentityKeepsPath() {
        Path path = tempDir.resolve("a.pdf");
        assertThat(LocalPathResolver.IDENTITY.resolve(item, path).path()).contains(path);
    }
}
