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
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class InsecureDownloadClassifierTest {

    private static final URI SECURE_PAGE = URI.create("https://shop.example.com/catalog");

    private static DownloadTargetSettings.Builder settings() {
        return DownloadTargetSettings.builder().downloadDirectory(Path.of("/home/user/Downloads"));
    }

    private static InsecureDownloadStatus classify(DownloadTargetSettings settings, DownloadRequest request,
                                                   String filename) {
        return new InsecureDownloadClassifier(settings).classify(request, Path.of("/home/user/Downloads", filename));
    }

    private static DownloadRequest.Builder request(String url) {
        return DownloadRequest.builder(URI.create(url));
    }

    @Test
    void testSecureDownloadsAreSafe() {
        assertThat(classify(settings().build(), request("https://example.com/setup.exe").build(), "setup.exe"))
            .isEqualTo(InsecureDownloadStatus.SAFE);
        assertThat(classify(settings().build(),
            request("https://example.com/setup.exe").initiator(SECURE_PAGE).build(), "setup.exe"))
            .isEqualTo(InsecureDownloadStatus.SAFE);
    }

    @Test
    void testInsecureDownloadWithoutSecureInitiator() {
        DownloadRequest request = request("http://example.com/setup.exe").build();
        assertThat(classify(settings().build(), request, "setup.exe")).isEqualTo(InsecureDownloadStatus.BLOCK);

        DownloadRequest image = request("http://example.com/photo.png").build();
        assertThat(classify(settings().build(), image, "photo.png")).isEqualTo(InsecureDownloadStatus.SAFE);
        assertThat(classify(settings().httpsFirstMode(true).build(), image, "photo.png"))
            .isEqualTo(InsecureDownloadStatus.BLOCK);
    }

    @Test
    void testInsecureRedirectHop() {
        DownloadRequest request = request("https://cdn.example.com/setup.exe")
            .redirectedFrom(URI.create("http://example.com/get")).build();
        assertThat(classify(settings().build(), request, "setup.exe")).isEqualTo(InsecureDownloadStatus.BLOCK);
    }

    @Test
    void testMixedContentFollowsExtensionLists() {
        DownloadRequest archive = request("http://files.example.com/a.zip").initiator(SECURE_PAGE).build();
        DownloadRequest program = request("http://files.example.com/a.exe").initiator(SECURE_PAGE).build();
        DownloadTargetSettings lists = settings()
            .silentBlockExtensions(Set.of("exe"))
            .blockExtensions(Set.of("zip"))
            .warnExtensions(Set.of("pdf"))
            .build();

        assertThat(classify(settings().build(), archive, "a.zip")).isEqualTo(InsecureDownloadStatus.WARN);
        assertThat(classify(lists, archive, "a.zip")).isEqualTo(InsecureDownloadStatus.BLOCK);
        assertThat(classify(lists, program, "a.exe")).isEqualTo(InsecureDownloadStatus.SILENT_BLOCK);
        assertThat(classify(lists, request("http://files.example.com/a.txt").initiator(SECURE_PAGE).build(), "a.txt"))
            .isEqualTo(InsecureDownloadStatus.SAFE);
    }

    @Test
    void testExplicitUserActionsAreNeverSilentlyBlocked() {
        DownloadTargetSettings silent = settings().silentBlockExtensions(Set.of("*")).build();
        DownloadRequest contextMenu = request("http://files.example.com/a.exe").initiator(SECURE_PAGE)
            .source(DownloadSource.CONTEXT_MENU).build();
        assertThat(classify(silent, contextMenu, "a.exe")).isEqualTo(InsecureDownloadStatus.BLOCK);
    }

    @Test
    void testTabUrlStandsInForInitiator() {
        DownloadRequest request = request("http://files.example.com/a.zip").tabUrl(SECURE_PAGE).build();
        assertThat(classify(settings().build(), request, "a.zip")).isEqualTo(InsecureDownloadStatus.WARN);
    }

    @Test
    void testExemptions() {
        assertThat(classify(settings().build(), request("http://localhost:8080/a.exe").build(), "a.exe"))
            .isEqualTo(InsecureDownloadStatus.SAFE);
        assertThat(classify(settings().build(),
            request("http://example.com/a.exe").transition(PageTransition.RELOAD).build(), "a.exe"))
            .isEqualTo(InsecureDownloadStatus.SAFE);
        assertThat(classify(settings().build(),
            request("http://example.com/a.exe").source(DownloadSource.EXTENSION_API).build(), "a.exe"))
            .isEqualTo(InsecureDownloadStatus.SAFE);
        assertThat(classify(settings().allowInsecureDownloads(true).build(),
            request("http://example.com/a.exe").build(), "a.exe"))
            .isEqualTo(InsecureDownloadStatus.SAFE);
    }

    @Test
    void testTypedNavigationIsNotMixedContent() {
        DownloadRequest typed = request("http://files.example.com/a.zip").initiator(SECURE_PAGE)
            .transition(PageTransition.TYPED).build();
        assertThat(classify(settings().build(), typed, "a.zip")).isEqualTo(InsecureDownloadStatus.BLOCK);
    }

    @Test
    void testMixedContentBlockingDisabled() {
        DownloadRequest archive = request("http://files.example.com/a.zip").initiator(SECURE_PAGE).build();
        assertThat(classify(settings().mixedContentBlocking(false).build(), archive, "a.zip"))
            .isEqualTo(InsecureDownloadStatus.SAFE);
    }
}
