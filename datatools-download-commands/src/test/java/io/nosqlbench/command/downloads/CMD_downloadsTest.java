package io.nosqlbench.command.downloads;

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

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CMD_downloadsTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = new CommandLine(new CMD_downloads()).setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void testClassifyText() {
        int exitCode = run("classify", "setup.scr");

        assertThat(exitCode).isEqualTo(0);
        String output = out.toString();
        assertThat(output).contains("dangerLevel:");
        assertThat(output).contains("DANGEROUS");
    }

    @Test
    void testClassifyJson() throws IOException {
        int exitCode = run("classify", "--format", "json", "paper.pdf");

        assertThat(exitCode).isEqualTo(0);
        JsonNode json = DownloadsCliSupport.MAPPER.readTree(out.toString());
        assertThat(json.get("filename").asText()).isEqualTo("paper.pdf");
        assertThat(json.get("dangerLevel").asText()).isEqualTo("NOT_DANGEROUS");
        assertThat(json.get("checkedBinary").asBoolean()).isTrue();
    }

    @Test
    void testResolveIntoDownloadDirectory() throws IOException {
        int exitCode = run("resolve", "--download-dir", tempDir.toString(), "--yes", "--format", "json",
            "https://example.com/files/report.txt");

        assertThat(exitCode).as(err.toString()).isEqualTo(0);
        JsonNode json = DownloadsCliSupport.MAPPER.readTree(out.toString());
        assertThat(json.get("target").asText()).isEqualTo(tempDir.resolve("report.txt").toString());
        assertThat(json.get("intermediate").asText()).isEqualTo(tempDir.resolve("report.txt.crdownload").toString());
        assertThat(json.get("interruptReason").asText()).isEqualTo("NONE");
    }

    @Test
    void testResolveUsesContentDisposition() throws IOException {
        int exitCode = run("resolve", "--download-dir", tempDir.toString(), "-y", "--format", "JSON",
            "--content-disposition", "attachment; filename=\"summary.txt\"", "https://example.com/get?id=4");

        assertThat(exitCode).as(err.toString()).isEqualTo(0);
        JsonNode json = DownloadsCliSupport.MAPPER.readTree(out.toString());
        assertThat(json.get("target").asText()).isEqualTo(tempDir.resolve("summary.txt").toString());
    }

    @Test
    void testResolveForcedPath() throws IOException {
        Path forced = tempDir.resolve("exact.bin");
        int exitCode = run("resolve", "--download-dir", tempDir.toString(), "-y", "--format", "json",
            "--forced-path", forced.toString(), "https://example.com/report.txt");

        assertThat(exitCode).as(err.toString()).isEqualTo(0);
        JsonNode json = DownloadsCliSupport.MAPPER.readTree(out.toString());
        assertThat(json.get("target").asText()).isEqualTo(forced.toString());
    }

    @Test
    void testBlockedByConfiguredRestriction() throws IOException {
        Path config = Files.writeString(tempDir.resolve("downloads.yaml"), "download_restriction: all_files\n");
        int exitCode = run("resolve", "--config", config.toString(), "--download-dir", tempDir.toString(), "-y",
            "https://example.com/report.txt");

        assertThat(exitCode).isEqualTo(DownloadsCliSupport.EXIT_NOT_RESOLVED);
        assertThat(out.toString()).contains("FILE_BLOCKED");
    }

    @Test
    void testMissingConfigIsReported() {
        int exitCode = run("resolve", "--config", tempDir.resolve("absent.yaml").toString(),
            "https://example.com/report.txt");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error:");
    }
}
