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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.nosqlbench.downloads.target.TargetInfo;
import io.nosqlbench.downloads.target.TargetResolution;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/// Output helpers shared by the downloads commands.
public final class DownloadsCliSupport {

    public static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /// Exit code for a resolution that ended canceled or blocked.
    public static final int EXIT_NOT_RESOLVED = 3;

    private DownloadsCliSupport() {
    }

    /// Log the invocation at debug level without polluting stdout.
    public static void logInvocation(CommandLine.Model.CommandSpec spec, Logger logger) {
        CommandLine.ParseResult parseResult = spec.commandLine().getParseResult();
        if (parseResult != null) {
            logger.debug("downloads invocation: {}", parseResult.originalArgs());
        }
    }

    public static void writeJson(PrintWriter out, Object value) throws JsonProcessingException {
        out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value));
        out.flush();
    }

    /// Flattens a resolution into ordered fields for text or JSON output.
    public static Map<String, Object> describe(TargetResolution resolution) {
        TargetInfo info = resolution.info();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("target", pathText(info.targetPath()));
        fields.put("intermediate", pathText(info.intermediatePath()));
        fields.put("mimeType", info.mimeType());
        fields.put("handledSafely", info.isFiletypeHandledSafely());
        fields.put("disposition", info.targetDisposition().name());
        fields.put("dangerType", info.dangerType().name());
        fields.put("dangerLevel", resolution.dangerLevel().name());
        fields.put("insecureDownloadStatus", info.insecureDownloadStatus().name());
        fields.put("interruptReason", info.interruptReason().name());
        return fields;
    }

    public static void writeText(PrintWriter out, Map<String, Object> fields) {
        int width = fields.keySet().stream().mapToInt(String::length).max().orElse(0) + 2;
        fields.forEach((key, value) -> out.printf("%-" + width + "s%s%n", key + ":", value));
        out.flush();
    }

    private static String pathText(Path path) {
        return path == null ? "" : path.toString();
    }
}
