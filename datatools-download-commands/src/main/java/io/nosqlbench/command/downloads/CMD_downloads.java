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

import io.nosqlbench.downloads.config.DownloadTargetSettings;
import io.nosqlbench.downloads.item.DownloadItem;
import io.nosqlbench.downloads.item.DownloadRequest;
import io.nosqlbench.downloads.item.InterruptReason;
import io.nosqlbench.downloads.item.PageTransition;
import io.nosqlbench.downloads.item.TargetDisposition;
import io.nosqlbench.downloads.naming.FileTypePolicies;
import io.nosqlbench.downloads.service.DownloadTargetService;
import io.nosqlbench.downloads.target.DangerLevel;
import io.nosqlbench.downloads.target.TargetResolution;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;

@CommandLine.Command(name = "downloads",
    header = "Resolve download targets",
    description = "Work out where a download would be saved and how risky it is.",
    subcommands = {
        CMD_downloads_resolve.class,
        CMD_downloads_classify.class,
        CommandLine.HelpCommand.class
    })
public class CMD_downloads implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    enum Format {
        text,
        json
    }
}

@CommandLine.Command(name = "resolve", description = "Resolve the target path of a download from its URL and headers")
class CMD_downloads_resolve implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_downloads_resolve.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "URL of the download")
    private URI url;

    @CommandLine.Option(names = {"--suggested-name"}, description = "File name suggested by the page")
    private String suggestedName;

    @CommandLine.Option(names = {"--content-disposition"}, description = "Content-Disposition response header")
    private String contentDisposition;

    @CommandLine.Option(names = {"--mime"}, description = "MIME type of the response")
    private String mimeType;

    @CommandLine.Option(names = {"--original-mime"}, description = "MIME type before any content conversion")
    private String originalMimeType;

    @CommandLine.Option(names = {"--referrer"}, description = "Referrer URL")
    private URI referrer;

    @CommandLine.Option(names = {"--forced-path"}, description = "Absolute path the download must be saved to")
    private Path forcedPath;

    @CommandLine.Option(names = {"--transient"}, description = "Treat the download as transient (no UI, no prompts)")
    private boolean transientDownload;

    @CommandLine.Option(names = {"--save-as"}, description = "Ask for the location as if \"Save As\" was chosen")
    private boolean saveAs;

    @CommandLine.Option(names = {"--gesture"}, description = "The download was started by a user gesture")
    private boolean gesture;

    @CommandLine.Option(names = {"--address-bar"}, description = "The download was started from the address bar")
    private boolean addressBar;

    @CommandLine.Option(names = {"--config"}, description = "YAML settings file")
    private Path config;

    @CommandLine.Option(names = {"--download-dir"}, description = "Override the default download directory")
    private Path downloadDir;

    @CommandLine.Option(names = {"--prompt"}, description = "Ask for the location of every download")
    private boolean prompt;

    @CommandLine.Option(names = {"--yes", "-y"}, description = "Accept every suggested location without asking")
    private boolean yes;

    @CommandLine.Option(names = {"--format"}, defaultValue = "text", description = "Output format: text|json")
    private CMD_downloads.Format format;

    @Override
    public Integer call() {
        DownloadsCliSupport.logInvocation(spec, logger);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            DownloadTargetSettings settings = settings();
            DownloadItem item = new DownloadItem(1, request());
            ConsoleFilePicker picker = new ConsoleFilePicker(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), err, yes);

            TargetResolution resolution;
            try (DownloadTargetService service = DownloadTargetService.builder(settings).filePicker(picker).build()) {
                resolution = service.determineTarget(item).join();
            }

            Map<String, Object> fields = DownloadsCliSupport.describe(resolution);
            if (format == CMD_downloads.Format.json) {
                DownloadsCliSupport.writeJson(out, fields);
            } else {
                DownloadsCliSupport.writeText(out, fields);
            }
            if (resolution.succeeded()) {
                return 0;
            }
            return resolution.canceled() || resolution.info().interruptReason() == InterruptReason.FILE_BLOCKED
                ? DownloadsCliSupport.EXIT_NOT_RESOLVED : 1;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            err.println("Error: " + cause.getMessage());
            logger.debug("downloads resolve failed", e);
            return 1;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            logger.debug("downloads resolve failed", e);
            return 1;
        }
    }

    DownloadTargetSettings settings() {
        DownloadTargetSettings base = config == null ? DownloadTargetSettings.defaults() : DownloadTargetSettings.load(config);
        DownloadTargetSettings.Builder builder = base.toBuilder();
        if (downloadDir != null) {
            builder.downloadDirectory(downloadDir.toAbsolutePath().normalize());
        }
        if (prompt) {
            builder.promptForDownload(true);
        }
        return builder.build();
    }

    DownloadRequest request() {
        DownloadRequest.Builder builder = DownloadRequest.builder(url)
            .suggestedFilename(suggestedName)
            .contentDisposition(contentDisposition)
            .mimeType(mimeType)
            .transientDownload(transientDownload)
            .userGesture(gesture);
        if (originalMimeType != null) {
            builder.originalMimeType(originalMimeType);
        }
        if (referrer != null) {
            builder.referrer(referrer);
        }
        if (forcedPath != null) {
            builder.forcedPath(forcedPath.toAbsolutePath().normalize());
        }
        if (saveAs) {
            builder.targetDisposition(TargetDisposition.PROMPT);
        }
        if (addressBar) {
            builder.transition(PageTransition.TYPED, PageTransition.FROM_ADDRESS_BAR);
        } else {
            builder.transition(PageTransition.LINK);
        }
        return builder.build();
    }
}

@CommandLine.Command(name = "classify", description = "Show the danger level of a file type")
class CMD_downloads_classify implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_downloads_classify.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "File name to classify")
    private String filename;

    @CommandLine.Option(names = {"--format"}, defaultValue = "text", description = "Output format: text|json")
    private CMD_downloads.Format format;

    @Override
    public Integer call() {
        DownloadsCliSupport.logInvocation(spec, logger);
        PrintWriter out = spec.commandLine().getOut();
        FileTypePolicies policies = FileTypePolicies.defaults();
        DangerLevel level = policies.dangerLevel(filename);
        boolean checked = policies.isCheckedBinaryFile(filename);

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("filename", filename);
        fields.put("dangerLevel", level.name());
        fields.put("checkedBinary", checked);
        try {
            if (format == CMD_downloads.Format.json) {
                DownloadsCliSupport.writeJson(out, fields);
            } else {
                DownloadsCliSupport.writeText(out, fields);
            }
        } catch (Exception e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            logger.debug("downloads classify failed", e);
            return 1;
        }
        return 0;
    }
}
