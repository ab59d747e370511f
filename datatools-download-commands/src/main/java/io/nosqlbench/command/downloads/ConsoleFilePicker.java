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

import io.nosqlbench.downloads.confirm.FilePicker;
import io.nosqlbench.downloads.item.DownloadItem;
import io.nosqlbench.downloads.target.ConfirmationReason;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/// A file picker for the terminal.
///
/// The suggested path is shown on the prompt stream and one line is read from the input.
/// An empty line keeps the suggestion, `n`, `no` or `cancel` dismiss the picker, and any
/// other text is taken as the chosen path. Relative answers resolve against the directory
/// of the suggestion.
public class ConsoleFilePicker implements FilePicker {
    private static final Logger logger = LogManager.getLogger(ConsoleFilePicker.class);
    private static final Set<String> DISMISS = Set.of("n", "no", "cancel");

    private final BufferedReader input;
    private final PrintWriter prompt;
    private final boolean acceptSuggested;

    /// @param input where answers are read from
    /// @param prompt where questions are written
    /// @param acceptSuggested if true, every suggestion is accepted without reading input
    public ConsoleFilePicker(BufferedReader input, PrintWriter prompt, boolean acceptSuggested) {
        this.input = input;
        this.prompt = prompt;
        this.acceptSuggested = acceptSuggested;
    }

    @Override
    public CompletionStage<Optional<Path>> pick(DownloadItem item, Path suggestedPath, ConfirmationReason reason) {
        if (acceptSuggested) {
            logger.debug("accepting suggested path {} for download {}", suggestedPath, item.id());
            return CompletableFuture.completedFuture(Optional.of(suggestedPath));
        }
        return CompletableFuture.supplyAsync(() -> ask(suggestedPath, reason));
    }

    Optional<Path> ask(Path suggestedPath, ConfirmationReason reason) {
        prompt.printf("Save download (%s) as [%s]: ", describe(reason), suggestedPath);
        prompt.flush();
        String line;
        try {
            line = input.readLine();
        } catch (IOException e) {
            logger.warn("unable to read an answer from the console", e);
            return Optional.empty();
        }
        if (line == null) {
            return Optional.empty();
        }
        String answer = line.strip();
        if (answer.isEmpty()) {
            return Optional.of(suggestedPath);
        }
        if (DISMISS.contains(answer.toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        Path chosen = Path.of(answer);
        if (!chosen.isAbsolute()) {
            Path parent = suggestedPath.getParent();
            chosen = parent == null ? chosen.toAbsolutePath() : parent.resolve(chosen);
        }
        return Optional.of(chosen.normalize());
    }

    private static String describe(ConfirmationReason reason) {
        switch (reason) {
            case TARGET_CONFLICT:
                return "a file with this name exists";
            case TARGET_NO_SPACE:
                return "not enough space";
            case PATH_NOT_WRITABLE:
                return "directory is not writeable";
            case NAME_TOO_LONG:
                return "name is too long";
            case DLP_BLOCKED:
                return "location is blocked by policy";
            default:
                return "confirm location";
        }
    }
}
