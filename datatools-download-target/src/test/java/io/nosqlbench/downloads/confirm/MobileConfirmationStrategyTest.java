package io.nosqlbench.downloads.confirm;

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

import io.nosqlbench.downloads.config.DownloadPrefs;
import io.nosqlbench.downloads.config.DownloadTargetSettings;
import io.nosqlbench.downloads.item.DownloadItem;
import io.nosqlbench.downloads.item.DownloadRequest;
import io.nosqlbench.downloads.reservation.DownloadPathReservationTracker;
import io.nosqlbench.downloads.target.ConfirmationOutcome;
import io.nosqlbench.downloads.target.ConfirmationReason;
import io.nosqlbench.downloads.target.ConfirmationResult;
import io.nosqlbench.downloads.target.ConflictAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static org.assertj.core.api.Assertions.assertThat;

class MobileConfirmationStrategyTest {

    @TempDir
    Path tempDir;

    private Path downloads;
    private DownloadPathReservationTracker tracker;
    private final List<DownloadLocationDialog.Type> shown = new ArrayList<>();
    private final List<Path> suggestions = new ArrayList<>();
    private Optional<Path> dialogAnswer = Optional.empty();
    private final DownloadLocationDialog dialog = (item, type, suggested) -> {
        shown.add(type);
        suggestions.add(suggested);
        return CompletableFuture.completedFuture(dialogAnswer);
    };

    @BeforeEach
    void setUp() throws IOException {
        downloads = Files.createDirectories(tempDir.resolve("Downloads"));
        tracker = new DownloadPathReservationTracker(downloads, 255);
    }

    private MobileConfirmationStrategy strategy(DownloadLocationDialog dialog, boolean prompt) {
        DownloadTargetSettings settings = DownloadTargetSettings.builder()
            .downloadDirectory(downloads).promptForDownload(prompt).build();
        return new MobileConfirmationStrategy(dialog, new DownloadPrefs(settings), tracker, Runnable::run);
    }

    private static DownloadItem item() {
        return new DownloadItem(1, DownloadRequest.builder(URI.create("https://example.com/a.pdf")).build());
    }

    private static ConfirmationOutcome outcome(CompletionStage<ConfirmationOutcome> stage) {
        return stage.toCompletableFuture().join();
    }

    @Test
    void testSaveAsContinuesWithoutAnotherPrompt() {
        Path suggested = downloads.resolve("a.pdf");
        ConfirmationOutcome result = outcome(strategy(dialog, false)
            .requestConfirmation(item(), suggested, ConfirmationReason.SAVE_AS));

        assertThat(result).isEqualTo(ConfirmationOutcome.continueWithoutConfirmation(suggested));
        assertThat(shown).isEmpty();
    }

    @Test
    void testWithoutDialogOnlyPreferenceProceeds() {
        MobileConfirmationStrategy headless = strategy(null, true);
        Path suggested = downloads.resolve("a.pdf");

        assertThat(outcome(headless.requestConfirmation(item(), suggested, ConfirmationReason.PREFERENCE)).result())
            .isEqualTo(ConfirmationResult.CONTINUE_WITHOUT_CONFIRMATION);
        assertThat(outcome(headless.requestConfirmation(item(), suggested, ConfirmationReason.TARGET_NO_SPACE)).result())
            .isEqualTo(ConfirmationResult.CANCELED);
    }

    @Test
    void testDialogExplainsTheProblem() {
        Path chosen = tempDir.resolve("sdcard/a.pdf");
        dialogAnswer = Optional.of(chosen);
        MobileConfirmationStrategy strategy = strategy(dialog, false);

        ConfirmationOutcome full = outcome(strategy.requestConfirmation(item(), downloads.resolve("a.pdf"),
            ConfirmationReason.TARGET_NO_SPACE));
        outcome(strategy.requestConfirmation(item(), downloads.resolve("a.pdf"), ConfirmationReason.PATH_NOT_WRITABLE));
        outcome(strategy.requestConfirmation(item(), downloads.resolve("a.pdf"), ConfirmationReason.PREFERENCE));

        assertThat(full).isEqualTo(ConfirmationOutcome.confirmedWithDialog(chosen));
        assertThat(shown).containsExactly(DownloadLocationDialog.Type.LOCATION_FULL,
            DownloadLocationDialog.Type.LOCATION_NOT_FOUND, DownloadLocationDialog.Type.DEFAULT);
    }

    @Test
    void testDismissedDialogCancels() {
        ConfirmationOutcome result = outcome(strategy(dialog, false)
            .requestConfirmation(item(), downloads.resolve("a.pdf"), ConfirmationReason.NAME_TOO_LONG));
        assertThat(result.result()).isEqualTo(ConfirmationResult.CANCELED);
        assertThat(shown).containsExactly(DownloadLocationDialog.Type.NAME_TOO_LONG);
    }

    @Test
    void testConflictPicksUniqueName() throws IOException {
        Files.writeString(downloads.resolve("a.pdf"), "existing");

        ConfirmationOutcome result = outcome(strategy(dialog, false)
            .requestConfirmation(item(), downloads.resolve("a.pdf"), ConfirmationReason.TARGET_CONFLICT));

        assertThat(result).isEqualTo(ConfirmationOutcome.continueWithoutConfirmation(downloads.resolve("a (1).pdf")));
        assertThat(shown).isEmpty();
    }

    @Test
    void testConflictWithPromptingShowsUniqueName() throws IOException {
        Files.writeString(downloads.resolve("a.pdf"), "existing");
        dialogAnswer = Optional.of(downloads.resolve("a (1).pdf"));

        ConfirmationOutcome result = outcome(strategy(dialog, true)
            .requestConfirmation(item(), downloads.resolve("a.pdf"), ConfirmationReason.TARGET_CONFLICT));

        assertThat(result.result()).isEqualTo(ConfirmationResult.CONFIRMED_WITH_DIALOG);
        assertThat(shown).containsExactly(DownloadLocationDialog.Type.NAME_CONFLICT);
        assertThat(suggestions).containsExactly(downloads.resolve("a (1).pdf"));
    }

    @Test
    void testConflictWithoutDialogContinuesWithUniqueName() throws IOException {
        Files.writeString(downloads.resolve("a.pdf"), "existing");

        ConfirmationOutcome quiet = outcome(strategy(null, false)
            .requestConfirmation(item(), downloads.resolve("a.pdf"), ConfirmationReason.TARGET_CONFLICT));
        assertThat(quiet).isEqualTo(ConfirmationOutcome.continueWithoutConfirmation(downloads.resolve("a (1).pdf")));

        DownloadItem second = new DownloadItem(2, DownloadRequest.builder(URI.create("https://example.com/a.pdf")).build());
        ConfirmationOutcome prompting = outcome(strategy(null, true)
            .requestConfirmation(second, downloads.resolve("a.pdf"), ConfirmationReason.TARGET_CONFLICT));
        assertThat(prompting).isEqualTo(ConfirmationOutcome.continueWithoutConfirmation(downloads.resolve("a (2).pdf")));
    }

    @Test
    void testPromptIsTheDefaultConflictAction() {
        assertThat(strategy(dialog, false).defaultConflictAction()).isEqualTo(ConflictAction.PROMPT);
    }
}
