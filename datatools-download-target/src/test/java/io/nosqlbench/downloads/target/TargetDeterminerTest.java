package io.nosqlbench.downloads.target;

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
import io.nosqlbench.downloads.item.DangerType;
import io.nosqlbench.downloads.item.DownloadItem;
import io.nosqlbench.downloads.item.DownloadRequest;
import io.nosqlbench.downloads.item.InsecureDownloadStatus;
import io.nosqlbench.downloads.item.InterruptReason;
import io.nosqlbench.downloads.item.PageTransition;
import io.nosqlbench.downloads.item.TargetDisposition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TargetDeterminerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path downloads;
    private ScriptedDelegate delegate;
    private final List<TargetResolution> results = new ArrayList<>();

    @BeforeEach
    void setUp() {
        downloads = tempDir.resolve("Downloads");
        delegate = new ScriptedDelegate();
        results.clear();
    }

    private DeterminerEnvironment environment(DownloadTargetSettings settings) {
        return DeterminerEnvironment.of(new DownloadPrefs(settings), ConflictAction.UNIQUIFY, Runnable::run)
            .withClock(CLOCK)
            .withUnconfirmedNumbers(() -> 4242);
    }

    private DownloadTargetSettings settings() {
        return DownloadTargetSettings.builder().downloadDirectory(downloads).build();
    }

    private TargetDeterminer start(DownloadItem item) {
        return start(item, environment(settings()));
    }

    private TargetDeterminer start(DownloadItem item, DeterminerEnvironment env) {
        return TargetDeterminer.start(item, delegate, env, results::add);
    }

    private static DownloadRequest.Builder request(String url) {
        return DownloadRequest.builder(URI.create(url));
    }

    private TargetInfo onlyResult() {
        assertThat(results).hasSize(1);
        return results.get(0).info();
    }

    @Test
    void testGeneratesTargetFromUrl() {
        delegate.mimeType = "application/pdf";
        delegate.handledSafely = true;
        start(new DownloadItem(1, request("https://example.com/files/report.pdf").mimeType("application/pdf").build()));

        TargetInfo info = onlyResult();
        assertThat(info.interruptReason()).isEqualTo(InterruptReason.NONE);
        assertThat(info.targetPath()).isEqualTo(downloads.resolve("report.pdf"));
        assertThat(info.intermediatePath()).isEqualTo(downloads.resolve("report.pdf.crdownload"));
        assertThat(info.mimeType()).isEqualTo("application/pdf");
        assertThat(info.isFiletypeHandledSafely()).isTrue();
        assertThat(info.targetDisposition()).isEqualTo(TargetDisposition.OVERWRITE);
        assertThat(info.dangerType()).isEqualTo(DangerType.NOT_DANGEROUS);
        assertThat(info.insecureDownloadStatus()).isEqualTo(InsecureDownloadStatus.SAFE);
        assertThat(delegate.reservedConflictAction).isEqualTo(ConflictAction.UNIQUIFY);
        assertThat(delegate.calls).contains(TargetResolutionState.NOTIFY_COLLABORATORS)
            .doesNotContain(TargetResolutionState.PROMPT_USER_FOR_DOWNLOAD_PATH);
    }

    @Test
    void testForcedPathIsWrittenDirectly() {
        Path forced = tempDir.resolve("forced/out.bin");
        start(new DownloadItem(2, request("https://example.com/data").forcedPath(forced).build()));

        TargetInfo info = onlyResult();
        assertThat(info.targetPath()).isEqualTo(forced);
        assertThat(info.intermediatePath()).isEqualTo(forced);
        assertThat(info.targetDisposition()).isEqualTo(TargetDisposition.OVERWRITE);
        assertThat(delegate.reservedConflictAction).isEqualTo(ConflictAction.OVERWRITE);
        assertThat(delegate.calls).doesNotContain(TargetResolutionState.NOTIFY_COLLABORATORS);
    }

    @Test
    void testReservationRenamesConflictingTarget() {
        delegate.reservation = path -> new PathReservation(PathValidationResult.SUCCESS_RESOLVED_CONFLICT,
            path.resolveSibling("report (1).pdf"));
        start(new DownloadItem(3, request("https://example.com/report.pdf").build()));

        TargetInfo info = onlyResult();
        assertThat(info.targetPath()).isEqualTo(downloads.resolve("report (1).pdf"));
        assertThat(info.intermediatePath()).isEqualTo(downloads.resolve("report (1).pdf.crdownload"));
        assertThat(delegate.calls).doesNotContain(TargetResolutionState.PROMPT_USER_FOR_DOWNLOAD_PATH);
    }

    @Test
    void testUnresolvedConflictPromptsAndCancelEndsResolution() {
        delegate.reservation = path -> new PathReservation(PathValidationResult.CONFLICT, path);
        delegate.confirmation = path -> ConfirmationOutcome.canceled();
        start(new DownloadItem(4, request("https://example.com/report.pdf").build()));

        TargetInfo info = onlyResult();
        assertThat(delegate.confirmationReason).isEqualTo(ConfirmationReason.TARGET_CONFLICT);
        assertThat(info.interruptReason()).isEqualTo(InterruptReason.USER_CANCELED);
        assertThat(delegate.calls).doesNotContain(TargetResolutionState.DETERMINE_LOCAL_PATH);
    }

    @Test
    void testConfirmedPathBecomesTargetAndNextSaveDirectory() {
        Path picked = tempDir.resolve("elsewhere/picked.pdf");
        delegate.confirmation = path -> ConfirmationOutcome.confirmed(picked);
        DownloadTargetSettings settings = settings().toBuilder().promptForDownload(true).build();
        DeterminerEnvironment env = environment(settings);
        start(new DownloadItem(5, request("https://example.com/report.pdf").build()), env);

        TargetInfo info = onlyResult();
        assertThat(delegate.confirmationReason).isEqualTo(ConfirmationReason.PREFERENCE);
        assertThat(info.targetPath()).isEqualTo(picked);
        assertThat(info.targetDisposition()).isEqualTo(TargetDisposition.PROMPT);
        assertThat(env.prefs().saveFilePath()).isEqualTo(picked.getParent());
    }

    @Test
    void testContinueWithoutConfirmationIsNotAPrompt() {
        delegate.confirmation = ConfirmationOutcome::continueWithoutConfirmation;
        DownloadTargetSettings settings = settings().toBuilder().promptForDownload(true).build();
        start(new DownloadItem(6, request("https://example.com/report.pdf").build()), environment(settings));

        TargetInfo info = onlyResult();
        assertThat(info.interruptReason()).isEqualTo(InterruptReason.NONE);
        assertThat(info.targetDisposition()).isEqualTo(TargetDisposition.OVERWRITE);
    }

    @Test
    void testDestroyWhileWaitingForUserCancelsOnce() {
        delegate.hold(TargetResolutionState.PROMPT_USER_FOR_DOWNLOAD_PATH);
        DownloadTargetSettings settings = settings().toBuilder().promptForDownload(true).build();
        DownloadItem item = new DownloadItem(7, request("https://example.com/report.pdf").build());
        TargetDeterminer determiner = start(item, environment(settings));

        assertThat(results).isEmpty();
        assertThat(delegate.isWaiting(TargetResolutionState.PROMPT_USER_FOR_DOWNLOAD_PATH)).isTrue();

        item.destroy();
        assertThat(determiner.isFinished()).isTrue();
        assertThat(onlyResult().interruptReason()).isEqualTo(InterruptReason.USER_CANCELED);

        // the late answer is dropped
        delegate.release(TargetResolutionState.PROMPT_USER_FOR_DOWNLOAD_PATH);
        assertThat(results).hasSize(1);
        assertThat(delegate.calls).doesNotContain(TargetResolutionState.DETERMINE_LOCAL_PATH);
    }

    @Test
    void testDestroyedBeforeStartNeverCallsCollaborators() {
        DownloadItem item = new DownloadItem(8, request("https://example.com/report.pdf").build());
        item.destroy();
        start(item);

        assertThat(onlyResult().interruptReason()).isEqualTo(InterruptReason.USER_CANCELED);
        assertThat(delegate.calls).isEmpty();
    }

    @Test
    void testCancelWhileReserving() {
        delegate.hold(TargetResolutionState.RESERVE_VIRTUAL_PATH);
        TargetDeterminer determiner = start(new DownloadItem(9, request("https://example.com/a.txt").build()));
        assertThat(results).isEmpty();

        determiner.cancel();
        assertThat(onlyResult().interruptReason()).isEqualTo(InterruptReason.USER_CANCELED);

        determiner.cancel();
        delegate.release(TargetResolutionState.RESERVE_VIRTUAL_PATH);
        assertThat(results).hasSize(1);
    }

    @SuppressWarnings("unchecked")
    @Test
    void testStaleAnswerIsRejected() {
        delegate.hold(TargetResolutionState.RESERVE_VIRTUAL_PATH)
            .hold(TargetResolutionState.PROMPT_USER_FOR_DOWNLOAD_PATH);
        DownloadTargetSettings settings = settings().toBuilder().promptForDownload(true).build();
        TargetDeterminer determiner = start(new DownloadItem(10, request("https://example.com/a.txt").build()),
            environment(settings));

        PendingStep<PathReservation> reserveStep = (PendingStep<PathReservation>) determiner.pendingStep();
        assertThat(reserveStep.state()).isEqualTo(TargetResolutionState.RESERVE_VIRTUAL_PATH);

        delegate.release(TargetResolutionState.RESERVE_VIRTUAL_PATH);
        assertThat(determiner.pendingStep().state()).isEqualTo(TargetResolutionState.PROMPT_USER_FOR_DOWNLOAD_PATH);
        ResolutionSnapshot before = determiner.snapshot();

        PathReservation other = new PathReservation(PathValidationResult.SUCCESS, tempDir.resolve("other.txt"));
        assertThatThrownBy(() -> reserveStep.deliver(other)).isInstanceOf(IllegalStateException.class);
        assertThat(determiner.snapshot()).isEqualTo(before);
        assertThat(results).isEmpty();
    }

    @Test
    void testStatesRunInOrderWithAbsolutePaths() {
        List<TargetResolutionState> entered = new ArrayList<>();
        List<ResolutionSnapshot> completed = new ArrayList<>();
        DeterminerEnvironment env = environment(settings()).withObserver(new TargetDeterminerObserver() {
            @Override
            public void onStateEntered(TargetResolutionState state, ResolutionSnapshot snapshot) {
                entered.add(state);
                if (snapshot.virtualPath() != null) {
                    assertThat(snapshot.virtualPath().isAbsolute()).isTrue();
                }
            }

            @Override
            public void onCompleted(ResolutionSnapshot snapshot, TargetResolution resolution) {
                completed.add(snapshot);
            }
        });
        delegate.mimeType = "text/plain";
        start(new DownloadItem(11, request("https://example.com/notes.txt").build()), env);

        assertThat(entered).containsExactly(
            TargetResolutionState.GENERATE_TARGET_PATH,
            TargetResolutionState.SET_INSECURE_DOWNLOAD_STATUS,
            TargetResolutionState.NOTIFY_COLLABORATORS,
            TargetResolutionState.RESERVE_VIRTUAL_PATH,
            TargetResolutionState.PROMPT_USER_FOR_DOWNLOAD_PATH,
            TargetResolutionState.DETERMINE_LOCAL_PATH,
            TargetResolutionState.DETERMINE_MIME_TYPE,
            TargetResolutionState.DETERMINE_IF_HANDLED_SAFELY_BY_BROWSER,
            TargetResolutionState.CHECK_DOWNLOAD_URL,
            TargetResolutionState.CHECK_VISITED_REFERRER_BEFORE,
            TargetResolutionState.DETERMINE_INTERMEDIATE_PATH);
        assertThat(completed).hasSize(1);
        ResolutionSnapshot last = completed.get(0);
        assertThat(last.localPath()).isAbsolute();
        assertThat(last.intermediatePath()).isAbsolute();
    }

    @Test
    void testTransientWithoutPathIsCanceled() {
        start(new DownloadItem(12, request("https://example.com/a.txt").transientDownload(true).build()));

        assertThat(onlyResult().interruptReason()).isEqualTo(InterruptReason.USER_CANCELED);
        assertThat(delegate.calls).isEmpty();
    }

    @Test
    void testTransientForcedPathOverwrites() {
        Path forced = tempDir.resolve("cache/blob.bin");
        start(new DownloadItem(13,
            request("https://example.com/blob").transientDownload(true).forcedPath(forced).build()));

        TargetInfo info = onlyResult();
        assertThat(info.interruptReason()).isEqualTo(InterruptReason.NONE);
        assertThat(delegate.reservedConflictAction).isEqualTo(ConflictAction.OVERWRITE);
        assertThat(info.targetPath()).isEqualTo(forced);
        assertThat(info.intermediatePath()).isEqualTo(forced);
    }

    @Test
    void testTransientReservationFailureCancels() {
        delegate.reservation = path -> new PathReservation(PathValidationResult.PATH_NOT_WRITABLE, path);
        Path forced = tempDir.resolve("cache/blob.bin");
        start(new DownloadItem(14,
            request("https://example.com/blob").transientDownload(true).forcedPath(forced).build()));

        assertThat(onlyResult().interruptReason()).isEqualTo(InterruptReason.USER_CANCELED);
        assertThat(delegate.calls).doesNotContain(TargetResolutionState.PROMPT_USER_FOR_DOWNLOAD_PATH);
    }

    @Test
    void testSilentBlockEndsBeforeReservation() {
        delegate.insecureStatus = InsecureDownloadStatus.SILENT_BLOCK;
        start(new DownloadItem(15, request("http://example.com/a.exe").build()));

        TargetInfo info = onlyResult();
        assertThat(info.interruptReason()).isEqualTo(InterruptReason.FILE_BLOCKED);
        assertThat(info.insecureDownloadStatus()).isEqualTo(InsecureDownloadStatus.SILENT_BLOCK);
        assertThat(delegate.calls).containsExactly(TargetResolutionState.SET_INSECURE_DOWNLOAD_STATUS);
    }

    @Test
    void testEmptyLocalPathFails() {
        delegate.localPath = path -> LocalPathResult.failed();
        start(new DownloadItem(16, request("https://example.com/a.txt").build()));

        assertThat(onlyResult().interruptReason()).isEqualTo(InterruptReason.FILE_FAILED);
    }

    @Test
    void testCollaboratorFailureFailsFile() {
        delegate.failures.put(TargetResolutionState.CHECK_DOWNLOAD_URL, new IOException("reputation service down"));
        start(new DownloadItem(17, request("https://example.com/a.txt").build()));

        assertThat(onlyResult().interruptReason()).isEqualTo(InterruptReason.FILE_FAILED);
        assertThat(delegate.calls).doesNotContain(TargetResolutionState.CHECK_VISITED_REFERRER_BEFORE);
    }

    @Test
    void testMissingUrlVerdictFailsFile() {
        delegate.urlVerdict = null;
        start(new DownloadItem(40, request("https://example.com/a.txt").build()));

        assertThat(onlyResult().interruptReason()).isEqualTo(InterruptReason.FILE_FAILED);
    }

    @Test
    void testMissingFilenameSuggestionFailsFile() {
        delegate.suggestion = null;
        start(new DownloadItem(41, request("https://example.com/a.txt").build()));

        assertThat(onlyResult().interruptReason()).isEqualTo(InterruptReason.FILE_FAILED);
        assertThat(delegate.calls).doesNotContain(TargetResolutionState.RESERVE_VIRTUAL_PATH);
    }

    @Test
    void testRelativeReservedPathFailsFile() {
        delegate.reservation = path -> new PathReservation(PathValidationResult.SUCCESS, Path.of("rel.pdf"));
        TargetDeterminer determiner = start(new DownloadItem(42, request("https://example.com/a.pdf").build()));

        assertThat(onlyResult().interruptReason()).isEqualTo(InterruptReason.FILE_FAILED);
        assertThat(determiner.isFinished()).isTrue();
        assertThat(delegate.calls).doesNotContain(TargetResolutionState.DETERMINE_LOCAL_PATH);
    }

    @Test
    void testDialogConfirmedPathIsReservedBeforeUse() {
        Path picked = tempDir.resolve("sdcard/picked.pdf");
        delegate.confirmation = path -> ConfirmationOutcome.confirmedWithDialog(picked);
        DownloadTargetSettings settings = settings().toBuilder().promptForDownload(true).build();
        start(new DownloadItem(43, request("https://example.com/report.pdf").build()), environment(settings));

        TargetInfo info = onlyResult();
        assertThat(info.targetPath()).isEqualTo(picked);
        assertThat(delegate.reservedPath).isEqualTo(picked);
        assertThat(delegate.calls).filteredOn(state -> state == TargetResolutionState.RESERVE_VIRTUAL_PATH)
            .hasSize(2);
        assertThat(delegate.calls).filteredOn(state -> state == TargetResolutionState.PROMPT_USER_FOR_DOWNLOAD_PATH)
            .hasSize(1);
        assertThat(info.targetDisposition()).isEqualTo(TargetDisposition.PROMPT);
    }

    @Test
    void testDialogConfirmedConflictAsksAgain() {
        Path taken = tempDir.resolve("sdcard/taken.pdf");
        Path free = tempDir.resolve("sdcard/free.pdf");
        delegate.reservation = path -> new PathReservation(
            path.equals(taken) ? PathValidationResult.CONFLICT : PathValidationResult.SUCCESS, path);
        delegate.confirmation = path -> ConfirmationOutcome.confirmedWithDialog(path.equals(taken) ? free : taken);
        DownloadTargetSettings settings = settings().toBuilder().promptForDownload(true).build();
        start(new DownloadItem(44, request("https://example.com/report.pdf").build()), environment(settings));

        TargetInfo info = onlyResult();
        assertThat(info.interruptReason()).isEqualTo(InterruptReason.NONE);
        assertThat(info.targetPath()).isEqualTo(free);
        assertThat(delegate.confirmationReason).isEqualTo(ConfirmationReason.TARGET_CONFLICT);
        assertThat(delegate.calls).filteredOn(state -> state == TargetResolutionState.PROMPT_USER_FOR_DOWNLOAD_PATH)
            .hasSize(2);
        assertThat(delegate.calls).filteredOn(state -> state == TargetResolutionState.RESERVE_VIRTUAL_PATH)
            .hasSize(3);
    }

    @Test
    void testLocalPathDifferentFromVirtualSkipsMimeSniffing() {
        Path local = tempDir.resolve("cache/a.txt.local");
        delegate.localPath = path -> LocalPathResult.of(local);
        start(new DownloadItem(18, request("https://example.com/a.txt").build()));

        TargetInfo info = onlyResult();
        assertThat(info.targetPath()).isEqualTo(local);
        assertThat(info.intermediatePath()).isEqualTo(local);
        assertThat(delegate.calls).doesNotContain(TargetResolutionState.DETERMINE_MIME_TYPE,
            TargetResolutionState.DETERMINE_IF_HANDLED_SAFELY_BY_BROWSER);
    }

    @Test
    void testFilenameSuggestionIsPlacedUnderDownloadDirectory() {
        delegate.suggestion = new FilenameSuggestion("reports/2026/summary.pdf", ConflictAction.OVERWRITE);
        start(new DownloadItem(19, request("https://example.com/report.pdf").build()));

        TargetInfo info = onlyResult();
        assertThat(info.targetPath()).isEqualTo(downloads.resolve("reports/2026/summary.pdf"));
        assertThat(delegate.reservedWithCreateDirectory).isTrue();
        assertThat(delegate.reservedConflictAction).isEqualTo(ConflictAction.OVERWRITE);
    }

    @Test
    void testFilenameSuggestionIgnoredForFileUrls() {
        delegate.suggestion = new FilenameSuggestion("renamed.txt", ConflictAction.OVERWRITE);
        start(new DownloadItem(20, request("file:///srv/share/notes.txt").build()));

        assertThat(onlyResult().targetPath()).isEqualTo(downloads.resolve("notes.txt"));
        assertThat(delegate.reservedWithCreateDirectory).isFalse();
        assertThat(delegate.reservedConflictAction).isEqualTo(ConflictAction.UNIQUIFY);
    }

    @Test
    void testDangerousTypeGetsUnconfirmedIntermediateName() {
        start(new DownloadItem(21, request("https://example.com/tool.exe").build()));

        TargetResolution resolution = results.get(0);
        assertThat(resolution.dangerLevel()).isEqualTo(DangerLevel.ALLOW_ON_USER_GESTURE);
        assertThat(resolution.info().dangerType()).isEqualTo(DangerType.DANGEROUS_FILE);
        assertThat(resolution.info().targetPath()).isEqualTo(downloads.resolve("tool.exe"));
        assertThat(resolution.info().intermediatePath()).isEqualTo(downloads.resolve("Unconfirmed 4242.crdownload"));
    }

    @Test
    void testReferrerVisitedBeforeTodayDowngradesDanger() {
        delegate.visits = new VisitCountResult(true, 3, Instant.parse("2026-03-08T09:00:00Z"));
        start(new DownloadItem(22, request("https://example.com/tool.exe")
            .referrer(URI.create("https://example.com/page")).userGesture(true).build()));

        TargetResolution resolution = results.get(0);
        assertThat(delegate.calls).contains(TargetResolutionState.CHECK_VISITED_REFERRER_BEFORE);
        assertThat(resolution.dangerLevel()).isEqualTo(DangerLevel.NOT_DANGEROUS);
        assertThat(resolution.info().dangerType()).isEqualTo(DangerType.NOT_DANGEROUS);
        assertThat(resolution.info().intermediatePath()).isEqualTo(downloads.resolve("tool.exe.crdownload"));
    }

    @Test
    void testReferrerFirstVisitedTodayStaysDangerous() {
        delegate.visits = new VisitCountResult(true, 1, Instant.parse("2026-03-10T08:00:00Z"));
        start(new DownloadItem(23, request("https://example.com/tool.exe")
            .referrer(URI.create("https://example.com/page")).userGesture(true).build()));

        TargetResolution resolution = results.get(0);
        assertThat(resolution.dangerLevel()).isEqualTo(DangerLevel.ALLOW_ON_USER_GESTURE);
        assertThat(resolution.info().dangerType()).isEqualTo(DangerType.DANGEROUS_FILE);
    }

    @Test
    void testAddressBarDownloadSkipsHistory() {
        start(new DownloadItem(24, request("https://example.com/tool.exe")
            .referrer(URI.create("https://example.com/page"))
            .transition(PageTransition.TYPED, PageTransition.FROM_ADDRESS_BAR).build()));

        assertThat(results.get(0).dangerLevel()).isEqualTo(DangerLevel.NOT_DANGEROUS);
        assertThat(delegate.calls).doesNotContain(TargetResolutionState.CHECK_VISITED_REFERRER_BEFORE);
    }

    @Test
    void testUrlVerdictSkipsFileTypeCheck() {
        delegate.urlVerdict = DangerType.DANGEROUS_URL;
        start(new DownloadItem(25, request("https://bad.example.com/a.txt").build()));

        TargetInfo info = onlyResult();
        assertThat(info.dangerType()).isEqualTo(DangerType.DANGEROUS_URL);
        assertThat(info.intermediatePath()).isEqualTo(downloads.resolve("Unconfirmed 4242.crdownload"));
    }

    @Test
    void testUserValidatedDownloadSkipsUrlCheck() {
        start(new DownloadItem(26, request("https://example.com/a.txt").dangerType(DangerType.USER_VALIDATED).build()));

        assertThat(onlyResult().dangerType()).isEqualTo(DangerType.USER_VALIDATED);
        assertThat(delegate.calls).doesNotContain(TargetResolutionState.CHECK_DOWNLOAD_URL);
    }

    @ParameterizedTest
    @CsvSource({
        "FILE_ACCESS_DENIED, PATH_NOT_WRITABLE",
        "FILE_NO_SPACE, TARGET_NO_SPACE",
        "FILE_TOO_LARGE, TARGET_NO_SPACE",
        "FILE_FAILED, NONE",
        "FILE_TRANSIENT_ERROR, NONE"
    })
    void testResumptionConfirmsOnlyFileSystemFailures(InterruptReason lastReason, ConfirmationReason expected) {
        DownloadRequest request = request("https://example.com/report.pdf")
            .resumedAfter(lastReason, downloads.resolve("report.pdf"), downloads.resolve("report.pdf.crdownload"))
            .build();
        start(new DownloadItem(27, request));

        TargetInfo info = onlyResult();
        if (expected == ConfirmationReason.NONE) {
            assertThat(delegate.confirmationReason).isNull();
            assertThat(info.targetDisposition()).isEqualTo(TargetDisposition.OVERWRITE);
        } else {
            assertThat(delegate.confirmationReason).isEqualTo(expected);
            assertThat(info.targetDisposition()).isEqualTo(TargetDisposition.PROMPT);
        }
    }

    @Test
    void testResumptionAfterPromptReusesChosenPath() {
        Path chosen = tempDir.resolve("picked/chosen.pdf");
        DownloadRequest request = request("https://example.com/report.pdf")
            .targetDisposition(TargetDisposition.PROMPT)
            .resumedAfter(InterruptReason.FILE_FAILED, chosen, null)
            .build();
        start(new DownloadItem(28, request));

        TargetInfo info = onlyResult();
        assertThat(info.targetPath()).isEqualTo(chosen);
        assertThat(info.targetDisposition()).isEqualTo(TargetDisposition.PROMPT);
        assertThat(delegate.reservedConflictAction).isEqualTo(ConflictAction.OVERWRITE);
        assertThat(delegate.confirmationReason).isNull();
    }

    @Test
    void testResumedDangerousDownloadKeepsIntermediateFile() {
        Path earlier = downloads.resolve("Unconfirmed 17.crdownload");
        DownloadRequest request = request("https://example.com/tool.exe")
            .resumedAfter(InterruptReason.FILE_FAILED, downloads.resolve("tool.exe"), earlier)
            .build();
        start(new DownloadItem(29, request));

        assertThat(onlyResult().intermediatePath()).isEqualTo(earlier);
    }

    @Test
    void testRelativeTargetPathIsRejected() {
        DownloadItem item = new DownloadItem(30, request("https://example.com/a.txt")
            .resumedAfter(InterruptReason.FILE_FAILED, Path.of("relative.txt"), null).build());

        assertThatThrownBy(() -> start(item)).isInstanceOf(IllegalArgumentException.class);
        assertThat(results).isEmpty();
    }
}
