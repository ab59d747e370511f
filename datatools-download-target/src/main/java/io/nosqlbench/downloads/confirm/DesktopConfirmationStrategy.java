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

import io.nosqlbench.downloads.item.DownloadItem;
import io.nosqlbench.downloads.target.ConfirmationOutcome;
import io.nosqlbench.downloads.target.ConfirmationReason;
import io.nosqlbench.downloads.target.ConflictAction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/// Desktop confirmation: a file picker for every reason.
///
/// Only one picker is shown at a time. Requests that arrive while a picker is open wait
/// in arrival order; a request whose download is destroyed while it waits is answered as
/// canceled without showing a picker.
public class DesktopConfirmationStrategy implements ConfirmationStrategy {
    private static final Logger logger = LogManager.getLogger(DesktopConfirmationStrategy.class);

    private final FilePicker picker;
    private final Deque<Runnable> waiting = new ArrayDeque<>();
    private boolean pickerShowing;

    public DesktopConfirmationStrategy(FilePicker picker) {
        this.picker = Objects.requireNonNull(picker, "picker");
    }

    @Override
    public ConflictAction defaultConflictAction() {
        return ConflictAction.UNIQUIFY;
    }

    @Override
    public CompletionStage<ConfirmationOutcome> requestConfirmation(DownloadItem item, Path suggestedPath,
                                                                    ConfirmationReason reason) {
        CompletableFuture<ConfirmationOutcome> answer = new CompletableFuture<>();
        Runnable show = () -> showPicker(item, suggestedPath, reason, answer);
        boolean showNow;
        synchronized (this) {
            showNow = !pickerShowing;
            if (showNow) {
                pickerShowing = true;
            } else {
                logger.debug("Queueing file picker for download {} behind {} others", item.id(), waiting.size());
                waiting.addLast(show);
            }
        }
        if (showNow) {
            show.run();
        }
        return answer;
    }

    /// @return the number of requests waiting for the open picker to close
    public synchronized int waitingCount() {
        return waiting.size();
    }

    private void showPicker(DownloadItem item, Path suggestedPath, ConfirmationReason reason,
                            CompletableFuture<ConfirmationOutcome> answer) {
        if (item.isDestroyed()) {
            pickerClosed(answer, ConfirmationOutcome.canceled());
            return;
        }
        picker.pick(item, suggestedPath, reason).whenComplete((chosen, error) -> {
            ConfirmationOutcome outcome;
            if (error != null) {
                logger.warn("File picker failed for download {}: {}", item.id(), error.toString());
                outcome = ConfirmationOutcome.canceled();
            } else {
                outcome = chosen.map(ConfirmationOutcome::confirmed).orElseGet(ConfirmationOutcome::canceled);
            }
            pickerClosed(answer, outcome);
        });
    }

    private void pickerClosed(CompletableFuture<ConfirmationOutcome> answer, ConfirmationOutcome outcome) {
        answer.complete(outcome);
        Runnable next;
        synchronized (this) {
            next = waiting.pollFirst();
            if (next == null) {
                pickerShowing = false;
            }
        }
        if (next != null) {
            next.run();
        }
    }
}
