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
import io.nosqlbench.downloads.naming.FileTypePolicies;
import io.nosqlbench.downloads.naming.FilenameGenerator;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntSupplier;

/// Everything a [TargetDeterminer] needs besides the download and its collaborators.
///
/// @param prefs the download preferences
/// @param filenames generates file names for downloads without a path
/// @param dangerClassifier rates file types
/// @param defaultConflictAction conflict handling for generated paths
/// @param sequence the executor all steps and callbacks of a determiner run on; must run tasks one at a time
/// @param clock supplies the current day for referrer visit checks
/// @param unconfirmedNumbers supplies numbers for unconfirmed intermediate names
/// @param observer receives progress notifications
public record DeterminerEnvironment(
    DownloadPrefs prefs,
    FilenameGenerator filenames,
    DangerClassifier dangerClassifier,
    ConflictAction defaultConflictAction,
    Executor sequence,
    Clock clock,
    IntSupplier unconfirmedNumbers,
    TargetDeterminerObserver observer
) {

    public DeterminerEnvironment {
        Objects.requireNonNull(prefs, "prefs");
        Objects.requireNonNull(filenames, "filenames");
        Objects.requireNonNull(dangerClassifier, "dangerClassifier");
        Objects.requireNonNull(defaultConflictAction, "defaultConflictAction");
        Objects.requireNonNull(sequence, "sequence");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(unconfirmedNumbers, "unconfirmedNumbers");
        Objects.requireNonNull(observer, "observer");
    }

    /// Builds an environment from settings with the default file type policies, the system
    /// clock and a random unconfirmed name source.
    /// @param prefs the download preferences
    /// @param defaultConflictAction conflict handling for generated paths
    /// @param sequence the determiner sequence
    /// @return the environment
    public static DeterminerEnvironment of(DownloadPrefs prefs, ConflictAction defaultConflictAction,
                                           Executor sequence) {
        DownloadTargetSettings settings = prefs.settings();
        FileTypePolicies fileTypes = FileTypePolicies.defaults();
        return new DeterminerEnvironment(
            prefs,
            new FilenameGenerator(fileTypes, settings.defaultFilename(), settings.defaultCharset()),
            new DangerClassifier(fileTypes, settings.allowInsecureDownloads()),
            defaultConflictAction,
            sequence,
            Clock.systemDefaultZone(),
            () -> ThreadLocalRandom.current().nextInt(IntermediatePaths.UNCONFIRMED_RANGE),
            TargetDeterminerObserver.NONE);
    }

    public DeterminerEnvironment withClock(Clock clock) {
        return new DeterminerEnvironment(prefs, filenames, dangerClassifier, defaultConflictAction, sequence, clock,
            unconfirmedNumbers, observer);
    }

    public DeterminerEnvironment withUnconfirmedNumbers(IntSupplier numbers) {
        return new DeterminerEnvironment(prefs, filenames, dangerClassifier, defaultConflictAction, sequence, clock,
            numbers, observer);
    }

    public DeterminerEnvironment withObserver(TargetDeterminerObserver observer) {
        return new DeterminerEnvironment(prefs, filenames, dangerClassifier, defaultConflictAction, sequence, clock,
            unconfirmedNumbers, observer);
    }

    public DeterminerEnvironment withSequence(Executor sequence) {
        return new DeterminerEnvironment(prefs, filenames, dangerClassifier, defaultConflictAction, sequence, clock,
            unconfirmedNumbers, observer);
    }
}
