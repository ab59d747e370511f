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

import io.nosqlbench.downloads.item.DangerType;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntSupplier;

/// Naming of the files a download is written to before it completes.
public final class IntermediatePaths {

    public static final String CRDOWNLOAD_SUFFIX = ".crdownload";

    /// Upper bound, exclusive, of the number in an unconfirmed name.
    public static final int UNCONFIRMED_RANGE = 1_000_000;

    private IntermediatePaths() {
    }

    /// @param path a target path
    /// @return the path with the partial download suffix appended
    public static Path crdownloadPath(Path path) {
        return path.resolveSibling(path.getFileName().toString() + CRDOWNLOAD_SUFFIX);
    }

    /// @return e.g. `Unconfirmed 123456.crdownload` in the given directory
    public static Path unconfirmedPath(Path directory, String prefix, int uniquifier) {
        return directory.resolve(prefix + " " + uniquifier + CRDOWNLOAD_SUFFIX);
    }

    /// Inputs for choosing an intermediate path.
    ///
    /// @param virtualPath the virtual target path
    /// @param localPath the local target path
    /// @param dangerType the accumulated danger type
    /// @param forced whether the target was forced by the initiator
    /// @param isTransient whether the download is transient
    /// @param isResumption whether the download resumes an earlier attempt
    /// @param existingFullPath the file the earlier attempt wrote to, if any
    /// @param unconfirmedPrefix prefix of randomized names for dangerous downloads
    public record Choice(
        Path virtualPath,
        Path localPath,
        DangerType dangerType,
        boolean forced,
        boolean isTransient,
        boolean isResumption,
        Optional<Path> existingFullPath,
        String unconfirmedPrefix
    ) {
        public Choice {
            Objects.requireNonNull(virtualPath, "virtualPath");
            Objects.requireNonNull(localPath, "localPath");
            Objects.requireNonNull(dangerType, "dangerType");
            Objects.requireNonNull(existingFullPath, "existingFullPath");
        }
    }

    /// Picks the intermediate path. The first matching rule wins:
    ///
    /// - a local path whose name differs from the virtual one is written directly
    /// - benign forced or transient downloads are written directly
    /// - benign downloads get the partial download suffix
    /// - a resumed dangerous download keeps writing to its earlier file in the same directory
    /// - other dangerous downloads get a randomized unconfirmed name, so they are not
    ///   recognizable by type until the user accepts them
    ///
    /// @param choice the inputs
    /// @param random source of the unconfirmed name number, in `[0, UNCONFIRMED_RANGE)`
    /// @return the intermediate path
    public static Path choose(Choice choice, IntSupplier random) {
        Path local = choice.localPath();
        boolean benign = choice.dangerType() == DangerType.NOT_DANGEROUS;
        if (!Objects.equals(choice.virtualPath().getFileName(), local.getFileName())) {
            return local;
        }
        if (benign && choice.forced()) {
            return local;
        }
        if (benign && choice.isTransient()) {
            return local;
        }
        if (benign) {
            return crdownloadPath(local);
        }
        Path directory = local.getParent();
        if (choice.isResumption() && choice.existingFullPath().isPresent()
            && Objects.equals(choice.existingFullPath().get().getParent(), directory)) {
            return choice.existingFullPath().get();
        }
        return unconfirmedPath(directory, choice.unconfirmedPrefix(), random.getAsInt());
    }
}
