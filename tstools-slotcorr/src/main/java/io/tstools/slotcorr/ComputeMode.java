package io.tstools.slotcorr;

/*
 * Copyright (c) tstools
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

import com.google.gson.annotations.SerializedName;

/// How lag slots are evaluated.
///
/// ## Modes
///
/// | Mode | Description |
/// |------|-------------|
/// | **SEQUENTIAL** | Slots evaluated one after another on the calling thread |
/// | **PARALLEL** | Slots evaluated concurrently on a `ForkJoinPool` |
///
/// Slots never depend on each other, so both modes return identical results.
/// Parallel evaluation pays off once the pair set holds a few million entries.
public enum ComputeMode {

    @SerializedName("sequential")
    SEQUENTIAL,

    @SerializedName("parallel")
    PARALLEL;

    /// Reserved threads (keep some cores free for system/other tasks)
    private static final int RESERVED_THREADS = 2;

    /// Returns the default worker count for [#PARALLEL].
    ///
    /// @return max(1, availableProcessors - 2)
    public static int defaultParallelism() {
        int available = Runtime.getRuntime().availableProcessors();
        return Math.max(1, available - RESERVED_THREADS);
    }
}
