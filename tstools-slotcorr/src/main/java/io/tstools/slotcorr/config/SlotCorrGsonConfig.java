package io.tstools.slotcorr.config;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for slotcorr JSON.
///
/// ## Purpose
///
/// Provides a configured [Gson] instance for writing estimator output and
/// reading or writing estimator configuration:
///
/// - [io.tstools.slotcorr.model.CorrentropyResult]
/// - [EstimatorConfig]
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable files |
/// | HTML escaping | Disabled | Cleaner numeric output |
/// | Special floats | Serialized | NaN or infinite doubles are written instead of failing serialization |
///
/// The [Gson] instance is thread-safe and shared.
public final class SlotCorrGsonConfig {

    private static final Gson INSTANCE = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .serializeSpecialFloatingPointValues()
        .create();

    private SlotCorrGsonConfig() {
        // Utility class
    }

    /// Returns the shared pretty-printing Gson instance.
    ///
    /// @return the shared Gson instance
    public static Gson gson() {
        return INSTANCE;
    }
}
