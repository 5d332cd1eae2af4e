package io.depinfer.config;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for depinfer configuration files.
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable config files |
/// | Serialize nulls | Disabled | Unset options stay absent |
/// | HTML escaping | Disabled | Protein ids are written as-is |
///
/// The [Gson] instance is thread-safe and shared.
public final class DepInferGsonConfig {

    private static final Gson INSTANCE = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    private DepInferGsonConfig() {
        // Utility class
    }

    /// Returns the shared Gson instance.
    ///
    /// @return the configured Gson
    public static Gson gson() {
        return INSTANCE;
    }
}
