////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.nesfabls;

import java.nio.file.Path;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.nesfabls.index.ProjectIndex;

/**
 * Handles didChangeConfiguration processing for the {@code nesfab} settings
 * section ({@code nesfab.home}, {@code nesfab.logLevel}).
 */
final class ConfigurationChangeHandler {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationChangeHandler.class);

    static final String SECTION = "nesfab";
    static final String HOME_SETTING = "home";
    static final String LOG_LEVEL_SETTING = "logLevel";

    /**
     * Notified after a new fallback base directory has been applied, so the
     * caller can schedule a rescan with it.
     */
    @FunctionalInterface
    public interface FallbackBaseListener {
        void onFallbackBaseChanged(Path fallbackBase);
    }

    private final ProjectIndex index;
    private FallbackBaseListener fallbackBaseListener;

    ConfigurationChangeHandler(ProjectIndex index) {
        this.index = index;
    }

    void setFallbackBaseListener(FallbackBaseListener listener) {
        this.fallbackBaseListener = listener;
    }

    /**
     * Processes a didChangeConfiguration notification.
     *
     * @param rawSettings the raw settings object from the LSP params
     */
    void handleConfigurationChange(Object rawSettings) {
        if (!(rawSettings instanceof JsonObject)) {
            return;
        }
        JsonElement section = ((JsonObject) rawSettings).get(SECTION);
        if (section == null || !section.isJsonObject()) {
            return;
        }
        JsonObject settings = section.getAsJsonObject();

        String logLevel = InitializationOptionsParser.stringOption(settings, LOG_LEVEL_SETTING);
        if (logLevel != null) {
            InitializationOptionsParser.applyLogLevel(logLevel);
        }

        if (!settings.has(HOME_SETTING)) {
            return;
        }
        Path home = InitializationOptionsParser.toPath(InitializationOptionsParser.stringOption(settings, HOME_SETTING));
        Path previous = index.getFallbackBase();
        if (home == null ? previous == null : home.equals(previous)) {
            return;
        }
        index.setFallbackBase(home);
        logger.info("NESFab home changed from {} to {}", previous, home);
        if (fallbackBaseListener != null) {
            fallbackBaseListener.onFallbackBaseChanged(home);
        }
    }
}
