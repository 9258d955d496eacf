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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Parses the {@code initializationOptions} JSON object sent by the client
 * during the LSP {@code initialize} request.
 */
class InitializationOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(InitializationOptionsParser.class);

    static final String LOG_LEVEL_OPTION = "logLevel";
    static final String NESFAB_HOME_OPTION = "nesfabHome";
    static final String NESFAB_ENV = "NESFAB";

    /** Immutable container for parsed initialization options. */
    static final class ParsedOptions {
        final String logLevel;
        final Path nesfabHome;

        ParsedOptions(String logLevel, Path nesfabHome) {
            this.logLevel = logLevel;
            this.nesfabHome = nesfabHome;
        }
    }

    /**
     * Parse initialization options and apply the log level, if one is given.
     *
     * @return parsed options, or {@code null} if the input is not a
     *         {@link JsonObject}
     */
    static ParsedOptions parse(Object initOptions) {
        if (!(initOptions instanceof JsonObject)) {
            return null;
        }
        JsonObject opts = (JsonObject) initOptions;
        String logLevel = stringOption(opts, LOG_LEVEL_OPTION);
        if (logLevel != null) {
            applyLogLevel(logLevel);
        }
        Path home = toPath(stringOption(opts, NESFAB_HOME_OPTION));
        if (home != null) {
            logger.info("NESFab home: {}", home);
        }
        return new ParsedOptions(logLevel, home);
    }

    /**
     * The directory config entries fall back to when they do not resolve
     * against their own directory: the {@code nesfabHome} option, else the
     * {@code NESFAB} environment variable, else {@code null}.
     */
    static Path resolveFallbackBase(ParsedOptions options, Map<String, String> environment) {
        if (options != null && options.nesfabHome != null) {
            return options.nesfabHome;
        }
        return toPath(environment.get(NESFAB_ENV));
    }

    static String stringOption(JsonObject opts, String name) {
        JsonElement element = opts.get(name);
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        String value = element.getAsString().trim();
        return value.isEmpty() ? null : value;
    }

    static Path toPath(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Paths.get(value.trim()).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            logger.warn("Ignoring invalid NESFab home '{}': {}", value, e.getMessage());
            return null;
        }
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
        try {
            ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
            if (level == null) {
                logger.warn("Unknown log level '{}', keeping current level", levelName);
                return;
            }
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
                    LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            ch.qos.logback.classic.Level previous = root.getLevel();
            root.setLevel(level);
            logger.info("Log level changed from {} to {}", previous, level);
        } catch (ClassCastException e) {
            logger.warn("Failed to set log level to '{}': {}", levelName, e.getMessage());
        }
    }

    private InitializationOptionsParser() {
        // utility class
    }
}
