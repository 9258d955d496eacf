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
package com.tomaszrup.nesfabls.index;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.nesfabls.util.CanonicalPaths;

/**
 * Scans directories for NESFab build configurations ({@code .cfg} files)
 * and resolves the source files they list.
 *
 * <p>A config line of the form {@code input = path} names one input.
 * The path is tried relative to the config file's directory first, then
 * relative to the NESFab home directory; the first one that exists wins and
 * unresolvable inputs are dropped. Only {@code .fab} files are kept, so
 * {@code .macrofab} inputs and other assets never reach the index.</p>
 *
 * <p>Config files are read in parallel on the supplied executor. The result
 * maps each directory containing at least one config file to the union of
 * its resolved inputs.</p>
 */
public class DependencyGraphBuilder {

    private static final Logger logger = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    public static final String CONFIG_EXTENSION = ".cfg";
    public static final String SOURCE_EXTENSION = ".fab";

    private static final String INPUT_KEY = "input";

    private final ExecutorService executor;

    public DependencyGraphBuilder(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Scans {@code roots} recursively and resolves every config file found.
     *
     * @param roots        directories to scan; missing ones are skipped
     * @param fallbackBase NESFab home used for the second resolution
     *                     attempt, or {@code null}
     * @return config directory → resolved input files, sorted by path
     * @throws InterruptedException if interrupted while waiting for the
     *                              per-config tasks
     */
    public Map<Path, Set<Path>> build(Collection<Path> roots, Path fallbackBase) throws InterruptedException {
        Set<Path> configFiles = findConfigFiles(roots);
        List<Callable<Set<Path>>> tasks = new ArrayList<>(configFiles.size());
        List<Path> order = new ArrayList<>(configFiles);
        for (Path configFile : order) {
            tasks.add(() -> readInputs(configFile, fallbackBase));
        }

        Map<Path, Set<Path>> result = new TreeMap<>();
        List<Future<Set<Path>>> futures = executor.invokeAll(tasks);
        for (int i = 0; i < futures.size(); i++) {
            Path configFile = order.get(i);
            try {
                Set<Path> inputs = futures.get(i).get();
                result.computeIfAbsent(configFile.getParent(), k -> new TreeSet<>()).addAll(inputs);
            } catch (ExecutionException e) {
                logger.warn("Skipping unreadable config {}: {}", configFile, e.getCause().toString());
            }
        }
        logger.info("Resolved {} config director{} from {} config file(s)",
                result.size(), result.size() == 1 ? "y" : "ies", configFiles.size());
        return result;
    }

    /**
     * Finds all regular {@code .cfg} files below the given roots, as
     * canonical paths.
     */
    static Set<Path> findConfigFiles(Collection<Path> roots) {
        Set<Path> configFiles = new TreeSet<>();
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                logger.debug("Skipping missing root {}", root);
                continue;
            }
            try {
                Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class),
                        Integer.MAX_VALUE, new SimpleFileVisitor<>() {

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile() && CanonicalPaths.hasExtension(file, CONFIG_EXTENSION)) {
                            configFiles.add(CanonicalPaths.canonicalize(file));
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) {
                        logger.debug("Cannot access {}: {}", file, exc.getMessage());
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (IOException e) {
                logger.warn("Failed to scan {}: {}", root, e.getMessage());
            }
        }
        return configFiles;
    }

    /**
     * Reads one config file and resolves its {@code input} lines.
     *
     * @throws IOException if the file cannot be read
     */
    static Set<Path> readInputs(Path configFile, Path fallbackBase) throws IOException {
        Path configDir = configFile.getParent();
        Set<Path> inputs = new TreeSet<>();
        try (BufferedReader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                Optional<String> reference = parseInputLine(line);
                if (reference.isEmpty()) {
                    continue;
                }
                Optional<Path> resolved = resolve(reference.get(), configDir, fallbackBase);
                if (resolved.isEmpty()) {
                    logger.trace("Unresolved input '{}' in {}", reference.get(), configFile);
                } else if (CanonicalPaths.hasExtension(resolved.get(), SOURCE_EXTENSION)) {
                    inputs.add(resolved.get());
                }
            }
        }
        return inputs;
    }

    /**
     * Extracts the value of an {@code input = value} line. The line must
     * start with {@code input} and contain exactly one {@code =}.
     */
    static Optional<String> parseInputLine(String line) {
        if (!line.startsWith(INPUT_KEY)) {
            return Optional.empty();
        }
        String[] parts = line.split("=", -1);
        if (parts.length != 2) {
            return Optional.empty();
        }
        return Optional.of(parts[1].trim());
    }

    /**
     * Resolves a raw input reference against the config directory, then
     * against {@code fallbackBase}. Returns the canonical path of the first
     * candidate that is an existing regular file.
     */
    static Optional<Path> resolve(String reference, Path configDir, Path fallbackBase) {
        List<Path> bases = new ArrayList<>(2);
        bases.add(configDir);
        if (fallbackBase != null) {
            bases.add(fallbackBase);
        }
        for (Path base : bases) {
            Path candidate;
            try {
                candidate = base.resolve(reference);
            } catch (InvalidPathException e) {
                logger.trace("Invalid input path '{}': {}", reference, e.getMessage());
                return Optional.empty();
            }
            if (Files.isRegularFile(candidate)) {
                return Optional.of(CanonicalPaths.canonicalize(candidate));
            }
        }
        return Optional.empty();
    }
}
