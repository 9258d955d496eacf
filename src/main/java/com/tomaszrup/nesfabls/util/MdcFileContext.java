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
package com.tomaszrup.nesfabls.util;

import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Manages the SLF4J MDC (Mapped Diagnostic Context) key {@code "file"} so
 * that log lines written while a document is being indexed name that
 * document.
 *
 * <p>The label is the path of the file relative to the deepest workspace
 * root containing it (e.g. {@code src/player.fab}), or its bare file name
 * when no root contains it.</p>
 *
 * <h3>Usage at entry points (LSP handlers, pool tasks):</h3>
 * <pre>{@code
 * MdcFileContext.setFile(path);
 * try {
 *     // ... all log calls inside here include [src/player.fab]
 * } finally {
 *     MdcFileContext.clear();
 * }
 * }</pre>
 *
 * <p>Use {@link #wrap(Runnable)} or {@link #wrap(Callable)} to carry the
 * caller's context into another thread.</p>
 */
public final class MdcFileContext {

    /** MDC key used in the logback pattern via {@code %X{file}}. */
    public static final String MDC_KEY = "file";

    private static volatile List<Path> workspaceRoots = List.of();

    private MdcFileContext() {
        // utility class
    }

    /**
     * Replaces the roots used to shorten file labels. Called whenever the
     * editor's workspace folders change.
     */
    public static void setWorkspaceRoots(Collection<Path> roots) {
        workspaceRoots = List.copyOf(roots);
    }

    /**
     * Sets the MDC {@code "file"} key for the given source file.
     *
     * @param file the file being processed, or {@code null}
     */
    public static void setFile(Path file) {
        if (file == null) {
            MDC.put(MDC_KEY, "-");
            return;
        }
        Path root = CanonicalPaths.deepestContainingRoot(file, workspaceRoots);
        if (root != null && !root.equals(file)) {
            MDC.put(MDC_KEY, root.relativize(file).toString().replace('\\', '/'));
        } else {
            Path fileName = file.getFileName();
            MDC.put(MDC_KEY, fileName != null ? fileName.toString() : file.toString());
        }
    }

    /**
     * Removes the MDC {@code "file"} key from the current thread.
     */
    public static void clear() {
        MDC.remove(MDC_KEY);
    }

    /**
     * Returns a snapshot of the current thread's MDC context map, or
     * {@code null} if it is empty.
     */
    public static Map<String, String> snapshot() {
        return MDC.getCopyOfContextMap();
    }

    /**
     * Restores a previously captured MDC context map on the current thread.
     *
     * @param contextMap the context map to restore (may be null)
     */
    public static void restore(Map<String, String> contextMap) {
        if (contextMap != null) {
            MDC.setContextMap(contextMap);
        } else {
            MDC.clear();
        }
    }

    /**
     * Wraps a {@link Runnable} so that the current thread's MDC context is
     * restored in the executing thread. The executing thread's own context
     * is put back when the task completes.
     */
    public static Runnable wrap(Runnable task) {
        Map<String, String> callerContext = snapshot();
        return () -> {
            Map<String, String> previousContext = snapshot();
            restore(callerContext);
            try {
                task.run();
            } finally {
                restore(previousContext);
            }
        };
    }

    /** Same as {@link #wrap(Runnable)} for tasks with a result. */
    public static <T> Callable<T> wrap(Callable<T> task) {
        Map<String, String> callerContext = snapshot();
        return () -> {
            Map<String, String> previousContext = snapshot();
            restore(callerContext);
            try {
                return task.call();
            } finally {
                restore(previousContext);
            }
        };
    }
}
