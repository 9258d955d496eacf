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

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;

/**
 * Path helpers shared by the index and the LSP layer. Every path used as a
 * key in the index goes through {@link #canonicalize(Path)} first.
 */
public final class CanonicalPaths {

    private CanonicalPaths() {
    }

    /**
     * Resolves symlinks and {@code ..} segments for existing files; paths
     * that do not exist (yet) are made absolute and normalized instead.
     */
    public static Path canonicalize(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }

    /**
     * Canonical path of a {@code file:} URI sent by the client.
     *
     * @throws IllegalArgumentException if the URI is malformed or not a file URI
     */
    public static Path fromUri(String uri) {
        return canonicalize(Paths.get(URI.create(uri)));
    }

    /**
     * Returns the root with the most name elements that contains
     * {@code file}, or {@code null} if none does.
     */
    public static Path deepestContainingRoot(Path file, Collection<Path> roots) {
        Path best = null;
        for (Path root : roots) {
            if (file.startsWith(root) && (best == null || root.getNameCount() > best.getNameCount())) {
                best = root;
            }
        }
        return best;
    }

    /**
     * Path of {@code file} relative to its deepest containing root, using
     * {@code /} separators, or its absolute path when no root contains it.
     */
    public static String displayPath(Path file, Collection<Path> roots) {
        Path root = deepestContainingRoot(file, roots);
        if (root == null || root.equals(file)) {
            return file.toString();
        }
        return root.relativize(file).toString().replace('\\', '/');
    }

    /** Whether the file name ends with {@code extension} (which includes the dot). */
    public static boolean hasExtension(Path path, String extension) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().endsWith(extension);
    }
}
