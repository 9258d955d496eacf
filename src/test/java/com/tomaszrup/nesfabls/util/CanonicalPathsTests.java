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

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CanonicalPathsTests {

	@TempDir
	Path tempDir;

	@Test
	void testCanonicalizeRemovesDotSegments() throws Exception {
		Path dir = Files.createDirectories(tempDir.resolve("game/src"));
		Path file = Files.writeString(dir.resolve("main.fab"), "");

		Path viaParent = dir.resolve("../src/./main.fab");
		Assertions.assertEquals(CanonicalPaths.canonicalize(file), CanonicalPaths.canonicalize(viaParent));
	}

	@Test
	void testCanonicalizeMissingFileIsAbsoluteAndNormal() {
		Path missing = CanonicalPaths.canonicalize(Paths.get("no-such-dir/../ghost.fab"));

		Assertions.assertTrue(missing.isAbsolute());
		Assertions.assertEquals("ghost.fab", missing.getFileName().toString());
		Assertions.assertFalse(missing.toString().contains(".."));
	}

	@Test
	void testFromUri() throws Exception {
		Path file = Files.writeString(tempDir.resolve("main.fab"), "");

		Assertions.assertEquals(CanonicalPaths.canonicalize(file), CanonicalPaths.fromUri(file.toUri().toString()));
		Assertions.assertThrows(IllegalArgumentException.class, () -> CanonicalPaths.fromUri("not a uri"));
	}

	@Test
	void testDeepestContainingRoot() {
		Path outer = Paths.get("/ws").toAbsolutePath();
		Path inner = outer.resolve("game");
		Path file = inner.resolve("src/main.fab");

		Assertions.assertEquals(inner, CanonicalPaths.deepestContainingRoot(file, List.of(outer, inner)));
		Assertions.assertEquals(inner, CanonicalPaths.deepestContainingRoot(file, List.of(inner, outer)));
		Assertions.assertNull(CanonicalPaths.deepestContainingRoot(file, List.of(outer.resolve("tools"))));
	}

	@Test
	void testDisplayPath() {
		Path root = Paths.get("/ws").toAbsolutePath();
		Path file = root.resolve("game").resolve("main.fab");

		Assertions.assertEquals("game/main.fab", CanonicalPaths.displayPath(file, List.of(root)));
		Assertions.assertEquals(file.toString(), CanonicalPaths.displayPath(file, List.of()));
	}

	@Test
	void testHasExtension() {
		Assertions.assertTrue(CanonicalPaths.hasExtension(Paths.get("game/main.fab"), ".fab"));
		Assertions.assertFalse(CanonicalPaths.hasExtension(Paths.get("game/main.fab.bak"), ".fab"));
		Assertions.assertFalse(CanonicalPaths.hasExtension(Paths.get("game/fab"), ".fab"));
	}
}
