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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tomaszrup.nesfabls.symbols.SymbolExtractor;
import com.tomaszrup.nesfabls.symbols.SymbolTable;
import com.tomaszrup.nesfabls.syntax.SourceParseException;
import com.tomaszrup.nesfabls.syntax.nesfab.NesfabParser;
import com.tomaszrup.nesfabls.util.CanonicalPaths;

/**
 * Tests for {@link ProjectIndex}: editor updates, failure handling, bulk
 * indexing and the replace-or-keep rules of workspace refreshes.
 */
class ProjectIndexTests {

	@TempDir
	Path tempDir;

	private Path workspace;
	private ExecutorService indexingPool;
	private ProjectIndex index;

	@BeforeEach
	void setup() {
		workspace = CanonicalPaths.canonicalize(tempDir);
		indexingPool = Executors.newFixedThreadPool(4);
		index = new ProjectIndex(new NesfabParser(), new SymbolExtractor(), indexingPool, null);
	}

	@AfterEach
	void tearDown() {
		indexingPool.shutdownNow();
	}

	private static Path write(Path file, String contents) throws Exception {
		Files.createDirectories(file.getParent());
		return Files.writeString(file, contents);
	}

	private Set<String> functionNames(Path file) {
		Set<String> names = new java.util.TreeSet<>();
		index.getSymbols(file).orElseThrow().getFunctions().forEach(f -> names.add(f.getName()));
		return names;
	}

	// ------------------------------------------------------------------
	// updateFile()
	// ------------------------------------------------------------------

	@Test
	void testUpdateFileIsIdempotent() throws Exception {
		Path file = workspace.resolve("main.fab");
		String text = "// entry\nfn main()\n    U x = 1\nU lives = 3\n";

		SymbolTable first = index.updateFile(file, text);
		SymbolTable second = index.updateFile(file, text);

		Assertions.assertEquals(first, second);
		Assertions.assertEquals(first, index.getSymbols(file).orElseThrow());
		Assertions.assertEquals(Set.of(file), index.getIndexedPaths());
	}

	@Test
	void testFailedParseKeepsPreviousTableButReplacesText() throws Exception {
		Path file = workspace.resolve("main.fab");
		index.updateFile(file, "fn main()\n");

		String broken = "fn main(\n";
		Assertions.assertThrows(SourceParseException.class, () -> index.updateFile(file, broken));

		Assertions.assertEquals(Set.of("main"), functionNames(file));
		Assertions.assertEquals(broken, index.getSourceFile(file).orElseThrow().getText());
		Assertions.assertTrue(index.getTree(file).isPresent());
	}

	@Test
	void testFailedFirstParseLeavesFileUnindexed() {
		Path file = workspace.resolve("main.fab");

		Assertions.assertThrows(SourceParseException.class, () -> index.updateFile(file, "fn main(\n"));

		SourceFile cached = index.getSourceFile(file).orElseThrow();
		Assertions.assertFalse(cached.isIndexed());
		Assertions.assertTrue(index.getSymbols(file).isEmpty());
		Assertions.assertTrue(index.getIndexedPaths().isEmpty());
	}

	@Test
	void testConcurrentUpdatesToDifferentFilesDoNotInterfere() throws Exception {
		ExecutorService editors = Executors.newFixedThreadPool(8);
		try {
			List<Callable<Void>> tasks = new ArrayList<>();
			for (int i = 0; i < 16; i++) {
				Path file = workspace.resolve("f" + i + ".fab");
				String name = "fn_" + i;
				tasks.add(() -> {
					for (int round = 0; round < 20; round++) {
						index.updateFile(file, "fn " + name + "()\n    U v = " + round + "\n");
					}
					return null;
				});
			}
			for (Future<Void> future : editors.invokeAll(tasks)) {
				future.get();
			}
		} finally {
			editors.shutdownNow();
		}

		Assertions.assertEquals(16, index.getIndexedPaths().size());
		for (int i = 0; i < 16; i++) {
			Path file = workspace.resolve("f" + i + ".fab");
			Assertions.assertEquals(Set.of("fn_" + i), functionNames(file));
			Assertions.assertTrue(index.getSourceFile(file).orElseThrow().getText().contains("= 19"));
		}
	}

	// ------------------------------------------------------------------
	// refreshWorkspace()
	// ------------------------------------------------------------------

	@Test
	void testRefreshIndexesConfiguredInputs() throws Exception {
		Path game = workspace.resolve("game");
		Path main = write(game.resolve("main.fab"), "fn main()\n    draw()\n");
		Path draw = write(game.resolve("draw.fab"), "fn draw()\n");
		write(game.resolve("unlisted.fab"), "fn unlisted()\n");
		write(game.resolve("game.cfg"), "input = main.fab\ninput = draw.fab\n");

		WorkspaceRefresh refresh = index.refreshWorkspace(List.of(workspace), List.of());

		Assertions.assertEquals(1, refresh.getRescannedConfigDirectories());
		Assertions.assertEquals(1, refresh.getTotalConfigDirectories());
		Assertions.assertEquals(2, refresh.getIndexedFiles());
		Assertions.assertEquals(0, refresh.getFailedFiles());
		Assertions.assertEquals(Set.of(draw, main), index.getIndexedPaths());
		Assertions.assertEquals(Set.of(draw, main), index.getDependencyGraph().getInputs(game));
		Assertions.assertEquals(Set.of(workspace), index.getWorkspaceRoots());
	}

	@Test
	void testBulkIndexingNeverOverwritesEditorTable() throws Exception {
		Path game = workspace.resolve("game");
		Path main = write(game.resolve("main.fab"), "fn from_disk()\n");
		write(game.resolve("game.cfg"), "input = main.fab\n");
		index.updateFile(main, "fn from_editor()\n");

		WorkspaceRefresh refresh = index.refreshWorkspace(List.of(workspace), List.of());

		Assertions.assertEquals(0, refresh.getIndexedFiles());
		Assertions.assertEquals(Set.of("from_editor"), functionNames(main));
	}

	@Test
	void testBulkIndexingPrefersCachedEditorText() throws Exception {
		Path game = workspace.resolve("game");
		Path main = write(game.resolve("main.fab"), "fn from_disk()\n");
		write(game.resolve("game.cfg"), "input = main.fab\n");
		Assertions.assertThrows(SourceParseException.class, () -> index.updateFile(main, "fn broken(\n"));

		WorkspaceRefresh refresh = index.refreshWorkspace(List.of(workspace), List.of());

		Assertions.assertEquals(1, refresh.getFailedFiles());
		Assertions.assertTrue(index.getSymbols(main).isEmpty());
	}

	@Test
	void testBrokenFileOnDiskDoesNotStopOthers() throws Exception {
		Path game = workspace.resolve("game");
		Path good = write(game.resolve("good.fab"), "fn good()\n");
		write(game.resolve("bad.fab"), "fn bad(\n");
		write(game.resolve("game.cfg"), "input = good.fab\ninput = bad.fab\n");

		WorkspaceRefresh refresh = index.refreshWorkspace(List.of(workspace), List.of());

		Assertions.assertEquals(1, refresh.getIndexedFiles());
		Assertions.assertEquals(1, refresh.getFailedFiles());
		Assertions.assertEquals(Set.of(good), index.getIndexedPaths());
	}

	@Test
	void testRefreshKeepsEntriesOfRootsNotRescanned() throws Exception {
		Path first = workspace.resolve("first");
		Path second = workspace.resolve("second");
		write(first.resolve("a.fab"), "fn a()\n");
		write(first.resolve("first.cfg"), "input = a.fab\n");
		write(second.resolve("b.fab"), "fn b()\n");
		write(second.resolve("second.cfg"), "input = b.fab\n");

		index.refreshWorkspace(List.of(first), List.of());
		WorkspaceRefresh refresh = index.refreshWorkspace(List.of(second), List.of());

		Assertions.assertEquals(1, refresh.getRescannedConfigDirectories());
		Assertions.assertEquals(2, refresh.getTotalConfigDirectories());
		Assertions.assertEquals(Set.of(first, second), index.getDependencyGraph().asMap().keySet());
	}

	@Test
	void testRemovedRootDropsItsEntries() throws Exception {
		Path first = workspace.resolve("first");
		Path second = workspace.resolve("second");
		write(first.resolve("a.fab"), "fn a()\n");
		write(first.resolve("first.cfg"), "input = a.fab\n");
		write(second.resolve("b.fab"), "fn b()\n");
		write(second.resolve("second.cfg"), "input = b.fab\n");
		index.refreshWorkspace(List.of(first, second), List.of());

		index.refreshWorkspace(List.of(), List.of(second));

		Assertions.assertEquals(Set.of(first), index.getDependencyGraph().asMap().keySet());
		Assertions.assertEquals(Set.of(first), index.getWorkspaceRoots());
	}

	@Test
	void testRemovedNestedRootKeepsEntriesOfEnclosingRoot() throws Exception {
		Path nested = workspace.resolve("game");
		write(nested.resolve("main.fab"), "fn main()\n");
		write(nested.resolve("game.cfg"), "input = main.fab\n");
		index.refreshWorkspace(List.of(workspace, nested), List.of());

		index.refreshWorkspace(List.of(), List.of(nested));

		Assertions.assertEquals(Set.of(nested), index.getDependencyGraph().asMap().keySet());
	}

	@Test
	void testRescanAfterConfigDeletedDropsEntry() throws Exception {
		Path game = workspace.resolve("game");
		write(game.resolve("main.fab"), "fn main()\n");
		Path cfg = write(game.resolve("game.cfg"), "input = main.fab\n");
		index.refreshWorkspace(List.of(workspace), List.of());

		Files.delete(cfg);
		index.rescanDirectories(List.of(game));

		Assertions.assertTrue(index.getDependencyGraph().isEmpty());
	}

	@Test
	void testFallbackBaseIsUsedByLaterScans() throws Exception {
		Path home = workspace.resolve("home");
		Path lib = write(home.resolve("lib/joy.fab"), "fn read_joy()\n");
		Path game = workspace.resolve("game");
		write(game.resolve("game.cfg"), "input = lib/joy.fab\n");

		index.refreshWorkspace(List.of(game), List.of());
		Assertions.assertTrue(index.getDependencyGraph().getInputs(game).isEmpty());

		index.setFallbackBase(home);
		index.rescanDirectories(List.of(game));

		Assertions.assertEquals(Set.of(lib), index.getDependencyGraph().getInputs(game));
		Assertions.assertEquals(Set.of("read_joy"), functionNames(lib));
	}
}
