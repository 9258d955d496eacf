////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
//
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.nesfabls;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.FileChangeType;
import org.eclipse.lsp4j.FileEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tomaszrup.nesfabls.index.ProjectIndex;
import com.tomaszrup.nesfabls.symbols.SymbolExtractor;
import com.tomaszrup.nesfabls.syntax.nesfab.NesfabParser;
import com.tomaszrup.nesfabls.util.CanonicalPaths;

class WatchedFileHandlerTests {

	@TempDir
	Path tempDir;

	private Path game;
	private ExecutorService indexingPool;
	private ExecutorService workspacePool;
	private ProjectIndex index;
	private final Set<Path> openFiles = new HashSet<>();
	private WatchedFileHandler handler;

	@BeforeEach
	void setup() throws Exception {
		game = Files.createDirectories(CanonicalPaths.canonicalize(tempDir).resolve("game"));
		indexingPool = Executors.newFixedThreadPool(2);
		workspacePool = Executors.newSingleThreadExecutor();
		index = new ProjectIndex(new NesfabParser(), new SymbolExtractor(), indexingPool, null);
		handler = new WatchedFileHandler(index, openFiles::contains, workspacePool);
	}

	@AfterEach
	void tearDown() {
		workspacePool.shutdownNow();
		indexingPool.shutdownNow();
	}

	private void fireEvent(Path file, FileChangeType type) throws Exception {
		handler.handleDidChangeWatchedFiles(new DidChangeWatchedFilesParams(
				List.of(new FileEvent(file.toUri().toString(), type)))).get(10, TimeUnit.SECONDS);
	}

	private boolean defines(Path file, String function) {
		return index.getSymbols(file).orElseThrow().findFunction(function).isPresent();
	}

	@Test
	void testClosedSourceIsReindexedFromDisk() throws Exception {
		Path main = game.resolve("main.fab");
		index.updateFile(main, "fn old()\n");
		Files.writeString(main, "fn fresh()\n");

		fireEvent(main, FileChangeType.Changed);

		Assertions.assertTrue(defines(main, "fresh"));
	}

	@Test
	void testOpenSourceKeepsEditorText() throws Exception {
		Path main = game.resolve("main.fab");
		index.updateFile(main, "fn edited()\n");
		openFiles.add(main);
		Files.writeString(main, "fn on_disk()\n");

		fireEvent(main, FileChangeType.Changed);

		Assertions.assertTrue(defines(main, "edited"));
	}

	@Test
	void testBrokenFileOnDiskKeepsPreviousSymbols() throws Exception {
		Path main = game.resolve("main.fab");
		index.updateFile(main, "fn old()\n");
		Files.writeString(main, "fn old(\n");

		fireEvent(main, FileChangeType.Changed);

		Assertions.assertTrue(defines(main, "old"));
	}

	@Test
	void testDeletedSourceIsIgnored() throws Exception {
		Path main = game.resolve("main.fab");
		index.updateFile(main, "fn old()\n");

		fireEvent(main, FileChangeType.Deleted);

		Assertions.assertTrue(defines(main, "old"));
	}

	@Test
	void testCreatedConfigRescansItsDirectory() throws Exception {
		Path main = Files.writeString(game.resolve("main.fab"), "fn main()\n");
		Path cfg = Files.writeString(game.resolve("game.cfg"), "input = main.fab\n");

		fireEvent(cfg, FileChangeType.Created);

		Assertions.assertEquals(Set.of(main), index.getDependencyGraph().getInputs(game));
		Assertions.assertTrue(defines(main, "main"));
	}

	@Test
	void testDeletedConfigDropsItsEntry() throws Exception {
		Files.writeString(game.resolve("main.fab"), "fn main()\n");
		Path cfg = Files.writeString(game.resolve("game.cfg"), "input = main.fab\n");
		index.refreshWorkspace(List.of(game), List.of());

		Files.delete(cfg);
		fireEvent(cfg, FileChangeType.Deleted);

		Assertions.assertTrue(index.getDependencyGraph().isEmpty());
	}

	@Test
	void testUnrelatedFilesAreIgnored() throws Exception {
		Path notes = Files.writeString(game.resolve("notes.txt"), "todo");

		fireEvent(notes, FileChangeType.Changed);

		Assertions.assertTrue(index.getIndexedPaths().isEmpty());
	}
}
