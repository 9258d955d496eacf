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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.nesfabls.symbols.SymbolExtractionException;
import com.tomaszrup.nesfabls.symbols.SymbolExtractor;
import com.tomaszrup.nesfabls.symbols.SymbolTable;
import com.tomaszrup.nesfabls.syntax.SourceParseException;
import com.tomaszrup.nesfabls.syntax.SyntaxParser;
import com.tomaszrup.nesfabls.syntax.SyntaxTree;
import com.tomaszrup.nesfabls.util.CanonicalPaths;
import com.tomaszrup.nesfabls.util.MdcFileContext;

/**
 * Shared, thread-safe store of everything the server knows about the
 * workspace: one {@link SourceFile} per canonical path, the current
 * {@link DependencyGraph} and the set of workspace roots.
 *
 * <p>Every write replaces a whole value. Source files are swapped per key
 * with {@link ConcurrentHashMap#compute}; the dependency graph is an
 * immutable snapshot published through an {@link AtomicReference}. Readers
 * never see a half-updated file, but may see different files at different
 * stages of a refresh.</p>
 *
 * <p>Entries are never evicted.</p>
 */
public class ProjectIndex {
	private static final Logger logger = LoggerFactory.getLogger(ProjectIndex.class);

	private final SyntaxParser parser;
	private final SymbolExtractor extractor;
	private final ExecutorService indexingPool;
	private final DependencyGraphBuilder graphBuilder;

	private final Map<Path, SourceFile> files = new ConcurrentHashMap<>();
	private final AtomicReference<DependencyGraph> graph = new AtomicReference<>(DependencyGraph.EMPTY);
	private final Set<Path> workspaceRoots = ConcurrentHashMap.newKeySet();
	private volatile Path fallbackBase;

	public ProjectIndex(SyntaxParser parser, SymbolExtractor extractor, ExecutorService indexingPool,
			Path fallbackBase) {
		this.parser = parser;
		this.extractor = extractor;
		this.indexingPool = indexingPool;
		this.graphBuilder = new DependencyGraphBuilder(indexingPool);
		this.fallbackBase = fallbackBase;
	}

	// --- Editor updates ---

	/**
	 * Stores new text for {@code path} and re-derives its tree and symbol
	 * table. The text is always stored. The tree and table are replaced only
	 * when both parsing and extraction succeed; otherwise the previous ones
	 * are kept and the failure is rethrown.
	 *
	 * @return the new symbol table
	 */
	public SymbolTable updateFile(Path path, String text) throws SourceParseException, SymbolExtractionException {
		Path key = CanonicalPaths.canonicalize(path);
		files.compute(key, (k, old) -> old == null ? SourceFile.unparsed(k, text) : old.withText(text));

		SyntaxTree tree = parser.parse(text);
		SymbolTable table = extractor.extract(tree);
		files.put(key, SourceFile.parsed(key, text, tree, table));
		logger.debug("Indexed {}: {} functions, {} variables", key, table.getFunctions().size(),
				table.getVariables().size());
		return table;
	}

	// --- Workspace updates ---

	/**
	 * Registers and unregisters workspace roots, then rescans the added ones.
	 *
	 * <p>Graph entries of config directories under a removed root (and not
	 * under any remaining root) are dropped. Entries under a rescanned root
	 * are replaced by the scan result. All other entries are kept. Files
	 * listed by the new graph that have no symbol table yet are indexed in
	 * parallel.</p>
	 *
	 * @throws InterruptedException if interrupted while scanning or indexing
	 */
	public WorkspaceRefresh refreshWorkspace(Collection<Path> added, Collection<Path> removed)
			throws InterruptedException {
		Set<Path> addedRoots = canonicalizeAll(added);
		Set<Path> removedRoots = canonicalizeAll(removed);
		workspaceRoots.removeAll(removedRoots);
		workspaceRoots.addAll(addedRoots);
		MdcFileContext.setWorkspaceRoots(workspaceRoots);
		logger.info("Workspace roots: {} (+{} -{})", workspaceRoots.size(), addedRoots.size(), removedRoots.size());
		return rebuild(addedRoots, removedRoots);
	}

	/**
	 * Rescans {@code directories} without touching the workspace roots.
	 * Used when config files change on disk.
	 *
	 * @throws InterruptedException if interrupted while scanning or indexing
	 */
	public WorkspaceRefresh rescanDirectories(Collection<Path> directories) throws InterruptedException {
		return rebuild(canonicalizeAll(directories), Collections.emptySet());
	}

	private WorkspaceRefresh rebuild(Set<Path> scanRoots, Set<Path> removedRoots) throws InterruptedException {
		Map<Path, Set<Path>> rescanned = graphBuilder.build(scanRoots, fallbackBase);
		Set<Path> remainingRoots = getWorkspaceRoots();
		DependencyGraph updated = graph.updateAndGet(current -> current.rebuild(
				dir -> isUnderAny(dir, scanRoots)
						|| (isUnderAny(dir, removedRoots) && !isUnderAny(dir, remainingRoots)),
				rescanned));

		List<Path> pending = new ArrayList<>();
		for (Path input : updated.getAllInputs()) {
			SourceFile cached = files.get(input);
			if (cached == null || !cached.isIndexed()) {
				pending.add(input);
			}
		}
		int[] outcome = indexAll(pending);
		WorkspaceRefresh refresh = new WorkspaceRefresh(rescanned.size(), updated.asMap().size(), outcome[0],
				outcome[1]);
		logger.info("Workspace refresh done: {}", refresh);
		return refresh;
	}

	/** Returns {indexed, failed}. */
	private int[] indexAll(List<Path> paths) throws InterruptedException {
		if (paths.isEmpty()) {
			return new int[] { 0, 0 };
		}
		List<Callable<Boolean>> tasks = new ArrayList<>(paths.size());
		for (Path path : paths) {
			tasks.add(() -> indexIfAbsent(path));
		}
		List<Future<Boolean>> futures = indexingPool.invokeAll(tasks);
		int indexed = 0;
		int failed = 0;
		for (int i = 0; i < futures.size(); i++) {
			try {
				if (futures.get(i).get()) {
					indexed++;
				}
			} catch (ExecutionException e) {
				failed++;
				logger.warn("Failed to index {}: {}", paths.get(i), e.getCause().getMessage());
			}
		}
		logger.debug("Bulk indexing: {} indexed, {} failed, {} requested", indexed, failed, paths.size());
		return new int[] { indexed, failed };
	}

	/**
	 * Parses one file for bulk indexing. Prefers text already cached from the
	 * editor over the file on disk. The result is merged only if the file
	 * still has no table and its text did not change in the meantime.
	 *
	 * @return whether the result was stored
	 */
	private boolean indexIfAbsent(Path path) throws IOException, SourceParseException, SymbolExtractionException {
		MdcFileContext.setFile(path);
		try {
			SourceFile cached = files.get(path);
			String text = cached != null ? cached.getText() : Files.readString(path, StandardCharsets.UTF_8);
			SyntaxTree tree = parser.parse(text);
			SymbolTable table = extractor.extract(tree);
			SourceFile parsed = SourceFile.parsed(path, text, tree, table);
			AtomicBoolean stored = new AtomicBoolean();
			files.compute(path, (k, old) -> {
				if (old != null && (old.isIndexed() || !old.getText().equals(text))) {
					return old;
				}
				stored.set(true);
				return parsed;
			});
			return stored.get();
		} finally {
			MdcFileContext.clear();
		}
	}

	// --- Queries ---

	public Optional<SourceFile> getSourceFile(Path path) {
		return Optional.ofNullable(files.get(CanonicalPaths.canonicalize(path)));
	}

	public Optional<SymbolTable> getSymbols(Path path) {
		return getSourceFile(path).flatMap(SourceFile::getSymbols);
	}

	public Optional<SyntaxTree> getTree(Path path) {
		return getSourceFile(path).flatMap(SourceFile::getTree);
	}

	/** Paths of every file that has a symbol table, sorted. */
	public Set<Path> getIndexedPaths() {
		Set<Path> paths = new TreeSet<>();
		for (SourceFile file : files.values()) {
			if (file.isIndexed()) {
				paths.add(file.getPath());
			}
		}
		return paths;
	}

	public DependencyGraph getDependencyGraph() {
		return graph.get();
	}

	/** Snapshot of the registered workspace roots. */
	public Set<Path> getWorkspaceRoots() {
		return Collections.unmodifiableSet(new LinkedHashSet<>(workspaceRoots));
	}

	public Path getFallbackBase() {
		return fallbackBase;
	}

	/** Changes the NESFab home used by later scans. */
	public void setFallbackBase(Path fallbackBase) {
		this.fallbackBase = fallbackBase;
	}

	private static Set<Path> canonicalizeAll(Collection<Path> paths) {
		Set<Path> result = new LinkedHashSet<>();
		for (Path path : paths) {
			result.add(CanonicalPaths.canonicalize(path));
		}
		return result;
	}

	private static boolean isUnderAny(Path dir, Collection<Path> roots) {
		for (Path root : roots) {
			if (dir.startsWith(root)) {
				return true;
			}
		}
		return false;
	}
}
