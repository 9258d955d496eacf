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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Predicate;

import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.FileChangeType;
import org.eclipse.lsp4j.FileEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.nesfabls.index.DependencyGraphBuilder;
import com.tomaszrup.nesfabls.index.ProjectIndex;
import com.tomaszrup.nesfabls.index.WorkspaceRefresh;
import com.tomaszrup.nesfabls.util.CanonicalPaths;
import com.tomaszrup.nesfabls.util.MdcFileContext;

/**
 * Handles file-system change events (didChangeWatchedFiles).
 *
 * <p>A {@code .fab} file that changed on disk and is not open in the editor
 * is re-read and re-indexed. Any change to a {@code .cfg} file rescans the
 * directory holding it. Both run on the workspace pool, after any refresh
 * already queued there.</p>
 */
public class WatchedFileHandler {
	private static final Logger logger = LoggerFactory.getLogger(WatchedFileHandler.class);

	private final ProjectIndex index;
	private final Predicate<Path> isOpen;
	private final ExecutorService workspacePool;

	public WatchedFileHandler(ProjectIndex index, Predicate<Path> isOpen, ExecutorService workspacePool) {
		this.index = index;
		this.isOpen = isOpen;
		this.workspacePool = workspacePool;
	}

	/**
	 * @return a future completing once the changed files were re-indexed
	 *         and the affected config directories rescanned
	 */
	public CompletableFuture<Void> handleDidChangeWatchedFiles(DidChangeWatchedFilesParams params) {
		List<Path> sources = new ArrayList<>();
		Set<Path> configDirectories = new TreeSet<>();
		for (FileEvent event : params.getChanges()) {
			logger.debug("watcherTrace eventType={} uri={}", event.getType(), event.getUri());
			Path path;
			try {
				path = CanonicalPaths.fromUri(event.getUri());
			} catch (IllegalArgumentException | FileSystemNotFoundException e) {
				logger.debug("Ignoring watched file event with unusable uri {}: {}", event.getUri(), e.getMessage());
				continue;
			}
			if (CanonicalPaths.hasExtension(path, DependencyGraphBuilder.CONFIG_EXTENSION)) {
				if (path.getParent() != null) {
					configDirectories.add(path.getParent());
				}
			} else if (CanonicalPaths.hasExtension(path, DependencyGraphBuilder.SOURCE_EXTENSION)
					&& event.getType() != FileChangeType.Deleted && !isOpen.test(path)) {
				sources.add(path);
			}
		}
		if (sources.isEmpty() && configDirectories.isEmpty()) {
			return CompletableFuture.completedFuture(null);
		}
		return CompletableFuture.runAsync(() -> {
			for (Path source : sources) {
				reindexFromDisk(source);
			}
			if (!configDirectories.isEmpty()) {
				rescan(configDirectories);
			}
		}, workspacePool);
	}

	private void reindexFromDisk(Path source) {
		MdcFileContext.setFile(source);
		try {
			if (isOpen.test(source)) {
				return;
			}
			String text = Files.readString(source, StandardCharsets.UTF_8);
			index.updateFile(source, text);
		} catch (IOException | IndexingException e) {
			logger.warn("Failed to re-index {} after it changed on disk: {}", source, e.getMessage());
		} finally {
			MdcFileContext.clear();
		}
	}

	private void rescan(Set<Path> configDirectories) {
		try {
			WorkspaceRefresh refresh = index.rescanDirectories(configDirectories);
			logger.info("Config change in {} directories: {}", configDirectories.size(), refresh);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("Interrupted while rescanning {}", configDirectories);
		}
	}
}
