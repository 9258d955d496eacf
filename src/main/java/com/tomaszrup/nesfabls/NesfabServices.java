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

import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.CompletionParams;
import org.eclipse.lsp4j.DefinitionParams;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidChangeWorkspaceFoldersParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.LocationLink;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.WorkspaceFolder;
import org.eclipse.lsp4j.WorkspaceFoldersChangeEvent;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.nesfabls.index.ProjectIndex;
import com.tomaszrup.nesfabls.index.WorkspaceRefresh;
import com.tomaszrup.nesfabls.providers.CompletionProvider;
import com.tomaszrup.nesfabls.providers.DefinitionProvider;
import com.tomaszrup.nesfabls.providers.HoverProvider;
import com.tomaszrup.nesfabls.providers.SymbolResolver;
import com.tomaszrup.nesfabls.symbols.SymbolTable;
import com.tomaszrup.nesfabls.util.CanonicalPaths;
import com.tomaszrup.nesfabls.util.MdcFileContext;

/**
 * Implements the LSP {@link TextDocumentService} and {@link WorkspaceService}
 * on top of a {@link ProjectIndex}.
 *
 * <p>Editor updates are indexed synchronously on the notification thread.
 * Workspace refreshes and config rescans are queued on the single-threaded
 * workspace pool, so they never overlap. Requests are answered from whatever
 * the index holds at the time.</p>
 */
public class NesfabServices implements TextDocumentService, WorkspaceService, LanguageClientAware {
	private static final Logger logger = LoggerFactory.getLogger(NesfabServices.class);

	private final ProjectIndex index;
	private final ExecutorPools executorPools;
	private final HoverProvider hoverProvider;
	private final DefinitionProvider definitionProvider;
	private final CompletionProvider completionProvider;
	private final WatchedFileHandler watchedFileHandler;
	private final ConfigurationChangeHandler configChangeHandler;
	private final LspRequestGuard requestGuard;

	private final Set<Path> openFiles = ConcurrentHashMap.newKeySet();
	private final AtomicReference<LanguageClient> languageClient = new AtomicReference<>();

	public NesfabServices(ProjectIndex index, ExecutorPools executorPools) {
		this.index = index;
		this.executorPools = executorPools;
		SymbolResolver resolver = new SymbolResolver(index);
		this.hoverProvider = new HoverProvider(resolver);
		this.definitionProvider = new DefinitionProvider(resolver);
		this.completionProvider = new CompletionProvider(resolver);
		this.watchedFileHandler = new WatchedFileHandler(index, openFiles::contains,
				executorPools.getWorkspacePool());
		this.configChangeHandler = new ConfigurationChangeHandler(index);
		this.requestGuard = new LspRequestGuard(index::getWorkspaceRoots);
		this.configChangeHandler.setFallbackBaseListener(
				fallbackBase -> refreshWorkspace(index.getWorkspaceRoots(), Collections.emptySet()));
	}

	// --- Lifecycle / wiring ---

	@Override
	public void connect(LanguageClient client) {
		this.languageClient.set(client);
	}

	public ProjectIndex getIndex() {
		return index;
	}

	/**
	 * Queues a workspace refresh on the workspace pool and reports its
	 * progress through {@code nesfab/statusUpdate}.
	 *
	 * @return a future completing with the refresh summary
	 */
	public CompletableFuture<WorkspaceRefresh> refreshWorkspace(Collection<Path> added, Collection<Path> removed) {
		List<Path> addedRoots = new ArrayList<>(added);
		List<Path> removedRoots = new ArrayList<>(removed);
		return CompletableFuture.supplyAsync(() -> {
			sendStatusUpdate(StatusUpdateParams.INDEXING, "Indexing NESFab workspace");
			try {
				WorkspaceRefresh refresh = index.refreshWorkspace(addedRoots, removedRoots);
				sendStatusUpdate(StatusUpdateParams.READY, refresh.getIndexedFiles() + " files indexed");
				return refresh;
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				sendStatusUpdate(StatusUpdateParams.ERROR, "Workspace indexing interrupted");
				throw new CompletionException(e);
			} catch (RuntimeException e) {
				logger.error("Workspace refresh failed: {}", e.toString());
				logger.debug("Workspace refresh failure details", e);
				sendStatusUpdate(StatusUpdateParams.ERROR, "Workspace indexing failed: " + e.getMessage());
				throw e;
			}
		}, executorPools.getWorkspacePool());
	}

	void sendStatusUpdate(String state, String message) {
		LanguageClient client = languageClient.get();
		if (client instanceof NesfabLanguageClient) {
			try {
				((NesfabLanguageClient) client).statusUpdate(new StatusUpdateParams(state, message));
			} catch (RuntimeException e) {
				logger.debug("Failed to send statusUpdate: {}", e.getMessage());
			}
		}
	}

	// --- TextDocumentService notifications ---

	@Override
	public void didOpen(DidOpenTextDocumentParams params) {
		String uri = params.getTextDocument().getUri();
		Path path = toPath(uri);
		if (path == null) {
			return;
		}
		openFiles.add(path);
		updateFile(path, params.getTextDocument().getText(), "didOpen");
	}

	@Override
	public void didChange(DidChangeTextDocumentParams params) {
		List<TextDocumentContentChangeEvent> changes = params.getContentChanges();
		if (changes == null || changes.isEmpty()) {
			return;
		}
		Path path = toPath(params.getTextDocument().getUri());
		if (path == null) {
			return;
		}
		updateFile(path, changes.get(changes.size() - 1).getText(), "didChange");
	}

	@Override
	public void didClose(DidCloseTextDocumentParams params) {
		Path path = toPath(params.getTextDocument().getUri());
		if (path != null) {
			openFiles.remove(path);
		}
		// The cached text and symbols stay until the file changes on disk.
	}

	@Override
	public void didSave(DidSaveTextDocumentParams params) {
		// the text was already indexed by didChange
	}

	private void updateFile(Path path, String text, String notification) {
		MdcFileContext.setFile(path);
		try {
			SymbolTable table = index.updateFile(path, text);
			logger.debug("{} indexed {} functions and {} variables", notification, table.getFunctions().size(),
					table.getVariables().size());
		} catch (IndexingException e) {
			logger.warn("{} could not index {}: {}", notification, path, e.getMessage());
			logMessage(MessageType.Error, CanonicalPaths.displayPath(path, index.getWorkspaceRoots()) + ": "
					+ e.getMessage());
		} catch (LinkageError e) {
			logger.warn("Linkage error during {} for {}: {}", notification, path, e.toString());
			logger.debug("{} LinkageError details", notification, e);
		} catch (RuntimeException e) {
			logger.warn("Unexpected exception during {} for {}: {}", notification, path, e.getMessage());
			logger.debug("{} exception details", notification, e);
		} finally {
			MdcFileContext.clear();
		}
	}

	private void logMessage(MessageType type, String message) {
		LanguageClient client = languageClient.get();
		if (client != null) {
			client.logMessage(new MessageParams(type, message));
		}
	}

	static Path toPath(String uri) {
		try {
			return CanonicalPaths.fromUri(uri);
		} catch (IllegalArgumentException | FileSystemNotFoundException e) {
			logger.debug("Ignoring document with non-file uri {}: {}", uri, e.getMessage());
			return null;
		}
	}

	// --- WorkspaceService notifications ---

	@Override
	public void didChangeWorkspaceFolders(DidChangeWorkspaceFoldersParams params) {
		WorkspaceFoldersChangeEvent event = params.getEvent();
		List<Path> added = toPaths(event.getAdded());
		List<Path> removed = toPaths(event.getRemoved());
		refreshWorkspace(added, removed);
	}

	@Override
	public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
		watchedFileHandler.handleDidChangeWatchedFiles(params);
	}

	@Override
	public void didChangeConfiguration(DidChangeConfigurationParams params) {
		configChangeHandler.handleConfigurationChange(params.getSettings());
	}

	static List<Path> toPaths(List<WorkspaceFolder> folders) {
		List<Path> paths = new ArrayList<>();
		if (folders == null) {
			return paths;
		}
		for (WorkspaceFolder folder : folders) {
			Path path = toPath(folder.getUri());
			if (path != null) {
				paths.add(path);
			}
		}
		return paths;
	}

	// --- TextDocumentService requests ---

	@Override
	public CompletableFuture<Hover> hover(HoverParams params) {
		String uri = params.getTextDocument().getUri();
		return requestGuard.failSoftRequest("hover", uri,
				() -> hoverProvider.provideHover(params.getTextDocument(), params.getPosition()), null);
	}

	@Override
	public CompletableFuture<Either<List<CompletionItem>, CompletionList>> completion(CompletionParams params) {
		String uri = params.getTextDocument().getUri();
		return requestGuard.failSoftRequest("completion", uri,
				() -> completionProvider.provideCompletion(params.getTextDocument()),
				Either.forLeft(Collections.emptyList()));
	}

	@Override
	public CompletableFuture<Either<List<? extends Location>, List<? extends LocationLink>>> definition(
			DefinitionParams params) {
		String uri = params.getTextDocument().getUri();
		return requestGuard.failSoftRequest("definition", uri,
				() -> definitionProvider.provideDefinition(params.getTextDocument(), params.getPosition()),
				Either.forLeft(Collections.emptyList()));
	}
}
