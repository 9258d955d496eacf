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

import com.tomaszrup.nesfabls.index.ProjectIndex;
import com.tomaszrup.nesfabls.symbols.SymbolExtractor;
import com.tomaszrup.nesfabls.syntax.nesfab.NesfabParser;
import org.eclipse.lsp4j.CompletionOptions;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.InitializedParams;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.ServerInfo;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.TextDocumentSyncOptions;
import org.eclipse.lsp4j.WorkspaceFoldersOptions;
import org.eclipse.lsp4j.WorkspaceServerCapabilities;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.logging.Level;

public class NesfabLanguageServer implements LanguageServer, LanguageClientAware {

    private static final Logger logger = LoggerFactory.getLogger(NesfabLanguageServer.class);

    static final int DEFAULT_PORT = 5007;

    public static void main(String[] args) throws IOException {
        // Log uncaught exceptions on any thread instead of letting them
        // silently kill the process.
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) -> {
            System.err.println("[FATAL] Uncaught exception on thread " + thread.getName());
            throwable.printStackTrace(System.err);
            logger.error("Uncaught exception on thread {}: {}",
                    thread.getName(), throwable.getMessage(), throwable);
        });

        // Unmatched $/cancelRequest notifications are normal.
        java.util.logging.Logger.getLogger("org.eclipse.lsp4j.jsonrpc.RemoteEndpoint")
                .setLevel(Level.SEVERE);
        if (args.length > 0 && "--tcp".equals(args[0])) {
            int port = DEFAULT_PORT;
            if (args.length > 1) {
                try {
                    port = Integer.parseInt(args[1]);
                } catch (NumberFormatException e) {
                    logger.error("Invalid port number: {}", args[1]);
                    System.exit(1);
                }
            }

            try (ServerSocket serverSocket = new ServerSocket(port, 50, InetAddress.getLoopbackAddress())) {
                logger.info("NESFab Language Server listening on port {} (localhost only)", port);
                try (Socket socket = serverSocket.accept()) {
                    logger.info("Client connected.");
                    startServer(socket.getInputStream(), socket.getOutputStream());
                }
            }
        } else {
            logger.info("NESFab Language Server starting in stdio mode.");
            startServer(System.in, System.out);
        }
    }

    private static void startServer(InputStream in, OutputStream out) {
        // stdout carries JSON-RPC
        System.setOut(new PrintStream(System.err));

        NesfabLanguageServer server = new NesfabLanguageServer();
        Launcher<NesfabLanguageClient> launcher = Launcher.createLauncher(server, NesfabLanguageClient.class, in, out);
        server.connect(launcher.getRemoteProxy());

        // All pool threads are daemons: block the main thread until the
        // connection closes.
        Future<Void> future = launcher.startListening();
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Language server listener interrupted");
        } catch (ExecutionException e) {
            logger.error("Language server listener terminated with error: {}",
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
        }
    }

    private final ExecutorPools executorPools;
    private final ProjectIndex index;
    private final NesfabServices nesfabServices;
    private final List<Path> initialRoots = new ArrayList<>();
    private LanguageClient client;

    public NesfabLanguageServer() {
        this(new ExecutorPools());
    }

    public NesfabLanguageServer(ExecutorPools executorPools) {
        this.executorPools = executorPools;
        this.index = new ProjectIndex(new NesfabParser(), new SymbolExtractor(),
                executorPools.getIndexingPool(), null);
        this.nesfabServices = new NesfabServices(index, executorPools);
    }

    @Override
    @SuppressWarnings("deprecation")
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        InitializationOptionsParser.ParsedOptions options =
                InitializationOptionsParser.parse(params.getInitializationOptions());
        index.setFallbackBase(InitializationOptionsParser.resolveFallbackBase(options, System.getenv()));

        initialRoots.clear();
        if (params.getWorkspaceFolders() != null && !params.getWorkspaceFolders().isEmpty()) {
            initialRoots.addAll(NesfabServices.toPaths(params.getWorkspaceFolders()));
        } else if (params.getRootUri() != null) {
            Path root = NesfabServices.toPath(params.getRootUri());
            if (root != null) {
                initialRoots.add(root);
            }
        }
        logger.info("Initializing with workspace roots {} and NESFab home {}", initialRoots,
                index.getFallbackBase());

        InitializeResult initializeResult = new InitializeResult(createCapabilities());
        initializeResult.setServerInfo(new ServerInfo("nesfab-language-server"));
        return CompletableFuture.completedFuture(initializeResult);
    }

    static ServerCapabilities createCapabilities() {
        ServerCapabilities serverCapabilities = new ServerCapabilities();
        TextDocumentSyncOptions syncOptions = new TextDocumentSyncOptions();
        syncOptions.setOpenClose(true);
        syncOptions.setChange(TextDocumentSyncKind.Full);
        serverCapabilities.setTextDocumentSync(syncOptions);
        serverCapabilities.setHoverProvider(true);
        serverCapabilities.setDefinitionProvider(true);
        serverCapabilities.setCompletionProvider(new CompletionOptions());

        WorkspaceFoldersOptions workspaceFolders = new WorkspaceFoldersOptions();
        workspaceFolders.setSupported(true);
        workspaceFolders.setChangeNotifications(Either.forRight(true));
        serverCapabilities.setWorkspace(new WorkspaceServerCapabilities(workspaceFolders));
        return serverCapabilities;
    }

    @Override
    public void initialized(InitializedParams params) {
        logProgress("Indexing " + initialRoots.size() + " workspace folders");
        nesfabServices.refreshWorkspace(initialRoots, Collections.emptySet())
                .thenAccept(refresh -> logProgress("Workspace indexed: " + refresh.getIndexedFiles()
                        + " files, " + refresh.getFailedFiles() + " failed"));
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        executorPools.shutdownAll();
        return CompletableFuture.completedFuture(new Object());
    }

    @Override
    public void exit() {
        System.exit(0);
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return nesfabServices;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return nesfabServices;
    }

    @Override
    public void connect(LanguageClient client) {
        this.client = client;
        nesfabServices.connect(client);
    }

    ProjectIndex getIndex() {
        return index;
    }

    /** Send a progress log message to the client (visible in output channel). */
    private void logProgress(String message) {
        logger.info(message);
        if (client != null) {
            client.logMessage(new MessageParams(MessageType.Info, message));
        }
    }
}
