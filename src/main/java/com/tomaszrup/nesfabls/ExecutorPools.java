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
package com.tomaszrup.nesfabls;

import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.nesfabls.util.MdcFileContext;

/**
 * Thread pools of the NESFab Language Server.
 *
 * <ul>
 *   <li><b>Workspace pool</b>: single thread; runs workspace refreshes one
 *       after the other so two folder changes never rebuild the dependency
 *       graph at the same time.</li>
 *   <li><b>Indexing pool</b>: fixed-size pool ({@code availableProcessors}
 *       threads) for per-config scans and per-file parse/extract tasks.</li>
 * </ul>
 *
 * <p>Both pools use daemon threads and hand the submitting thread's MDC
 * context to their tasks. Create one instance in
 * {@link NesfabLanguageServer} and call {@link #shutdownAll()} on
 * shutdown.</p>
 */
public class ExecutorPools {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorPools.class);

    private final ExecutorService workspacePool;

    private final ExecutorService indexingPool;

    public ExecutorPools() {
        this(Runtime.getRuntime().availableProcessors());
    }

    public ExecutorPools(int indexingThreads) {
        this.workspacePool = new MdcExecutor(
                Executors.newSingleThreadExecutor(daemonThreads("nesfabls-workspace")));
        this.indexingPool = new MdcExecutor(
                Executors.newFixedThreadPool(Math.max(1, indexingThreads), daemonThreads("nesfabls-index")));
        logger.info("Indexing threads: {}", Math.max(1, indexingThreads));
    }

    /** Single-threaded executor for workspace refreshes. */
    public ExecutorService getWorkspacePool() {
        return workspacePool;
    }

    /** Pool for config scanning and per-file indexing. */
    public ExecutorService getIndexingPool() {
        return indexingPool;
    }

    /**
     * Shut down all pools. Running tasks are interrupted; waits up to 5
     * seconds for each pool to terminate.
     */
    public void shutdownAll() {
        logger.debug("Shutting down executor pools");
        workspacePool.shutdownNow();
        indexingPool.shutdownNow();
        try {
            workspacePool.awaitTermination(5, TimeUnit.SECONDS);
            indexingPool.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Hands the submitting thread's MDC (the {@code file} key in particular)
     * to each task. Every {@code submit} and {@code invokeAll} variant of
     * {@link AbstractExecutorService} reaches {@link #execute} on the
     * submitting thread.
     */
    private static final class MdcExecutor extends AbstractExecutorService {
        private final ExecutorService delegate;

        MdcExecutor(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(MdcFileContext.wrap(command));
        }

        @Override
        public void shutdown() {
            delegate.shutdown();
        }

        @Override
        public List<Runnable> shutdownNow() {
            return delegate.shutdownNow();
        }

        @Override
        public boolean isShutdown() {
            return delegate.isShutdown();
        }

        @Override
        public boolean isTerminated() {
            return delegate.isTerminated();
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }
    }
}
