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

import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.nesfabls.util.CanonicalPaths;
import com.tomaszrup.nesfabls.util.MdcFileContext;

/**
 * Runs hover, definition and completion requests so that an unexpected
 * failure answers the request's empty value instead of an error response.
 * The failure is logged against the document's workspace-relative path,
 * with the {@code file} MDC key set to that document.
 */
class LspRequestGuard {
	private static final Logger logger = LoggerFactory.getLogger(LspRequestGuard.class);

	private final Supplier<? extends Collection<Path>> workspaceRoots;

	LspRequestGuard(Supplier<? extends Collection<Path>> workspaceRoots) {
		this.workspaceRoots = workspaceRoots;
	}

	<T> CompletableFuture<T> failSoftRequest(String requestName, String uri,
			Supplier<CompletableFuture<T>> requestCall, T fallbackValue) {
		CompletableFuture<T> future;
		try {
			future = requestCall.get();
		} catch (Exception | LinkageError throwable) {
			return CompletableFuture.completedFuture(recover(requestName, uri, throwable, fallbackValue));
		}
		if (future == null) {
			return CompletableFuture.completedFuture(fallbackValue);
		}
		return future.exceptionally(throwable -> recover(requestName, uri, throwable, fallbackValue));
	}

	private <T> T recover(String requestName, String uri, Throwable throwable, T fallbackValue) {
		Throwable cause = unwrapRequestThrowable(throwable);
		if (cause instanceof VirtualMachineError) {
			throw (VirtualMachineError) cause;
		}
		Path file = documentPath(uri);
		Map<String, String> previousContext = MdcFileContext.snapshot();
		MdcFileContext.setFile(file);
		try {
			logger.warn("{} failed for {}: {}", requestName, displayName(uri), summarizeThrowable(cause));
			logger.debug("{} failure details", requestName, cause);
		} finally {
			MdcFileContext.restore(previousContext);
		}
		return fallbackValue;
	}

	/**
	 * The document as it is shown in log lines: its path relative to the
	 * deepest workspace root, or the URI itself when it is not a file URI.
	 */
	String displayName(String uri) {
		Path file = documentPath(uri);
		if (file == null) {
			return String.valueOf(uri);
		}
		return CanonicalPaths.displayPath(file, workspaceRoots.get());
	}

	private static Path documentPath(String uri) {
		return uri == null ? null : NesfabServices.toPath(uri);
	}

	static String summarizeThrowable(Throwable throwable) {
		if (throwable == null) {
			return "<null>";
		}
		String message = throwable.getMessage();
		if (message == null || message.isBlank()) {
			return throwable.getClass().getName();
		}
		return throwable.getClass().getName() + ": " + message;
	}

	static Throwable unwrapRequestThrowable(Throwable throwable) {
		Throwable current = throwable;
		while (current instanceof CompletionException || current instanceof ExecutionException) {
			Throwable cause = current.getCause();
			if (cause == null) {
				break;
			}
			current = cause;
		}
		return current;
	}
}
