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
package com.tomaszrup.nesfabls.providers;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.LocationLink;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.nesfabls.util.CanonicalPaths;

public class DefinitionProvider {
	private static final Logger logger = LoggerFactory.getLogger(DefinitionProvider.class);

	private final SymbolResolver resolver;

	public DefinitionProvider(SymbolResolver resolver) {
		this.resolver = resolver;
	}

	public CompletableFuture<Either<List<? extends Location>, List<? extends LocationLink>>> provideDefinition(
			TextDocumentIdentifier textDocument, Position position) {
		Path path = CanonicalPaths.fromUri(textDocument.getUri());
		Optional<DefinitionResult> result = resolver.gotoDefinition(path, position);
		if (result.isEmpty()) {
			logger.debug("No definition at {}:{} in {}", position.getLine(), position.getCharacter(), path);
			return CompletableFuture.completedFuture(Either.forLeft(Collections.emptyList()));
		}
		Location location = new Location(result.get().getFile().toUri().toString(), result.get().getRange());
		return CompletableFuture.completedFuture(Either.forLeft(Collections.singletonList(location)));
	}
}
