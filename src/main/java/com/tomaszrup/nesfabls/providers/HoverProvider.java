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
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.TextDocumentIdentifier;

import com.tomaszrup.nesfabls.util.CanonicalPaths;

public class HoverProvider {
	private final SymbolResolver resolver;

	public HoverProvider(SymbolResolver resolver) {
		this.resolver = resolver;
	}

	public CompletableFuture<Hover> provideHover(TextDocumentIdentifier textDocument, Position position) {
		Path path = CanonicalPaths.fromUri(textDocument.getUri());
		Optional<HoverResult> result = resolver.hover(path, position);
		if (result.isEmpty()) {
			return CompletableFuture.completedFuture(null);
		}

		StringBuilder contentsBuilder = new StringBuilder();
		contentsBuilder.append(result.get().getDisplayPath());
		contentsBuilder.append("\n\n```nesfab\n");
		contentsBuilder.append(result.get().getDescription());
		contentsBuilder.append("\n```");

		MarkupContent contents = new MarkupContent();
		contents.setKind(MarkupKind.MARKDOWN);
		contents.setValue(contentsBuilder.toString());
		Hover hover = new Hover();
		hover.setContents(contents);
		return CompletableFuture.completedFuture(hover);
	}
}
