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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionItemKind;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.jsonrpc.messages.Either;

import com.tomaszrup.nesfabls.symbols.Symbol;
import com.tomaszrup.nesfabls.util.CanonicalPaths;

/**
 * Offers every function and global variable visible from the document:
 * its own definitions plus those of files sharing a build configuration.
 * The cursor position does not narrow the list; clients filter by prefix.
 */
public class CompletionProvider {
	private final SymbolResolver resolver;

	public CompletionProvider(SymbolResolver resolver) {
		this.resolver = resolver;
	}

	public CompletableFuture<Either<List<CompletionItem>, CompletionList>> provideCompletion(
			TextDocumentIdentifier textDocument) {
		Path path = CanonicalPaths.fromUri(textDocument.getUri());
		List<CompletionItem> items = new ArrayList<>();
		for (CompletionCandidate candidate : resolver.completion(path)) {
			CompletionItem item = new CompletionItem(candidate.getName());
			item.setKind(toItemKind(candidate.getKind()));
			item.setDetail(candidate.getDetail());
			item.setDocumentation(new MarkupContent(MarkupKind.MARKDOWN, candidate.getDocumentation()));
			items.add(item);
		}
		return CompletableFuture.completedFuture(Either.forLeft(items));
	}

	private static CompletionItemKind toItemKind(Symbol.Kind kind) {
		switch (kind) {
			case FUNCTION:
				return CompletionItemKind.Function;
			case VARIABLE:
			default:
				return CompletionItemKind.Variable;
		}
	}
}
