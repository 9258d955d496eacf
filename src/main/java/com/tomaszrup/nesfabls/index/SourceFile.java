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

import java.nio.file.Path;
import java.util.Optional;

import com.tomaszrup.nesfabls.symbols.SymbolTable;
import com.tomaszrup.nesfabls.syntax.SyntaxTree;

/**
 * Cached state of one source file: its latest text and, once a parse has
 * succeeded, the tree and symbol table derived from it. The tree and table
 * are either both present or both absent. They may lag behind the text when
 * the latest text failed to parse.
 */
public final class SourceFile {

	private final Path path;
	private final String text;
	private final SyntaxTree tree;
	private final SymbolTable symbols;

	private SourceFile(Path path, String text, SyntaxTree tree, SymbolTable symbols) {
		this.path = path;
		this.text = text;
		this.tree = tree;
		this.symbols = symbols;
	}

	static SourceFile unparsed(Path path, String text) {
		return new SourceFile(path, text, null, null);
	}

	static SourceFile parsed(Path path, String text, SyntaxTree tree, SymbolTable symbols) {
		return new SourceFile(path, text, tree, symbols);
	}

	/** A copy with new text and the same tree and table. */
	SourceFile withText(String newText) {
		return new SourceFile(path, newText, tree, symbols);
	}

	public Path getPath() {
		return path;
	}

	public String getText() {
		return text;
	}

	public Optional<SyntaxTree> getTree() {
		return Optional.ofNullable(tree);
	}

	public Optional<SymbolTable> getSymbols() {
		return Optional.ofNullable(symbols);
	}

	public boolean isIndexed() {
		return symbols != null;
	}
}
