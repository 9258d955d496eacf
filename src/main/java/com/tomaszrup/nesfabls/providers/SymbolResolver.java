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
package com.tomaszrup.nesfabls.providers;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.eclipse.lsp4j.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.nesfabls.index.ProjectIndex;
import com.tomaszrup.nesfabls.symbols.FunctionSymbol;
import com.tomaszrup.nesfabls.symbols.Symbol;
import com.tomaszrup.nesfabls.symbols.SymbolTable;
import com.tomaszrup.nesfabls.symbols.VariableSymbol;
import com.tomaszrup.nesfabls.syntax.NodeKinds;
import com.tomaszrup.nesfabls.syntax.SyntaxNode;
import com.tomaszrup.nesfabls.syntax.SyntaxTree;
import com.tomaszrup.nesfabls.syntax.SyntaxTrees;
import com.tomaszrup.nesfabls.util.CanonicalPaths;

/**
 * Read-only queries over a {@link ProjectIndex}.
 *
 * <p>A name is looked up in the requesting file first, then in the files
 * that share a build configuration with it, then in every other indexed
 * file. Within each group files are tried in path order and the first
 * definition wins.</p>
 */
public class SymbolResolver {
	private static final Logger logger = LoggerFactory.getLogger(SymbolResolver.class);

	private static final String FENCE_OPEN = "```nesfab\n";
	private static final String FENCE_CLOSE = "\n```";

	private final ProjectIndex index;

	public SymbolResolver(ProjectIndex index) {
		this.index = index;
	}

	/** Files sharing at least one build configuration with {@code path}. */
	public Set<Path> getDependencies(Path path) {
		return index.getDependencyGraph().getDependencies(CanonicalPaths.canonicalize(path));
	}

	/**
	 * Resolves the identifier under {@code position} in {@code path}.
	 * Returns empty when the file has no tree, the position is not on an
	 * identifier, or no indexed file defines the name.
	 */
	public Optional<ResolvedSymbol> findSymbol(Path path, Position position) {
		Path file = CanonicalPaths.canonicalize(path);
		Optional<SyntaxTree> tree = index.getTree(file);
		if (tree.isEmpty()) {
			return Optional.empty();
		}
		SyntaxNode node = SyntaxTrees.descendantForPosition(tree.get().getRootNode(), position);
		if (node == null || !node.isKind(NodeKinds.IDENTIFIER)) {
			return Optional.empty();
		}
		String name = node.getText();
		ReferenceKind kind = ReferenceKind.of(node);

		ResolvedSymbol found = null;
		List<Path> otherDefinitions = new ArrayList<>();
		for (Path candidate : lookupOrder(file)) {
			Optional<SymbolTable> table = index.getSymbols(candidate);
			if (table.isEmpty()) {
				continue;
			}
			Optional<Symbol> symbol = lookup(table.get(), name, kind);
			if (symbol.isEmpty()) {
				continue;
			}
			if (found == null) {
				found = new ResolvedSymbol(candidate, symbol.get());
				if (candidate.equals(file) || !logger.isDebugEnabled()) {
					break;
				}
			} else {
				otherDefinitions.add(candidate);
			}
		}
		if (!otherDefinitions.isEmpty()) {
			logger.debug("'{}' is defined in {} and also in {}; using the first", name, found.getFile(),
					otherDefinitions);
		}
		return Optional.ofNullable(found);
	}

	public Optional<HoverResult> hover(Path path, Position position) {
		return findSymbol(path, position).map(resolved -> new HoverResult(
				resolved.getSymbol().getDescription(), displayPath(resolved.getFile())));
	}

	public Optional<DefinitionResult> gotoDefinition(Path path, Position position) {
		return findSymbol(path, position).map(resolved -> new DefinitionResult(
				resolved.getFile(), resolved.getSymbol().getRange()));
	}

	/**
	 * Lists every function and global variable of {@code path} and of the
	 * files sharing a configuration with it, in path order.
	 */
	public List<CompletionCandidate> completion(Path path) {
		Path file = CanonicalPaths.canonicalize(path);
		Set<Path> visible = new TreeSet<>(getDependencies(file));
		visible.add(file);

		List<CompletionCandidate> candidates = new ArrayList<>();
		for (Path source : visible) {
			Optional<SymbolTable> table = index.getSymbols(source);
			if (table.isEmpty()) {
				continue;
			}
			String detail = displayPath(source);
			for (FunctionSymbol function : table.get().getFunctions()) {
				candidates.add(toCandidate(function, detail));
			}
			for (VariableSymbol variable : table.get().getVariables()) {
				candidates.add(toCandidate(variable, detail));
			}
		}
		return candidates;
	}

	/** Path shown to the user: relative to the deepest containing workspace root. */
	public String displayPath(Path file) {
		return CanonicalPaths.displayPath(file, index.getWorkspaceRoots());
	}

	private Set<Path> lookupOrder(Path file) {
		Set<Path> order = new LinkedHashSet<>();
		order.add(file);
		order.addAll(getDependencies(file));
		order.addAll(index.getIndexedPaths());
		return Collections.unmodifiableSet(order);
	}

	private static Optional<Symbol> lookup(SymbolTable table, String name, ReferenceKind kind) {
		Optional<FunctionSymbol> function = table.findFunction(name);
		if (function.isPresent()) {
			return Optional.of(function.get());
		}
		if (kind.allowsVariables()) {
			Optional<VariableSymbol> variable = table.findVariable(name);
			if (variable.isPresent()) {
				return Optional.of(variable.get());
			}
		}
		return Optional.empty();
	}

	private static CompletionCandidate toCandidate(Symbol symbol, String detail) {
		return new CompletionCandidate(symbol.getName(), symbol.getKind(),
				FENCE_OPEN + symbol.getDescription() + FENCE_CLOSE, detail);
	}
}
