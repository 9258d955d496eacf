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
package com.tomaszrup.nesfabls.syntax;

import java.util.ArrayList;
import java.util.List;

import org.eclipse.lsp4j.Range;

/**
 * A node of a concrete syntax tree, as produced by a {@link SyntaxParser}.
 *
 * <p>Symbol extraction and resolution only navigate trees through this
 * interface, so they stay independent of the parser implementation.
 * Ranges use zero-based lines and columns.</p>
 */
public interface SyntaxNode {

	/** Grammar kind of this node, e.g. {@code function_definition}. See {@link NodeKinds}. */
	String getKind();

	/** Whether the node is a named grammar rule (as opposed to punctuation). */
	boolean isNamed();

	/** Parent node, or {@code null} for the root. */
	SyntaxNode getParent();

	/** All children in source order. */
	List<SyntaxNode> getChildren();

	/**
	 * Returns the child registered under the given grammar field
	 * (e.g. {@code "name"}), or {@code null} if this node has none.
	 */
	SyntaxNode getChildByFieldName(String fieldName);

	/** The sibling immediately before this node, or {@code null}. */
	SyntaxNode getPreviousSibling();

	Range getRange();

	/** Source text covered by this node. */
	String getText();

	default List<SyntaxNode> getNamedChildren() {
		List<SyntaxNode> named = new ArrayList<>();
		for (SyntaxNode child : getChildren()) {
			if (child.isNamed()) {
				named.add(child);
			}
		}
		return named;
	}

	default boolean isKind(String kind) {
		return kind.equals(getKind());
	}
}
