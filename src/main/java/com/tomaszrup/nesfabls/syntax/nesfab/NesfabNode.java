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
package com.tomaszrup.nesfabls.syntax.nesfab;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

import com.tomaszrup.lsp.utils.Positions;
import com.tomaszrup.nesfabls.syntax.SyntaxNode;

/**
 * Mutable while {@link NesfabParser} builds the tree, never modified after
 * the tree is handed out.
 */
final class NesfabNode implements SyntaxNode {

	private final String kind;
	private final boolean named;
	private final String source;
	private final int startOffset;
	private final Position start;
	private int endOffset;
	private Position end;
	private NesfabNode parent;
	private final List<SyntaxNode> children = new ArrayList<>();
	private final Map<String, SyntaxNode> fields = new HashMap<>(4);

	NesfabNode(String kind, boolean named, String source, int startOffset, Position start, int endOffset,
			Position end) {
		this.kind = kind;
		this.named = named;
		this.source = source;
		this.startOffset = startOffset;
		this.start = start;
		this.endOffset = endOffset;
		this.end = end;
	}

	static NesfabNode spanning(String kind, String source, Token first, Token last) {
		return new NesfabNode(kind, true, source, first.startOffset, first.start, last.endOffset, last.end);
	}

	static NesfabNode leaf(String kind, boolean named, String source, Token token) {
		return new NesfabNode(kind, named, source, token.startOffset, token.start, token.endOffset, token.end);
	}

	/**
	 * Appends {@code child} and stretches this node and every ancestor to
	 * cover it. A statement is attached before its body is parsed, so the
	 * body's end has to reach the whole parent chain.
	 */
	void addChild(NesfabNode child) {
		child.parent = this;
		children.add(child);
		for (NesfabNode node = this; node != null && child.endOffset > node.endOffset; node = node.parent) {
			node.endOffset = child.endOffset;
			node.end = child.end;
		}
	}

	void addField(String fieldName, NesfabNode child) {
		addChild(child);
		fields.put(fieldName, child);
	}

	boolean hasChildren() {
		return !children.isEmpty();
	}

	@Override
	public String getKind() {
		return kind;
	}

	@Override
	public boolean isNamed() {
		return named;
	}

	@Override
	public SyntaxNode getParent() {
		return parent;
	}

	@Override
	public List<SyntaxNode> getChildren() {
		return Collections.unmodifiableList(children);
	}

	@Override
	public SyntaxNode getChildByFieldName(String fieldName) {
		return fields.get(fieldName);
	}

	@Override
	public SyntaxNode getPreviousSibling() {
		if (parent == null) {
			return null;
		}
		List<SyntaxNode> siblings = parent.children;
		for (int i = 1; i < siblings.size(); i++) {
			if (siblings.get(i) == this) {
				return siblings.get(i - 1);
			}
		}
		return null;
	}

	@Override
	public Range getRange() {
		return new Range(Positions.copy(start), Positions.copy(end));
	}

	@Override
	public String getText() {
		return source.substring(startOffset, endOffset);
	}

	@Override
	public String toString() {
		return kind + " [" + start.getLine() + ":" + start.getCharacter() + "-" + end.getLine() + ":"
				+ end.getCharacter() + "]";
	}
}
