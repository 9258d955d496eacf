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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.eclipse.lsp4j.Position;

import com.tomaszrup.lsp.utils.Positions;
import com.tomaszrup.lsp.utils.Ranges;

/**
 * Parser-agnostic traversal helpers over {@link SyntaxNode} trees.
 */
public final class SyntaxTrees {

	private SyntaxTrees() {
	}

	/**
	 * Returns every named node under {@code root} (inclusive) in document
	 * order: a node, then its named children in order, then its following
	 * siblings.
	 */
	public static List<SyntaxNode> preOrder(SyntaxNode root) {
		List<SyntaxNode> result = new ArrayList<>();
		Deque<SyntaxNode> stack = new ArrayDeque<>();
		stack.push(root);
		while (!stack.isEmpty()) {
			SyntaxNode node = stack.pop();
			result.add(node);
			List<SyntaxNode> children = node.getNamedChildren();
			for (int i = children.size() - 1; i >= 0; i--) {
				stack.push(children.get(i));
			}
		}
		return result;
	}

	/**
	 * Finds the smallest node whose range covers {@code position}. Both range
	 * ends are inclusive, so a cursor placed right after an identifier still
	 * selects it.
	 *
	 * @return the covering node, or {@code null} if the position lies outside
	 *         the root node
	 */
	public static SyntaxNode descendantForPosition(SyntaxNode root, Position position) {
		if (root == null || position == null || !Positions.valid(position)
				|| !Ranges.contains(root.getRange(), position)) {
			return null;
		}
		SyntaxNode current = root;
		while (true) {
			SyntaxNode next = null;
			for (SyntaxNode child : current.getNamedChildren()) {
				if (Ranges.contains(child.getRange(), position)
						&& (next == null || Ranges.isSmaller(child.getRange(), next.getRange()))) {
					next = child;
				}
			}
			if (next == null) {
				return current;
			}
			current = next;
		}
	}
}
