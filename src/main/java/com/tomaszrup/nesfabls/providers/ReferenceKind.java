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

import com.tomaszrup.nesfabls.syntax.NodeKinds;
import com.tomaszrup.nesfabls.syntax.SyntaxNode;

/**
 * How an identifier is used, which decides the symbol tables it may
 * resolve against.
 */
enum ReferenceKind {
	/** Callee of a call expression; functions only. */
	CALL,
	/**
	 * Anywhere in a {@code fn} or {@code asm fn} header, parameter names
	 * included; functions only.
	 */
	FUNCTION_HEADER,
	/** Anything else; functions first, then global variables. */
	OTHER;

	static ReferenceKind of(SyntaxNode identifier) {
		SyntaxNode parent = identifier.getParent();
		if (parent == null) {
			return OTHER;
		}
		if (parent.isKind(NodeKinds.CALL)) {
			return CALL;
		}
		for (SyntaxNode node = parent; node != null; node = node.getParent()) {
			if (node.isKind(NodeKinds.FUNCTION_SIGNATURE)) {
				SyntaxNode definition = node.getParent();
				return definition != null && NodeKinds.isFunctionDefinition(definition.getKind())
						? FUNCTION_HEADER : OTHER;
			}
			if (node.isKind(NodeKinds.BLOCK)) {
				break;
			}
		}
		return OTHER;
	}

	boolean allowsVariables() {
		return this == OTHER;
	}
}
