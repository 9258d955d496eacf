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

import org.eclipse.lsp4j.Position;

/**
 * A lexical token of NESFab source. Offsets index into the source string;
 * positions are zero-based line/column pairs.
 */
final class Token {

	enum Type {
		IDENTIFIER,
		NUMBER,
		STRING,
		OPEN,
		CLOSE,
		COMMA,
		DOT,
		OPERATOR,
		COMMENT
	}

	final Type type;
	final String text;
	final int startOffset;
	final int endOffset;
	final Position start;
	final Position end;

	Token(Type type, String text, int startOffset, int endOffset, Position start, Position end) {
		this.type = type;
		this.text = text;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.start = start;
		this.end = end;
	}

	boolean is(Type expected, String expectedText) {
		return type == expected && text.equals(expectedText);
	}

	boolean isIdentifier(String expectedText) {
		return is(Type.IDENTIFIER, expectedText);
	}

	/** The closing bracket that pairs with this opening bracket. */
	String closingBracket() {
		switch (text) {
			case "(":
				return ")";
			case "[":
				return "]";
			default:
				return "}";
		}
	}

	@Override
	public String toString() {
		return type + "'" + text + "'@" + (start.getLine() + 1) + ":" + (start.getCharacter() + 1);
	}
}
