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
import java.util.List;

import org.eclipse.lsp4j.Position;

import com.tomaszrup.nesfabls.syntax.SourceParseException;

/**
 * Splits NESFab source into {@link Token}s. Whitespace and newlines are
 * dropped; comments are kept as {@link Token.Type#COMMENT} tokens because
 * they carry documentation for the definitions below them.
 */
final class NesfabLexer {

	private static final String[] MULTI_CHAR_OPERATORS = {
			"<<=", ">>=", "==", "!=", "<=", ">=", "&&", "||", "<<", ">>",
			"+=", "-=", "*=", "/=", "&=", "|=", "^=", "->", "++", "--", "::"
	};

	private final String source;
	private int offset;
	private int line;
	private int column;

	NesfabLexer(String source) {
		this.source = source;
	}

	List<Token> tokenize() throws SourceParseException {
		List<Token> tokens = new ArrayList<>();
		while (offset < source.length()) {
			char c = source.charAt(offset);
			if (c == '\n') {
				advance();
				continue;
			}
			if (Character.isWhitespace(c)) {
				advance();
				continue;
			}
			int startOffset = offset;
			Position start = new Position(line, column);
			Token.Type type;
			if (c == '/' && peek(1) == '/') {
				while (offset < source.length() && source.charAt(offset) != '\n') {
					advance();
				}
				type = Token.Type.COMMENT;
			} else if (c == '/' && peek(1) == '*') {
				int close = source.indexOf("*/", offset + 2);
				if (close < 0) {
					throw new SourceParseException("unterminated block comment", start);
				}
				advanceTo(close + 2);
				type = Token.Type.COMMENT;
			} else if (isIdentifierStart(c)) {
				while (offset < source.length() && isIdentifierPart(source.charAt(offset))) {
					advance();
				}
				type = Token.Type.IDENTIFIER;
			} else if (Character.isDigit(c) || (c == '$' && isHexDigit(peek(1)))
					|| (c == '%' && isBinaryDigit(peek(1)) && !followsValue(tokens))) {
				advance();
				while (offset < source.length() && isNumberPart(source.charAt(offset))) {
					advance();
				}
				type = Token.Type.NUMBER;
			} else if (c == '"' || c == '\'') {
				readQuoted(c, start);
				type = Token.Type.STRING;
			} else if (c == '(' || c == '[' || c == '{') {
				advance();
				type = Token.Type.OPEN;
			} else if (c == ')' || c == ']' || c == '}') {
				advance();
				type = Token.Type.CLOSE;
			} else if (c == ',') {
				advance();
				type = Token.Type.COMMA;
			} else if (c == '.') {
				advance();
				type = Token.Type.DOT;
			} else {
				advanceTo(offset + operatorLength());
				type = Token.Type.OPERATOR;
			}
			String text = source.substring(startOffset, offset);
			if (type == Token.Type.COMMENT) {
				text = stripTrailingCarriageReturn(text);
			}
			tokens.add(new Token(type, text, startOffset, startOffset + text.length(), start,
					type == Token.Type.COMMENT ? endOf(start, text) : new Position(line, column)));
		}
		return tokens;
	}

	/** End of the document, as a position just past its last character. */
	Position endPosition() {
		return new Position(line, column);
	}

	private void readQuoted(char quote, Position start) throws SourceParseException {
		advance();
		while (offset < source.length()) {
			char c = source.charAt(offset);
			if (c == '\n') {
				break;
			}
			if (c == '\\') {
				advance();
				if (offset < source.length() && source.charAt(offset) != '\n') {
					advance();
				}
				continue;
			}
			advance();
			if (c == quote) {
				return;
			}
		}
		throw new SourceParseException("unterminated " + (quote == '"' ? "string" : "character") + " literal", start);
	}

	private int operatorLength() {
		for (String op : MULTI_CHAR_OPERATORS) {
			if (source.startsWith(op, offset)) {
				return op.length();
			}
		}
		return 1;
	}

	private void advance() {
		if (source.charAt(offset) == '\n') {
			line++;
			column = 0;
		} else {
			column++;
		}
		offset++;
	}

	private void advanceTo(int target) {
		while (offset < target) {
			advance();
		}
	}

	private char peek(int ahead) {
		int index = offset + ahead;
		return index < source.length() ? source.charAt(index) : '\0';
	}

	private static Position endOf(Position start, String text) {
		int endLine = start.getLine();
		int lastBreak = -1;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				endLine++;
				lastBreak = i;
			}
		}
		int endColumn = lastBreak < 0 ? start.getCharacter() + text.length() : text.length() - lastBreak - 1;
		return new Position(endLine, endColumn);
	}

	private static String stripTrailingCarriageReturn(String text) {
		return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
	}

	private static boolean followsValue(List<Token> tokens) {
		if (tokens.isEmpty()) {
			return false;
		}
		Token previous = tokens.get(tokens.size() - 1);
		return previous.type == Token.Type.IDENTIFIER || previous.type == Token.Type.NUMBER
				|| previous.type == Token.Type.CLOSE || previous.type == Token.Type.STRING;
	}

	private static boolean isIdentifierStart(char c) {
		return Character.isLetter(c) || c == '_';
	}

	private static boolean isIdentifierPart(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}

	private static boolean isNumberPart(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '.';
	}

	private static boolean isHexDigit(char c) {
		return Character.digit(c, 16) >= 0;
	}

	private static boolean isBinaryDigit(char c) {
		return c == '0' || c == '1';
	}
}
