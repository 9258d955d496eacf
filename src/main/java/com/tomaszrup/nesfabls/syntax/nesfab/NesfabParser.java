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

import static com.tomaszrup.nesfabls.syntax.NodeKinds.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.eclipse.lsp4j.Position;

import com.tomaszrup.nesfabls.syntax.SourceParseException;
import com.tomaszrup.nesfabls.syntax.SyntaxParser;
import com.tomaszrup.nesfabls.syntax.SyntaxTree;

/**
 * Indentation-based parser for the part of NESFab that indexing and
 * navigation need.
 *
 * <p>Source is first split into logical lines: a line continues while any
 * bracket is open. A line followed by more deeply indented lines owns them
 * as its nested block, so {@code fn}, {@code if} or {@code vars} headers get
 * their bodies without the parser knowing every statement form. Comments
 * become {@code comment} nodes that sit next to the statements around them,
 * which is what documentation lookup relies on.</p>
 *
 * <p>Instances are stateless and may be shared between threads.</p>
 */
public class NesfabParser implements SyntaxParser {

	private static final Set<String> GROUP_KEYWORDS = Set.of("struct", "data", "omni", "ready", "chrrom",
			"charmap", "audio");
	private static final Set<String> JUMP_KEYWORDS = Set.of("break", "continue", "goto", "fence", "label");
	private static final Set<String> KEYWORDS;

	static {
		Set<String> keywords = new HashSet<>(GROUP_KEYWORDS);
		keywords.addAll(JUMP_KEYWORDS);
		keywords.addAll(Set.of("fn", "asm", "ct", "mode", "nmi", "irq", "vars", "if", "else", "while", "for",
				"do", "switch", "case", "default", "return", "true", "false"));
		KEYWORDS = Set.copyOf(keywords);
	}

	@Override
	public SyntaxTree parse(String source) throws SourceParseException {
		NesfabLexer lexer = new NesfabLexer(source);
		List<Token> tokens = lexer.tokenize();
		List<Line> lines = groupLines(tokens);
		NesfabNode root = new NesfabNode(SOURCE_FILE, true, source, 0, new Position(0, 0), source.length(),
				lexer.endPosition());
		new Run(source, lines).parseLines(root, 0);
		return new NesfabTree(root, source);
	}

	private static List<Line> groupLines(List<Token> tokens) throws SourceParseException {
		List<Line> lines = new ArrayList<>();
		Deque<Token> open = new ArrayDeque<>();
		Line current = null;
		int lastLine = -1;
		for (Token token : tokens) {
			if (current == null || (open.isEmpty() && token.start.getLine() > lastLine)) {
				current = new Line(token.start.getCharacter());
				lines.add(current);
			}
			if (token.type == Token.Type.COMMENT) {
				current.comments.add(token);
			} else {
				current.code.add(token);
				if (token.type == Token.Type.OPEN) {
					open.push(token);
				} else if (token.type == Token.Type.CLOSE) {
					if (open.isEmpty() || !open.peek().closingBracket().equals(token.text)) {
						throw new SourceParseException("unexpected '" + token.text + "'", token.start);
					}
					open.pop();
				}
			}
			lastLine = token.end.getLine();
		}
		if (!open.isEmpty()) {
			Token unclosed = open.peek();
			throw new SourceParseException("unclosed '" + unclosed.text + "'", unclosed.start);
		}
		return lines;
	}

	/** One logical line: its code tokens plus any comments written on it. */
	private static final class Line {
		final int indent;
		final List<Token> code = new ArrayList<>();
		final List<Token> comments = new ArrayList<>();

		Line(int indent) {
			this.indent = indent;
		}

		boolean isCommentOnly() {
			return code.isEmpty();
		}

		Token first() {
			if (code.isEmpty()) {
				return comments.get(0);
			}
			if (comments.isEmpty() || code.get(0).startOffset < comments.get(0).startOffset) {
				return code.get(0);
			}
			return comments.get(0);
		}
	}

	/** State of a single parse. */
	private static final class Run {
		private final String source;
		private final List<Line> lines;
		private int pos;

		Run(String source, List<Line> lines) {
			this.source = source;
			this.lines = lines;
		}

		/**
		 * Adds every following line indented by at least {@code minIndent} to
		 * {@code container}. A comment-only line goes with the next line of
		 * code, so comments above a dedented definition stay outside the
		 * block that precedes it.
		 */
		void parseLines(NesfabNode container, int minIndent) {
			while (pos < lines.size()) {
				Line line = lines.get(pos);
				if (line.isCommentOnly()) {
					if (!commentBelongs(minIndent)) {
						return;
					}
					addComments(container, line.comments);
					pos++;
					continue;
				}
				if (line.indent < minIndent) {
					return;
				}
				pos++;
				NesfabNode statement = parseStatement(line.code);
				container.addChild(statement);
				addComments(container, line.comments);
				if (nextCodeIndent() > line.indent) {
					parseNested(statement, line.indent);
				}
			}
		}

		private void parseNested(NesfabNode statement, int indent) {
			int minIndent = indent + 1;
			String kind = statement.getKind();
			if (VARS.equals(kind) || GROUP_BLOCK.equals(kind)) {
				parseLines(statement, minIndent);
				return;
			}
			if (isHeader(kind)) {
				while (pos < lines.size()) {
					Line line = lines.get(pos);
					if (line.isCommentOnly() || line.indent < minIndent
							|| !line.code.get(0).is(Token.Type.OPERATOR, ":")) {
						break;
					}
					pos++;
					NesfabNode modifier = NesfabNode.spanning(MODIFIER, source, line.code.get(0), last(line.code));
					addExpression(modifier, line.code, 0, line.code.size());
					statement.addChild(modifier);
					addComments(statement, line.comments);
				}
			}
			if (pos >= lines.size()) {
				return;
			}
			Line next = lines.get(pos);
			boolean opensBlock = next.isCommentOnly() ? commentBelongs(minIndent) : next.indent >= minIndent;
			if (!opensBlock) {
				return;
			}
			Token first = next.first();
			NesfabNode block = new NesfabNode(BLOCK, true, source, first.startOffset, first.start, first.endOffset,
					first.end);
			parseLines(block, minIndent);
			statement.addField(FIELD_BODY, block);
		}

		private boolean commentBelongs(int minIndent) {
			int next = nextCodeIndent();
			return next >= 0 ? next >= minIndent : lines.get(pos).indent >= minIndent;
		}

		private int nextCodeIndent() {
			for (int i = pos; i < lines.size(); i++) {
				if (!lines.get(i).isCommentOnly()) {
					return lines.get(i).indent;
				}
			}
			return -1;
		}

		private void addComments(NesfabNode container, List<Token> comments) {
			for (Token comment : comments) {
				container.addChild(NesfabNode.leaf(COMMENT, true, source, comment));
			}
		}

		private NesfabNode parseStatement(List<Token> code) {
			Token first = code.get(0);
			Token second = code.size() > 1 ? code.get(1) : null;
			boolean secondIsName = second != null && second.type == Token.Type.IDENTIFIER;
			if (first.type == Token.Type.IDENTIFIER) {
				switch (first.text) {
					case "fn":
						return definition(code, FUNCTION_DEFINITION, 1);
					case "asm":
						if (second != null && second.isIdentifier("fn")) {
							return definition(code, ASM_FUNCTION_DEFINITION, 2);
						}
						return container(code, GROUP_BLOCK);
					case "ct":
						if (second != null && second.isIdentifier("fn")) {
							return definition(code, FUNCTION_DEFINITION, 2);
						}
						break;
					case "mode":
						return definition(code, MODE_DEFINITION, 1);
					case "nmi":
						return secondIsName ? definition(code, NMI_DEFINITION, 1)
								: keywordStatement(code, JUMP_STATEMENT, 1, null);
					case "irq":
						return secondIsName ? definition(code, IRQ_DEFINITION, 1)
								: keywordStatement(code, JUMP_STATEMENT, 1, null);
					case "vars":
						return container(code, VARS);
					case "if":
						return keywordStatement(code, IF_STATEMENT, 1, FIELD_CONDITION);
					case "else":
						return keywordStatement(code, ELSE_CLAUSE,
								second != null && second.isIdentifier("if") ? 2 : 1, FIELD_CONDITION);
					case "while":
					case "for":
					case "do":
						return keywordStatement(code, LOOP_STATEMENT, 1, FIELD_CONDITION);
					case "switch":
						return keywordStatement(code, SWITCH_STATEMENT, 1, FIELD_CONDITION);
					case "case":
					case "default":
						return keywordStatement(code, CASE_CLAUSE, 1, FIELD_CONDITION);
					case "return":
						return keywordStatement(code, RETURN_STATEMENT, 1, null);
					default:
						if (GROUP_KEYWORDS.contains(first.text)) {
							return container(code, GROUP_BLOCK);
						}
						if (JUMP_KEYWORDS.contains(first.text)) {
							return keywordStatement(code, JUMP_STATEMENT, 1, null);
						}
				}
			}
			int nameIndex = variableNameIndex(code);
			if (nameIndex >= 0) {
				return variableDefinition(code, nameIndex);
			}
			NesfabNode statement = NesfabNode.spanning(EXPRESSION_STATEMENT, source, first, last(code));
			addExpression(statement, code, 0, code.size());
			return statement;
		}

		private NesfabNode definition(List<Token> code, String kind, int keywordCount) {
			NesfabNode definition = NesfabNode.spanning(kind, source, code.get(0), last(code));
			NesfabNode signature = NesfabNode.spanning(FUNCTION_SIGNATURE, source, code.get(0), last(code));
			for (int i = 0; i < keywordCount; i++) {
				signature.addChild(keyword(code.get(i)));
			}
			int i = keywordCount;
			if (i < code.size() && code.get(i).type == Token.Type.IDENTIFIER) {
				signature.addField(FIELD_NAME, NesfabNode.leaf(IDENTIFIER, true, source, code.get(i)));
				i++;
			}
			if (i < code.size() && code.get(i).is(Token.Type.OPEN, "(")) {
				int close = matching(code, i);
				signature.addField(FIELD_PARAMETERS, parameters(code, i, close));
				i = close + 1;
			}
			if (i < code.size()) {
				signature.addField(FIELD_RETURN_TYPE, type(code, i, code.size()));
			}
			definition.addField(FIELD_SIGNATURE, signature);
			return definition;
		}

		private NesfabNode parameters(List<Token> code, int open, int close) {
			NesfabNode parameters = NesfabNode.spanning(PARAMETERS, source, code.get(open), code.get(close));
			int segmentStart = open + 1;
			int depth = 0;
			for (int i = open + 1; i <= close; i++) {
				Token token = code.get(i);
				if (i == close || (depth == 0 && token.type == Token.Type.COMMA)) {
					if (i > segmentStart) {
						parameters.addChild(parameter(code, segmentStart, i));
					}
					if (i < close) {
						parameters.addChild(keyword(token));
					}
					segmentStart = i + 1;
					continue;
				}
				if (token.type == Token.Type.OPEN) {
					depth++;
				} else if (token.type == Token.Type.CLOSE) {
					depth--;
				}
			}
			return parameters;
		}

		private NesfabNode parameter(List<Token> code, int from, int to) {
			NesfabNode parameter = NesfabNode.spanning(PARAMETER, source, code.get(from), code.get(to - 1));
			Token name = code.get(to - 1);
			if (name.type != Token.Type.IDENTIFIER) {
				addExpression(parameter, code, from, to);
				return parameter;
			}
			if (to - 1 > from) {
				parameter.addField(FIELD_TYPE, type(code, from, to - 1));
			}
			parameter.addField(FIELD_NAME, NesfabNode.leaf(IDENTIFIER, true, source, name));
			return parameter;
		}

		private NesfabNode type(List<Token> code, int from, int to) {
			NesfabNode type = NesfabNode.spanning(TYPE, source, code.get(from), code.get(to - 1));
			for (int i = from; i < to; i++) {
				Token token = code.get(i);
				if (token.type == Token.Type.IDENTIFIER) {
					type.addChild(NesfabNode.leaf(TYPE_IDENTIFIER, true, source, token));
				} else if (token.type == Token.Type.NUMBER) {
					type.addChild(NesfabNode.leaf(NUMBER_LITERAL, true, source, token));
				} else {
					type.addChild(keyword(token));
				}
			}
			return type;
		}

		private NesfabNode container(List<Token> code, String kind) {
			NesfabNode container = NesfabNode.spanning(kind, source, code.get(0), last(code));
			container.addChild(keyword(code.get(0)));
			addExpression(container, code, 1, code.size());
			return container;
		}

		private NesfabNode keywordStatement(List<Token> code, String kind, int keywordCount, String field) {
			NesfabNode statement = NesfabNode.spanning(kind, source, code.get(0), last(code));
			for (int i = 0; i < keywordCount; i++) {
				statement.addChild(keyword(code.get(i)));
			}
			if (keywordCount < code.size()) {
				NesfabNode expression = expression(code, keywordCount, code.size());
				if (field != null) {
					statement.addField(field, expression);
				} else {
					statement.addChild(expression);
				}
			}
			return statement;
		}

		/**
		 * Returns the index of the declared name if the line has the shape
		 * {@code [ct] Type[...][/group] name [= value]}, or -1.
		 */
		private int variableNameIndex(List<Token> code) {
			int i = 0;
			if (code.get(0).isIdentifier("ct")) {
				i++;
			}
			if (!isPlainName(code, i)) {
				return -1;
			}
			i++;
			while (i < code.size()) {
				Token token = code.get(i);
				if (token.is(Token.Type.OPEN, "[")) {
					i = matching(code, i) + 1;
				} else if (token.is(Token.Type.OPERATOR, "/") && i + 1 < code.size()
						&& code.get(i + 1).type == Token.Type.IDENTIFIER) {
					i += 2;
				} else {
					break;
				}
			}
			if (!isPlainName(code, i)) {
				return -1;
			}
			if (i + 1 == code.size() || code.get(i + 1).is(Token.Type.OPERATOR, "=")) {
				return i;
			}
			return -1;
		}

		private NesfabNode variableDefinition(List<Token> code, int nameIndex) {
			NesfabNode definition = NesfabNode.spanning(VARIABLE_DEFINITION, source, code.get(0), last(code));
			int typeStart = 0;
			if (code.get(0).isIdentifier("ct")) {
				definition.addChild(keyword(code.get(0)));
				typeStart = 1;
			}
			definition.addField(FIELD_TYPE, type(code, typeStart, nameIndex));
			definition.addField(FIELD_NAME, NesfabNode.leaf(IDENTIFIER, true, source, code.get(nameIndex)));
			if (nameIndex + 1 < code.size()) {
				definition.addChild(keyword(code.get(nameIndex + 1)));
				if (nameIndex + 2 < code.size()) {
					definition.addField(FIELD_VALUE, expression(code, nameIndex + 2, code.size()));
				}
			}
			return definition;
		}

		/** Parses {@code [from, to)} as one node, wrapping it when it is not a single term. */
		private NesfabNode expression(List<Token> code, int from, int to) {
			List<NesfabNode> terms = parseExpression(code, from, to);
			if (terms.size() == 1 && terms.get(0).isNamed()) {
				return terms.get(0);
			}
			NesfabNode expression = NesfabNode.spanning(EXPRESSION, source, code.get(from), code.get(to - 1));
			for (NesfabNode term : terms) {
				expression.addChild(term);
			}
			return expression;
		}

		private void addExpression(NesfabNode parent, List<Token> code, int from, int to) {
			for (NesfabNode term : parseExpression(code, from, to)) {
				parent.addChild(term);
			}
		}

		private List<NesfabNode> parseExpression(List<Token> code, int from, int to) {
			List<NesfabNode> terms = new ArrayList<>();
			int i = from;
			while (i < to) {
				Token token = code.get(i);
				boolean afterDot = i > from && code.get(i - 1).type == Token.Type.DOT;
				switch (token.type) {
					case IDENTIFIER:
						if (!afterDot && i + 1 < to && code.get(i + 1).is(Token.Type.OPEN, "(")) {
							int close = matching(code, i + 1);
							NesfabNode call = NesfabNode.spanning(CALL, source, token, code.get(close));
							call.addField(FIELD_FUNCTION, NesfabNode.leaf(IDENTIFIER, true, source, token));
							NesfabNode arguments = NesfabNode.spanning(ARGUMENTS, source, code.get(i + 1),
									code.get(close));
							addExpression(arguments, code, i + 2, close);
							call.addField(FIELD_ARGUMENTS, arguments);
							terms.add(call);
							i = close + 1;
							continue;
						}
						terms.add(NesfabNode.leaf(identifierKind(token, afterDot), true, source, token));
						break;
					case NUMBER:
						terms.add(NesfabNode.leaf(NUMBER_LITERAL, true, source, token));
						break;
					case STRING:
						terms.add(NesfabNode.leaf(STRING_LITERAL, true, source, token));
						break;
					case OPEN:
						int groupEnd = matching(code, i);
						NesfabNode group = NesfabNode.spanning(groupKind(token), source, token, code.get(groupEnd));
						addExpression(group, code, i + 1, groupEnd);
						terms.add(group);
						i = groupEnd + 1;
						continue;
					default:
						terms.add(keyword(token));
				}
				i++;
			}
			return terms;
		}

		private NesfabNode keyword(Token token) {
			return NesfabNode.leaf(token.text, false, source, token);
		}

		private static String identifierKind(Token token, boolean afterDot) {
			if (afterDot) {
				return FIELD_IDENTIFIER;
			}
			if (token.text.equals("true") || token.text.equals("false")) {
				return BOOLEAN_LITERAL;
			}
			return IDENTIFIER;
		}

		private static String groupKind(Token open) {
			switch (open.text) {
				case "[":
					return SUBSCRIPT;
				case "{":
					return REGISTER;
				default:
					return EXPRESSION;
			}
		}

		private static boolean isHeader(String kind) {
			return isFunctionDefinition(kind) || MODE_DEFINITION.equals(kind) || NMI_DEFINITION.equals(kind)
					|| IRQ_DEFINITION.equals(kind);
		}

		private static boolean isPlainName(List<Token> code, int index) {
			return index < code.size() && code.get(index).type == Token.Type.IDENTIFIER
					&& !KEYWORDS.contains(code.get(index).text);
		}

		/** Index of the bracket closing the one at {@code open}; lines are balanced when they get here. */
		private static int matching(List<Token> code, int open) {
			int depth = 0;
			for (int i = open; i < code.size(); i++) {
				Token token = code.get(i);
				if (token.type == Token.Type.OPEN) {
					depth++;
				} else if (token.type == Token.Type.CLOSE && --depth == 0) {
					return i;
				}
			}
			return code.size() - 1;
		}

		private static Token last(List<Token> code) {
			return code.get(code.size() - 1);
		}
	}
}
