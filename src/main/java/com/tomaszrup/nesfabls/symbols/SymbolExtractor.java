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
package com.tomaszrup.nesfabls.symbols;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.nesfabls.syntax.NodeKinds;
import com.tomaszrup.nesfabls.syntax.SyntaxNode;
import com.tomaszrup.nesfabls.syntax.SyntaxTree;
import com.tomaszrup.nesfabls.syntax.SyntaxTrees;

/**
 * Builds a {@link SymbolTable} from one file's syntax tree.
 *
 * <p>Functions are collected wherever they appear; variables only at file
 * scope or directly inside a {@code vars} block, so locals, parameters and
 * struct members never become symbols. A function definition without a
 * signature or name rejects the whole file.</p>
 */
public class SymbolExtractor {
	private static final Logger logger = LoggerFactory.getLogger(SymbolExtractor.class);

	public SymbolTable extract(SyntaxTree tree) throws SymbolExtractionException {
		SymbolTable.Builder builder = SymbolTable.builder();
		int functions = 0;
		int variables = 0;
		for (SyntaxNode node : SyntaxTrees.preOrder(tree.getRootNode())) {
			if (NodeKinds.isFunctionDefinition(node.getKind())) {
				builder.putFunction(toFunctionSymbol(node));
				functions++;
			} else if (node.isKind(NodeKinds.VARIABLE_DEFINITION) && isGlobalScope(node.getParent())) {
				builder.putVariable(toVariableSymbol(node));
				variables++;
			}
		}
		logger.debug("Extracted {} function and {} variable definitions", functions, variables);
		return builder.build();
	}

	private static FunctionSymbol toFunctionSymbol(SyntaxNode definition) throws SymbolExtractionException {
		SyntaxNode signature = definition.getChildByFieldName(NodeKinds.FIELD_SIGNATURE);
		if (signature == null) {
			throw new SymbolExtractionException("Function definition has no signature", definition.getRange());
		}
		SyntaxNode name = signature.getChildByFieldName(NodeKinds.FIELD_NAME);
		if (name == null) {
			throw new SymbolExtractionException("Function signature has no name", definition.getRange());
		}
		return new FunctionSymbol(name.getText(), definition.getRange(), signature.getText(),
				leadingComments(definition));
	}

	private static VariableSymbol toVariableSymbol(SyntaxNode definition) throws SymbolExtractionException {
		SyntaxNode name = definition.getChildByFieldName(NodeKinds.FIELD_NAME);
		if (name == null) {
			throw new SymbolExtractionException("Variable definition has no name", definition.getRange());
		}
		return new VariableSymbol(name.getText(), definition.getRange(), definition.getText(),
				leadingComments(definition));
	}

	private static boolean isGlobalScope(SyntaxNode parent) {
		return parent != null && (parent.isKind(NodeKinds.SOURCE_FILE) || parent.isKind(NodeKinds.VARS));
	}

	/**
	 * Collects the comment siblings directly above {@code definition}. Each
	 * comment must end at most one line above the line that follows it, so
	 * a blank line ends the block.
	 */
	static String leadingComments(SyntaxNode definition) {
		List<String> bottomUp = new ArrayList<>();
		int pivotLine = definition.getRange().getStart().getLine();
		SyntaxNode sibling = definition.getPreviousSibling();
		while (sibling != null && sibling.isKind(NodeKinds.COMMENT)
				&& pivotLine - sibling.getRange().getEnd().getLine() <= 1) {
			bottomUp.add(sibling.getText());
			pivotLine = sibling.getRange().getStart().getLine();
			sibling = sibling.getPreviousSibling();
		}
		StringBuilder comments = new StringBuilder();
		for (int i = bottomUp.size() - 1; i >= 0; i--) {
			comments.append(bottomUp.get(i)).append('\n');
		}
		return comments.toString();
	}
}
