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

/**
 * Node kinds and field names shared between the NESFab grammar and the code
 * that consumes its trees.
 */
public final class NodeKinds {

	public static final String SOURCE_FILE = "source_file";
	public static final String COMMENT = "comment";
	public static final String IDENTIFIER = "identifier";
	public static final String TYPE_IDENTIFIER = "type_identifier";
	public static final String FIELD_IDENTIFIER = "field_identifier";

	public static final String FUNCTION_DEFINITION = "function_definition";
	public static final String ASM_FUNCTION_DEFINITION = "asm_function_definition";
	public static final String MODE_DEFINITION = "mode_definition";
	public static final String NMI_DEFINITION = "nmi_definition";
	public static final String IRQ_DEFINITION = "irq_definition";
	public static final String FUNCTION_SIGNATURE = "function_signature";
	public static final String PARAMETERS = "parameters";
	public static final String PARAMETER = "parameter";
	public static final String MODIFIER = "modifier";
	public static final String BLOCK = "block";

	public static final String VARS = "vars";
	public static final String GROUP_BLOCK = "group_block";
	public static final String VARIABLE_DEFINITION = "variable_definition";
	public static final String TYPE = "type";

	public static final String IF_STATEMENT = "if_statement";
	public static final String ELSE_CLAUSE = "else_clause";
	public static final String LOOP_STATEMENT = "loop_statement";
	public static final String SWITCH_STATEMENT = "switch_statement";
	public static final String CASE_CLAUSE = "case_clause";
	public static final String RETURN_STATEMENT = "return_statement";
	public static final String JUMP_STATEMENT = "jump_statement";
	public static final String EXPRESSION_STATEMENT = "expression_statement";

	public static final String EXPRESSION = "expression";
	public static final String CALL = "call";
	public static final String ARGUMENTS = "arguments";
	public static final String SUBSCRIPT = "subscript";
	public static final String REGISTER = "register";
	public static final String NUMBER_LITERAL = "number_literal";
	public static final String STRING_LITERAL = "string_literal";
	public static final String BOOLEAN_LITERAL = "boolean_literal";

	public static final String FIELD_NAME = "name";
	public static final String FIELD_SIGNATURE = "signature";
	public static final String FIELD_PARAMETERS = "parameters";
	public static final String FIELD_RETURN_TYPE = "return_type";
	public static final String FIELD_BODY = "body";
	public static final String FIELD_TYPE = "type";
	public static final String FIELD_VALUE = "value";
	public static final String FIELD_FUNCTION = "function";
	public static final String FIELD_ARGUMENTS = "arguments";
	public static final String FIELD_CONDITION = "condition";

	private NodeKinds() {
	}

	/** True for {@code fn} and {@code asm fn} definitions. */
	public static boolean isFunctionDefinition(String kind) {
		return FUNCTION_DEFINITION.equals(kind) || ASM_FUNCTION_DEFINITION.equals(kind);
	}
}
