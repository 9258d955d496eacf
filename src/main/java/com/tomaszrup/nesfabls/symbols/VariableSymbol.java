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

import org.eclipse.lsp4j.Range;

/** A module-level variable, either at file scope or in a {@code vars} block. */
public final class VariableSymbol extends Symbol {

	private final String declaration;

	public VariableSymbol(String name, Range range, String declaration, String leadingComments) {
		super(name, range, leadingComments, declaration);
		this.declaration = declaration;
	}

	@Override
	public Kind getKind() {
		return Kind.VARIABLE;
	}

	public String getDeclaration() {
		return declaration;
	}
}
