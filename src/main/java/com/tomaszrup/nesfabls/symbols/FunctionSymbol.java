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

/** A {@code fn} or {@code asm fn} definition. */
public final class FunctionSymbol extends Symbol {

	private final String signature;

	public FunctionSymbol(String name, Range range, String signature, String leadingComments) {
		super(name, range, leadingComments, signature);
		this.signature = signature;
	}

	@Override
	public Kind getKind() {
		return Kind.FUNCTION;
	}

	/** The header line, e.g. {@code fn add(U a, U b) U}. */
	public String getSignature() {
		return signature;
	}
}
