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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable per-file table of function and global variable symbols.
 *
 * <p>Names are unique within each map: a later definition with the same name
 * replaces the earlier one while keeping the position of the first, so
 * iteration order is the order in which names first appear in the file.</p>
 */
public final class SymbolTable {

	public static final SymbolTable EMPTY = new Builder().build();

	private final Map<String, FunctionSymbol> functions;
	private final Map<String, VariableSymbol> variables;

	private SymbolTable(Map<String, FunctionSymbol> functions, Map<String, VariableSymbol> variables) {
		this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
		this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
	}

	public static Builder builder() {
		return new Builder();
	}

	public Optional<FunctionSymbol> findFunction(String name) {
		return Optional.ofNullable(functions.get(name));
	}

	public Optional<VariableSymbol> findVariable(String name) {
		return Optional.ofNullable(variables.get(name));
	}

	public Collection<FunctionSymbol> getFunctions() {
		return functions.values();
	}

	public Collection<VariableSymbol> getVariables() {
		return variables.values();
	}

	public boolean isEmpty() {
		return functions.isEmpty() && variables.isEmpty();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SymbolTable)) {
			return false;
		}
		SymbolTable other = (SymbolTable) o;
		return functions.equals(other.functions) && variables.equals(other.variables);
	}

	@Override
	public int hashCode() {
		return 31 * functions.hashCode() + variables.hashCode();
	}

	@Override
	public String toString() {
		return "SymbolTable{functions=" + functions.keySet() + ", variables=" + variables.keySet() + "}";
	}

	public static final class Builder {
		private final Map<String, FunctionSymbol> functions = new LinkedHashMap<>();
		private final Map<String, VariableSymbol> variables = new LinkedHashMap<>();

		private Builder() {
		}

		public Builder putFunction(FunctionSymbol symbol) {
			functions.put(symbol.getName(), symbol);
			return this;
		}

		public Builder putVariable(VariableSymbol symbol) {
			variables.put(symbol.getName(), symbol);
			return this;
		}

		public SymbolTable build() {
			return new SymbolTable(functions, variables);
		}
	}
}
