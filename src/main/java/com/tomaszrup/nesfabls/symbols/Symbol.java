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

import java.util.Objects;

import org.eclipse.lsp4j.Range;

import com.tomaszrup.lsp.utils.Ranges;

/**
 * A named top-level definition found in a NESFab source file.
 *
 * <p>There are exactly two kinds, {@link FunctionSymbol} and
 * {@link VariableSymbol}; callers branch on {@link #getKind()}. Instances are
 * immutable.</p>
 */
public abstract class Symbol {

	public enum Kind {
		FUNCTION,
		VARIABLE
	}

	private final String name;
	private final Range range;
	private final String leadingComments;
	private final String description;

	Symbol(String name, Range range, String leadingComments, String definitionText) {
		this.name = Objects.requireNonNull(name, "name");
		this.range = Ranges.copy(range);
		this.leadingComments = leadingComments == null ? "" : leadingComments;
		this.description = this.leadingComments + definitionText;
	}

	public abstract Kind getKind();

	public String getName() {
		return name;
	}

	/** Range of the whole definition, body included. */
	public Range getRange() {
		return Ranges.copy(range);
	}

	/**
	 * Comment lines directly above the definition, each followed by a
	 * newline, or an empty string.
	 */
	public String getLeadingComments() {
		return leadingComments;
	}

	/** Leading comments followed by the definition's header text. */
	public String getDescription() {
		return description;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		Symbol other = (Symbol) o;
		return name.equals(other.name) && range.equals(other.range) && description.equals(other.description);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getKind(), name, range, description);
	}

	@Override
	public String toString() {
		return getKind() + " " + name + " @" + range.getStart().getLine() + ":" + range.getStart().getCharacter();
	}
}
