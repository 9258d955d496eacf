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

import com.tomaszrup.nesfabls.symbols.Symbol;

/**
 * One completion entry: a function or global variable visible from the
 * requesting file.
 */
public final class CompletionCandidate {

	private final String name;
	private final Symbol.Kind kind;
	private final String documentation;
	private final String detail;

	public CompletionCandidate(String name, Symbol.Kind kind, String documentation, String detail) {
		this.name = name;
		this.kind = kind;
		this.documentation = documentation;
		this.detail = detail;
	}

	public String getName() {
		return name;
	}

	public Symbol.Kind getKind() {
		return kind;
	}

	/** Markdown: the symbol description in a fenced {@code nesfab} block. */
	public String getDocumentation() {
		return documentation;
	}

	/** Display path of the defining file. */
	public String getDetail() {
		return detail;
	}

	@Override
	public String toString() {
		return kind + " " + name + " (" + detail + ")";
	}
}
