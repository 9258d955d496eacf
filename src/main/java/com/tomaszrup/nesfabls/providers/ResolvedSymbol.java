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

import java.nio.file.Path;

import com.tomaszrup.nesfabls.symbols.Symbol;

/** A symbol together with the file that defines it. */
public final class ResolvedSymbol {

	private final Path file;
	private final Symbol symbol;

	public ResolvedSymbol(Path file, Symbol symbol) {
		this.file = file;
		this.symbol = symbol;
	}

	public Path getFile() {
		return file;
	}

	public Symbol getSymbol() {
		return symbol;
	}

	@Override
	public String toString() {
		return symbol + " in " + file;
	}
}
