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

import com.tomaszrup.lsp.utils.Ranges;
import com.tomaszrup.nesfabls.IndexingException;

/**
 * Raised when a definition in an otherwise parsed tree lacks a part that
 * symbol extraction needs. The whole file is rejected.
 */
public class SymbolExtractionException extends IndexingException {
	private static final long serialVersionUID = 1L;

	private final Range range;

	public SymbolExtractionException(String message, Range range) {
		super(message + " at " + (range.getStart().getLine() + 1) + ":" + (range.getStart().getCharacter() + 1));
		this.range = Ranges.copy(range);
	}

	/** Range of the offending definition. */
	public Range getRange() {
		return Ranges.copy(range);
	}
}
