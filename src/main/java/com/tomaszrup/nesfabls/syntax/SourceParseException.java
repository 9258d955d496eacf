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

import org.eclipse.lsp4j.Position;

import com.tomaszrup.nesfabls.IndexingException;

/**
 * Raised when a document cannot be turned into a syntax tree.
 */
public class SourceParseException extends IndexingException {
	private static final long serialVersionUID = 1L;

	private final Position position;

	public SourceParseException(String message, Position position) {
		super(message + " at " + (position.getLine() + 1) + ":" + (position.getCharacter() + 1));
		this.position = position;
	}

	/** Zero-based location of the problem. */
	public Position getPosition() {
		return position;
	}
}
