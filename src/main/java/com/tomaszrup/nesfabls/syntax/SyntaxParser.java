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
 * Turns source text into a {@link SyntaxTree}. Implementations must be safe
 * to call from several threads at once.
 */
public interface SyntaxParser {

	/**
	 * Parses a whole document.
	 *
	 * @throws SourceParseException if the text is malformed beyond recovery
	 */
	SyntaxTree parse(String source) throws SourceParseException;
}
