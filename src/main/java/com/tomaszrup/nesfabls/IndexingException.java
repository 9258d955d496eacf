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
package com.tomaszrup.nesfabls;

/**
 * Base class for failures that are scoped to a single source file: the
 * file could not be parsed, or its symbols could not be extracted. The
 * index keeps its previous state for that file when one of these is thrown.
 */
public class IndexingException extends Exception {
	private static final long serialVersionUID = 1L;

	public IndexingException(String message) {
		super(message);
	}

	public IndexingException(String message, Throwable cause) {
		super(message, cause);
	}
}
