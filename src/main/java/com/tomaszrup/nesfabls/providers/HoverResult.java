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

/** What to show when hovering a resolved name. */
public final class HoverResult {

	private final String description;
	private final String displayPath;

	public HoverResult(String description, String displayPath) {
		this.description = description;
		this.displayPath = displayPath;
	}

	/** Leading comments plus the definition header. */
	public String getDescription() {
		return description;
	}

	/** Defining file, relative to its workspace root when it has one. */
	public String getDisplayPath() {
		return displayPath;
	}
}
