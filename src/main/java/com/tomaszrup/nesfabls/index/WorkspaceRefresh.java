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
package com.tomaszrup.nesfabls.index;

/**
 * Outcome of a workspace refresh or directory rescan.
 */
public final class WorkspaceRefresh {

	private final int rescannedConfigDirectories;
	private final int totalConfigDirectories;
	private final int indexedFiles;
	private final int failedFiles;

	public WorkspaceRefresh(int rescannedConfigDirectories, int totalConfigDirectories, int indexedFiles,
			int failedFiles) {
		this.rescannedConfigDirectories = rescannedConfigDirectories;
		this.totalConfigDirectories = totalConfigDirectories;
		this.indexedFiles = indexedFiles;
		this.failedFiles = failedFiles;
	}

	/** Config directories found by this scan. */
	public int getRescannedConfigDirectories() {
		return rescannedConfigDirectories;
	}

	/** Config directories in the graph after the refresh. */
	public int getTotalConfigDirectories() {
		return totalConfigDirectories;
	}

	/** Files that gained a symbol table during the refresh. */
	public int getIndexedFiles() {
		return indexedFiles;
	}

	/** Files that could not be read, parsed or extracted. */
	public int getFailedFiles() {
		return failedFiles;
	}

	@Override
	public String toString() {
		return "WorkspaceRefresh{rescanned=" + rescannedConfigDirectories + ", total=" + totalConfigDirectories
				+ ", indexed=" + indexedFiles + ", failed=" + failedFiles + "}";
	}
}
