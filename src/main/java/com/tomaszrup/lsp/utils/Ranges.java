////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
//
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lsp.utils;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

public class Ranges {
	private Ranges() {
	}

	public static boolean contains(Range range, Position position) {
		return Positions.COMPARATOR.compare(position, range.getStart()) >= 0
				&& Positions.COMPARATOR.compare(position, range.getEnd()) <= 0;
	}

	public static boolean contains(Range outer, Range inner) {
		return contains(outer, inner.getStart()) && contains(outer, inner.getEnd());
	}

	/**
	 * Orders ranges by extent: fewer lines first, then fewer characters for
	 * single-line ranges. Multi-line ranges of equal height compare by
	 * containment. Used to pick the innermost of several covering nodes.
	 */
	public static boolean isSmaller(Range r1, Range r2) {
		int lines1 = r1.getEnd().getLine() - r1.getStart().getLine();
		int lines2 = r2.getEnd().getLine() - r2.getStart().getLine();
		if (lines1 != lines2) {
			return lines1 < lines2;
		}
		if (lines1 == 0) {
			return r1.getEnd().getCharacter() - r1.getStart().getCharacter()
					< r2.getEnd().getCharacter() - r2.getStart().getCharacter();
		}
		return contains(r2, r1) && !contains(r1, r2);
	}

	public static Range copy(Range range) {
		return new Range(Positions.copy(range.getStart()), Positions.copy(range.getEnd()));
	}
}
