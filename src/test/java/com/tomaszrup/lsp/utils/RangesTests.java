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
package com.tomaszrup.lsp.utils;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link Ranges}: containment, size ordering and copying.
 */
class RangesTests {

	private static Range range(int startLine, int startColumn, int endLine, int endColumn) {
		return new Range(new Position(startLine, startColumn), new Position(endLine, endColumn));
	}

	// ------------------------------------------------------------------
	// contains()
	// ------------------------------------------------------------------

	@Test
	void testContainsIsInclusiveAtBothEnds() {
		Range range = range(1, 5, 3, 10);
		Assertions.assertTrue(Ranges.contains(range, new Position(1, 5)));
		Assertions.assertTrue(Ranges.contains(range, new Position(3, 10)));
		Assertions.assertTrue(Ranges.contains(range, new Position(2, 0)));
	}

	@Test
	void testContainsRejectsPositionsOutside() {
		Range range = range(1, 5, 1, 10);
		Assertions.assertFalse(Ranges.contains(range, new Position(1, 4)));
		Assertions.assertFalse(Ranges.contains(range, new Position(1, 11)));
		Assertions.assertFalse(Ranges.contains(range, new Position(0, 7)));
	}

	@Test
	void testContainsRange() {
		Range outer = range(0, 0, 5, 0);
		Assertions.assertTrue(Ranges.contains(outer, range(1, 2, 3, 4)));
		Assertions.assertFalse(Ranges.contains(outer, range(4, 0, 6, 0)));
	}

	// ------------------------------------------------------------------
	// isSmaller()
	// ------------------------------------------------------------------

	@Test
	void testIsSmallerPrefersFewerLines() {
		Assertions.assertTrue(Ranges.isSmaller(range(2, 0, 2, 80), range(1, 0, 3, 0)));
		Assertions.assertFalse(Ranges.isSmaller(range(1, 0, 3, 0), range(2, 0, 2, 80)));
	}

	@Test
	void testIsSmallerOnOneLineComparesWidth() {
		Assertions.assertTrue(Ranges.isSmaller(range(4, 10, 4, 13), range(4, 3, 4, 20)));
		Assertions.assertFalse(Ranges.isSmaller(range(4, 3, 4, 20), range(4, 10, 4, 13)));
	}

	@Test
	void testIsSmallerMultiLineUsesContainment() {
		Range outer = range(1, 0, 3, 20);
		Range inner = range(1, 4, 3, 2);
		Assertions.assertTrue(Ranges.isSmaller(inner, outer));
		Assertions.assertFalse(Ranges.isSmaller(outer, inner));
		Assertions.assertFalse(Ranges.isSmaller(outer, outer));
	}

	@Test
	void testCopyIsDeep() {
		Range original = range(1, 2, 3, 4);
		Range copy = Ranges.copy(original);
		Assertions.assertEquals(original, copy);
		copy.getStart().setLine(7);
		Assertions.assertEquals(1, original.getStart().getLine());
	}
}
