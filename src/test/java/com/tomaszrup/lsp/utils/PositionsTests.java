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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link Positions}.
 */
class PositionsTests {

	@Test
	void testComparatorOrdersByLineFirst() {
		Position earlier = new Position(1, 40);
		Position later = new Position(2, 0);
		Assertions.assertTrue(Positions.COMPARATOR.compare(earlier, later) < 0);
		Assertions.assertTrue(Positions.COMPARATOR.compare(later, earlier) > 0);
	}

	@Test
	void testComparatorSameLineUsesColumn() {
		Assertions.assertTrue(Positions.COMPARATOR.compare(new Position(3, 2), new Position(3, 10)) < 0);
		Assertions.assertEquals(0, Positions.COMPARATOR.compare(new Position(5, 10), new Position(5, 10)));
	}

	@Test
	void testValidRequiresNonNegativeLineAndColumn() {
		Assertions.assertTrue(Positions.valid(new Position(0, 0)));
		Assertions.assertFalse(Positions.valid(new Position(1, -1)));
		Assertions.assertFalse(Positions.valid(new Position(-1, 1)));
	}

	@Test
	void testCopyIsDetached() {
		Position original = new Position(4, 7);
		Position copy = Positions.copy(original);
		Assertions.assertEquals(original, copy);
		Assertions.assertNotSame(original, copy);

		copy.setLine(9);
		Assertions.assertEquals(4, original.getLine());
	}
}
