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

import java.util.ArrayList;
import java.util.List;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.nesfabls.syntax.nesfab.NesfabParser;

/**
 * Tests for {@link SymbolExtractor}: which definitions become symbols, how
 * leading comments are attached, and when extraction fails.
 */
class SymbolExtractorTests {

	private final NesfabParser parser = new NesfabParser();
	private final SymbolExtractor extractor = new SymbolExtractor();

	private SymbolTable extract(String source) throws Exception {
		return extractor.extract(parser.parse(source));
	}

	// ------------------------------------------------------------------
	// Functions
	// ------------------------------------------------------------------

	@Test
	void testUncommentedFunctionDescriptionIsSignature() throws Exception {
		SymbolTable table = extract("fn add(a, b)\n    return a + b\n");

		FunctionSymbol add = table.findFunction("add").orElseThrow();
		Assertions.assertEquals("fn add(a, b)", add.getDescription());
		Assertions.assertEquals("fn add(a, b)", add.getSignature());
		Assertions.assertEquals("", add.getLeadingComments());
		Assertions.assertEquals(Symbol.Kind.FUNCTION, add.getKind());
		Assertions.assertEquals(new Range(new Position(0, 0), new Position(1, 16)), add.getRange());
	}

	@Test
	void testCommentBlockPrefixesDescription() throws Exception {
		SymbolTable table = extract("// Adds two bytes.\n// Wraps on overflow.\nfn add(U a, U b) U\n    return a + b\n");

		Assertions.assertEquals("// Adds two bytes.\n// Wraps on overflow.\nfn add(U a, U b) U",
				table.findFunction("add").orElseThrow().getDescription());
	}

	@Test
	void testBlankLineSeparatesComment() throws Exception {
		SymbolTable table = extract("// unrelated\n\nfn f()\n    g()\n");

		Assertions.assertEquals("fn f()", table.findFunction("f").orElseThrow().getDescription());
	}

	@Test
	void testCommentBlockStopsAtGap() throws Exception {
		SymbolTable table = extract("// file header\n\n// about f\nfn f()\n");

		Assertions.assertEquals("// about f\nfn f()", table.findFunction("f").orElseThrow().getDescription());
	}

	@Test
	void testCommentAfterPreviousBodyAttachesToNextFunction() throws Exception {
		SymbolTable table = extract("fn a()\n    x()\n// about b\nfn b()\n    y()\n");

		Assertions.assertEquals("fn a()", table.findFunction("a").orElseThrow().getDescription());
		Assertions.assertEquals("// about b\nfn b()", table.findFunction("b").orElseThrow().getDescription());
	}

	@Test
	void testAsmFunctionIsCollected() throws Exception {
		SymbolTable table = extract("asm fn reset()\n    rts\n");

		Assertions.assertEquals("asm fn reset()", table.findFunction("reset").orElseThrow().getDescription());
	}

	@Test
	void testLaterDefinitionWinsButKeepsFirstPosition() throws Exception {
		SymbolTable table = extract("fn a()\nfn b()\nfn a(U x)\n");

		List<String> names = new ArrayList<>();
		for (FunctionSymbol symbol : table.getFunctions()) {
			names.add(symbol.getName());
		}
		Assertions.assertEquals(List.of("a", "b"), names);
		Assertions.assertEquals("fn a(U x)", table.findFunction("a").orElseThrow().getSignature());
	}

	@Test
	void testModesAndHandlersAreNotFunctions() throws Exception {
		SymbolTable table = extract("mode main()\n    nmi\nnmi main_nmi()\n    ppu()\n");

		Assertions.assertTrue(table.getFunctions().isEmpty());
	}

	// ------------------------------------------------------------------
	// Variables
	// ------------------------------------------------------------------

	@Test
	void testGlobalVariablesAreCollected() throws Exception {
		SymbolTable table = extract("// lives left\nU lives = 3\nvars /game\n    U score\n");

		VariableSymbol lives = table.findVariable("lives").orElseThrow();
		Assertions.assertEquals("// lives left\nU lives = 3", lives.getDescription());
		Assertions.assertEquals("U lives = 3", lives.getDeclaration());
		Assertions.assertEquals(Symbol.Kind.VARIABLE, lives.getKind());
		Assertions.assertEquals("U score", table.findVariable("score").orElseThrow().getDescription());
	}

	@Test
	void testLocalsParametersAndMembersAreExcluded() throws Exception {
		SymbolTable table = extract("struct Point\n    U x\nfn f(U p)\n    U local = p\n");

		Assertions.assertTrue(table.getVariables().isEmpty());
		Assertions.assertTrue(table.findFunction("f").isPresent());
	}

	// ------------------------------------------------------------------
	// Failures and equality
	// ------------------------------------------------------------------

	@Test
	void testFunctionWithoutNameFailsWholeFile() throws Exception {
		SymbolExtractionException e = Assertions.assertThrows(SymbolExtractionException.class,
				() -> extract("fn ok()\nfn (a)\n"));
		Assertions.assertEquals(1, e.getRange().getStart().getLine());
	}

	@Test
	void testExtractionIsDeterministic() throws Exception {
		String source = "// doc\nfn f()\n    g()\nU v = 1\n";

		Assertions.assertEquals(extract(source), extract(source));
		Assertions.assertEquals(extract(source).hashCode(), extract(source).hashCode());
	}

	@Test
	void testEmptyFileHasEmptyTable() throws Exception {
		Assertions.assertTrue(extract("// nothing here\n").isEmpty());
		Assertions.assertEquals(SymbolTable.EMPTY, extract(""));
	}
}
