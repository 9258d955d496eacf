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
package com.tomaszrup.nesfabls.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

/**
 * Tests for {@link MdcFileContext}: file labels and MDC hand-over between
 * threads.
 */
class MdcFileContextTests {

	private static final Path ROOT = Paths.get("/ws").toAbsolutePath();

	@AfterEach
	void tearDown() {
		MdcFileContext.setWorkspaceRoots(List.of());
		MDC.clear();
	}

	@Test
	void testLabelIsRelativeToDeepestRoot() {
		MdcFileContext.setWorkspaceRoots(List.of(ROOT, ROOT.resolve("game")));

		MdcFileContext.setFile(ROOT.resolve("game/src/player.fab"));

		Assertions.assertEquals("src/player.fab", MDC.get(MdcFileContext.MDC_KEY));
	}

	@Test
	void testLabelFallsBackToFileName() {
		MdcFileContext.setFile(Paths.get("/elsewhere/lib/math.fab").toAbsolutePath());

		Assertions.assertEquals("math.fab", MDC.get(MdcFileContext.MDC_KEY));
	}

	@Test
	void testNullFileAndClear() {
		MdcFileContext.setFile(null);
		Assertions.assertEquals("-", MDC.get(MdcFileContext.MDC_KEY));

		MdcFileContext.clear();
		Assertions.assertNull(MDC.get(MdcFileContext.MDC_KEY));
	}

	@Test
	void testWrapCarriesCallerContextAndRestoresWorker() throws Exception {
		ExecutorService worker = Executors.newSingleThreadExecutor();
		try {
			worker.submit(() -> MDC.put("worker", "kept")).get();

			MDC.put(MdcFileContext.MDC_KEY, "main.fab");
			Callable<String> task = MdcFileContext.wrap(() -> MDC.get(MdcFileContext.MDC_KEY));
			Assertions.assertEquals("main.fab", worker.submit(task).get());

			Assertions.assertNull(worker.submit(() -> MDC.get(MdcFileContext.MDC_KEY)).get());
			Assertions.assertEquals("kept", worker.submit(() -> MDC.get("worker")).get());
		} finally {
			worker.shutdownNow();
		}
	}

	@Test
	void testWrapRunnableWithEmptyCallerContext() throws Exception {
		ExecutorService worker = Executors.newSingleThreadExecutor();
		try {
			String[] seen = new String[1];
			Runnable task = MdcFileContext.wrap(() -> {
				seen[0] = MDC.get(MdcFileContext.MDC_KEY);
			});
			worker.submit(() -> MDC.put(MdcFileContext.MDC_KEY, "stale.fab")).get();

			worker.submit(task).get();

			Assertions.assertNull(seen[0]);
			Assertions.assertEquals("stale.fab", worker.submit(() -> MDC.get(MdcFileContext.MDC_KEY)).get());
		} finally {
			worker.shutdownNow();
		}
	}
}
