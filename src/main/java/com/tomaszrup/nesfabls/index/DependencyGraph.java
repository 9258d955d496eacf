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

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Immutable snapshot of which source files each build configuration
 * declares as inputs.
 *
 * <p>The graph keeps two maps:
 * <ul>
 *   <li>{@code inputsByConfigDir}: forward edges: config directory → the
 *       {@code .fab} files its {@code .cfg} files list</li>
 *   <li>{@code configDirsBySource}: reverse edges: source file → config
 *       directories listing it</li>
 * </ul>
 *
 * <p>Keys and values are sorted by path, so iteration order is stable.
 * Changes produce a new snapshot through {@link #rebuild}; the index swaps
 * snapshots atomically.</p>
 */
public final class DependencyGraph {

	public static final DependencyGraph EMPTY = new DependencyGraph(Collections.emptyMap());

	/** Forward edges: config directory → its input files. */
	private final Map<Path, Set<Path>> inputsByConfigDir;

	/** Reverse edges: input file → config directories that list it. */
	private final Map<Path, Set<Path>> configDirsBySource;

	public DependencyGraph(Map<Path, ? extends Set<Path>> entries) {
		Map<Path, Set<Path>> forward = new TreeMap<>();
		Map<Path, Set<Path>> reverse = new TreeMap<>();
		for (Map.Entry<Path, ? extends Set<Path>> entry : entries.entrySet()) {
			forward.put(entry.getKey(), Collections.unmodifiableSet(new TreeSet<>(entry.getValue())));
			for (Path source : entry.getValue()) {
				reverse.computeIfAbsent(source, k -> new TreeSet<>()).add(entry.getKey());
			}
		}
		reverse.replaceAll((source, dirs) -> Collections.unmodifiableSet(dirs));
		this.inputsByConfigDir = Collections.unmodifiableMap(forward);
		this.configDirsBySource = Collections.unmodifiableMap(reverse);
	}

	/**
	 * Returns a new graph that keeps every entry of this one whose config
	 * directory is not matched by {@code replaced}, then adds
	 * {@code rescanned} on top.
	 */
	public DependencyGraph rebuild(Predicate<Path> replaced, Map<Path, ? extends Set<Path>> rescanned) {
		Map<Path, Set<Path>> entries = new TreeMap<>();
		for (Map.Entry<Path, Set<Path>> entry : inputsByConfigDir.entrySet()) {
			if (!replaced.test(entry.getKey())) {
				entries.put(entry.getKey(), entry.getValue());
			}
		}
		entries.putAll(rescanned);
		return new DependencyGraph(entries);
	}

	/** All entries, config directory → inputs. */
	public Map<Path, Set<Path>> asMap() {
		return inputsByConfigDir;
	}

	public Set<Path> getInputs(Path configDir) {
		return inputsByConfigDir.getOrDefault(configDir, Collections.emptySet());
	}

	/** Config directories whose inputs include {@code source}. */
	public Set<Path> getConfigDirectories(Path source) {
		return configDirsBySource.getOrDefault(source, Collections.emptySet());
	}

	/**
	 * Returns every file that shares a configuration with {@code source}:
	 * the union of the inputs of each config listing it. Includes
	 * {@code source} itself when it is listed anywhere.
	 */
	public Set<Path> getDependencies(Path source) {
		Set<Path> result = new TreeSet<>();
		for (Path configDir : getConfigDirectories(source)) {
			result.addAll(inputsByConfigDir.get(configDir));
		}
		return result;
	}

	/** Every file listed by any configuration. */
	public Set<Path> getAllInputs() {
		return configDirsBySource.keySet();
	}

	public boolean isEmpty() {
		return inputsByConfigDir.isEmpty();
	}

	@Override
	public String toString() {
		return "DependencyGraph{" + inputsByConfigDir + "}";
	}
}
