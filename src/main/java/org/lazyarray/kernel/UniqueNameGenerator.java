/*
 * Copyright 2025 The Retrospect Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.lazyarray.kernel;

import com.google.common.base.Preconditions;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Generates names that are distinct from each other and from a set of reserved names. Each
 * generated name is {@code basedOn} itself if that is still free, otherwise {@code basedOn_<k>}
 * for the smallest {@code k} (counting separately for each {@code basedOn}) that is free.
 *
 * <p>Not thread-safe; each lowering call owns its own generators.
 */
public final class UniqueNameGenerator {
  private final Set<String> existingNames;

  /** For each {@code basedOn} seen so far, the next suffix to try. */
  private final Map<String, Integer> nextSuffix = new HashMap<>();

  public UniqueNameGenerator(Iterable<String> existingNames) {
    this.existingNames = new HashSet<>();
    existingNames.forEach(this.existingNames::add);
  }

  public UniqueNameGenerator() {
    this.existingNames = new HashSet<>();
  }

  /** True if {@code name} has been reserved or generated. */
  public boolean isNameTaken(String name) {
    return existingNames.contains(name);
  }

  /**
   * Reserves the given name, so that it will never be generated.
   *
   * @throws IllegalArgumentException if the name is already taken
   */
  public void addName(String name) {
    Preconditions.checkArgument(
        existingNames.add(name), "Name '%s' conflicts with existing names", name);
  }

  /** Calls {@link #addName} on each element. */
  public void addNames(Iterable<String> names) {
    names.forEach(this::addName);
  }

  /** Returns a new name, based on the given one. */
  public String generate(String basedOn) {
    String name = basedOn;
    if (isNameTaken(name)) {
      int suffix = nextSuffix.getOrDefault(basedOn, 0);
      do {
        name = basedOn + "_" + suffix++;
      } while (isNameTaken(name));
      nextSuffix.put(basedOn, suffix);
    }
    existingNames.add(name);
    return name;
  }
}
