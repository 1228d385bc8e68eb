/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.yul.optimizer;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashSet;
import java.util.Set;

/**
 * Hands out identifiers that do not clash with each other, with built-in function names or with
 * any name the dispenser was told about.
 */
public final class NameDispenser {
  private final Set<String> usedNames = new HashSet<>();

  public NameDispenser(Set<String> reservedNames) {
    usedNames.addAll(Builtins.all().keySet());
    usedNames.addAll(reservedNames);
  }

  /**
   * Returns {@code hint} if it is still free, otherwise {@code hint_n} for the smallest free
   * {@code n}. An empty hint yields {@code _1}, {@code _2} and so on.
   */
  public String newName(String hint) {
    checkNotNull(hint);
    String name = hint;
    for (int suffix = 1; name.isEmpty() || usedNames.contains(name); suffix++) {
      name = hint + "_" + suffix;
    }
    usedNames.add(name);
    return name;
  }

  /** Marks {@code name} as taken; returns false if it already was. */
  @CanIgnoreReturnValue
  public boolean markUsed(String name) {
    return usedNames.add(name);
  }

  public boolean isUsed(String name) {
    return usedNames.contains(name);
  }
}
