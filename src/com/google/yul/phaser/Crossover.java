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

package com.google.yul.phaser;

import java.util.Random;

/** Combines the genes of two parents into two children. */
@FunctionalInterface
public interface Crossover {

  /** The children of one crossover. */
  record Offspring(Chromosome first, Chromosome second) {}

  Offspring cross(Chromosome first, Chromosome second, Random random);
}
