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

import java.time.Duration;

/**
 * The outcome of a search.
 *
 * @param best the best individual of all generations
 * @param rounds the number of generations bred after the initial one
 * @param finalPopulation the last generation
 */
public record SearchResult(
    Individual best,
    int rounds,
    AlgorithmRunner.StopReason stopReason,
    Population finalPopulation,
    Duration elapsed) {}
