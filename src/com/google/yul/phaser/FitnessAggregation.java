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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.primitives.Longs;

/** How the scores of one chromosome on the programs of a corpus are combined. */
public enum FitnessAggregation {
  SUM,
  /** The sum divided by the number of programs, rounded down. */
  AVERAGE,
  MINIMUM,
  MAXIMUM;

  public long aggregate(long... values) {
    checkArgument(values.length > 0, "Nothing to aggregate");
    switch (this) {
      case SUM:
        return sum(values);
      case AVERAGE:
        return sum(values) / values.length;
      case MINIMUM:
        return Longs.min(values);
      case MAXIMUM:
        return Longs.max(values);
    }
    throw new AssertionError(this);
  }

  private static long sum(long[] values) {
    long sum = 0;
    for (long value : values) {
      sum += value;
    }
    return sum;
  }
}
