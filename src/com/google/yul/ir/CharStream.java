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

package com.google.yul.ir;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Source text with a symbolic name and a read cursor. The name is only used in diagnostics.
 */
public final class CharStream {
  private final String source;
  private final String name;
  private int position = 0;

  public CharStream(String source, String name) {
    this.source = checkNotNull(source);
    this.name = checkNotNull(name);
  }

  public static CharStream fromFile(Path path) throws IOException {
    return new CharStream(Files.readString(path, UTF_8), path.toString());
  }

  public String getName() {
    return name;
  }

  public int position() {
    return position;
  }

  public void setPosition(int position) {
    checkArgument(position >= 0 && position <= source.length(), "Position out of range");
    this.position = position;
  }

  public void reset() {
    position = 0;
  }

  public boolean isPastEndOfInput() {
    return position >= source.length();
  }

  /** The character under the cursor, or {@code '\0'} at the end of input. */
  public char get() {
    return get(0);
  }

  public char get(int offset) {
    int index = position + offset;
    return index < source.length() ? source.charAt(index) : '\0';
  }

  public char advanceAndGet() {
    if (!isPastEndOfInput()) {
      position++;
    }
    return get();
  }

  public String substring(int start, int end) {
    return source.substring(start, end);
  }

  @Override
  public String toString() {
    return name;
  }
}
