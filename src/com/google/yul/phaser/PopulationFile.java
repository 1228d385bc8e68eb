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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes populations as JSON:
 *
 * <pre>
 * {
 *   "round": 3,
 *   "population": [{"chromosome": "fDxsju", "fitness": 118}, ...]
 * }
 * </pre>
 *
 * Only the chromosomes are read back; fitness depends on the corpus and is computed again.
 */
public final class PopulationFile {

  private PopulationFile() {}

  public static void write(Path file, Population population, int round) throws IOException {
    try (Writer out = Files.newBufferedWriter(file, UTF_8);
        JsonWriter jsonWriter = new JsonWriter(out)) {
      jsonWriter.setIndent("  ");
      jsonWriter.beginObject();
      jsonWriter.name("round").value(round);
      jsonWriter.name("population").beginArray();
      for (Individual individual : population.getIndividuals()) {
        jsonWriter.beginObject();
        jsonWriter.name("chromosome").value(individual.getChromosome().getGenes());
        jsonWriter.name("fitness").value(individual.getFitness());
        jsonWriter.endObject();
      }
      jsonWriter.endArray();
      jsonWriter.endObject();
    }
  }

  /**
   * @throws IOException if the file cannot be read, is not in the format above or contains a gene
   *     that is not a step abbreviation
   */
  public static ImmutableList<Chromosome> read(Path file) throws IOException {
    String contents = Files.readString(file, UTF_8);
    ImmutableList.Builder<Chromosome> chromosomes = ImmutableList.builder();
    try {
      JsonObject root = new Gson().fromJson(contents, JsonObject.class);
      if (root == null || !root.has("population")) {
        throw new IOException("Malformed population file " + file + ": no population");
      }
      for (JsonElement each : root.get("population").getAsJsonArray()) {
        JsonObject entry = each.getAsJsonObject();
        JsonElement genes = entry.get("chromosome");
        if (genes == null || !genes.isJsonPrimitive() || !genes.getAsJsonPrimitive().isString()) {
          throw new IOException("Malformed population file " + file + ": no chromosome string");
        }
        chromosomes.add(Chromosome.of(genes.getAsString()));
      }
    } catch (JsonParseException | IllegalStateException | IllegalArgumentException e) {
      throw new IOException("Malformed population file " + file + ": " + e.getMessage(), e);
    }
    return chromosomes.build();
  }
}
