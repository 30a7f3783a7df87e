/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.crossword.json;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import us.blanshard.crossword.core.Assignment;
import us.blanshard.crossword.core.Direction;
import us.blanshard.crossword.core.LetterGrid;
import us.blanshard.crossword.core.Slot;
import us.blanshard.crossword.core.Structure;

/**
 * Static methods that convert filled-in crosswords to and from json.  A slot's
 * json value is a string of the form "row,column,direction,length".
 *
 * @author Luke Blanshard
 */
public class CrosswordJson {
  public static final Splitter SPLITTER = Splitter.on(',').trimResults();
  public static final Joiner JOINER = Joiner.on(',');

  /** A convenience for reading and writing slots. */
  public static final Gson GSON = registerSlot(new GsonBuilder()).setPrettyPrinting().create();

  /**
   * Registers a type adapter in the given builder so that slots can be
   * serialized and deserialized.
   */
  public static GsonBuilder registerSlot(GsonBuilder builder) {
    builder.registerTypeAdapter(Slot.class, new TypeAdapter<Slot>() {
      @Override public void write(JsonWriter out, Slot value) throws IOException {
        out.value(toJsonValue(value));
      }
      @Override public Slot read(JsonReader in) throws IOException {
        return fromJsonValue(in.nextString());
      }
    });
    return builder;
  }

  public static String toJsonValue(Slot slot) {
    return JOINER.join(slot.row, slot.column, slot.direction, slot.length);
  }

  public static Slot fromJsonValue(String value) {
    List<String> parts = SPLITTER.splitToList(value);
    if (parts.size() != 4) throw new JsonParseException("Malformed slot: " + value);
    try {
      return Slot.of(Integer.parseInt(parts.get(0)), Integer.parseInt(parts.get(1)),
                     Direction.valueOf(parts.get(2)), Integer.parseInt(parts.get(3)));
    } catch (IllegalArgumentException e) {
      // Covers NumberFormatException too.
      throw new JsonParseException("Malformed slot: " + value, e);
    }
  }

  /**
   * Returns the json form of the given assignment on the given structure: its
   * dimensions, its rows of letters, and each slot's word.
   */
  public static JsonObject toJson(Structure structure, Assignment assignment) {
    JsonObject object = new JsonObject();
    object.addProperty("width", structure.width);
    object.addProperty("height", structure.height);
    JsonArray rows = new JsonArray();
    for (String line : LetterGrid.of(structure, assignment).format(LetterGrid.BLOCKED))
      rows.add(new JsonPrimitive(line));
    object.add("rows", rows);
    JsonArray slots = new JsonArray();
    for (Map.Entry<Slot, String> entry : assignment.entrySet()) {
      JsonObject slot = new JsonObject();
      slot.add("slot", GSON.toJsonTree(entry.getKey(), Slot.class));
      slot.addProperty("word", entry.getValue());
      slots.add(slot);
    }
    object.add("slots", slots);
    return object;
  }

  /** Returns the json text form of the given assignment on the given structure. */
  public static String toJsonString(Structure structure, Assignment assignment) {
    return GSON.toJson(toJson(structure, assignment));
  }

  /**
   * Reads the slots' words back out of the json text form, checking that each
   * slot belongs to the given structure and each word fits its slot.
   */
  public static Assignment fromJson(Structure structure, String json) {
    JsonElement root = JsonParser.parseString(json);
    if (!root.isJsonObject()) throw new JsonParseException("Expected an object: " + json);
    return fromJson(structure, root.getAsJsonObject());
  }

  public static Assignment fromJson(Structure structure, JsonObject object) {
    ImmutableSet<Slot> known = ImmutableSet.copyOf(structure.slots);
    Assignment.Builder builder = Assignment.builder();
    JsonElement slots = object.get("slots");
    if (slots == null || !slots.isJsonArray())
      throw new JsonParseException("Missing slots array");
    for (JsonElement element : slots.getAsJsonArray()) {
      if (!element.isJsonObject())
        throw new JsonParseException("Malformed slot entry: " + element);
      JsonObject entry = element.getAsJsonObject();
      if (!isString(entry.get("slot")) || !isString(entry.get("word")))
        throw new JsonParseException("Slot entry needs slot and word strings: " + entry);
      Slot slot = GSON.fromJson(entry.get("slot"), Slot.class);
      String word = entry.get("word").getAsString();
      if (!known.contains(slot))
        throw new JsonParseException("Slot " + slot + " is not in the structure");
      if (word.length() != slot.length)
        throw new JsonParseException("Word " + word + " doesn't fit slot " + slot);
      if (builder.containsKey(slot))
        throw new JsonParseException("Slot " + slot + " appears twice");
      builder.put(slot, word);
    }
    return builder.build();
  }

  private static boolean isString(@Nullable JsonElement element) {
    return element != null && element.isJsonPrimitive()
        && element.getAsJsonPrimitive().isString();
  }

  // Static methods only.
  private CrosswordJson() {}
}
