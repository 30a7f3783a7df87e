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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import org.junit.Test;

import java.util.Arrays;

import us.blanshard.crossword.core.Assignment;
import us.blanshard.crossword.core.Direction;
import us.blanshard.crossword.core.Slot;
import us.blanshard.crossword.core.Solver;
import us.blanshard.crossword.core.Structure;

public class CrosswordJsonTest {
  Structure structure = Structure.fromString("#_#\n___\n#_#\n#_#");
  Slot down = Slot.down(0, 1, 4);
  Slot across = Slot.across(1, 0, 3);
  Assignment assignment = Assignment.builder().put(down, "BOAT").put(across, "DOG").build();

  @Test public void slotValues() {
    assertEquals("0,1,DOWN,4", CrosswordJson.toJsonValue(down));
    assertEquals(across, CrosswordJson.fromJsonValue("1,0,ACROSS,3"));
    assertEquals(Slot.of(2, 3, Direction.DOWN, 5), CrosswordJson.fromJsonValue("2, 3, DOWN, 5"));
    assertEquals("\"1,0,ACROSS,3\"", CrosswordJson.GSON.toJson(across, Slot.class));
  }

  @Test public void slotValues_malformed() {
    for (String value : new String[] {"1,0,ACROSS", "1,0,SIDEWAYS,3", "x,0,DOWN,3", "0,0,DOWN,0"}) {
      try {
        CrosswordJson.fromJsonValue(value);
        fail(value);
      } catch (JsonParseException e) {
        // Expected
      }
    }
  }

  @Test public void toJson() {
    JsonObject object = CrosswordJson.toJson(structure, assignment);
    assertEquals(3, object.get("width").getAsInt());
    assertEquals(4, object.get("height").getAsInt());
    JsonArray rows = object.getAsJsonArray("rows");
    assertEquals("#B#", rows.get(0).getAsString());
    assertEquals("DOG", rows.get(1).getAsString());
    JsonArray slots = object.getAsJsonArray("slots");
    assertEquals(2, slots.size());
    assertEquals("0,1,DOWN,4", slots.get(0).getAsJsonObject().get("slot").getAsString());
    assertEquals("BOAT", slots.get(0).getAsJsonObject().get("word").getAsString());
  }

  @Test public void fromJson_readsSolverOutput() {
    Solver.Result result = Solver.solve(structure, Arrays.asList("DOG", "BOAT", "CAT"));
    String json = CrosswordJson.toJsonString(structure, result.solution);
    assertEquals(assignment, CrosswordJson.fromJson(structure, json));
  }

  @Test(expected = JsonParseException.class) public void fromJson_unknownSlot() {
    CrosswordJson.fromJson(structure,
        "{\"slots\": [{\"slot\": \"0,0,DOWN,4\", \"word\": \"BOAT\"}]}");
  }

  @Test(expected = JsonParseException.class) public void fromJson_wrongLength() {
    CrosswordJson.fromJson(structure,
        "{\"slots\": [{\"slot\": \"1,0,ACROSS,3\", \"word\": \"BOAT\"}]}");
  }

  @Test(expected = JsonParseException.class) public void fromJson_duplicateSlot() {
    CrosswordJson.fromJson(structure,
        "{\"slots\": [{\"slot\": \"1,0,ACROSS,3\", \"word\": \"DOG\"},"
        + " {\"slot\": \"1,0,ACROSS,3\", \"word\": \"CAT\"}]}");
  }

  @Test(expected = JsonParseException.class) public void fromJson_noSlots() {
    CrosswordJson.fromJson(structure, "{\"rows\": []}");
  }

  @Test public void fromJson_malformed() {
    String[] inputs = {
      "[]",
      "\"DOG\"",
      "{\"slots\": [\"x\"]}",
      "{\"slots\": [[\"1,0,ACROSS,3\", \"DOG\"]]}",
      "{\"slots\": [{\"slot\": \"1,0,ACROSS,3\"}]}",
      "{\"slots\": [{\"word\": \"DOG\"}]}",
      "{\"slots\": [{\"slot\": \"1,0,ACROSS,3\", \"word\": null}]}",
      "{\"slots\": [{\"slot\": \"1,0,ACROSS,3\", \"word\": [\"DOG\"]}]}",
      "{\"slots\": [{\"slot\": 5, \"word\": \"DOG\"}]}",
    };
    for (String input : inputs) {
      try {
        CrosswordJson.fromJson(structure, input);
        fail(input);
      } catch (JsonParseException e) {
        // Expected
      }
    }
  }
}
