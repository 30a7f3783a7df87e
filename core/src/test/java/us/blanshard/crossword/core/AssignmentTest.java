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
package us.blanshard.crossword.core;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static us.blanshard.crossword.core.Fixtures.HOOK;
import static us.blanshard.crossword.core.Fixtures.HOOK_BOTTOM;
import static us.blanshard.crossword.core.Fixtures.HOOK_DOWN;
import static us.blanshard.crossword.core.Fixtures.HOOK_TOP;
import static us.blanshard.crossword.core.Fixtures.s;

import org.junit.Test;

public class AssignmentTest {
  Structure structure = s(HOOK);
  Assignment.Builder builder = Assignment.builder();

  @Test public void build() {
    Assignment assignment = builder
        .put(HOOK_BOTTOM, "TAN")
        .put(HOOK_DOWN, "CUT")
        .put(HOOK_TOP, "CAB")
        .build();
    assertThat(assignment.keySet()).containsExactly(HOOK_TOP, HOOK_DOWN, HOOK_BOTTOM).inOrder();
    assertEquals("CUT", assignment.get(HOOK_DOWN));
    assertTrue(assignment.isComplete(structure));
    assertTrue(assignment.isConsistent(structure));
  }

  @Test public void build_isASnapshot() {
    Assignment first = builder.put(HOOK_TOP, "CAB").build();
    builder.put(HOOK_DOWN, "CUT");
    assertEquals(1, first.size());
    assertFalse(first.isComplete(structure));
    assertTrue(first.isConsistent(structure));
  }

  @Test public void builder_removeAndUsed() {
    builder.put(HOOK_TOP, "CAB");
    assertTrue(builder.isUsed("CAB"));
    assertEquals("CAB", builder.remove(HOOK_TOP));
    assertFalse(builder.isUsed("CAB"));
    assertFalse(builder.containsKey(HOOK_TOP));
    assertNull(builder.remove(HOOK_TOP));
    assertEquals(0, builder.size());
  }

  @Test public void builder_replace() {
    builder.put(HOOK_TOP, "CAB").put(HOOK_TOP, "TAN");
    assertFalse(builder.isUsed("CAB"));
    assertTrue(builder.isUsed("TAN"));
    assertEquals(1, builder.size());
  }

  @Test public void builder_sameWordTwice() {
    builder.put(HOOK_TOP, "CAB").put(HOOK_BOTTOM, "CAB");
    builder.remove(HOOK_TOP);
    assertTrue(builder.isUsed("CAB"));
  }

  @Test(expected = IllegalArgumentException.class) public void builder_wrongLength() {
    builder.put(HOOK_TOP, "CABS");
  }

  @Test public void inconsistent_duplicateWords() {
    Assignment assignment = builder.put(HOOK_TOP, "CAB").put(HOOK_BOTTOM, "CAB").build();
    assertFalse(assignment.isConsistent(structure));
  }

  @Test public void inconsistent_crossingLetters() {
    Assignment assignment = builder.put(HOOK_TOP, "CAB").put(HOOK_DOWN, "TAN").build();
    assertFalse(assignment.isConsistent(structure));
  }

  @Test(expected = UnsupportedOperationException.class) public void immutable() {
    Assignment.EMPTY.put(HOOK_TOP, "CAB");
  }

  @Test public void empty() {
    assertTrue(Assignment.EMPTY.isConsistent(structure));
    assertFalse(Assignment.EMPTY.isComplete(structure));
    assertTrue(Assignment.EMPTY.isComplete(s("#_\n_#")));
  }
}
