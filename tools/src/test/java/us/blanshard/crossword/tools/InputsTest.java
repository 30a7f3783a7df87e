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
package us.blanshard.crossword.tools;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;

import us.blanshard.crossword.core.Slot;
import us.blanshard.crossword.core.Structure;

public class InputsTest {
  @Rule public TemporaryFolder folder = new TemporaryFolder();

  @Test public void readStructure() throws IOException {
    File file = write("structure.txt", "#___\n#_##\n____\n");
    Structure structure = Inputs.readStructure(file);
    assertEquals(4, structure.width);
    assertEquals(3, structure.height);
    assertEquals(ImmutableList.of(Slot.across(0, 1, 3), Slot.down(0, 1, 3), Slot.across(2, 0, 4)),
                 structure.slots);
  }

  @Test public void readWords() throws IOException {
    File file = write("words.txt", "cat\n  Dog \n\nCAT\nboat\n");
    assertThat(Inputs.readWords(file)).containsExactly("CAT", "DOG", "BOAT").inOrder();
  }

  @Test(expected = IOException.class) public void missingFile() throws IOException {
    Inputs.readWords(new File(folder.getRoot(), "nope.txt"));
  }

  private File write(String name, String contents) throws IOException {
    File file = folder.newFile(name);
    Files.asCharSink(file, Charsets.UTF_8).write(contents);
    return file;
  }
}
