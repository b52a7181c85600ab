/*
 * Copyright (C) 2014  Ohm Data
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU Affero General Public License as
 *  published by the Free Software Foundation, either version 3 of the
 *  License, or (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU Affero General Public License for more details.
 *
 *  You should have received a copy of the GNU Affero General Public License
 *  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package vexdb.log;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

public class FileAppliedPositionStoreTest {
  @Rule
  public TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Test
  public void readsZeroWhenNothingWasEverWritten() throws Exception {
    Path path = temporaryFolder.getRoot().toPath().resolve("applied");
    assertThat(new FileAppliedPositionStore(path).read(), is(equalTo(0L)));
  }

  @Test
  public void readsBackTheLastPositionWritten() throws Exception {
    Path path = temporaryFolder.getRoot().toPath().resolve("shard").resolve("applied");
    new FileAppliedPositionStore(path).write(41);
    new FileAppliedPositionStore(path).write(42);

    assertThat(new FileAppliedPositionStore(path).read(), is(equalTo(42L)));
  }

  @Test(expected = IOException.class)
  public void throwsWhenTheFileDoesNotHoldAPosition() throws Exception {
    Path path = temporaryFolder.newFile("applied").toPath();
    Files.write(path, "forty-two\n".getBytes(StandardCharsets.UTF_8));

    new FileAppliedPositionStore(path).read();
  }
}
