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

import com.google.common.collect.Lists;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * AppliedPositionStore backed by a one-line text file, replaced atomically on every write.
 */
public class FileAppliedPositionStore implements AppliedPositionStore {
  private final Path path;

  public FileAppliedPositionStore(Path path) {
    this.path = path;
  }

  @Override
  public long read() throws IOException {
    final List<String> lines;
    try {
      lines = Files.readAllLines(path, StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      return 0;
    }

    if (lines.size() != 1) {
      throw new IOException("malformed applied position file " + path);
    }
    try {
      return Long.parseLong(lines.get(0).trim());
    } catch (NumberFormatException e) {
      throw new IOException("malformed applied position file " + path, e);
    }
  }

  @Override
  public void write(long position) throws IOException {
    Files.createDirectories(path.getParent());
    final Path tempPath = path.resolveSibling(path.getFileName() + ".tmp");
    Files.write(tempPath, Lists.newArrayList(Long.toString(position)), StandardCharsets.UTF_8);
    Files.move(tempPath, path, ATOMIC_MOVE, REPLACE_EXISTING);
  }
}
