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

package vexdb.replication;

import vexdb.ReplicatorConstants;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

public class NioQuorumFileReaderWriter implements QuorumFileReaderWriter {
  private final Path basePath;

  public NioQuorumFileReaderWriter(Path basePath) {
    this.basePath = basePath.resolve(ReplicatorConstants.REPLICATOR_QUORUM_FILE_ROOT_DIRECTORY_RELATIVE_PATH);
  }

  public Path getQuorumDirectory(String quorumId) {
    return basePath.resolve(quorumId);
  }

  @Override
  public List<String> readQuorumFile(String quorumId, String fileName) throws IOException {
    Path filePath = getQuorumDirectory(quorumId).resolve(fileName);

    try {
      return Files.readAllLines(filePath, StandardCharsets.UTF_8);
    } catch (NoSuchFileException ex) {
      return new ArrayList<>();
    }
  }

  /**
   * Replace the file atomically, so a crash leaves either the old or the new contents.
   */
  @Override
  public void writeQuorumFile(String quorumId, String fileName, List<String> data) throws IOException {
    Path dirPath = getQuorumDirectory(quorumId);
    Files.createDirectories(dirPath);

    Path tempPath = dirPath.resolve(fileName + ".tmp");
    Files.write(tempPath, data, StandardCharsets.UTF_8);
    Files.move(tempPath, dirPath.resolve(fileName), ATOMIC_MOVE, REPLACE_EXISTING);
  }
}
