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

import java.io.IOException;
import java.util.List;

/**
 * Reads and writes small line-oriented files kept per quorum.
 */
public interface QuorumFileReaderWriter {
  /**
   * @return the lines of the file, or an empty list if it does not exist.
   */
  List<String> readQuorumFile(String quorumId, String fileName) throws IOException;

  void writeQuorumFile(String quorumId, String fileName, List<String> data) throws IOException;
}
