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

import java.io.IOException;

/**
 * Durable record of the id of the last operation a shard replica applied, for the times the
 * replica's operation log cannot tell: right after its state was replaced by a snapshot, the
 * log is empty.
 */
public interface AppliedPositionStore {
  long read() throws IOException;

  void write(long position) throws IOException;

  class InRam implements AppliedPositionStore {
    private volatile long position;

    @Override
    public long read() {
      return position;
    }

    @Override
    public void write(long position) {
      this.position = position;
    }
  }
}
