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

package vexdb.interfaces.replication;

/**
 * A requested log entry has been discarded by log compaction; its effect is only available
 * through the snapshot that replaced it.
 */
public class EntryCompactedException extends Exception {
  public EntryCompactedException(long index, long baseIndex) {
    super("entry " + index + " has been compacted into the snapshot at " + baseIndex);
  }
}
