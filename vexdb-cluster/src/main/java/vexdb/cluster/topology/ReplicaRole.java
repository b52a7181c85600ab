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

package vexdb.cluster.topology;

/**
 * The committed state of one replica of a shard.
 */
public enum ReplicaRole {
  /**
   * Up to date; takes part in every write.
   */
  ACTIVE,
  /**
   * Being filled by a shard transfer; receives writes but is not yet required to acknowledge them.
   */
  INITIALIZING,
  /**
   * Failed a write; the shard's primary is trying to bring it back.
   */
  DEAD
}
