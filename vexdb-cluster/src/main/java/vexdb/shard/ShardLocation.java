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

package vexdb.shard;

import com.google.common.collect.ImmutableList;
import vexdb.interfaces.shard.HashRange;

import java.util.List;

/**
 * Where to read a key: its shard and the peers holding an active replica of it, primary first.
 */
public final class ShardLocation {
  public final String collection;
  public final long shardId;
  public final HashRange range;
  public final long primary;
  public final ImmutableList<Long> activePeers;

  public ShardLocation(String collection, long shardId, HashRange range, long primary, List<Long> activePeers) {
    this.collection = collection;
    this.shardId = shardId;
    this.range = range;
    this.primary = primary;
    this.activePeers = ImmutableList.copyOf(activePeers);
  }

  @Override
  public String toString() {
    return "ShardLocation{" +
        "collection='" + collection + '\'' +
        ", shardId=" + shardId +
        ", range=" + range +
        ", primary=" + primary +
        ", activePeers=" + activePeers +
        '}';
  }
}
