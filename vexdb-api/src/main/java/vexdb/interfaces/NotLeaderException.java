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

package vexdb.interfaces;

/**
 * A proposal reached a node that is not the consensus leader.
 */
public class NotLeaderException extends ClusterException {
  private final long leaderHint;

  /**
   * @param leaderHint id of the leader this node knows of, or zero if it knows of none.
   */
  public NotLeaderException(long nodeId, long leaderHint) {
    super("node " + nodeId + " is not the leader; leader hint " + leaderHint);
    this.leaderHint = leaderHint;
  }

  public long getLeaderHint() {
    return leaderHint;
  }

  public boolean hasLeaderHint() {
    return leaderHint != 0;
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
