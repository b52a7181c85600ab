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

package vexdb.cluster.consensus;

import com.google.common.util.concurrent.ListenableFuture;
import vexdb.cluster.command.ClusterCommand;

/**
 * Something that can get a command into the cluster consensus log.
 */
public interface CommandProposer {
  /**
   * @return a future of the index the command committed at, set once the local topology includes it.
   */
  ListenableFuture<Long> propose(ClusterCommand command);
}
