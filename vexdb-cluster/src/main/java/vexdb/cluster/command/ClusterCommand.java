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

package vexdb.cluster.command;

import vexdb.cluster.topology.Topology;
import vexdb.interfaces.TopologyRejectedException;

/**
 * A metadata mutation carried by a cluster consensus log entry. Applying a command must depend
 * only on the command and the topology it is applied to, because every node applies it on its own.
 * <p>
 * Subclasses are plain serializable holders; their fields are not final so that the runtime
 * schema can populate them.
 */
public abstract class ClusterCommand {

  /**
   * Apply this command to the topology under construction.
   *
   * @throws TopologyRejectedException if the command is invalid for that topology, in which
   *                                   case the builder has not been changed.
   */
  public abstract void applyTo(Topology.Builder topology) throws TopologyRejectedException;
}
