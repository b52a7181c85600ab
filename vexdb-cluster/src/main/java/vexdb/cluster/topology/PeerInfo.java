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

public final class PeerInfo {
  public final long peerId;
  public final String address;
  public final PeerRole role;

  public PeerInfo(long peerId, String address, PeerRole role) {
    this.peerId = peerId;
    this.address = address;
    this.role = role;
  }

  public PeerInfo withRole(PeerRole newRole) {
    return new PeerInfo(peerId, address, newRole);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    PeerInfo that = (PeerInfo) o;
    return peerId == that.peerId
        && address.equals(that.address)
        && role == that.role;
  }

  @Override
  public int hashCode() {
    int result = Long.hashCode(peerId);
    result = 31 * result + address.hashCode();
    result = 31 * result + role.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return "PeerInfo{" +
        "peerId=" + peerId +
        ", address='" + address + '\'' +
        ", role=" + role +
        '}';
  }
}
