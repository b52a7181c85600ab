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

import vexdb.interfaces.shard.Operation;

import java.util.ArrayList;
import java.util.List;

/**
 * OperationLog kept in memory, for tests and for nodes without a data directory.
 */
public class InRamOperationLog implements OperationLog {
  private final List<Operation> operations = new ArrayList<>();

  @Override
  public void append(Operation operation) {
    if (operation.getOperationId() <= lastOperationId()) {
      throw new IllegalArgumentException("operation " + operation.getOperationId()
          + " does not follow " + lastOperationId());
    }
    operations.add(operation);
  }

  @Override
  public List<Operation> getRange(long afterId, long throughId) {
    final List<Operation> range = new ArrayList<>();
    if (throughId <= afterId) {
      return range;
    }
    if (operations.isEmpty() || afterId + 1 < firstOperationId() || throughId > lastOperationId()) {
      return null;
    }

    for (Operation operation : operations) {
      if (operation.getOperationId() > afterId && operation.getOperationId() <= throughId) {
        range.add(operation);
      }
    }
    return range;
  }

  @Override
  public long firstOperationId() {
    return operations.isEmpty() ? 0 : operations.get(0).getOperationId();
  }

  @Override
  public long lastOperationId() {
    return operations.isEmpty() ? 0 : operations.get(operations.size() - 1).getOperationId();
  }

  @Override
  public void retainLast(int count) {
    if (operations.size() > count) {
      operations.subList(0, operations.size() - count).clear();
    }
  }

  @Override
  public void truncateFrom(long operationId) {
    operations.removeIf((operation) -> operation.getOperationId() >= operationId);
  }

  @Override
  public void clear() {
    operations.clear();
  }

  @Override
  public void close() {
  }
}
