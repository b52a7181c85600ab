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

package vexdb.codec;

import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;

public class ProtostuffCodecTest {
  private final ProtostuffCodec<Envelope> codec = new ProtostuffCodec<>(Envelope.class);

  @Test
  public void preservesTheConcreteTypeOfAnAbstractlyDeclaredField() throws Exception {
    Envelope decoded = codec.decode(codec.encode(new Envelope(new Square(3))));

    assertThat(decoded.shape, is(instanceOf(Square.class)));
    assertThat(((Square) decoded.shape).side, is(equalTo(3)));
  }

  @Test
  public void readsBackSeveralDelimitedMessagesFromOneStream() throws Exception {
    ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
    codec.writeDelimited(outputStream, new Envelope(new Square(1)));
    codec.writeDelimited(outputStream, new Envelope(new Circle(Arrays.asList(4L, 5L))));

    ByteArrayInputStream inputStream = new ByteArrayInputStream(outputStream.toByteArray());

    assertThat(codec.readDelimited(inputStream).shape, is(instanceOf(Square.class)));
    assertThat(((Circle) codec.readDelimited(inputStream).shape).radii, is(equalTo(Arrays.asList(4L, 5L))));
  }

  @Test(expected = EOFException.class)
  public void throwsEofWhenReadingPastTheLastDelimitedMessage() throws Exception {
    codec.readDelimited(new ByteArrayInputStream(new byte[0]));
  }

  static final class Envelope {
    final Shape shape;

    Envelope(Shape shape) {
      this.shape = shape;
    }
  }

  abstract static class Shape {
  }

  static final class Square extends Shape {
    final int side;

    Square(int side) {
      this.side = side;
    }
  }

  static final class Circle extends Shape {
    final List<Long> radii;

    Circle(List<Long> radii) {
      this.radii = radii;
    }
  }
}
