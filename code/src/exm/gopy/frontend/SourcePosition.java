/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.gopy.frontend;

/**
 * Simple immutable class to record a position in the source text.
 * Line and column are 1-based, offset is 0-based.
 */
public class SourcePosition {
  public final int offset;
  public final int line;
  public final int column;

  public SourcePosition(int offset, int line, int column) {
    super();
    this.offset = offset;
    this.line = line;
    this.column = column;
  }

  public int getOffset() {
    return offset;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + offset;
    result = prime * result + line;
    result = prime * result + column;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof SourcePosition))
      return false;
    SourcePosition other = (SourcePosition) obj;
    return offset == other.offset && line == other.line &&
           column == other.column;
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
