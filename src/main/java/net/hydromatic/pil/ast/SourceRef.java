/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.pil.ast;

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/** Position of a statement in a PIL source file. */
public class SourceRef {
  public static final SourceRef ZERO = new SourceRef("", 0);

  public final String file;
  public final int line;

  /** Creates a SourceRef. */
  public SourceRef(String file, int line) {
    this.file = requireNonNull(file);
    this.line = line;
  }

  /** Creates a SourceRef with no file name. */
  public static SourceRef of(int line) {
    return new SourceRef("", line);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, line);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof SourceRef
            && this.file.equals(((SourceRef) o).file)
            && this.line == ((SourceRef) o).line;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(file).append(file.isEmpty() ? "" : ":").append(line);
  }
}

// End SourceRef.java
