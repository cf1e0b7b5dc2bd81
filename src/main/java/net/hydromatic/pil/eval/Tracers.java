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
package net.hydromatic.pil.eval;

import java.io.PrintWriter;
import java.util.function.Consumer;
import java.util.function.LongConsumer;
import net.hydromatic.pil.ast.Identity;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that writes a line for each event. */
  public static Tracer printTracer(PrintWriter w) {
    return new Tracer() {
      @Override public void onIdentity(long row, Identity identity,
          EvalValue value) {
        w.println("row " + row + ": " + identity + " => " + value);
        w.flush();
      }

      @Override public void onQuery(long row, String column,
          EvalValue value) {
        w.println("row " + row + ": query " + column + " => " + value);
        w.flush();
      }

      @Override public void onPass(long row, int pass, boolean progress) {
        w.println("row " + row + ": pass " + pass
            + (progress ? "" : " (no progress)"));
        w.flush();
      }

      @Override public void onRowComplete(long row) {
        w.println("row " + row + ": complete");
        w.flush();
      }

      @Override public void onError(long row, EvalException e) {
        w.println("row " + row + ": error " + e.getMessage());
        w.flush();
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of each
   * identity, then calls the underlying tracer. */
  public static Tracer withOnIdentity(Tracer tracer,
      Consumer<EvalValue> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onIdentity(long row, Identity identity,
          EvalValue value) {
        consumer.accept(value);
        super.onIdentity(row, identity, value);
      }
    };
  }

  /** Returns a tracer that performs the given action when a row is
   * complete, then calls the underlying tracer. */
  public static Tracer withOnRowComplete(Tracer tracer,
      LongConsumer consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRowComplete(long row) {
        consumer.accept(row);
        super.onRowComplete(row);
      }
    };
  }

  public static Tracer withOnError(Tracer tracer,
      Consumer<EvalException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onError(long row, EvalException e) {
        consumer.accept(e);
        super.onError(row, e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onIdentity(long row, Identity identity,
        EvalValue value) {
    }

    @Override public void onQuery(long row, String column, EvalValue value) {
    }

    @Override public void onPass(long row, int pass, boolean progress) {
    }

    @Override public void onRowComplete(long row) {
    }

    @Override public void onError(long row, EvalException e) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onIdentity(long row, Identity identity,
        EvalValue value) {
      tracer.onIdentity(row, identity, value);
    }

    @Override public void onQuery(long row, String column, EvalValue value) {
      tracer.onQuery(row, column, value);
    }

    @Override public void onPass(long row, int pass, boolean progress) {
      tracer.onPass(row, pass, progress);
    }

    @Override public void onRowComplete(long row) {
      tracer.onRowComplete(row);
    }

    @Override public void onError(long row, EvalException e) {
      tracer.onError(row, e);
    }
  }
}

// End Tracers.java
