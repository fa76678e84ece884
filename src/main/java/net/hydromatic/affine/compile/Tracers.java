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
package net.hydromatic.affine.compile;

import static java.util.Objects.requireNonNull;

import java.io.PrintWriter;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.affine.ast.IndexMap;
import net.hydromatic.affine.op.AccessOp;
import net.hydromatic.affine.range.Interval;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that writes a line for each event to a writer. */
  public static Tracer printTracer(PrintWriter w) {
    return new PrintTracer(w);
  }

  /**
   * Returns a tracer that performs the given action on each term that is
   * dropped, then calls the underlying tracer.
   */
  public static Tracer withOnDrop(Tracer tracer, Consumer<Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onDrop(
          AccessOp op, Term term, Interval interval, long threshold) {
        consumer.accept(term);
        super.onDrop(op, term, interval, threshold);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each term that is
   * kept, then calls the underlying tracer.
   */
  public static Tracer withOnKeep(Tracer tracer, Consumer<Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onKeep(
          AccessOp op,
          Term term,
          @Nullable Interval interval,
          long threshold) {
        consumer.accept(term);
        super.onKeep(op, term, interval, threshold);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the old and new map of
   * each rewrite, then calls the underlying tracer.
   */
  public static Tracer withOnRewrite(
      Tracer tracer, BiConsumer<IndexMap, IndexMap> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onRewrite(AccessOp op, IndexMap before, IndexMap after) {
        consumer.accept(before, after);
        super.onRewrite(op, before, after);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the message of each
   * internal inconsistency, then calls the underlying tracer.
   */
  public static Tracer withOnViolation(
      Tracer tracer, Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onViolation(AccessOp op, String message) {
        consumer.accept(message);
        super.onViolation(op, message);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onDrop(
        AccessOp op, Term term, Interval interval, long threshold) {}

    @Override
    public void onKeep(
        AccessOp op, Term term, @Nullable Interval interval, long threshold) {}

    @Override
    public void onRewrite(AccessOp op, IndexMap before, IndexMap after) {}

    @Override
    public void onViolation(AccessOp op, String message) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override
    public void onDrop(
        AccessOp op, Term term, Interval interval, long threshold) {
      tracer.onDrop(op, term, interval, threshold);
    }

    @Override
    public void onKeep(
        AccessOp op, Term term, @Nullable Interval interval, long threshold) {
      tracer.onKeep(op, term, interval, threshold);
    }

    @Override
    public void onRewrite(AccessOp op, IndexMap before, IndexMap after) {
      tracer.onRewrite(op, before, after);
    }

    @Override
    public void onViolation(AccessOp op, String message) {
      tracer.onViolation(op, message);
    }
  }

  /** Tracer that writes to a given {@link PrintWriter}. */
  private static class PrintTracer implements Tracer {
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    @Override
    public void onDrop(
        AccessOp op, Term term, Interval interval, long threshold) {
      w.println("drop " + term + " " + interval + " < " + threshold);
      w.flush();
    }

    @Override
    public void onKeep(
        AccessOp op, Term term, @Nullable Interval interval, long threshold) {
      w.println(
          "keep " + term + " " + (interval == null ? "unknown" : interval)
              + " vs " + threshold);
      w.flush();
    }

    @Override
    public void onRewrite(AccessOp op, IndexMap before, IndexMap after) {
      w.println("rewrite " + before + " => " + after);
      w.flush();
    }

    @Override
    public void onViolation(AccessOp op, String message) {
      w.println("violation " + message);
      w.flush();
    }
  }
}

// End Tracers.java
