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
package net.hydromatic.equate.simplify;

import java.util.function.Consumer;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each accepted
   * conditional equation, then calls the underlying tracer. */
  public static Tracer withOnAccept(Tracer tracer,
      Consumer<CondEq> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onAccept(CondEq ceq) {
        consumer.accept(ceq);
        super.onAccept(ceq);
      }
    };
  }

  /** Returns a tracer that performs the given action on each rejected
   * candidate, then calls the underlying tracer. */
  public static Tracer withOnReject(Tracer tracer,
      Consumer<CondEq> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onReject(CondEq ceq) {
        consumer.accept(ceq);
        super.onReject(ceq);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onAccept(CondEq ceq) {}

    @Override
    public void onReject(CondEq ceq) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onAccept(CondEq ceq) {
      tracer.onAccept(ceq);
    }

    @Override
    public void onReject(CondEq ceq) {
      tracer.onReject(ceq);
    }
  }
}

// End Tracers.java
