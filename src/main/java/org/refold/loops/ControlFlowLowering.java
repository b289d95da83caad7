/*
 * Copyright 2025 The Refold Authors
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
 * limitations under the License.
 */

package org.refold.loops;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;
import org.refold.target.TargetExpr;
import org.refold.target.TargetExpr.Atom;
import org.refold.target.TargetExpr.Match;
import org.refold.target.TargetExpr.Throw;
import org.refold.target.TargetExpr.Try;
import org.refold.target.TargetExpr.TupleLit;
import org.refold.target.TargetExpr.Var;

/**
 * Lowers {@code break}, {@code continue} and {@code return} into thrown values, and wraps fold
 * bodies with the handlers that turn those values back into the fold's continue/halt protocol.
 *
 * <p>Each loop being emitted pushes a {@link Frame}; nested function literals push a boundary, so
 * that an exit inside a closure is never attributed to a loop outside it.
 */
final class ControlFlowLowering {

  private static final Atom BREAK = new Atom("break");
  private static final Atom CONTINUE = new Atom("continue");
  private static final Atom RETURN = new Atom("return");
  private static final Atom CONT = new Atom("cont");
  private static final Atom HALT = new Atom("halt");

  private static final Var BREAK_STATE = new Var("break_state");
  private static final Var CONTINUE_STATE = new Var("continue_state");
  private static final Var RETURN_VALUE = new Var("return_value");

  /** The exit-handling state of one loop whose body is being compiled. */
  static final class Frame {
    /** The loop state as an expression (and pattern), or null if the loop threads no state. */
    final @Nullable TargetExpr state;

    /** True if the fold is a {@code reduce_while}, whose function returns {@code {:cont, s}}. */
    final boolean haltable;

    /** True if exits throw a tuple carrying the current state rather than a bare atom. */
    final boolean carrying;

    /** True if the handlers also accept the bare {@code :break} and {@code :continue} atoms. */
    final boolean acceptsBare;

    /**
     * For a {@code do ... while} loop, the loop condition; a {@code continue} must evaluate it
     * before deciding whether to go on.
     */
    final @Nullable TargetExpr doWhileCond;

    final boolean isFunctionBoundary;

    private boolean breakUsed;
    private boolean continueUsed;

    private Frame(
        @Nullable TargetExpr state,
        boolean haltable,
        boolean carrying,
        boolean acceptsBare,
        @Nullable TargetExpr doWhileCond,
        boolean isFunctionBoundary) {
      this.state = state;
      this.haltable = haltable;
      this.carrying = carrying;
      this.acceptsBare = acceptsBare;
      this.doWhileCond = doWhileCond;
      this.isFunctionBoundary = isFunctionBoundary;
    }

    /** The value passed to and returned from the fold function. */
    TargetExpr stateValue() {
      return (state == null) ? TargetExpr.OK : state;
    }
  }

  private final EngineConfig config;
  private final Deque<Frame> frames = new ArrayDeque<>();

  ControlFlowLowering(EngineConfig config) {
    this.config = config;
  }

  /**
   * Starts compiling the body of a loop. {@code state} is the pattern of the threaded variables
   * (null if none); {@code haltable} is true if the loop can stop early.
   */
  Frame pushLoop(@Nullable TargetExpr state, boolean haltable, @Nullable TargetExpr doWhileCond) {
    // A loop with state always carries it, so a break keeps the updates made before it.
    boolean carrying = state != null;
    boolean acceptsBare = !carrying || !config.stateCarryingSignals;
    Frame frame = new Frame(state, haltable, carrying, acceptsBare, doWhileCond, false);
    frames.push(frame);
    return frame;
  }

  void popLoop(Frame frame) {
    Preconditions.checkState(frames.peek() == frame, "Unbalanced loop frames");
    frames.pop();
  }

  void enterFunction() {
    frames.push(new Frame(null, false, false, false, null, true));
  }

  void exitFunction() {
    Preconditions.checkState(
        !frames.isEmpty() && frames.peek().isFunctionBoundary, "Unbalanced function frames");
    frames.pop();
  }

  /** Returns true if a {@code break} or {@code continue} here would exit a loop being emitted. */
  boolean inLoop() {
    return !frames.isEmpty() && !frames.peek().isFunctionBoundary;
  }

  private Frame currentLoop() {
    Preconditions.checkState(inLoop(), "break or continue outside a loop");
    return frames.peek();
  }

  TargetExpr lowerBreak() {
    Frame frame = currentLoop();
    frame.breakUsed = true;
    return new Throw(frame.carrying ? TupleLit.of(BREAK, frame.state) : BREAK);
  }

  TargetExpr lowerContinue() {
    Frame frame = currentLoop();
    frame.continueUsed = true;
    return new Throw(frame.carrying ? TupleLit.of(CONTINUE, frame.state) : CONTINUE);
  }

  /** Returns a throw that exits the enclosing function with {@code value}. */
  TargetExpr lowerReturn(@Nullable TargetExpr value) {
    return new Throw(TupleLit.of(RETURN, (value == null) ? TargetExpr.NIL : value));
  }

  /** Wraps a function body that may throw a return value so that it produces the value instead. */
  static TargetExpr catchReturn(TargetExpr body) {
    return new Try(
        body,
        ImmutableList.of(
            new Try.CatchClause("throw", TupleLit.of(RETURN, RETURN_VALUE), RETURN_VALUE)));
  }

  /**
   * Wraps the compiled body of a loop in the handlers for whichever exits it used; returns {@code
   * body} unchanged if it used none.
   */
  TargetExpr wrap(Frame frame, TargetExpr body) {
    if (!frame.breakUsed && !frame.continueUsed) {
      return body;
    }
    ImmutableList.Builder<Try.CatchClause> catches = ImmutableList.builder();
    TargetExpr current = frame.stateValue();
    if (frame.breakUsed) {
      Preconditions.checkState(frame.haltable, "break in a loop that cannot halt");
      if (frame.carrying) {
        catches.add(
            new Try.CatchClause(
                "throw", TupleLit.of(BREAK, BREAK_STATE), TupleLit.of(HALT, BREAK_STATE)));
      }
      if (frame.acceptsBare) {
        catches.add(new Try.CatchClause("throw", BREAK, TupleLit.of(HALT, current)));
      }
    }
    if (frame.continueUsed) {
      if (frame.carrying) {
        catches.add(
            new Try.CatchClause(
                "throw",
                TupleLit.of(CONTINUE, CONTINUE_STATE),
                resume(frame, new Match(frame.state, CONTINUE_STATE))));
      }
      if (frame.acceptsBare) {
        catches.add(new Try.CatchClause("throw", CONTINUE, resume(frame, null)));
      }
    }
    return new Try(body, catches.build());
  }

  /**
   * Returns the handler for a {@code continue}: {@code rebind} (if any) restores the state it
   * carried, then the fold goes on with the next element.
   */
  private static TargetExpr resume(Frame frame, @Nullable Match rebind) {
    TargetExpr current = frame.stateValue();
    TargetExpr next;
    if (frame.doWhileCond != null) {
      next = new TargetExpr.If(frame.doWhileCond, cont(current), halt(current));
    } else if (rebind != null) {
      return frame.haltable ? TupleLit.of(CONT, rebind.value) : rebind.value;
    } else {
      next = frame.haltable ? cont(current) : current;
    }
    return (rebind == null) ? next : new TargetExpr.Block(ImmutableList.of(rebind, next));
  }

  static TargetExpr cont(TargetExpr state) {
    return TupleLit.of(CONT, state);
  }

  static TargetExpr halt(TargetExpr state) {
    return TupleLit.of(HALT, state);
  }
}
