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
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Settings that control how aggressively loops are reconstructed. An EngineConfig is immutable;
 * use {@link #builder} or {@link #parse} to create one.
 */
public final class EngineConfig {

  public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;
  public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

  public static final ImmutableSet<String> DEFAULT_SIDE_EFFECT_FUNCTIONS =
      ImmutableSet.of("trace", "Log.trace", "Sys.println", "Sys.print", "Std.print");

  public static final EngineConfig DEFAULT = builder().build();

  private static final Splitter SETTING_SPLITTER = Splitter.on('=').limit(2).trimResults();
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  /** Candidate shapes with a lower confidence than this are compiled with the generic fallback. */
  public final double confidenceThreshold;

  /** Loops nested more deeply than this are compiled with the generic fallback. */
  public final int maxNestingDepth;

  /**
   * If true, unrolled sequences whose values refer to variables bound outside the sequence are
   * reconstructed (with reduced confidence); if false they are left alone.
   */
  public final boolean looseUnrolledExtraction;

  /**
   * A loop that threads state always throws {@code {:break, state}} and {@code {:continue, state}}.
   * If this is false its handlers also accept the bare {@code :break} and {@code :continue} atoms,
   * resuming from the state the iteration started with. Loops without state always throw bare
   * atoms.
   */
  public final boolean stateCarryingSignals;

  /**
   * Static functions (by qualified name, e.g. {@code "Log.trace"}) whose only effect is output, so
   * a loop body that just calls them can be iterated for effect.
   */
  public final ImmutableSet<String> sideEffectFunctions;

  private EngineConfig(Builder builder) {
    this.confidenceThreshold = builder.confidenceThreshold;
    this.maxNestingDepth = builder.maxNestingDepth;
    this.looseUnrolledExtraction = builder.looseUnrolledExtraction;
    this.stateCarryingSignals = builder.stateCarryingSignals;
    this.sideEffectFunctions = builder.sideEffectFunctions;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setConfidenceThreshold(confidenceThreshold)
        .setMaxNestingDepth(maxNestingDepth)
        .setLooseUnrolledExtraction(looseUnrolledExtraction)
        .setStateCarryingSignals(stateCarryingSignals)
        .setSideEffectFunctions(sideEffectFunctions);
  }

  /**
   * Returns a config with the default settings overridden by each of the given {@code key=value}
   * strings.
   *
   * @throws IllegalArgumentException if a key is unknown or a value is malformed
   */
  public static EngineConfig parse(String... settings) {
    Builder builder = builder();
    for (String setting : settings) {
      var parts = SETTING_SPLITTER.splitToList(setting);
      Preconditions.checkArgument(parts.size() == 2, "Expected key=value, got \"%s\"", setting);
      builder.set(parts.get(0), parts.get(1));
    }
    return builder.build();
  }

  @Override
  public String toString() {
    return String.format(
        "confidenceThreshold=%s maxNestingDepth=%s looseUnrolledExtraction=%s"
            + " stateCarryingSignals=%s sideEffectFunctions=%s",
        confidenceThreshold,
        maxNestingDepth,
        looseUnrolledExtraction,
        stateCarryingSignals,
        String.join(",", sideEffectFunctions));
  }

  public static final class Builder {
    private double confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
    private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;
    private boolean looseUnrolledExtraction = true;
    private boolean stateCarryingSignals = true;
    private ImmutableSet<String> sideEffectFunctions = DEFAULT_SIDE_EFFECT_FUNCTIONS;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setConfidenceThreshold(double threshold) {
      Preconditions.checkArgument(
          threshold >= 0 && threshold <= 1, "confidenceThreshold must be in [0, 1]: %s", threshold);
      this.confidenceThreshold = threshold;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setMaxNestingDepth(int depth) {
      Preconditions.checkArgument(depth > 0, "maxNestingDepth must be positive: %s", depth);
      this.maxNestingDepth = depth;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLooseUnrolledExtraction(boolean enabled) {
      this.looseUnrolledExtraction = enabled;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setStateCarryingSignals(boolean enabled) {
      this.stateCarryingSignals = enabled;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSideEffectFunctions(Iterable<String> names) {
      this.sideEffectFunctions = ImmutableSet.copyOf(names);
      return this;
    }

    @CanIgnoreReturnValue
    Builder set(String key, String value) {
      switch (key) {
        case "confidenceThreshold" -> setConfidenceThreshold(parseDouble(key, value));
        case "maxNestingDepth" -> setMaxNestingDepth(parseInt(key, value));
        case "looseUnrolledExtraction" -> setLooseUnrolledExtraction(parseBoolean(key, value));
        case "stateCarryingSignals" -> setStateCarryingSignals(parseBoolean(key, value));
        case "sideEffectFunctions" -> setSideEffectFunctions(LIST_SPLITTER.split(value));
        default -> throw new IllegalArgumentException("Unknown setting \"" + key + "\"");
      }
      return this;
    }

    public EngineConfig build() {
      return new EngineConfig(this);
    }
  }

  private static double parseDouble(String key, String value) {
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("Bad value for %s: \"%s\"", key, value), e);
    }
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("Bad value for %s: \"%s\"", key, value), e);
    }
  }

  private static boolean parseBoolean(String key, String value) {
    return switch (value) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(
          String.format("Bad value for %s: \"%s\"", key, value));
    };
  }
}
