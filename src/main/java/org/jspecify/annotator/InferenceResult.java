// Copyright 2026 The JSpecify Authors
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.jspecify.annotator;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * What was inferred for one declaration. Results hold only names and counts, never trees, so they
 * remain valid after compilation has finished.
 */
public final class InferenceResult {
  /** How the verdict, if any, was reached. */
  public enum Outcome {
    /** At least one exit point was classified. */
    INFERRED,
    /** Bodies were inspected, but none contains a {@code return} statement. */
    NO_RETURN_STATEMENTS,
    /** No body was available: an abstract method nobody in the index implements, say. */
    NO_EVIDENCE,
    /** The declaration overrides an abstract method and is analyzed as part of that method. */
    NOT_CANONICAL,
    /** A field. Fields are matched but their values are not analyzed. */
    NOT_ANALYZED,
    /** There was no declaration to analyze, or it was not in the category it was matched as. */
    MALFORMED,
  }

  static final String NO_NAME = "<none>";

  private final MatchedDeclaration.@Nullable Kind kind;
  private final String qualifiedName;
  private final Outcome outcome;
  private final Optional<Nullability> nullability;
  private final int exitPointCount;
  private final int valueExitPointCount;
  private final int bodiesInspected;

  private InferenceResult(
      MatchedDeclaration.@Nullable Kind kind,
      String qualifiedName,
      Outcome outcome,
      Optional<Nullability> nullability,
      int exitPointCount,
      int valueExitPointCount,
      int bodiesInspected) {
    this.kind = kind;
    this.qualifiedName = checkNotNull(qualifiedName);
    this.outcome = checkNotNull(outcome);
    this.nullability = checkNotNull(nullability);
    this.exitPointCount = exitPointCount;
    this.valueExitPointCount = valueExitPointCount;
    this.bodiesInspected = bodiesInspected;
  }

  static InferenceResult inferred(
      MatchedDeclaration.Kind kind,
      String qualifiedName,
      Nullability nullability,
      int exitPointCount,
      int valueExitPointCount,
      int bodiesInspected) {
    checkArgument(exitPointCount > 0, "no exit points for %s", qualifiedName);
    return new InferenceResult(
        kind,
        qualifiedName,
        Outcome.INFERRED,
        Optional.of(nullability),
        exitPointCount,
        valueExitPointCount,
        bodiesInspected);
  }

  static InferenceResult withoutVerdict(
      MatchedDeclaration.Kind kind, String qualifiedName, Outcome outcome, int bodiesInspected) {
    checkArgument(
        outcome != Outcome.INFERRED && outcome != Outcome.MALFORMED,
        "%s needs a verdict",
        outcome);
    return new InferenceResult(
        kind, qualifiedName, outcome, Optional.empty(), 0, 0, bodiesInspected);
  }

  static InferenceResult malformed(@Nullable String qualifiedName) {
    return new InferenceResult(
        null,
        qualifiedName == null ? NO_NAME : qualifiedName,
        Outcome.MALFORMED,
        Optional.of(Nullability.UNSPECIFIED),
        0,
        0,
        0);
  }

  /** Returns the category the declaration was matched as, or null if it was malformed. */
  public MatchedDeclaration.@Nullable Kind kind() {
    return kind;
  }

  /** Returns the name of the declaration, such as {@code com.example.Outer.Inner.method}. */
  public String qualifiedName() {
    return qualifiedName;
  }

  public Outcome outcome() {
    return outcome;
  }

  /** Returns the verdict, or empty if there was no evidence to base one on. */
  public Optional<Nullability> nullability() {
    return nullability;
  }

  /** Returns the verdict to show a user: the absence of evidence reads as unspecified. */
  public Nullability reportedNullability() {
    return nullability.orElse(Nullability.UNSPECIFIED);
  }

  public int exitPointCount() {
    return exitPointCount;
  }

  /** Returns how many exit points return a value, as opposed to a bare {@code return;}. */
  public int valueExitPointCount() {
    return valueExitPointCount;
  }

  public int bodiesInspected() {
    return bodiesInspected;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof InferenceResult)) {
      return false;
    }
    InferenceResult that = (InferenceResult) o;
    return kind == that.kind
        && qualifiedName.equals(that.qualifiedName)
        && outcome == that.outcome
        && nullability.equals(that.nullability)
        && exitPointCount == that.exitPointCount
        && valueExitPointCount == that.valueExitPointCount
        && bodiesInspected == that.bodiesInspected;
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        kind,
        qualifiedName,
        outcome,
        nullability,
        exitPointCount,
        valueExitPointCount,
        bodiesInspected);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("kind", kind)
        .add("qualifiedName", qualifiedName)
        .add("outcome", outcome)
        .add("nullability", nullability.orElse(null))
        .add("exitPointCount", exitPointCount)
        .add("valueExitPointCount", valueExitPointCount)
        .add("bodiesInspected", bodiesInspected)
        .toString();
  }
}
