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

/**
 * The nullness of a value, as inferred for a declaration or as written on it.
 *
 * <p>Constants are declared from strongest to weakest. Combining two verdicts always yields the
 * weaker one, so a verdict can only ever move toward {@link #NULLABLE}.
 */
public enum Nullability {
  /** The value is always present. */
  NON_NULL("@NonNull"),
  /** There is not enough information to say either way. */
  UNSPECIFIED("@NullnessUnspecified"),
  /** The value may be absent. */
  NULLABLE("@Nullable"),
  ;

  private final String annotation;

  Nullability(String annotation) {
    this.annotation = annotation;
  }

  /** Returns the JSpecify annotation that expresses this nullness, such as {@code @Nullable}. */
  public String annotation() {
    return annotation;
  }

  /** Returns true if {@code this} is strictly weaker than {@code other}. */
  public boolean isWeakerThan(Nullability other) {
    return compareTo(other) > 0;
  }

  /** Returns the weaker of the two verdicts. */
  public static Nullability weakest(Nullability a, Nullability b) {
    return b.isWeakerThan(a) ? b : a;
  }
}
