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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.Modifier;
import org.jspecify.annotations.Nullable;

/** A declaration that nullness can be inferred for, tagged with the category it was matched as. */
public final class MatchedDeclaration {
  /** The four categories of declaration that are matched. */
  public enum Kind {
    /** An instance method. */
    METHOD,
    /** A static method. */
    FUNCTION,
    /** An instance field. */
    PROPERTY,
    /** A static field. */
    GLOBAL_VARIABLE,
  }

  private final Kind kind;
  private final Element element;

  private MatchedDeclaration(Kind kind, Element element) {
    this.kind = checkNotNull(kind);
    this.element = checkNotNull(element);
  }

  /**
   * Tags {@code element} with {@code kind} as given. A tag that does not fit the element makes the
   * declaration malformed, and inference on it reports {@link InferenceResult.Outcome#MALFORMED}.
   */
  public static MatchedDeclaration of(Kind kind, Element element) {
    return new MatchedDeclaration(kind, element);
  }

  /**
   * Returns {@code element} tagged with its category, or null if it is not a method or a field
   * (constructors, enum constants, locals and parameters are never matched).
   */
  public static @Nullable MatchedDeclaration forElement(@Nullable Element element) {
    Kind kind = kindOf(element);
    return kind == null ? null : new MatchedDeclaration(kind, element);
  }

  static @Nullable Kind kindOf(@Nullable Element element) {
    if (element == null) {
      return null;
    }
    boolean isStatic = element.getModifiers().contains(Modifier.STATIC);
    if (element.getKind() == ElementKind.METHOD) {
      return isStatic ? Kind.FUNCTION : Kind.METHOD;
    }
    if (element.getKind() == ElementKind.FIELD) {
      return isStatic ? Kind.GLOBAL_VARIABLE : Kind.PROPERTY;
    }
    return null;
  }

  public Kind kind() {
    return kind;
  }

  public Element element() {
    return element;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof MatchedDeclaration)) {
      return false;
    }
    MatchedDeclaration that = (MatchedDeclaration) o;
    return kind == that.kind && element.equals(that.element);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, element);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("kind", kind).add("element", element).toString();
  }
}
