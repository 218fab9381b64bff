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

import static com.google.common.collect.Iterables.getOnlyElement;
import static com.google.common.truth.Truth.assertThat;
import static java.util.stream.Collectors.toList;
import static javax.lang.model.util.ElementFilter.constructorsIn;
import static org.jspecify.annotator.InferenceResult.Outcome.INFERRED;
import static org.jspecify.annotator.InferenceResult.Outcome.MALFORMED;
import static org.jspecify.annotator.InferenceResult.Outcome.NOT_ANALYZED;
import static org.jspecify.annotator.InferenceResult.Outcome.NOT_CANONICAL;
import static org.jspecify.annotator.InferenceResult.Outcome.NO_EVIDENCE;
import static org.jspecify.annotator.InferenceResult.Outcome.NO_RETURN_STATEMENTS;
import static org.jspecify.annotator.MatchedDeclaration.Kind.FUNCTION;
import static org.jspecify.annotator.MatchedDeclaration.Kind.GLOBAL_VARIABLE;
import static org.jspecify.annotator.MatchedDeclaration.Kind.METHOD;
import static org.jspecify.annotator.MatchedDeclaration.Kind.PROPERTY;
import static org.jspecify.annotator.Nullability.NON_NULL;
import static org.jspecify.annotator.Nullability.NULLABLE;
import static org.jspecify.annotator.Nullability.UNSPECIFIED;

import javax.lang.model.element.Element;
import javax.lang.model.element.ExecutableElement;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class NullabilityAnnotatorTest {
  private static final Compilation COMPILATION =
      Compilation.compile(
          "package com.example;",
          "class Outer {",
          "  static final String CONSTANT = \"\";",
          "  String property;",
          "  Outer() {}",
          "  Object method(@NonNull Object p) { return null; }",
          "  static Object function() { return \"f\"; }",
          "  void procedure() {}",
          "  void bare(boolean b) {",
          "    if (b) {",
          "      return;",
          "    }",
          "  }",
          "  Object loops() {",
          "    while (true) {}",
          "  }",
          "  Object mixed(@NonNull Object p, boolean b) {",
          "    if (b) {",
          "      return p;",
          "    }",
          "    return property;",
          "  }",
          "  Object anonymous() {",
          "    return new Object() {",
          "      @Override",
          "      public String toString() { return null; }",
          "    };",
          "  }",
          "  static class Inner {",
          "    Object self() { return this; }",
          "  }",
          "  interface Contract {",
          "    Object get();",
          "  }",
          "  static class Implementation implements Contract {",
          "    public Object get() { return \"yes\"; }",
          "  }",
          "  static class Another implements Contract {",
          "    public Object get() { return \"also\"; }",
          "  }",
          "  interface Unimplemented {",
          "    Object get();",
          "  }",
          "}");

  private static final NullabilityAnnotator ANNOTATOR = COMPILATION.annotator();

  private static InferenceResult infer(String type, String method) {
    return ANNOTATOR.infer(COMPILATION.method("com.example." + type, method));
  }

  @Test
  public void inferred() {
    InferenceResult result = infer("Outer", "method");
    assertThat(result.kind()).isEqualTo(METHOD);
    assertThat(result.qualifiedName()).isEqualTo("com.example.Outer.method");
    assertThat(result.outcome()).isEqualTo(INFERRED);
    assertThat(result.nullability()).hasValue(NULLABLE);
    assertThat(result.exitPointCount()).isEqualTo(1);
    assertThat(result.valueExitPointCount()).isEqualTo(1);
    assertThat(result.bodiesInspected()).isEqualTo(1);
  }

  @Test
  public void inferred_function() {
    InferenceResult result = infer("Outer", "function");
    assertThat(result.kind()).isEqualTo(FUNCTION);
    assertThat(result.nullability()).hasValue(NON_NULL);
  }

  @Test
  public void inferred_weakestExitPointWins() {
    InferenceResult result = infer("Outer", "mixed");
    assertThat(result.outcome()).isEqualTo(INFERRED);
    assertThat(result.nullability()).hasValue(UNSPECIFIED);
    assertThat(result.exitPointCount()).isEqualTo(2);
  }

  @Test
  public void bareReturnsOnly() {
    InferenceResult result = infer("Outer", "bare");
    assertThat(result.outcome()).isEqualTo(INFERRED);
    assertThat(result.nullability()).hasValue(UNSPECIFIED);
    assertThat(result.exitPointCount()).isEqualTo(1);
    assertThat(result.valueExitPointCount()).isEqualTo(0);
  }

  @Test
  public void noReturnStatements() {
    for (String method : new String[] {"procedure", "loops"}) {
      InferenceResult result = infer("Outer", method);
      assertThat(result.outcome()).isEqualTo(NO_RETURN_STATEMENTS);
      assertThat(result.nullability()).isEmpty();
      assertThat(result.reportedNullability()).isEqualTo(UNSPECIFIED);
      assertThat(result.bodiesInspected()).isEqualTo(1);
    }
  }

  @Test
  public void noReturnStatements_distinctFromUnspecifiedValue() {
    assertThat(infer("Outer", "procedure")).isNotEqualTo(infer("Outer", "bare"));
    assertThat(infer("Outer", "procedure").nullability()).isEmpty();
    assertThat(infer("Outer", "bare").nullability()).hasValue(UNSPECIFIED);
  }

  @Test
  public void contract_poolsImplementations() {
    InferenceResult result = infer("Outer.Contract", "get");
    assertThat(result.qualifiedName()).isEqualTo("com.example.Outer.Contract.get");
    assertThat(result.outcome()).isEqualTo(INFERRED);
    assertThat(result.nullability()).hasValue(NON_NULL);
    assertThat(result.bodiesInspected()).isEqualTo(2);
    assertThat(result.exitPointCount()).isEqualTo(2);
  }

  @Test
  public void contract_implementationsAreNotCanonical() {
    InferenceResult result = infer("Outer.Implementation", "get");
    assertThat(result.outcome()).isEqualTo(NOT_CANONICAL);
    assertThat(result.nullability()).isEmpty();
    assertThat(result.bodiesInspected()).isEqualTo(0);
  }

  @Test
  public void noEvidence() {
    InferenceResult result = infer("Outer.Unimplemented", "get");
    assertThat(result.outcome()).isEqualTo(NO_EVIDENCE);
    assertThat(result.nullability()).isEmpty();
    assertThat(result.reportedNullability()).isEqualTo(UNSPECIFIED);
  }

  @Test
  public void noEvidence_libraryMethod() {
    InferenceResult result = ANNOTATOR.infer(COMPILATION.method("java.lang.Runnable", "run"));
    assertThat(result.outcome()).isEqualTo(NO_EVIDENCE);
    assertThat(result.qualifiedName()).isEqualTo("java.lang.Runnable.run");
  }

  @Test
  public void fieldsAreNotAnalyzed() {
    InferenceResult constant = ANNOTATOR.infer(COMPILATION.field("com.example.Outer", "CONSTANT"));
    assertThat(constant.kind()).isEqualTo(GLOBAL_VARIABLE);
    assertThat(constant.outcome()).isEqualTo(NOT_ANALYZED);
    assertThat(constant.nullability()).isEmpty();

    InferenceResult property = ANNOTATOR.infer(COMPILATION.field("com.example.Outer", "property"));
    assertThat(property.kind()).isEqualTo(PROPERTY);
    assertThat(property.outcome()).isEqualTo(NOT_ANALYZED);
  }

  @Test
  public void malformed_null() {
    for (InferenceResult result :
        new InferenceResult[] {
          ANNOTATOR.infer((Element) null), ANNOTATOR.infer((MatchedDeclaration) null)
        }) {
      assertThat(result.outcome()).isEqualTo(MALFORMED);
      assertThat(result.kind()).isNull();
      assertThat(result.nullability()).hasValue(UNSPECIFIED);
    }
  }

  @Test
  public void malformed_notAMethodOrField() {
    ExecutableElement constructor =
        getOnlyElement(
            constructorsIn(COMPILATION.type("com.example.Outer").getEnclosedElements()));
    assertThat(ANNOTATOR.infer(constructor).outcome()).isEqualTo(MALFORMED);
    assertThat(ANNOTATOR.infer(COMPILATION.type("com.example.Outer")).outcome())
        .isEqualTo(MALFORMED);
  }

  @Test
  public void malformed_wrongCategory() {
    InferenceResult result =
        ANNOTATOR.infer(
            MatchedDeclaration.of(FUNCTION, COMPILATION.method("com.example.Outer", "method")));
    assertThat(result.outcome()).isEqualTo(MALFORMED);
    assertThat(result.qualifiedName()).isEqualTo("com.example.Outer.method");
    assertThat(result.reportedNullability()).isEqualTo(UNSPECIFIED);
  }

  @Test
  public void qualifiedNames_nestedAndAnonymousClasses() {
    assertThat(infer("Outer.Inner", "self").qualifiedName())
        .isEqualTo("com.example.Outer.Inner.self");
    assertThat(
            ANNOTATOR.inferAll().stream()
                .map(InferenceResult::qualifiedName)
                .filter(name -> name.endsWith(".toString"))
                .collect(toList()))
        .containsExactly("com.example.Outer$1.toString");
  }

  @Test
  public void inferAll_sourceOrder() {
    assertThat(ANNOTATOR.inferAll().stream().map(InferenceResult::qualifiedName).collect(toList()))
        .containsExactly(
            "com.example.Outer.CONSTANT",
            "com.example.Outer.property",
            "com.example.Outer.method",
            "com.example.Outer.function",
            "com.example.Outer.procedure",
            "com.example.Outer.bare",
            "com.example.Outer.loops",
            "com.example.Outer.mixed",
            "com.example.Outer.anonymous",
            "com.example.Outer$1.toString",
            "com.example.Outer.Inner.self",
            "com.example.Outer.Contract.get",
            "com.example.Outer.Implementation.get",
            "com.example.Outer.Another.get",
            "com.example.Outer.Unimplemented.get")
        .inOrder();
  }

  @Test
  public void methodsNeverComeBackNotAnalyzedOrMalformed() {
    for (InferenceResult result : ANNOTATOR.inferAll()) {
      if (result.kind() == METHOD || result.kind() == FUNCTION) {
        assertThat(result.outcome()).isNoneOf(NOT_ANALYZED, MALFORMED);
      }
    }
  }

  @Test
  public void inferIsRepeatable() {
    assertThat(ANNOTATOR.inferAll()).isEqualTo(ANNOTATOR.inferAll());
    assertThat(infer("Outer", "mixed")).isEqualTo(infer("Outer", "mixed"));
  }

  @Test
  public void parameterNullability_notInferred() {
    ExecutableElement method = COMPILATION.method("com.example.Outer", "method");
    assertThat(ANNOTATOR.parameterNullability(method.getParameters().get(0))).isEmpty();
  }
}
