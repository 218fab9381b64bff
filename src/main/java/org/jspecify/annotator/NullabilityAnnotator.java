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

import com.google.common.collect.ImmutableList;
import com.sun.source.tree.Tree;
import com.sun.source.util.Trees;
import java.util.Optional;
import javax.lang.model.element.Element;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.util.Elements;
import org.jspecify.annotations.Nullable;

/**
 * Infers whether methods may return null, from the {@code return} statements of their bodies.
 *
 * <p>An instance covers one set of attributed source trees, typically the compilation units of a
 * {@link com.sun.source.util.JavacTask} after {@code analyze()}. Only bodies inside those trees are
 * ever inspected:
 *
 * <pre>{@code
 * JavacTask task = (JavacTask) compiler.getTask(...);
 * Iterable<? extends CompilationUnitTree> units = task.parse();
 * task.analyze();
 * NullabilityAnnotator annotator =
 *     NullabilityAnnotator.create(Trees.instance(task), task.getElements(), units);
 * for (InferenceResult result : annotator.inferAll()) {
 *   ...
 * }
 * }</pre>
 *
 * <p>The verdict for a method is the weakest verdict among the values it returns. A method with a
 * body is judged by that body alone. An abstract or interface method is judged by the bodies of
 * all the methods in the trees that implement it, and those implementations are reported as {@link
 * InferenceResult.Outcome#NOT_CANONICAL}.
 */
public final class NullabilityAnnotator {
  private final ImmutableList<Tree> roots;
  private final DeclarationIndex index;
  private final DeclaredNullness declaredNullness;
  private final ReturnValueClassifier classifier;
  private final RedeclarationAggregator aggregator;

  private NullabilityAnnotator(
      ImmutableList<Tree> roots, DeclarationIndex index, DeclaredNullness declaredNullness) {
    this.roots = roots;
    this.index = index;
    this.declaredNullness = declaredNullness;
    this.classifier = new ReturnValueClassifier(declaredNullness);
    this.aggregator = new RedeclarationAggregator(index, new ExitPointCollector());
  }

  /**
   * Creates an annotator over {@code roots}, which may be compilation units or class trees. They
   * must already have been attributed.
   */
  public static NullabilityAnnotator create(
      Trees trees, Elements elements, Iterable<? extends Tree> roots) {
    ImmutableList<Tree> rootList = ImmutableList.copyOf(roots);
    return new NullabilityAnnotator(
        rootList, DeclarationIndex.of(elements, rootList), new DeclaredNullness(trees));
  }

  /** Infers nullness for every declaration under the roots, in source order. */
  public ImmutableList<InferenceResult> inferAll() {
    ImmutableList.Builder<InferenceResult> results = ImmutableList.builder();
    for (MatchedDeclaration declaration : DeclarationMatcher.match(roots)) {
      results.add(infer(declaration));
    }
    return results.build();
  }

  /**
   * Infers nullness for {@code element}. Anything other than a method or field, including null,
   * gives a {@link InferenceResult.Outcome#MALFORMED} result.
   */
  public InferenceResult infer(@Nullable Element element) {
    MatchedDeclaration declaration = MatchedDeclaration.forElement(element);
    if (declaration == null) {
      return InferenceResult.malformed(element == null ? null : element.toString());
    }
    return infer(declaration);
  }

  /**
   * Infers nullness for {@code declaration}. A null declaration, or one matched under a category
   * that does not fit its element, gives a {@link InferenceResult.Outcome#MALFORMED} result rather
   * than an exception, so that one bad match cannot stop the analysis of the others.
   */
  public InferenceResult infer(@Nullable MatchedDeclaration declaration) {
    if (declaration == null) {
      return InferenceResult.malformed(null);
    }
    Element element = declaration.element();
    String name = index.util().qualifiedName(element);
    if (MatchedDeclaration.kindOf(element) != declaration.kind()) {
      return InferenceResult.malformed(name);
    }
    switch (declaration.kind()) {
      case METHOD:
      case FUNCTION:
        return inferReturn(declaration.kind(), (ExecutableElement) element, name);
      case PROPERTY:
      case GLOBAL_VARIABLE:
        return InferenceResult.withoutVerdict(
            declaration.kind(), name, InferenceResult.Outcome.NOT_ANALYZED, 0);
    }
    throw new AssertionError(declaration.kind());
  }

  private InferenceResult inferReturn(
      MatchedDeclaration.Kind kind, ExecutableElement method, String name) {
    RedeclarationAggregator.Collected collected = aggregator.exitPointsFor(method);
    if (!collected.canonical) {
      return InferenceResult.withoutVerdict(kind, name, InferenceResult.Outcome.NOT_CANONICAL, 0);
    }
    if (collected.bodiesInspected == 0) {
      return InferenceResult.withoutVerdict(kind, name, InferenceResult.Outcome.NO_EVIDENCE, 0);
    }
    Optional<Nullability> merged = VerdictMerger.merge(collected.exitPoints, classifier);
    if (!merged.isPresent()) {
      return InferenceResult.withoutVerdict(
          kind, name, InferenceResult.Outcome.NO_RETURN_STATEMENTS, collected.bodiesInspected);
    }
    int withValue = 0;
    for (ExitPoint exitPoint : collected.exitPoints) {
      if (exitPoint.hasValue()) {
        withValue++;
      }
    }
    return InferenceResult.inferred(
        kind,
        name,
        merged.get(),
        collected.exitPoints.size(),
        withValue,
        collected.bodiesInspected);
  }

  /**
   * Returns the inferred nullness of {@code parameter}.
   *
   * <p>Parameters are not inferred yet, so this is always empty. Callers must treat that as "no
   * verdict", never as {@link Nullability#UNSPECIFIED}.
   */
  public Optional<Nullability> parameterNullability(VariableElement parameter) {
    checkNotNull(parameter);
    return Optional.empty();
  }

  /** Returns true if {@code method}'s return type already carries a nullness annotation. */
  boolean isAnnotated(ExecutableElement method) {
    return declaredNullness.isAnnotated(method);
  }
}
