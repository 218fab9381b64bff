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

import static org.checkerframework.javacutil.TreeUtils.elementFromDeclaration;

import com.sun.source.tree.MethodTree;
import com.sun.source.tree.Tree;
import com.sun.source.tree.VariableTree;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.type.TypeKind;
import javax.lang.model.util.Elements;
import org.checkerframework.framework.source.SourceVisitor;
import org.checkerframework.javacutil.BugInCF;

final class NullabilityAnnotatorVisitor extends SourceVisitor<Void, Void> {
  private final NullabilityAnnotatorChecker annotatorChecker;
  private final boolean onlyUnannotated;
  private final boolean verbose;

  NullabilityAnnotatorVisitor(NullabilityAnnotatorChecker checker) {
    super(checker);
    this.annotatorChecker = checker;
    this.onlyUnannotated = checker.hasOption("onlyUnannotated");
    this.verbose = checker.hasOption("verboseInference");
  }

  @Override
  public Void visitMethod(MethodTree tree, Void p) {
    ExecutableElement method = elementFromDeclaration(tree);
    if (method.getKind() == ElementKind.METHOD
        && annotatorChecker.getElementUtils().getOrigin(method) == Elements.Origin.EXPLICIT) {
      report(tree, method);
    }
    return super.visitMethod(tree, p);
  }

  @Override
  public Void visitVariable(VariableTree tree, Void p) {
    VariableElement variable = elementFromDeclaration(tree);
    if (variable.getKind() == ElementKind.FIELD && verbose) {
      InferenceResult result = annotatorChecker.annotator().infer(variable);
      note(result, "fields are not analyzed");
    }
    return super.visitVariable(tree, p);
  }

  private void report(Tree tree, ExecutableElement method) {
    NullabilityAnnotator annotator = annotatorChecker.annotator();
    InferenceResult result = annotator.infer(method);
    TypeKind returnKind = method.getReturnType().getKind();
    if (returnKind == TypeKind.VOID || returnKind.isPrimitive()) {
      note(result, "nothing to annotate on a " + returnKind + " return type");
      return;
    }
    if (onlyUnannotated && annotator.isAnnotated(method)) {
      note(result, "return type is already annotated");
      return;
    }
    String name = result.qualifiedName();
    switch (result.outcome()) {
      case INFERRED:
        Nullability verdict = result.reportedNullability();
        annotatorChecker.reportWarning(tree, messageKey(verdict), name, verdict.annotation());
        break;
      case NO_RETURN_STATEMENTS:
        annotatorChecker.reportWarning(tree, "return.none", name, result.bodiesInspected());
        break;
      case NO_EVIDENCE:
        annotatorChecker.reportWarning(tree, "return.noevidence", name);
        break;
      case NOT_CANONICAL:
        note(result, "analyzed as part of the abstract method it implements");
        break;
      case NOT_ANALYZED:
      case MALFORMED:
        // Only fields give NOT_ANALYZED, and a method always matches as a method.
        throw new BugInCF("unexpected outcome for method " + name + ": " + result.outcome());
    }
  }

  private static String messageKey(Nullability verdict) {
    switch (verdict) {
      case NON_NULL:
        return "return.nonnull";
      case NULLABLE:
        return "return.nullable";
      case UNSPECIFIED:
        return "return.unspecified";
    }
    throw new AssertionError(verdict);
  }

  private void note(InferenceResult result, String reason) {
    if (verbose) {
      annotatorChecker.note(
          "No nullness reported for " + result.qualifiedName() + " (" + result.outcome() + "): "
              + reason);
    }
  }
}
