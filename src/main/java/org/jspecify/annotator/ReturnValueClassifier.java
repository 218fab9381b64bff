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

import static org.checkerframework.javacutil.TreeUtils.elementFromTree;

import com.sun.source.tree.ExpressionTree;
import com.sun.source.tree.IdentifierTree;
import com.sun.source.tree.LiteralTree;
import com.sun.source.tree.MemberSelectTree;
import com.sun.source.tree.ParenthesizedTree;
import com.sun.source.tree.ReturnTree;
import com.sun.source.tree.TypeCastTree;
import javax.lang.model.element.Element;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.VariableElement;
import org.checkerframework.javacutil.BugInCF;

/**
 * Decides the nullness of a single returned expression.
 *
 * <p>Only the expression itself is examined. We never follow a local variable back to its
 * initializer or a call into the callee's body: a reference or a call is exactly as null as its
 * declaration says it is, and {@link Nullability#UNSPECIFIED} if the declaration says nothing.
 */
final class ReturnValueClassifier {
  private final DeclaredNullness declaredNullness;

  ReturnValueClassifier(DeclaredNullness declaredNullness) {
    this.declaredNullness = declaredNullness;
  }

  /**
   * Classifies the value of {@code returnStatement}. A bare {@code return;} carries no evidence
   * either way and classifies as {@link Nullability#UNSPECIFIED}.
   */
  Nullability classify(ReturnTree returnStatement) {
    ExpressionTree value = returnStatement.getExpression();
    return value == null ? Nullability.UNSPECIFIED : classify(value);
  }

  Nullability classify(ExpressionTree expression) {
    ExpressionTree innermost = innermostExpression(expression);
    ExpressionCategory category = categorize(innermost);
    switch (category) {
      case NULL_CONSTANT:
        return Nullability.NULLABLE;
      case STRING_LITERAL:
      case NEW_INSTANCE:
      case RECEIVER:
        return Nullability.NON_NULL;
      case INVOCATION:
        Element callee = elementFromTree(innermost);
        if (callee instanceof ExecutableElement) {
          return declaredNullness
              .ofReturnType((ExecutableElement) callee)
              .orElse(Nullability.UNSPECIFIED);
        }
        return Nullability.UNSPECIFIED;
      case DECLARATION_REFERENCE:
        return declaredNullness
            .ofVariable((VariableElement) elementFromTree(innermost))
            .orElse(Nullability.UNSPECIFIED);
      case OTHER:
        return Nullability.UNSPECIFIED;
      default:
        throw new BugInCF("unexpected expression category " + category + " for " + innermost);
    }
  }

  /**
   * Strips parentheses and casts until none are left. Neither can change whether a value is null.
   */
  static ExpressionTree innermostExpression(ExpressionTree expression) {
    while (true) {
      switch (expression.getKind()) {
        case PARENTHESIZED:
          expression = ((ParenthesizedTree) expression).getExpression();
          break;
        case TYPE_CAST:
          expression = ((TypeCastTree) expression).getExpression();
          break;
        default:
          return expression;
      }
    }
  }

  /** Returns the category of {@code expression}, which should already be stripped of wrappers. */
  static ExpressionCategory categorize(ExpressionTree expression) {
    switch (expression.getKind()) {
      case NULL_LITERAL:
        return ExpressionCategory.NULL_CONSTANT;
      case INT_LITERAL:
      case LONG_LITERAL:
        return isZero((LiteralTree) expression)
            ? ExpressionCategory.NULL_CONSTANT
            : ExpressionCategory.OTHER;
      case STRING_LITERAL:
        return ExpressionCategory.STRING_LITERAL;
      case NEW_CLASS:
      case NEW_ARRAY:
        return ExpressionCategory.NEW_INSTANCE;
      case METHOD_INVOCATION:
        return ExpressionCategory.INVOCATION;
      case IDENTIFIER:
        if (((IdentifierTree) expression).getName().contentEquals("this")) {
          return ExpressionCategory.RECEIVER;
        }
        return referencesVariable(expression)
            ? ExpressionCategory.DECLARATION_REFERENCE
            : ExpressionCategory.OTHER;
      case MEMBER_SELECT:
        if (((MemberSelectTree) expression).getIdentifier().contentEquals("this")) {
          return ExpressionCategory.RECEIVER;
        }
        return referencesVariable(expression)
            ? ExpressionCategory.DECLARATION_REFERENCE
            : ExpressionCategory.OTHER;
      default:
        return ExpressionCategory.OTHER;
    }
  }

  private static boolean isZero(LiteralTree literal) {
    Object value = literal.getValue();
    return value instanceof Number && ((Number) value).longValue() == 0;
  }

  private static boolean referencesVariable(ExpressionTree expression) {
    Element element = elementFromTree(expression);
    return element instanceof VariableElement
        && Util.REFERENCEABLE_VARIABLE_KINDS.contains(element.getKind());
  }
}
