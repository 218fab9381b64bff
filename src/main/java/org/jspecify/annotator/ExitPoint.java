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

import com.sun.source.tree.ExpressionTree;
import com.sun.source.tree.MethodTree;
import com.sun.source.tree.ReturnTree;
import java.util.Optional;

/** One {@code return} statement, together with the method body it belongs to. */
final class ExitPoint {
  private final ReturnTree returnStatement;
  private final MethodTree enclosingMethod;

  ExitPoint(ReturnTree returnStatement, MethodTree enclosingMethod) {
    this.returnStatement = checkNotNull(returnStatement);
    this.enclosingMethod = checkNotNull(enclosingMethod);
  }

  ReturnTree returnStatement() {
    return returnStatement;
  }

  MethodTree enclosingMethod() {
    return enclosingMethod;
  }

  Optional<ExpressionTree> value() {
    return Optional.ofNullable(returnStatement.getExpression());
  }

  /** Returns false for a bare {@code return;}. */
  boolean hasValue() {
    return returnStatement.getExpression() != null;
  }

  @Override
  public String toString() {
    return returnStatement.toString();
  }
}
