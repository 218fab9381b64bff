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

import com.google.common.collect.ImmutableList;
import com.sun.source.tree.BlockTree;
import com.sun.source.tree.ClassTree;
import com.sun.source.tree.LambdaExpressionTree;
import com.sun.source.tree.MethodTree;
import com.sun.source.tree.ReturnTree;
import com.sun.source.util.TreeScanner;

/**
 * Finds the {@code return} statements of a method body, in source order.
 *
 * <p>Returns inside a lambda or inside the body of a local or anonymous class exit a different
 * method, so the scan does not descend into either.
 */
final class ExitPointCollector {
  ImmutableList<ExitPoint> collect(MethodTree method) {
    BlockTree body = method.getBody();
    if (body == null) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<ExitPoint> exitPoints = ImmutableList.builder();
    new TreeScanner<Void, Void>() {
      @Override
      public Void visitReturn(ReturnTree node, Void unused) {
        exitPoints.add(new ExitPoint(node, method));
        return super.visitReturn(node, unused);
      }

      @Override
      public Void visitLambdaExpression(LambdaExpressionTree node, Void unused) {
        return null;
      }

      @Override
      public Void visitClass(ClassTree node, Void unused) {
        return null;
      }
    }.scan(body, null);
    return exitPoints.build();
  }
}
