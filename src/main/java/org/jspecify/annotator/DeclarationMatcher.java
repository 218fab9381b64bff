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

import com.google.common.collect.ImmutableList;
import com.sun.source.tree.MethodTree;
import com.sun.source.tree.Tree;
import com.sun.source.tree.VariableTree;
import com.sun.source.util.TreeScanner;
import org.jspecify.annotations.Nullable;

/**
 * Finds the declarations under a set of trees that fall into one of the {@link
 * MatchedDeclaration.Kind} categories, in source order.
 */
final class DeclarationMatcher {
  private DeclarationMatcher() {}

  static ImmutableList<MatchedDeclaration> match(Iterable<? extends Tree> roots) {
    ImmutableList.Builder<MatchedDeclaration> matches = ImmutableList.builder();
    TreeScanner<Void, Void> scanner =
        new TreeScanner<Void, Void>() {
          @Override
          public Void visitMethod(MethodTree node, Void unused) {
            add(MatchedDeclaration.forElement(elementFromTree((Tree) node)));
            return super.visitMethod(node, unused);
          }

          @Override
          public Void visitVariable(VariableTree node, Void unused) {
            // Parameters and locals come through here too; forElement drops them.
            add(MatchedDeclaration.forElement(elementFromTree((Tree) node)));
            return super.visitVariable(node, unused);
          }

          private void add(@Nullable MatchedDeclaration match) {
            if (match != null) {
              matches.add(match);
            }
          }
        };
    for (Tree root : roots) {
      scanner.scan(root, null);
    }
    return matches.build();
  }
}
