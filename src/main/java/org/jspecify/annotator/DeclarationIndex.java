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
import static org.checkerframework.javacutil.TreeUtils.elementFromTree;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.sun.source.tree.MethodTree;
import com.sun.source.tree.Tree;
import com.sun.source.util.TreeScanner;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.util.Elements;
import org.jspecify.annotations.Nullable;

/**
 * The methods declared in a set of source trees, in source order, with the trees that declare
 * them.
 *
 * <p>The index answers the questions that decide which bodies describe a method: whether it has a
 * body of its own, whether it is canonical, and which other indexed methods redeclare it.
 */
final class DeclarationIndex {
  private final Util util;
  private final ImmutableMap<ExecutableElement, MethodTree> declarations;

  private DeclarationIndex(Util util, ImmutableMap<ExecutableElement, MethodTree> declarations) {
    this.util = util;
    this.declarations = declarations;
  }

  /**
   * Indexes every method (but no constructor) declared under {@code roots}, including those of
   * nested, local and anonymous classes. Methods without a symbol, such as those of local classes
   * that javac has not attributed yet, are skipped.
   */
  static DeclarationIndex of(Elements elements, Iterable<? extends Tree> roots) {
    Map<ExecutableElement, MethodTree> declarations = new LinkedHashMap<>();
    TreeScanner<Void, Void> scanner =
        new TreeScanner<Void, Void>() {
          @Override
          public Void visitMethod(MethodTree node, Void unused) {
            Element method = elementFromTree((Tree) node);
            if (method != null && method.getKind() == ElementKind.METHOD) {
              declarations.putIfAbsent((ExecutableElement) method, node);
            }
            return super.visitMethod(node, unused);
          }
        };
    for (Tree root : roots) {
      scanner.scan(root, null);
    }
    return new DeclarationIndex(new Util(elements), ImmutableMap.copyOf(declarations));
  }

  boolean contains(ExecutableElement method) {
    return declarations.containsKey(method);
  }

  /** Returns the tree that declares {@code method}, or null if it was not declared in the index. */
  @Nullable MethodTree declaration(ExecutableElement method) {
    return declarations.get(method);
  }

  boolean hasBody(ExecutableElement method) {
    MethodTree tree = declarations.get(method);
    return tree != null && tree.getBody() != null;
  }

  /**
   * Returns whether {@code method} is the declaration its redeclarations are analyzed through.
   *
   * <p>A method is canonical unless it overrides an indexed method that has no body. The bodies of
   * implementations of an abstract or interface method are all pooled under that contract method,
   * so analyzing an implementation on its own would count its body twice.
   */
  boolean isCanonical(ExecutableElement method) {
    checkNotNull(method);
    for (ExecutableElement other : declarations.keySet()) {
      if (!hasBody(other) && util.overrides(method, other)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns {@code method} itself, if indexed, and every indexed method that overrides it, directly
   * or transitively, in source order.
   */
  ImmutableList<ExecutableElement> redeclarations(ExecutableElement method) {
    ImmutableList.Builder<ExecutableElement> result = ImmutableList.builder();
    for (ExecutableElement other : declarations.keySet()) {
      if (util.isOrOverrides(other, method)) {
        result.add(other);
      }
    }
    return result.build();
  }

  Util util() {
    return util;
  }
}
