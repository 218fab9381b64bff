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

import com.google.common.collect.ImmutableMap;
import com.sun.source.tree.AnnotatedTypeTree;
import com.sun.source.tree.AnnotationTree;
import com.sun.source.tree.ClassTree;
import com.sun.source.tree.MethodTree;
import com.sun.source.tree.Tree;
import com.sun.source.tree.VariableTree;
import com.sun.source.util.TreeScanner;
import com.sun.source.util.Trees;
import java.lang.annotation.ElementType;
import java.lang.annotation.Target;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.Element;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import org.jspecify.annotations.Nullable;

/**
 * Reads the nullness that a declaration carries in its annotations.
 *
 * <p>Annotations are recognized by simple name, so that {@code org.jspecify.annotations.Nullable},
 * {@code javax.annotation.Nullable} and the many other copies in the wild all count. We look in
 * three places, because which of them javac fills in depends on whether the annotation is a
 * declaration annotation or a type-use annotation and on whether the declaration comes from source
 * or from a class file:
 *
 * <ul>
 *   <li>the declaration annotations of the element
 *   <li>the type annotations of its type (the return type, for a method)
 *   <li>for source declarations, the annotations written on the declaration tree
 * </ul>
 *
 * <p>If the annotations disagree, the weakest one wins, as it does everywhere else.
 *
 * <p>On a declaration of array type, a type-use annotation in modifier position ({@code @Nullable
 * String[]}) belongs to the element type, so only annotations on the array type itself ({@code
 * String @Nullable []}) and declaration annotations count.
 */
final class DeclaredNullness {
  private static final ImmutableMap<String, Nullability> ANNOTATION_NAMES =
      ImmutableMap.<String, Nullability>builder()
          .put("Nullable", Nullability.NULLABLE)
          .put("CheckForNull", Nullability.NULLABLE)
          .put("NullableDecl", Nullability.NULLABLE)
          .put("NonNull", Nullability.NON_NULL)
          .put("Nonnull", Nullability.NON_NULL)
          .put("NotNull", Nullability.NON_NULL)
          .put("NonNullDecl", Nullability.NON_NULL)
          .put("NullnessUnspecified", Nullability.UNSPECIFIED)
          .buildOrThrow();

  private final Trees trees;

  DeclaredNullness(Trees trees) {
    this.trees = trees;
  }

  /**
   * Returns the nullness written on the return type of {@code method}, or empty if it carries no
   * recognized annotation.
   */
  Optional<Nullability> ofReturnType(ExecutableElement method) {
    boolean array = method.getReturnType().getKind() == TypeKind.ARRAY;
    List<String> names = new ArrayList<>();
    addAll(names, method.getAnnotationMirrors(), array);
    addAll(names, method.getReturnType());
    Tree tree = trees.getTree(method);
    if (tree instanceof MethodTree) {
      MethodTree methodTree = (MethodTree) tree;
      addAllTrees(names, methodTree.getModifiers().getAnnotations(), array);
      addAllTypeTrees(names, methodTree.getReturnType());
    }
    return weakestWritten(names);
  }

  /**
   * Returns the nullness written on the type of {@code variable} (a parameter, local variable or
   * field), or empty if it carries no recognized annotation.
   */
  Optional<Nullability> ofVariable(VariableElement variable) {
    boolean array = variable.asType().getKind() == TypeKind.ARRAY;
    List<String> names = new ArrayList<>();
    addAll(names, variable.getAnnotationMirrors(), array);
    addAll(names, variable.asType());
    VariableTree tree = declarationTree(variable);
    if (tree != null) {
      addAllTrees(names, tree.getModifiers().getAnnotations(), array);
      addAllTypeTrees(names, tree.getType());
    }
    return weakestWritten(names);
  }

  /** Returns true if {@code method}'s return type carries any recognized nullness annotation. */
  boolean isAnnotated(ExecutableElement method) {
    return ofReturnType(method).isPresent();
  }

  private @Nullable VariableTree declarationTree(VariableElement variable) {
    Tree tree = trees.getTree(variable);
    if (tree instanceof VariableTree) {
      return (VariableTree) tree;
    }
    /*
     * Trees.getTree finds fields, but for parameters and locals we have to search the body of the
     * method that owns them.
     */
    Element owner = variable.getEnclosingElement();
    if (!(owner instanceof ExecutableElement)) {
      return null;
    }
    Tree ownerTree = trees.getTree(owner);
    if (ownerTree == null) {
      return null;
    }
    VariableTree[] found = new VariableTree[1];
    new TreeScanner<Void, Void>() {
      @Override
      public Void visitVariable(VariableTree node, Void unused) {
        if (found[0] == null && variable.equals(elementFromTree((Tree) node))) {
          found[0] = node;
        }
        return super.visitVariable(node, unused);
      }

      @Override
      public Void visitClass(ClassTree node, Void unused) {
        // Variables of nested classes are owned by their own methods.
        return null;
      }
    }.scan(ownerTree, null);
    return found[0];
  }

  /**
   * Adds the names of {@code annotations}. If the declaration is of array type, type-use
   * annotations are left out, since javac also applies them to the element type.
   */
  private static void addAll(
      List<String> names, List<? extends AnnotationMirror> annotations, boolean array) {
    for (AnnotationMirror annotation : annotations) {
      Element type = annotation.getAnnotationType().asElement();
      if (!array || !isTypeUse(type)) {
        names.add(type.getSimpleName().toString());
      }
    }
  }

  private static void addAll(List<String> names, TypeMirror type) {
    addAll(names, type.getAnnotationMirrors(), false);
  }

  /**
   * Adds the names of annotations written in modifier position. On an array declaration, an
   * annotation counts only if it resolves to a declaration annotation.
   */
  private static void addAllTrees(
      List<String> names, List<? extends AnnotationTree> annotations, boolean array) {
    for (AnnotationTree annotation : annotations) {
      if (array) {
        Element type = elementFromTree(annotation.getAnnotationType());
        if (type == null || isTypeUse(type)) {
          continue;
        }
      }
      names.add(Util.simpleName(annotation));
    }
  }

  /**
   * Adds the names of the annotations on the outermost type of {@code type}. An annotation before
   * the brackets of an array type annotates the array, and javac parses it as an annotated type
   * around the array type.
   */
  private static void addAllTypeTrees(List<String> names, @Nullable Tree type) {
    if (type instanceof AnnotatedTypeTree) {
      addAllTrees(names, ((AnnotatedTypeTree) type).getAnnotations(), false);
    }
  }

  private static boolean isTypeUse(Element annotationType) {
    if (!(annotationType instanceof TypeElement)) {
      return false;
    }
    Target target = annotationType.getAnnotation(Target.class);
    return target != null && Arrays.asList(target.value()).contains(ElementType.TYPE_USE);
  }

  private static Optional<Nullability> weakestWritten(List<String> names) {
    Nullability result = null;
    for (String name : names) {
      Nullability written = ANNOTATION_NAMES.get(name);
      if (written != null) {
        result = result == null ? written : Nullability.weakest(result, written);
      }
    }
    return Optional.ofNullable(result);
  }
}
