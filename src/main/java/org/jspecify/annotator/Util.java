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

import static java.util.Arrays.asList;
import static java.util.Collections.unmodifiableSet;

import com.sun.source.tree.AnnotationTree;
import java.util.HashSet;
import java.util.Set;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.Elements;

final class Util {
  private final Elements elementUtils;

  Util(Elements elementUtils) {
    this.elementUtils = elementUtils;
  }

  boolean isOrOverrides(ExecutableElement overrider, ExecutableElement overridden) {
    return overrider.equals(overridden) || overrides(overrider, overridden);
  }

  /*
   * Elements.overrides already follows the supertype chain, so an implementation two levels below
   * an interface method counts as overriding it.
   */
  boolean overrides(ExecutableElement overrider, ExecutableElement overridden) {
    Element owner = overrider.getEnclosingElement();
    return owner instanceof TypeElement
        && !overrider.equals(overridden)
        && elementUtils.overrides(overrider, overridden, (TypeElement) owner);
  }

  /**
   * Returns the name under which results for {@code element} are reported: the binary name of the
   * enclosing class for anonymous and local classes, its canonical name otherwise, followed by the
   * member's simple name.
   */
  String qualifiedName(Element element) {
    Element owner = element.getEnclosingElement();
    if (!(owner instanceof TypeElement)) {
      return element.getSimpleName().toString();
    }
    TypeElement type = (TypeElement) owner;
    CharSequence typeName =
        type.getQualifiedName().length() == 0
            ? elementUtils.getBinaryName(type)
            : type.getQualifiedName();
    return typeName + "." + element.getSimpleName();
  }

  /**
   * Returns the simple name of the annotation type as written in source, without resolving it. This
   * lets us read annotations on trees of classes that javac has not attributed yet.
   */
  static String simpleName(AnnotationTree annotation) {
    String written = annotation.getAnnotationType().toString();
    return written.substring(written.lastIndexOf('.') + 1);
  }

  static final Set<ElementKind> REFERENCEABLE_VARIABLE_KINDS =
      unmodifiableSet(
          new HashSet<>(
              asList(
                  ElementKind.PARAMETER,
                  ElementKind.LOCAL_VARIABLE,
                  ElementKind.RESOURCE_VARIABLE,
                  ElementKind.EXCEPTION_PARAMETER,
                  ElementKind.BINDING_VARIABLE,
                  ElementKind.FIELD)));
}
