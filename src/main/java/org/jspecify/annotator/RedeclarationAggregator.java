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
import com.sun.source.tree.MethodTree;
import javax.lang.model.element.ExecutableElement;

/** Gathers the exit points that together describe what a method returns. */
final class RedeclarationAggregator {
  private final DeclarationIndex index;
  private final ExitPointCollector collector;

  RedeclarationAggregator(DeclarationIndex index, ExitPointCollector collector) {
    this.index = index;
    this.collector = collector;
  }

  /**
   * The exit points of one method and the number of bodies they were taken from, or {@link
   * #NOT_CANONICAL} for a method that is described elsewhere.
   */
  static final class Collected {
    static final Collected NOT_CANONICAL = new Collected(false, ImmutableList.of(), 0);

    final boolean canonical;
    final ImmutableList<ExitPoint> exitPoints;
    final int bodiesInspected;

    private Collected(boolean canonical, ImmutableList<ExitPoint> exitPoints, int bodiesInspected) {
      this.canonical = canonical;
      this.exitPoints = exitPoints;
      this.bodiesInspected = bodiesInspected;
    }

    Collected(ImmutableList<ExitPoint> exitPoints, int bodiesInspected) {
      this(true, exitPoints, bodiesInspected);
    }
  }

  /**
   * Returns the exit points that describe {@code method}:
   *
   * <ul>
   *   <li>{@link Collected#NOT_CANONICAL}, if {@code method} is not canonical. Its body is reached
   *       through its canonical declaration instead.
   *   <li>those of its own body, if it has one, and no others. Overriding bodies are analyzed
   *       separately, as their own canonical declarations.
   *   <li>otherwise, those of every redeclaration that has a body, in source order.
   * </ul>
   */
  Collected exitPointsFor(ExecutableElement method) {
    if (!index.isCanonical(method)) {
      return Collected.NOT_CANONICAL;
    }
    if (index.hasBody(method)) {
      return new Collected(collector.collect(index.declaration(method)), 1);
    }
    ImmutableList.Builder<ExitPoint> pooled = ImmutableList.builder();
    int bodies = 0;
    for (ExecutableElement redeclaration : index.redeclarations(method)) {
      MethodTree tree = index.declaration(redeclaration);
      if (tree != null && tree.getBody() != null) {
        pooled.addAll(collector.collect(tree));
        bodies++;
      }
    }
    return new Collected(pooled.build(), bodies);
  }
}
