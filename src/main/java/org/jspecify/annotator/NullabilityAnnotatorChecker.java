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

import static com.sun.source.util.TaskEvent.Kind.COMPILATION;
import static java.util.Comparator.comparing;
import static javax.tools.Diagnostic.Kind.NOTE;

import com.google.common.collect.ImmutableList;
import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.util.JavacTask;
import com.sun.source.util.TaskEvent;
import com.sun.source.util.TaskListener;
import com.sun.source.util.TreePath;
import com.sun.source.util.Trees;
import com.sun.tools.javac.code.Symbol.ClassSymbol;
import com.sun.tools.javac.code.Symtab;
import com.sun.tools.javac.processing.JavacProcessingEnvironment;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;
import javax.lang.model.element.TypeElement;
import org.checkerframework.framework.source.SourceChecker;
import org.checkerframework.framework.source.SourceVisitor;
import org.checkerframework.framework.source.SupportedOptions;
import org.checkerframework.javacutil.BugInCF;
import org.jspecify.annotations.Nullable;

/**
 * Reports, for each method, the nullness annotation its return type should carry, as inferred by
 * {@link NullabilityAnnotator} from the method's {@code return} statements.
 *
 * <p>Supported options:
 *
 * <ol>
 *   <li>"onlyUnannotated": Report only methods whose return type has no nullness annotation yet.
 *   <li>"verboseInference": Log a note for every declaration that gets no report, and why.
 * </ol>
 *
 * <p>Reports can be suppressed with {@code @SuppressWarnings("nullability")}.
 *
 * <p>The checker indexes every compilation unit of the compilation, so an interface method is
 * described by implementations declared in other top-level classes and files. Run it with {@code
 * -XDcompilePolicy=simple}: under javac's default policy, classes after the one being processed
 * are not attributed yet, and their calls and variable references classify as unspecified.
 */
@SupportedOptions({"onlyUnannotated", "verboseInference"})
public final class NullabilityAnnotatorChecker extends SourceChecker {
  /** Built on the first processed class and kept until the compilation finishes. */
  private @Nullable NullabilityAnnotator annotator;

  public NullabilityAnnotatorChecker() {}

  @Override
  public NavigableSet<String> getSuppressWarningsPrefixes() {
    TreeSet<String> prefixes = new TreeSet<>();
    prefixes.add("nullability");
    return prefixes;
  }

  @Override
  public void initChecker() {
    super.initChecker();

    JavacTask.instance(processingEnv)
        .addTaskListener(
            new TaskListener() {
              @Override
              public void finished(TaskEvent event) {
                if (event.getKind() == COMPILATION) {
                  annotator = null;
                }
              }
            });
  }

  @Override
  protected SourceVisitor<?, ?> createSourceVisitor() {
    return new NullabilityAnnotatorVisitor(this);
  }

  @Override
  public void typeProcess(TypeElement element, TreePath path) {
    if (annotator == null) {
      Trees trees = Trees.instance(processingEnv);
      annotator =
          NullabilityAnnotator.create(
              trees, processingEnv.getElementUtils(), compilationUnits(trees));
    }
    super.typeProcess(element, path);
  }

  /**
   * Returns every compilation unit that declares a class of this compilation, ordered by file
   * name. By the time any class is processed, all of them have been parsed and entered.
   */
  private ImmutableList<CompilationUnitTree> compilationUnits(Trees trees) {
    Symtab symtab = Symtab.instance(((JavacProcessingEnvironment) processingEnv).getContext());
    List<ClassSymbol> classes = new ArrayList<>();
    symtab.getAllClasses().forEach(classes::add);
    Set<CompilationUnitTree> units = new LinkedHashSet<>();
    for (ClassSymbol type : classes) {
      // Only classes entered from source have a path; class files are skipped without completion.
      TreePath path = trees.getPath(type);
      if (path != null) {
        units.add(path.getCompilationUnit());
      }
    }
    List<CompilationUnitTree> sorted = new ArrayList<>(units);
    sorted.sort(comparing(unit -> unit.getSourceFile().toUri().toString()));
    return ImmutableList.copyOf(sorted);
  }

  NullabilityAnnotator annotator() {
    if (annotator == null) {
      throw new BugInCF("no class is being processed");
    }
    return annotator;
  }

  void note(String message) {
    processingEnv.getMessager().printMessage(NOTE, message);
  }
}
