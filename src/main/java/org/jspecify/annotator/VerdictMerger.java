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

import java.util.Optional;
import java.util.function.Function;

/** Reduces many classified values to one verdict. The weakest verdict always wins. */
final class VerdictMerger {
  /**
   * Returns the weakest classification among {@code exitPoints}, or empty if there are none. A
   * bare {@code return;} counts as {@link Nullability#UNSPECIFIED}.
   */
  static Optional<Nullability> merge(
      Iterable<ExitPoint> exitPoints, ReturnValueClassifier classifier) {
    return weakest(exitPoints, exitPoint -> classifier.classify(exitPoint.returnStatement()));
  }

  /**
   * Folds {@code items} from {@link Nullability#NON_NULL}, keeping whichever verdict is weaker at
   * each step. The result does not depend on the order of {@code items}.
   */
  static <T> Optional<Nullability> weakest(
      Iterable<T> items, Function<? super T, Nullability> classifier) {
    boolean any = false;
    Nullability result = Nullability.NON_NULL;
    for (T item : items) {
      any = true;
      Nullability classification = classifier.apply(item);
      if (classification.isWeakerThan(result)) {
        result = classification;
      }
    }
    return any ? Optional.of(result) : Optional.empty();
  }

  private VerdictMerger() {}
}
