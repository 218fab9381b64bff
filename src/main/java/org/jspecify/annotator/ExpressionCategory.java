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

/**
 * The kinds of returned expression that {@link ReturnValueClassifier} tells apart. Every
 * expression falls into exactly one category; anything we have no rule for is {@link #OTHER}.
 */
enum ExpressionCategory {
  /** {@code null}, or an integral literal equal to zero. */
  NULL_CONSTANT,
  /** A string literal or text block. */
  STRING_LITERAL,
  /** {@code new C(...)}, {@code new T[n]} or an array initializer. */
  NEW_INSTANCE,
  /** {@code this} or {@code C.this}. */
  RECEIVER,
  /** A method call, whose value is whatever the callee declares it returns. */
  INVOCATION,
  /** A name that resolves to a parameter, local variable or field. */
  DECLARATION_REFERENCE,
  OTHER,
}
