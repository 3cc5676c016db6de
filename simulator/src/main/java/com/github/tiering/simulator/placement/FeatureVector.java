/*
 * Copyright 2026 The Tiering Simulator Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.tiering.simulator.placement;

import static com.google.common.base.Preconditions.checkElementIndex;

import java.util.Arrays;

/** An immutable vector of features describing a request and its context. */
public final class FeatureVector {
  private final double[] values;

  private FeatureVector(double[] values) {
    this.values = values;
  }

  public static FeatureVector of(double... values) {
    return new FeatureVector(values.clone());
  }

  public double get(int index) {
    checkElementIndex(index, values.length);
    return values[index];
  }

  public int size() {
    return values.length;
  }

  public double[] toArray() {
    return values.clone();
  }

  @Override
  public boolean equals(Object o) {
    return (o instanceof FeatureVector) && Arrays.equals(values, ((FeatureVector) o).values);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return Arrays.toString(values);
  }
}
