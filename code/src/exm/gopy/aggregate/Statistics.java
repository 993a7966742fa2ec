/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.gopy.aggregate;

import java.util.Arrays;
import java.util.Collection;

/**
 * Summary statistics over samples.  Empty samples, or samples containing
 * NaN, give NaN.
 */
public class Statistics {

  public static double median(Collection<Double> values) {
    double[] sorted = toArray(values);
    if (sorted.length == 0 || containsNaN(sorted)) {
      return Double.NaN;
    }
    Arrays.sort(sorted);
    int mid = sorted.length / 2;
    if (sorted.length % 2 == 1) {
      return sorted[mid];
    }
    return (sorted[mid - 1] + sorted[mid]) / 2.0;
  }

  /**
   * Population standard deviation (divides by n, not n - 1)
   */
  public static double std(Collection<Double> values) {
    double[] vals = toArray(values);
    if (vals.length == 0) {
      return Double.NaN;
    }
    double sum = 0.0;
    for (double v: vals) {
      sum += v;
    }
    double mean = sum / vals.length;
    double sqDiff = 0.0;
    for (double v: vals) {
      sqDiff += (v - mean) * (v - mean);
    }
    return Math.sqrt(sqDiff / vals.length);
  }

  private static double[] toArray(Collection<Double> values) {
    double[] result = new double[values.size()];
    int i = 0;
    for (Double v: values) {
      result[i++] = v;
    }
    return result;
  }

  private static boolean containsNaN(double[] vals) {
    for (double v: vals) {
      if (Double.isNaN(v))
        return true;
    }
    return false;
  }
}
