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

/**
 * Median and standard deviation of the values recorded for one symbol
 */
public class SymbolSummary {
  private final String symbol;
  private final double median;
  private final double std;

  public SymbolSummary(String symbol, double median, double std) {
    this.symbol = symbol;
    this.median = median;
    this.std = std;
  }

  public String getSymbol() {
    return symbol;
  }

  public double getMedian() {
    return median;
  }

  public double getStd() {
    return std;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = symbol.hashCode();
    result = prime * result + Double.valueOf(median).hashCode();
    result = prime * result + Double.valueOf(std).hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof SymbolSummary))
      return false;
    SymbolSummary other = (SymbolSummary) obj;
    return symbol.equals(other.symbol) &&
        Double.compare(median, other.median) == 0 &&
        Double.compare(std, other.std) == 0;
  }

  @Override
  public String toString() {
    return symbol + "(median=" + median + ", std=" + std + ")";
  }
}
