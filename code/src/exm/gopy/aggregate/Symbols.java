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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Column names and symbol alphabet of the sample data files
 */
public class Symbols {
  public static final String SYMBOL_COLUMN = "syml";
  public static final String VALUE_COLUMN = "value";

  /** Symbols in reporting order */
  public static final List<String> ALL = ImmutableList.of("A", "B", "C", "D");
}
