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
package exm.gopy.target.tree;

/**
 * The TargetTree class hierarchy represents the constructs a lowered
 * program is made of, independent of any one output language.
 * Renderers turn a tree into text.
 *
 * Trees are immutable and compare structurally.
 */
public abstract class TargetTree
{
  public abstract TreeKind kind();

  @Override
  public abstract boolean equals(Object obj);

  @Override
  public abstract int hashCode();
}
