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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Line after line sequence of statements
 * */
public class Sequence extends TargetTree
{
  private static final Sequence EMPTY =
      new Sequence(ImmutableList.<TargetTree>of());

  private final ImmutableList<TargetTree> members;

  public Sequence(List<? extends TargetTree> members)
  {
    this.members = ImmutableList.copyOf(members);
  }

  public static Sequence empty() {
    return EMPTY;
  }

  @Override
  public TreeKind kind() {
    return TreeKind.SEQUENCE;
  }

  public List<TargetTree> members() {
    return members;
  }

  public boolean isEmpty() {
    return members.isEmpty();
  }

  public int size() {
    return members.size();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Sequence))
      return false;
    return members.equals(((Sequence) obj).members);
  }

  @Override
  public int hashCode() {
    return members.hashCode();
  }

  @Override
  public String toString() {
    return members.toString();
  }
}
