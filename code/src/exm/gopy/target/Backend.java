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
package exm.gopy.target;

import exm.gopy.common.exceptions.GopyRuntimeError;
import exm.gopy.common.exceptions.InvalidOptionException;
import exm.gopy.pybackend.PythonRenderer;
import exm.gopy.tclbackend.TclRenderer;

/**
 * Output languages a target tree can be rendered as
 */
public enum Backend
{
  PYTHON("python"),
  TCL("tcl");

  private final String name;

  Backend(String name)
  {
    this.name = name;
  }

  public String getName()
  {
    return name;
  }

  /**
   * @return a fresh renderer; renderers are not shared between threads
   */
  public Renderer createRenderer(int indentWidth)
  {
    switch (this) {
      case PYTHON:
        return new PythonRenderer(indentWidth);
      case TCL:
        return new TclRenderer(indentWidth);
      default:
        throw new GopyRuntimeError("No renderer for backend " + this);
    }
  }

  public static Backend fromName(String name) throws InvalidOptionException
  {
    for (Backend b: values()) {
      if (b.name.equalsIgnoreCase(name)) {
        return b;
      }
    }
    throw new InvalidOptionException("Unknown target language: " + name);
  }
}
