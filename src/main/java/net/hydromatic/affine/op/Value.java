/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.affine.op;

import static java.util.Objects.requireNonNull;

/**
 * Value in a program, such as a loop induction variable, a parameter, or a
 * quantity computed from other values.
 *
 * <p>Values have identity; two values with the same name are distinct.
 */
public class Value {
  public final String name;

  protected Value(String name) {
    this.name = requireNonNull(name, "name");
  }

  /** Creates a value that is defined outside the analyzed code. */
  public static Value of(String name) {
    return new Value(name);
  }

  @Override
  public String toString() {
    return name;
  }
}

// End Value.java
