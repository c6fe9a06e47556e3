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
package net.hydromatic.boogie.type;

import net.hydromatic.boogie.ast.Pos;

/** Proxy that carries constraints on the type it may stand for, and
 * therefore cannot be unified with an arbitrary type. */
public abstract class ConstrainedProxy extends TypeProxy {
  protected ConstrainedProxy(Pos pos, String givenName, String kind) {
    super(pos, givenName, kind);
  }
}

// End ConstrainedProxy.java
