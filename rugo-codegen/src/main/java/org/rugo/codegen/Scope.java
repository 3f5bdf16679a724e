/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.rugo.codegen;

import java.util.HashMap;
import java.util.Map;
import org.rugo.frontend.ast.AssignStmt;

/**
 * Variables visible at one point of the generated code. Lookups walk outwards; closures see
 * their enclosing scope, function bodies see only package-level variables.
 */
class Scope {

    private final Scope parent;

    /** Rugo name to Go name. */
    private final Map<String, String> vars = new HashMap<>();

    /** Constants declared here, by the assignment that first bound them. */
    private final Map<String, AssignStmt> constants = new HashMap<>();

    Scope(final Scope parent) {
        this.parent = parent;
    }

    Scope child() {
        return new Scope(this);
    }

    /**
     * @return the Go name of a visible variable, or null
     */
    String lookup(final String name) {
        for (Scope s = this; s != null; s = s.parent) {
            String goName = s.vars.get(name);
            if (goName != null) {
                return goName;
            }
        }
        return null;
    }

    boolean isVisible(final String name) {
        return lookup(name) != null;
    }

    void declare(final String name, final String goName) {
        vars.put(name, goName);
    }

    /**
     * @return the assignment that bound the visible constant {@code name}, or null
     */
    AssignStmt constant(final String name) {
        Scope owner = owner(name);
        return owner == null ? null : owner.constants.get(name);
    }

    /**
     * Record {@code first} as the binding of a visible variable that is a constant.
     */
    void bindConstant(final String name, final AssignStmt first) {
        Scope owner = owner(name);
        if (owner != null) {
            owner.constants.putIfAbsent(name, first);
        }
    }

    private Scope owner(final String name) {
        for (Scope s = this; s != null; s = s.parent) {
            if (s.vars.containsKey(name)) {
                return s;
            }
        }
        return null;
    }
}
