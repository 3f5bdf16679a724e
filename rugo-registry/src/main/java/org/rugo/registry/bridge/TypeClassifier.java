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

package org.rugo.registry.bridge;

/**
 * Decides whether a Go type can cross the dynamic value boundary and how.
 */
public interface TypeClassifier {

    /**
     * @param type  the type as written in {@code pkg}
     * @param param true for a parameter, false for a result
     * @param pkg   the package declaring the function, for resolving local names
     */
    TypeClassification classify(GoType type, boolean param, GoPackage pkg);
}
