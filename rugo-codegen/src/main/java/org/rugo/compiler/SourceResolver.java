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

package org.rugo.compiler;

import java.io.IOException;
import java.util.Optional;

/**
 * Supplies the text of units named by {@code require "path"}.
 */
@FunctionalInterface
public interface SourceResolver {

    /** Resolves nothing; every require fails. */
    SourceResolver NONE = path -> Optional.empty();

    /**
     * @param path the path as written in the require statement
     * @return the unit's source text, or empty when there is no such unit
     */
    Optional<String> resolve(String path) throws IOException;
}
