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

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;

/**
 * A Go package could not be registered as a bridge module. {@link #getReasons()} lists each
 * rejected function with the type that blocked it.
 */
@Getter
public class BridgeException extends RuntimeException {

    private final String importPath;

    private final List<String> reasons;

    public BridgeException(final String importPath, final String message, final List<String> reasons) {
        super(reasons.isEmpty() ? message : message + ": " + String.join("; ", reasons));
        this.importPath = importPath;
        this.reasons = ImmutableList.copyOf(reasons);
    }
}
