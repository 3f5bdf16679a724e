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

package org.rugo.frontend.error;

/**
 * The compiler met a parse-tree or AST shape it has no rule for. This is a defect of the
 * compiler, never of the user's program, and is worded so.
 */
public class InternalCompilerException extends CompileException {

    private static final String PREFIX = "internal compiler error: ";

    public InternalCompilerException(final String sourceName, final int line, final String message) {
        super(sourceName, line, PREFIX + message);
    }

    public InternalCompilerException(final String sourceName, final int line, final String message,
                                     final Throwable cause) {
        super(sourceName, line, PREFIX + message, cause);
    }
}
