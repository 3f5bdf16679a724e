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

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;

/**
 * A malformed program. Raised by the lexer/parser with the position of the first offending
 * token, and by the walker for constructs the grammar accepts but the language forbids.
 */
@Getter
public class RugoSyntaxException extends CompileException {

    /** 0-based column inside the preprocessed line. */
    private final int column;

    /** Token names the parser would have accepted, empty when unknown. */
    private final List<String> expected;

    public RugoSyntaxException(final String sourceName, final int line, final int column,
                               final String message, final List<String> expected) {
        super(sourceName, line, message);
        this.column = column;
        this.expected = expected == null ? ImmutableList.of() : ImmutableList.copyOf(expected);
    }

    public RugoSyntaxException(final String sourceName, final int line, final String message) {
        this(sourceName, line, 0, message, ImmutableList.of());
    }
}
