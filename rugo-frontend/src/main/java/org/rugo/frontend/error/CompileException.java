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

import lombok.Getter;

/**
 * Base of every error the compiler reports to its user. Carries the source name and the
 * original (pre-preprocessing) line so that all failures render as one line.
 */
@Getter
public class CompileException extends RuntimeException {

    private final String sourceName;

    /** 1-based source line, or 0 when no position is known. */
    private final int line;

    public CompileException(final String sourceName, final int line, final String message) {
        super(message);
        this.sourceName = sourceName;
        this.line = line;
    }

    public CompileException(final String sourceName, final int line, final String message, final Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
        this.line = line;
    }

    /**
     * Render as {@code <source>:<line>: <message>}.
     */
    public String toUserMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(sourceName == null ? "<unknown>" : sourceName);
        if (line > 0) {
            sb.append(':').append(line);
        }
        sb.append(": ").append(getMessage());
        return sb.toString();
    }
}
