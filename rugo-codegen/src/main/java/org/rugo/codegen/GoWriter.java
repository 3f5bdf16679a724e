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

/**
 * Line-oriented Go text buffer. Multi-line fragments keep their relative indentation and are
 * shifted to the current depth; {@code //line} directives stay in column 1.
 */
class GoWriter {

    private static final String LINE_DIRECTIVE = "//line ";

    private final StringBuilder sb = new StringBuilder();

    private int depth;

    GoWriter(final int depth) {
        this.depth = depth;
    }

    GoWriter line(final String code) {
        for (String piece : code.split("\n", -1)) {
            if (!piece.isEmpty() && !piece.startsWith(LINE_DIRECTIVE)) {
                for (int i = 0; i < depth; i++) {
                    sb.append('\t');
                }
                sb.append(piece);
            }
            sb.append('\n');
        }
        return this;
    }

    GoWriter open(final String code) {
        line(code);
        depth++;
        return this;
    }

    GoWriter close(final String code) {
        depth--;
        line(code);
        return this;
    }

    /** Line that closes one block and opens the next, as an else branch does. */
    GoWriter reopen(final String code) {
        depth--;
        line(code);
        depth++;
        return this;
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
