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

package org.rugo.frontend.preprocess;

import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.rugo.frontend.ast.StructDecl;

/**
 * Output of {@link Preprocessor}: the rewritten text, where each of its lines came from, and
 * the struct declarations found.
 */
@Getter
@RequiredArgsConstructor
public class PreprocessResult {

    /** The source as given, before any rewriting. */
    private final String source;

    private final String text;

    /** {@code lineMap[i]} is the original line of preprocessed line {@code i + 1}. */
    private final int[] lineMap;

    private final List<StructDecl> structs;

    /**
     * Translate a 1-based line of {@link #getText()} to the original source line. Lines past
     * the end (the parser's EOF position) map to the last original line.
     */
    public int originalLine(final int preprocessedLine) {
        if (lineMap.length == 0 || preprocessedLine <= 0) {
            return preprocessedLine;
        }
        if (preprocessedLine > lineMap.length) {
            return lineMap[lineMap.length - 1];
        }
        return lineMap[preprocessedLine - 1];
    }
}
