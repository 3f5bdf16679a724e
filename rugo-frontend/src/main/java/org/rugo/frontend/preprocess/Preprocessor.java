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

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;

/**
 * Text-to-text rewriting run before parsing. Passes, in order:
 * <ol>
 *   <li>heredocs</li>
 *   <li>comments</li>
 *   <li>struct declarations and struct methods</li>
 *   <li>sugar: hash colon keys, compound assignment, destructuring, {@code def} parens,
 *       postfix {@code if}, backticks, one-line {@code try} and {@code spawn}, paren-free
 *       calls with shell fallback, bare {@code append}, and finally string interpolation</li>
 * </ol>
 * Never throws on malformed input; whatever it cannot make sense of is passed through for
 * the parser to report with a position.
 */
@Slf4j
public class Preprocessor {

    public PreprocessResult preprocess(final String source) {
        Preconditions.checkNotNull(source, "source");
        MappedLines lines = MappedLines.of(source.replace("\r\n", "\n"));

        lines = new HeredocExpander().expand(lines);
        lines = new CommentStripper().strip(lines);
        StructExpander structs = new StructExpander();
        lines = structs.expand(lines);

        SugarExpander sugar = new SugarExpander();
        lines = sugar.hashColonKeys(lines);
        lines = sugar.compoundAssignment(lines);
        lines = sugar.destructuring(lines);
        lines = sugar.defParens(lines);
        lines = sugar.postfixIf(lines);
        lines = sugar.backticks(lines);
        lines = sugar.trySugar(lines);
        lines = sugar.spawnSugar(lines);
        lines = new CallResolver(CallResolver.scanFunctionNames(lines)).resolve(lines);
        lines = sugar.bareAppend(lines);
        lines = new Interpolator().expand(lines);

        String text = lines.join();
        log.debug("Preprocessed {} source chars into {} lines", source.length(), lines.size());
        return new PreprocessResult(source, text, lines.lineMap(), structs.getStructs());
    }
}
