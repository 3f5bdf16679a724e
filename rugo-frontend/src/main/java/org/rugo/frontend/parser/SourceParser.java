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

package org.rugo.frontend.parser;

import lombok.extern.slf4j.Slf4j;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.rugo.frontend.error.RugoSyntaxException;
import org.rugo.frontend.grammar.RugoLexer;
import org.rugo.frontend.grammar.RugoParser;
import org.rugo.frontend.preprocess.PreprocessResult;

/**
 * Runs the generated {@code Rugo.g4} lexer and parser over preprocessed text. Fails fast on
 * the first error; the ANTLR console listeners are removed.
 */
@Slf4j
public class SourceParser {

    public RugoParser.ProgramContext parse(final String sourceName, final PreprocessResult preprocessed) {
        SyntaxErrorListener listener = new SyntaxErrorListener(sourceName, preprocessed);

        RugoLexer lexer = new RugoLexer(CharStreams.fromString(preprocessed.getText(), sourceName));
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);

        RugoParser parser = new RugoParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(listener);

        try {
            RugoParser.ProgramContext program = parser.program();
            log.debug("Parsed {}: {} top-level entries", sourceName, program.getChildCount());
            return program;
        } catch (StackOverflowError e) {
            throw new RugoSyntaxException(sourceName, 0, "program is nested too deeply to parse");
        }
    }
}
