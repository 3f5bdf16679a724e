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

import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.rugo.frontend.error.RugoSyntaxException;
import org.rugo.frontend.preprocess.PreprocessResult;

/**
 * Turns the first lexer or parser error into a {@link RugoSyntaxException} positioned on the
 * original source line.
 */
class SyntaxErrorListener extends BaseErrorListener {

    private final String sourceName;

    private final PreprocessResult preprocessed;

    SyntaxErrorListener(final String sourceName, final PreprocessResult preprocessed) {
        this.sourceName = sourceName;
        this.preprocessed = preprocessed;
    }

    @Override
    public void syntaxError(final Recognizer<?, ?> recognizer, final Object offendingSymbol, final int line,
                            final int charPositionInLine, final String msg, final RecognitionException e) {
        List<String> expected = new ArrayList<>();
        if (recognizer instanceof Parser) {
            IntervalSet set = e != null && e.getExpectedTokens() != null
                ? e.getExpectedTokens()
                : ((Parser) recognizer).getExpectedTokens();
            for (int type : set.toArray()) {
                expected.add(type == Token.EOF ? "<EOF>" : recognizer.getVocabulary().getDisplayName(type));
            }
        }
        throw new RugoSyntaxException(
            sourceName, preprocessed.originalLine(line), charPositionInLine, describe(offendingSymbol, msg), expected);
    }

    private static String describe(final Object offendingSymbol, final String msg) {
        if (offendingSymbol instanceof Token) {
            Token token = (Token) offendingSymbol;
            if (token.getType() == Token.EOF) {
                return "unexpected end of input (" + msg + ")";
            }
        }
        return msg.replace("\n", "\\n");
    }
}
