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

import com.google.common.collect.ImmutableSet;
import java.util.Collections;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GoNamesTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "count, count",
        "type, type_",
        "len, len_",
        "main, main_",
        "_tmp, v_tmp",
        "rugo_line, vrugo_line",
        "strings, strings_"
    })
    void localNamesNeverShadowGoIdentifiers(final String rugoName, final String goName) {
        assertEquals(goName, GoNames.local(rugoName, ImmutableSet.of("fmt", "strings")));
    }

    @Test
    void plainNamesPassThrough() {
        assertEquals("total", GoNames.local("total", Collections.emptySet()));
    }

    @Test
    void quoteEscapesGoStringLiterals() {
        assertEquals("\"say \\\"hi\\\"\\n\"", GoNames.quote("say \"hi\"\n"));
        assertEquals("\"a\\\\b\\tc\"", GoNames.quote("a\\b\tc"));
        assertEquals("\"\\x01\\x7f\"", GoNames.quote("\u0001\u007f"));
        assertEquals("\"héllo 世界\"", GoNames.quote("héllo 世界"));
    }
}
