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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class NameConverterTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "HasPrefix, has_prefix",
        "IsNaN, is_nan",
        "URLEncode, url_encode",
        "HTTPSProxy, https_proxy",
        "HTTPServer, http_server",
        "ParseInt, parse_int",
        "Itoa, itoa",
        "FMA, fma",
        "UTF8String, utf8_string",
        "ReadID, read_id",
        "XMLHttpRequest, xml_http_request",
        "Float64bits, float64bits",
        "ToUpper, to_upper",
        "Sqrt, sqrt",
        "ABCDef, abc_def",
        "Get_Value, get_value"
    })
    void toSnakeCase(final String goName, final String rugoName) {
        assertEquals(rugoName, NameConverter.toSnakeCase(goName));
    }

    @Test
    void toPascalCase() {
        assertEquals("ToS", NameConverter.toPascalCase("to_s"));
        assertEquals("StartsWith", NameConverter.toPascalCase("starts_with"));
        assertEquals("Log10", NameConverter.toPascalCase("log10"));
        assertEquals("E", NameConverter.toPascalCase("e"));
    }
}
