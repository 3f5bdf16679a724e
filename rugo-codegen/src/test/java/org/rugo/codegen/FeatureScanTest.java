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

import org.junit.jupiter.api.Test;
import org.rugo.frontend.ast.Program;
import org.rugo.frontend.parser.SourceParser;
import org.rugo.frontend.preprocess.PreprocessResult;
import org.rugo.frontend.preprocess.Preprocessor;
import org.rugo.frontend.walker.AstWalker;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeatureScanTest {

    private static FeatureScan scan(final String source) {
        PreprocessResult preprocessed = new Preprocessor().preprocess(source);
        Program program = AstWalker.walk(new SourceParser().parse("test.rugo", preprocessed), preprocessed,
                                         "test.rugo");
        return FeatureScan.of(program);
    }

    @Test
    void plainProgram() {
        FeatureScan scan = scan("x = 1\nputs x\n");
        assertFalse(scan.isTasks());
        assertFalse(scan.isBridge());
        assertFalse(scan.imports().contains("sync"));
        assertTrue(scan.imports().contains("os/exec"));
    }

    @Test
    void spawnNestedInAFunctionNeedsTasks() {
        FeatureScan scan = scan("def f()\n  if true\n    t = spawn\n      1\n    end\n  end\nend\n");
        assertTrue(scan.isTasks());
        assertTrue(scan.imports().contains("sync"));
        assertTrue(scan.imports().contains("time"));
    }

    @Test
    void importNeedsBridgeConversions() {
        assertTrue(scan("import \"example.com/strutil\"\n").isBridge());
    }
}
