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

import java.util.Set;
import java.util.TreeSet;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.rugo.frontend.ast.ImportStmt;
import org.rugo.frontend.ast.Node;
import org.rugo.frontend.ast.ParallelExpr;
import org.rugo.frontend.ast.SpawnExpr;

/**
 * One pass over a program deciding which optional runtime parts it needs.
 */
@Slf4j
@Getter
class FeatureScan {

    /** {@code spawn} or {@code parallel} appears. */
    private boolean tasks;

    /** A Go package is imported. */
    private boolean bridge;

    static FeatureScan of(final Node program) {
        FeatureScan scan = new FeatureScan();
        scan.visit(program);
        log.debug("Feature scan: tasks={}, bridge={}", scan.tasks, scan.bridge);
        return scan;
    }

    private void visit(final Node node) {
        if (node instanceof SpawnExpr || node instanceof ParallelExpr) {
            tasks = true;
        } else if (node instanceof ImportStmt) {
            bridge = true;
        }
        node.forEachChild(this::visit);
    }

    /**
     * @return Go imports the selected runtime parts reference
     */
    Set<String> imports() {
        Set<String> imports = new TreeSet<>();
        imports.add("fmt");
        imports.add("os");
        imports.add("os/exec");
        imports.add("runtime");
        imports.add("sort");
        imports.add("strconv");
        imports.add("strings");
        if (tasks) {
            imports.add("sync");
            imports.add("time");
        }
        return imports;
    }
}
