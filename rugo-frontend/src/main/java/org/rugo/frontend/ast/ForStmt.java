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

package org.rugo.frontend.ast;

import java.util.List;
import java.util.function.Consumer;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * {@code for var in collection} or {@code for var, indexVar in collection}. With two variables the
 * first binds the key (array index or hash key) and the second the value.
 */
@Getter
@RequiredArgsConstructor
public class ForStmt extends Statement {

    private final String var;

    private final String indexVar;

    private final Expr collection;

    private final List<Statement> body;

    @Override
    public void forEachChild(final Consumer<Node> action) {
        action.accept(collection);
        each(body, action);
    }
}
