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

import java.util.ArrayList;
import java.util.List;

/**
 * Lines of text under rewrite, each remembering the original source line it came from. A pass
 * reads one {@code MappedLines} and appends to a fresh one; lines it expands into several all
 * keep the origin of the line they replace.
 */
final class MappedLines {

    private final List<String> texts = new ArrayList<>();

    private final List<Integer> origins = new ArrayList<>();

    static MappedLines of(final String source) {
        MappedLines lines = new MappedLines();
        String[] split = source.split("\n", -1);
        for (int i = 0; i < split.length; i++) {
            lines.add(split[i], i + 1);
        }
        return lines;
    }

    void add(final String text, final int origin) {
        texts.add(text);
        origins.add(origin);
    }

    int size() {
        return texts.size();
    }

    String text(final int index) {
        return texts.get(index);
    }

    int origin(final int index) {
        return origins.get(index);
    }

    void set(final int index, final String text) {
        texts.set(index, text);
    }

    String join() {
        return String.join("\n", texts);
    }

    int[] lineMap() {
        int[] map = new int[origins.size()];
        for (int i = 0; i < map.length; i++) {
            map[i] = origins.get(i);
        }
        return map;
    }
}
