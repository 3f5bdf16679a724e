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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Converts between Go exported identifiers and Rugo snake_case names.
 */
public final class NameConverter {

    /** Longest first, so {@code HTTPS} wins over {@code HTTP}. */
    private static final List<String> ACRONYMS = ImmutableList.of(
        "NaN", "URL", "URI", "HTTP", "HTTPS", "JSON", "XML", "ID", "UTF", "TCP", "UDP", "IP", "TLS", "SSL", "API",
        "SQL", "DNS", "EOF", "FMA"
    ).stream().sorted(Comparator.comparingInt(String::length).reversed()).collect(ImmutableList.toImmutableList());

    private NameConverter() {
    }

    /**
     * {@code HasPrefix} → {@code has_prefix}, {@code IsNaN} → {@code is_nan},
     * {@code HTTPSProxy} → {@code https_proxy}. A word starts at an acronym, at an upper
     * case letter after a lower case one, or at the last capital of a capital run that is
     * followed by lower case. Digits stay with the preceding word.
     */
    public static String toSnakeCase(final String goName) {
        List<String> words = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        int i = 0;
        while (i < goName.length()) {
            char c = goName.charAt(i);
            if (c == '_') {
                flush(word, words);
                i++;
                continue;
            }
            String acronym = acronymAt(goName, i);
            if (acronym != null) {
                flush(word, words);
                word.append(acronym.toLowerCase(Locale.ROOT));
                i += acronym.length();
                continue;
            }
            if (Character.isUpperCase(c)) {
                flush(word, words);
                int j = i + 1;
                if (j < goName.length() && Character.isUpperCase(goName.charAt(j))) {
                    while (j < goName.length() && Character.isUpperCase(goName.charAt(j)) && acronymAt(goName, j) == null) {
                        j++;
                    }
                    if (j < goName.length() && Character.isLowerCase(goName.charAt(j))) {
                        j--;
                    }
                }
                word.append(goName.substring(i, j).toLowerCase(Locale.ROOT));
                i = j;
                continue;
            }
            word.append(Character.toLowerCase(c));
            i++;
        }
        flush(word, words);
        return String.join("_", words);
    }

    /**
     * {@code to_s} → {@code ToS}, {@code starts_with} → {@code StartsWith}.
     */
    public static String toPascalCase(final String snakeName) {
        StringBuilder sb = new StringBuilder();
        for (String part : snakeName.split("_")) {
            if (!part.isEmpty()) {
                sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
            }
        }
        return sb.toString();
    }

    /**
     * An acronym only counts when it ends the name or the next character starts a new word.
     */
    private static String acronymAt(final String s, final int at) {
        for (String acronym : ACRONYMS) {
            if (!s.startsWith(acronym, at)) {
                continue;
            }
            int end = at + acronym.length();
            if (end == s.length() || !Character.isLowerCase(s.charAt(end))) {
                return acronym;
            }
        }
        return null;
    }

    private static void flush(final StringBuilder word, final List<String> words) {
        if (word.length() > 0) {
            words.add(word.toString());
            word.setLength(0);
        }
    }
}
