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

package org.rugo.compiler;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.yaml.snakeyaml.Yaml;

/**
 * Compiler settings, read from {@code rugoc.yml}.
 */
@Data
public class CompilerConfig {

    static final String DEFAULT_RESOURCE = "rugoc.yml";

    /** Curated modules loaded into the registry. */
    private List<String> modules = new ArrayList<>();

    /** Emit a {@code // line N} comment before each generated statement. */
    private boolean emitLineComments;

    private String goPackage = "main";

    /**
     * Load the {@code rugoc.yml} bundled on the classpath.
     */
    public static CompilerConfig load() {
        InputStream is = CompilerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (is == null) {
            throw new IllegalStateException("Configuration resource not found: " + DEFAULT_RESOURCE);
        }
        try (Reader r = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            return parse(r, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public static CompilerConfig load(final Path file) throws IOException {
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(r, file.toString());
        }
    }

    private static CompilerConfig parse(final Reader reader, final String name) {
        CompilerConfig config = new Yaml().loadAs(reader, CompilerConfig.class);
        if (config == null) {
            throw new IllegalStateException(name + " is empty");
        }
        return config;
    }
}
