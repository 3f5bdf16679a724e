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

package org.rugo.registry;

import com.google.common.base.Preconditions;
import com.google.common.io.CharStreams;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads curated module declarations from the classpath: {@code modules/<name>.yml} for the
 * function table and {@code modules/<name>.go.txt} for the Go runtime text.
 */
@Slf4j
public class CuratedModuleLoader {

    private static final String MODULE_DIR = "modules/";

    private final ClassLoader classLoader;

    public CuratedModuleLoader() {
        this(CuratedModuleLoader.class.getClassLoader());
    }

    public CuratedModuleLoader(final ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    public List<CuratedModule> loadAll(final List<String> names) {
        List<CuratedModule> modules = new ArrayList<>(names.size());
        for (String name : names) {
            modules.add(load(name));
        }
        return modules;
    }

    public CuratedModule load(final String name) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "module name is empty");
        String yamlPath = MODULE_DIR + name + ".yml";
        CuratedModule module;
        try (Reader r = open(yamlPath)) {
            module = new Yaml().loadAs(r, CuratedModule.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read module declaration " + yamlPath, e);
        }
        if (module == null || !name.equals(module.getName())) {
            throw new IllegalStateException(yamlPath + " does not declare module '" + name + "'");
        }
        for (ModuleFunction function : module.getFunctions()) {
            // unknown type names throw here
            function.argTypes();
        }

        String runtimePath = MODULE_DIR + name + ".go.txt";
        try (Reader r = open(runtimePath)) {
            module.setRuntime(CharStreams.toString(r));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read module runtime " + runtimePath, e);
        }
        log.debug("Loaded module {} ({} functions)", name, module.getFunctions().size());
        return module;
    }

    private Reader open(final String path) {
        InputStream is = classLoader.getResourceAsStream(path);
        if (is == null) {
            throw new IllegalStateException("Module resource not found: " + path);
        }
        return new InputStreamReader(is, StandardCharsets.UTF_8);
    }
}
