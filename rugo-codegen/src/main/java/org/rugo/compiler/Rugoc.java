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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.rugo.codegen.GeneratedProgram;
import org.rugo.frontend.error.CompileException;
import org.rugo.registry.CuratedModuleLoader;
import org.rugo.registry.ModuleRegistry;
import org.rugo.registry.bridge.BridgeException;
import org.rugo.registry.bridge.BridgeModule;
import org.rugo.registry.bridge.GoBridgeIntrospector;
import org.rugo.registry.bridge.ModuleDescriber;

/**
 * Command-line driver.
 *
 * <pre>
 * rugoc &lt;input.rugo&gt; &lt;output.go&gt; [bridge-dir[=import-path] ...]
 * </pre>
 *
 * Each bridge argument is a Go package directory to introspect; the import path defaults to the
 * directory name.
 */
@Slf4j
public class Rugoc {

    public static void main(final String[] args) {
        System.exit(run(args));
    }

    static int run(final String[] args) {
        if (args.length < 2) {
            log.error("usage: rugoc <input.rugo> <output.go> [bridge-dir[=import-path] ...]");
            return 1;
        }
        Path input = Path.of(args[0]);
        Path output = Path.of(args[1]);
        try {
            CompilerConfig config = CompilerConfig.load();
            ModuleRegistry.Builder registry = ModuleRegistry.builder()
                                                            .curated(new CuratedModuleLoader().loadAll(config.getModules()));
            GoBridgeIntrospector introspector = new GoBridgeIntrospector();
            for (int i = 2; i < args.length; i++) {
                String arg = args[i];
                int eq = arg.indexOf('=');
                Path dir = Path.of(eq < 0 ? arg : arg.substring(0, eq));
                String importPath = eq < 0 ? dir.getFileName().toString() : arg.substring(eq + 1);
                registry.bridge(introspector.introspect(dir, importPath));
            }

            ModuleRegistry modules = registry.build();
            if (log.isDebugEnabled()) {
                logModules(modules);
            }

            String source = Files.readString(input, StandardCharsets.UTF_8);
            Path baseDir = input.toAbsolutePath().getParent();
            RugoCompiler compiler = new RugoCompiler(modules, config, new DirectorySourceResolver(baseDir));
            GeneratedProgram program = compiler.compile(args[0], source);
            Files.writeString(output, program.getSource(), StandardCharsets.UTF_8);
            log.info("Wrote {}", output);
            return 0;
        } catch (CompileException e) {
            log.error(e.toUserMessage());
            return 1;
        } catch (BridgeException e) {
            log.error(e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("{}: {}", args[0], e.getMessage());
            return 1;
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("rugoc: {}", e.getMessage());
            return 1;
        }
    }

    private static void logModules(final ModuleRegistry modules) throws IOException {
        log.debug("Curated modules: {}", modules.curatedModules().size());
        ModuleDescriber describer = new ModuleDescriber();
        for (BridgeModule module : modules.bridgeModules()) {
            log.debug("Bridge {}:\n{}", module.getImportPath(), describer.toJson(module));
        }
    }
}
