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

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.rugo.codegen.GeneratedProgram;
import org.rugo.codegen.GoCodeGenerator;
import org.rugo.codegen.RuntimeTemplates;
import org.rugo.frontend.ast.FunctionDef;
import org.rugo.frontend.ast.Program;
import org.rugo.frontend.ast.RequireStmt;
import org.rugo.frontend.ast.Statement;
import org.rugo.frontend.error.CompileException;
import org.rugo.frontend.error.InternalCompilerException;
import org.rugo.frontend.parser.SourceParser;
import org.rugo.frontend.preprocess.PreprocessResult;
import org.rugo.frontend.preprocess.Preprocessor;
import org.rugo.frontend.walker.AstWalker;
import org.rugo.registry.ModuleRegistry;

/**
 * The whole pipeline for one compile unit: preprocess, parse, walk, link required units and
 * generate Go. Every failure surfaces as a {@link CompileException}.
 */
@Slf4j
public class RugoCompiler {

    private final ModuleRegistry registry;

    private final CompilerConfig config;

    private final SourceResolver resolver;

    private final Preprocessor preprocessor = new Preprocessor();

    private final SourceParser parser = new SourceParser();

    private final RuntimeTemplates templates = new RuntimeTemplates();

    public RugoCompiler(final ModuleRegistry registry) {
        this(registry, CompilerConfig.load(), SourceResolver.NONE);
    }

    public RugoCompiler(final ModuleRegistry registry, final CompilerConfig config, final SourceResolver resolver) {
        this.registry = Preconditions.checkNotNull(registry, "registry");
        this.config = Preconditions.checkNotNull(config, "config");
        this.resolver = Preconditions.checkNotNull(resolver, "resolver");
    }

    public GeneratedProgram compile(final String sourceName, final String source) {
        Preconditions.checkNotNull(sourceName, "sourceName");
        Preconditions.checkNotNull(source, "source");
        long start = System.currentTimeMillis();
        try {
            Program program = parse(sourceName, source);
            List<Statement> statements = new ArrayList<>(program.getStatements());
            statements.addAll(requiredFunctions(program, new HashSet<>()));
            Program linked = new Program(sourceName, program.getRawSource(), statements, program.getStructs());

            GoCodeGenerator generator = new GoCodeGenerator(templates, config.isEmitLineComments(), config.getGoPackage());
            GeneratedProgram generated = generator.generate(linked, registry);
            log.info("Compiled {} ({} statements) in {} ms",
                     sourceName, program.getStatements().size(), System.currentTimeMillis() - start);
            return generated;
        } catch (CompileException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InternalCompilerException(sourceName, 0, String.valueOf(e.getMessage()), e);
        }
    }

    Program parse(final String sourceName, final String source) {
        PreprocessResult preprocessed = preprocessor.preprocess(source);
        log.debug("Preprocessed {}: {} -> {} chars", sourceName, source.length(), preprocessed.getText().length());
        return AstWalker.walk(parser.parse(sourceName, preprocessed), preprocessed, sourceName);
    }

    /**
     * Function definitions of every unit {@code program} requires, transitively, each tagged with
     * the namespace it was required under.
     */
    private List<FunctionDef> requiredFunctions(final Program program, final Set<String> linked) {
        List<FunctionDef> result = new ArrayList<>();
        for (Statement s : program.getStatements()) {
            if (!(s instanceof RequireStmt)) {
                continue;
            }
            RequireStmt r = (RequireStmt) s;
            String namespace = GoCodeGenerator.requireNamespace(r);
            if (!linked.add(namespace + "=" + r.getPath())) {
                continue;
            }
            String text;
            try {
                text = resolver.resolve(r.getPath()).orElseThrow(() -> new CompileException(
                    program.getSourceName(), r.getLine(), "cannot resolve require \"" + r.getPath() + "\""));
            } catch (IOException e) {
                throw new CompileException(program.getSourceName(), r.getLine(),
                    "cannot read required unit \"" + r.getPath() + "\": " + e.getMessage(), e);
            }
            Program unit = parse(r.getPath(), text);
            for (Statement unitStatement : unit.getStatements()) {
                if (unitStatement instanceof FunctionDef) {
                    FunctionDef f = (FunctionDef) unitStatement;
                    f.setNamespace(namespace);
                    result.add(f);
                }
            }
            result.addAll(requiredFunctions(unit, linked));
            log.debug("Linked {} as {}", r.getPath(), namespace);
        }
        return result;
    }
}
