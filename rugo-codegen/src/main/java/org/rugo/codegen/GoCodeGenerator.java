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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.rugo.frontend.ast.ArrayLit;
import org.rugo.frontend.ast.AssignStmt;
import org.rugo.frontend.ast.BenchDef;
import org.rugo.frontend.ast.BinaryExpr;
import org.rugo.frontend.ast.BinaryOp;
import org.rugo.frontend.ast.BoolLit;
import org.rugo.frontend.ast.BreakStmt;
import org.rugo.frontend.ast.CallExpr;
import org.rugo.frontend.ast.DotAssignStmt;
import org.rugo.frontend.ast.DotExpr;
import org.rugo.frontend.ast.ElsifClause;
import org.rugo.frontend.ast.Expr;
import org.rugo.frontend.ast.ExprStmt;
import org.rugo.frontend.ast.FloatLit;
import org.rugo.frontend.ast.FnExpr;
import org.rugo.frontend.ast.ForStmt;
import org.rugo.frontend.ast.FunctionDef;
import org.rugo.frontend.ast.HashLit;
import org.rugo.frontend.ast.IdentExpr;
import org.rugo.frontend.ast.IfStmt;
import org.rugo.frontend.ast.ImportStmt;
import org.rugo.frontend.ast.IndexAssignStmt;
import org.rugo.frontend.ast.IndexExpr;
import org.rugo.frontend.ast.IntLit;
import org.rugo.frontend.ast.NextStmt;
import org.rugo.frontend.ast.NilLit;
import org.rugo.frontend.ast.Node;
import org.rugo.frontend.ast.ParallelExpr;
import org.rugo.frontend.ast.Program;
import org.rugo.frontend.ast.RequireStmt;
import org.rugo.frontend.ast.ReturnStmt;
import org.rugo.frontend.ast.SliceExpr;
import org.rugo.frontend.ast.SpawnExpr;
import org.rugo.frontend.ast.Statement;
import org.rugo.frontend.ast.StringLit;
import org.rugo.frontend.ast.TestDef;
import org.rugo.frontend.ast.TryExpr;
import org.rugo.frontend.ast.UnaryExpr;
import org.rugo.frontend.ast.UseStmt;
import org.rugo.frontend.ast.WhileStmt;
import org.rugo.frontend.error.CompileException;
import org.rugo.frontend.error.InternalCompilerException;
import org.rugo.registry.CuratedModule;
import org.rugo.registry.ModuleFunction;
import org.rugo.registry.ModuleRegistry;
import org.rugo.registry.bridge.BridgeFunction;
import org.rugo.registry.bridge.BridgeModule;
import org.rugo.registry.bridge.TypeClassification;

/**
 * Translates a walked {@link Program} into one Go source file.
 *
 * <p>Every Rugo value is an {@code interface{}} in the generated code; operators, truthiness,
 * indexing and iteration go through the runtime helpers rendered from the templates. User
 * functions become {@code rugofn_<name>} (or {@code rugons_<ns>_<name>} for required units)
 * with fixed arity, and calls into curated modules or bridged Go packages go through wrappers
 * emitted once per called function.
 *
 * <p>Instances keep per-program state and are not thread-safe.
 */
@Slf4j
public class GoCodeGenerator {

    /** Identifiers of every package the runtime or a curated module may import. */
    private static final Set<String> RUNTIME_PACKAGES = Set.of(
        "fmt", "os", "exec", "runtime", "sort", "strconv", "strings", "sync", "time");

    private final RuntimeTemplates templates;

    private final boolean emitLineComments;

    private final String goPackage;

    // ---- Per-program state ----

    private String sourceName;

    private ModuleRegistry registry;

    private final Map<String, FunctionDef> functions = new LinkedHashMap<>();

    private final Map<String, Map<String, FunctionDef>> namespaces = new TreeMap<>();

    private final Map<String, CuratedModule> usedModules = new TreeMap<>();

    private final Map<String, BridgeModule> importAliases = new TreeMap<>();

    private final Set<String> packageNames = new HashSet<>();

    private final Set<String> imports = new TreeSet<>();

    private final Set<String> silencers = new TreeSet<>();

    private final Map<String, String> wrappers = new TreeMap<>();

    /** Top-level variables promoted to package level. */
    private final Set<String> globalNames = new HashSet<>();

    private Scope packageScope;

    private Scope scope;

    private GoWriter out;

    /** Source line of the statement being emitted; closures restore it after their body. */
    private int currentLine;

    /** The current body returns a value: functions and closures. */
    private boolean valueReturn;

    private int loopDepth;

    private FunctionDef currentFunction;

    private int tempCounter;

    public GoCodeGenerator() {
        this(new RuntimeTemplates(), false, "main");
    }

    public GoCodeGenerator(final RuntimeTemplates templates, final boolean emitLineComments, final String goPackage) {
        this.templates = templates;
        this.emitLineComments = emitLineComments;
        this.goPackage = goPackage;
    }

    public GeneratedProgram generate(final Program program, final ModuleRegistry registry) {
        Preconditions.checkNotNull(program, "program");
        Preconditions.checkNotNull(registry, "registry");
        reset(program.getSourceName(), registry);

        FeatureScan features = FeatureScan.of(program);
        imports.addAll(features.imports());

        registerDeclarations(program.getStatements());
        promoteGlobals(program.getStatements());

        List<String> declarations = new ArrayList<>();
        List<String> tests = new ArrayList<>();
        List<String> benches = new ArrayList<>();
        for (Statement s : program.getStatements()) {
            if (s instanceof FunctionDef) {
                declarations.add(visitFunctionDef((FunctionDef) s));
            } else if (s instanceof TestDef) {
                TestDef t = (TestDef) s;
                String goName = "rugotest_" + (tests.size() + 1);
                declarations.add(visitTestBody(goName, t.getBody()));
                tests.add("{" + GoNames.quote(t.getName()) + ", " + goName + "}");
            } else if (s instanceof BenchDef) {
                BenchDef b = (BenchDef) s;
                String goName = "rugobench_" + (benches.size() + 1);
                declarations.add(visitTestBody(goName, b.getBody()));
                benches.add("{" + GoNames.quote(b.getName()) + ", " + goName + "}");
            }
        }

        out = new GoWriter(1);
        scope = packageScope.child();
        valueReturn = false;
        currentFunction = null;
        emitBody(program.getStatements(), false);
        String mainBody = out.toString();

        StringBuilder decls = new StringBuilder();
        for (String wrapper : wrappers.values()) {
            decls.append('\n').append(wrapper);
        }
        for (String decl : declarations) {
            decls.append('\n').append(decl);
        }

        List<String> moduleRuntimes = new ArrayList<>();
        List<String> moduleVars = new ArrayList<>();
        for (CuratedModule m : usedModules.values()) {
            moduleRuntimes.add(m.getRuntime());
            moduleVars.add(m.instanceVar() + " = &" + m.getType() + "{}");
        }
        String runtime = templates.runtime(features.isTasks(), features.isBridge());

        List<String> quotedImports = new ArrayList<>();
        for (String imp : imports) {
            quotedImports.add(GoNames.quote(imp));
        }
        List<String> globals = new ArrayList<>();
        for (String name : new TreeSet<>(globalNames)) {
            globals.add(packageScope.lookup(name));
        }

        Map<String, Object> model = new HashMap<>();
        model.put("sourceName", sourceName);
        model.put("sourceLiteral", GoNames.quote(sourceName));
        model.put("goPackage", goPackage);
        model.put("imports", quotedImports);
        model.put("silencers", new ArrayList<>(silencers));
        model.put("runtime", runtime);
        model.put("moduleRuntimes", moduleRuntimes);
        model.put("moduleVars", moduleVars);
        model.put("globals", globals);
        model.put("tests", tests);
        model.put("benches", benches);
        model.put("declarations", decls.toString());
        model.put("mainBody", mainBody);
        String source = templates.program(model);

        StringBuilder runtimeText = new StringBuilder(runtime);
        for (String moduleRuntime : moduleRuntimes) {
            runtimeText.append('\n').append(moduleRuntime);
        }
        log.debug("Generated {}: {} functions, {} wrappers, {} imports",
                  sourceName, declarations.size(), wrappers.size(), imports.size());
        return new GeneratedProgram(source, ImmutableList.copyOf(imports), runtimeText.toString());
    }

    private void reset(final String sourceName, final ModuleRegistry registry) {
        this.sourceName = sourceName;
        this.registry = registry;
        functions.clear();
        namespaces.clear();
        usedModules.clear();
        importAliases.clear();
        packageNames.clear();
        packageNames.addAll(RUNTIME_PACKAGES);
        imports.clear();
        silencers.clear();
        wrappers.clear();
        globalNames.clear();
        packageScope = new Scope(null);
        scope = packageScope;
        loopDepth = 0;
        tempCounter = 0;
        currentFunction = null;
    }

    // ---- Declarations ----

    private void registerDeclarations(final List<Statement> statements) {
        for (Statement s : statements) {
            if (s instanceof FunctionDef) {
                registerFunction((FunctionDef) s);
            } else if (s instanceof UseStmt) {
                registerUse((UseStmt) s);
            } else if (s instanceof ImportStmt) {
                registerImport((ImportStmt) s);
            } else if (s instanceof RequireStmt) {
                RequireStmt r = (RequireStmt) s;
                namespaces.computeIfAbsent(requireNamespace(r), k -> new LinkedHashMap<>());
            }
            s.forEachChild(this::checkNotNested);
        }
        for (CuratedModule m : usedModules.values()) {
            packageNames.add(m.getType());
            for (String goImport : m.getGoImports()) {
                imports.add(goImport);
                packageNames.add(lastSegment(goImport));
            }
        }
        for (Map.Entry<String, BridgeModule> e : importAliases.entrySet()) {
            BridgeModule m = e.getValue();
            imports.add(m.getImportPath());
            List<BridgeFunction> bridged = m.bridged();
            if (!bridged.isEmpty()) {
                silencers.add(m.getPackageName() + "." + bridged.get(0).getGoName());
            }
        }
    }

    /**
     * @return the namespace a required unit's functions are called through
     */
    public static String requireNamespace(final RequireStmt r) {
        if (r.getAlias() != null) {
            return r.getAlias();
        }
        return lastSegment(r.getPath());
    }

    private static String lastSegment(final String path) {
        String trimmed = path.endsWith(".rugo") ? path.substring(0, path.length() - ".rugo".length()) : path;
        int slash = trimmed.lastIndexOf('/');
        return slash < 0 ? trimmed : trimmed.substring(slash + 1);
    }

    private void registerFunction(final FunctionDef f) {
        Set<String> seen = new HashSet<>();
        for (String p : f.getParams()) {
            if (!seen.add(p)) {
                throw error(f, "duplicate parameter " + p + " in " + f.getName() + "()");
            }
        }
        if (f.getNamespace() != null) {
            Map<String, FunctionDef> ns = namespaces.computeIfAbsent(f.getNamespace(), k -> new LinkedHashMap<>());
            FunctionDef previous = ns.putIfAbsent(f.getName(), f);
            if (previous != null) {
                throw error(f, "function \"" + f.getNamespace() + "." + f.getName()
                    + "\" already defined at line " + previous.getLine());
            }
            return;
        }
        FunctionDef previous = functions.putIfAbsent(f.getName(), f);
        if (previous != null) {
            throw error(f, "function \"" + f.getName() + "\" already defined at line " + previous.getLine());
        }
    }

    private void registerUse(final UseStmt u) {
        Optional<CuratedModule> module = registry.curatedModule(u.getModule());
        if (!module.isPresent()) {
            throw error(u, "unknown module \"" + u.getModule() + "\"");
        }
        usedModules.put(u.getModule(), module.get());
    }

    private void registerImport(final ImportStmt i) {
        Optional<BridgeModule> found = registry.bridgeModule(i.getPath());
        if (!found.isPresent()) {
            throw error(i, "Go package \"" + i.getPath() + "\" is not registered for bridging");
        }
        BridgeModule module = found.get();
        String alias = i.getAlias() != null ? i.getAlias() : module.defaultAlias();
        BridgeModule existing = importAliases.get(alias);
        if (existing != null && !existing.getImportPath().equals(module.getImportPath())) {
            throw error(i, "import alias " + alias + " already used for \"" + existing.getImportPath() + "\"");
        }
        for (BridgeModule other : importAliases.values()) {
            if (!other.getImportPath().equals(module.getImportPath())
                && other.getPackageName().equals(module.getPackageName())) {
                throw error(i, "Go package name " + module.getPackageName() + " of \"" + module.getImportPath()
                    + "\" clashes with \"" + other.getImportPath() + "\"");
            }
        }
        if (RUNTIME_PACKAGES.contains(module.getPackageName())) {
            throw error(i, "Go package name " + module.getPackageName() + " clashes with a runtime import");
        }
        importAliases.put(alias, module);
        packageNames.add(module.getPackageName());
    }

    private void checkNotNested(final Node node) {
        if (node instanceof FunctionDef || node instanceof TestDef || node instanceof BenchDef) {
            throw error(node, "definitions are only allowed at the top level");
        }
        if (node instanceof UseStmt || node instanceof ImportStmt || node instanceof RequireStmt) {
            throw error(node, "use, import and require are only allowed at the top level");
        }
        node.forEachChild(this::checkNotNested);
    }

    /**
     * Top-level variables that any function, test or bench body mentions become package-level
     * variables.
     */
    private void promoteGlobals(final List<Statement> statements) {
        Set<String> topLevel = new LinkedHashSet<>();
        Set<String> inFunctions = new HashSet<>();
        for (Statement s : statements) {
            if (s instanceof FunctionDef || s instanceof TestDef || s instanceof BenchDef) {
                s.forEachChild(child -> collectNames(child, inFunctions));
            } else {
                collectAssigned(s, topLevel, true);
            }
        }
        for (String name : topLevel) {
            if (inFunctions.contains(name)) {
                globalNames.add(name);
                packageScope.declare(name, GoNames.local(name, packageNames));
            }
        }
        Map<String, AssignStmt> first = new HashMap<>();
        for (Statement s : statements) {
            collectFirstAssignments(s, first);
        }
        for (String name : globalNames) {
            if (isConstant(name) && first.containsKey(name)) {
                packageScope.bindConstant(name, first.get(name));
            }
        }
    }

    /** Uppercase names are constants once declared. */
    private static boolean isConstant(final String name) {
        return !name.isEmpty() && name.charAt(0) >= 'A' && name.charAt(0) <= 'Z';
    }

    /**
     * First assignment to each name in source order, descending into nested blocks but not into
     * closures or definitions.
     */
    private static void collectFirstAssignments(final Statement s, final Map<String, AssignStmt> first) {
        if (s instanceof AssignStmt) {
            first.putIfAbsent(((AssignStmt) s).getTarget(), (AssignStmt) s);
        } else if (s instanceof IfStmt) {
            IfStmt i = (IfStmt) s;
            collectFirstAssignments(i.getBody(), first);
            for (ElsifClause c : i.getElsifClauses()) {
                collectFirstAssignments(c.getBody(), first);
            }
            collectFirstAssignments(i.getElseBody(), first);
        } else if (s instanceof WhileStmt) {
            collectFirstAssignments(((WhileStmt) s).getBody(), first);
        } else if (s instanceof ForStmt) {
            collectFirstAssignments(((ForStmt) s).getBody(), first);
        }
    }

    private static void collectFirstAssignments(final List<Statement> body, final Map<String, AssignStmt> first) {
        if (body == null) {
            return;
        }
        for (Statement s : body) {
            collectFirstAssignments(s, first);
        }
    }

    private static void collectNames(final Node node, final Set<String> names) {
        if (node instanceof IdentExpr) {
            names.add(((IdentExpr) node).getName());
        } else if (node instanceof AssignStmt) {
            names.add(((AssignStmt) node).getTarget());
        } else if (node instanceof ForStmt) {
            addLoopVars((ForStmt) node, names);
        }
        node.forEachChild(child -> collectNames(child, names));
    }

    /**
     * Assignment targets and loop variables of a statement, descending into nested blocks but
     * not into closures.
     */
    private static void collectAssigned(final Statement s, final Set<String> names, final boolean nested) {
        if (s instanceof AssignStmt) {
            names.add(((AssignStmt) s).getTarget());
        } else if (!nested) {
            return;
        } else if (s instanceof IfStmt) {
            IfStmt i = (IfStmt) s;
            collectAssigned(i.getBody(), names);
            for (ElsifClause c : i.getElsifClauses()) {
                collectAssigned(c.getBody(), names);
            }
            collectAssigned(i.getElseBody(), names);
        } else if (s instanceof WhileStmt) {
            collectAssigned(((WhileStmt) s).getBody(), names);
        } else if (s instanceof ForStmt) {
            addLoopVars((ForStmt) s, names);
            collectAssigned(((ForStmt) s).getBody(), names);
        }
    }

    private static void collectAssigned(final List<Statement> body, final Set<String> names) {
        if (body == null) {
            return;
        }
        for (Statement s : body) {
            collectAssigned(s, names, true);
        }
    }

    private static void addLoopVars(final ForStmt f, final Set<String> names) {
        names.add(f.getVar());
        if (f.getIndexVar() != null) {
            names.add(f.getIndexVar());
        }
    }

    // ---- Functions ----

    private String visitFunctionDef(final FunctionDef f) {
        String goName = functionName(f);
        List<String> params = new ArrayList<>();
        scope = packageScope.child();
        for (String p : f.getParams()) {
            String goParam = GoNames.local(p, packageNames);
            scope.declare(p, goParam);
            params.add(goParam + " interface{}");
        }
        out = new GoWriter(1);
        valueReturn = true;
        currentFunction = f;
        emitBody(f.getBody(), true);
        currentFunction = null;
        return "func " + goName + "(" + String.join(", ", params) + ") interface{} {\n" + out + "}\n";
    }

    private String visitTestBody(final String goName, final List<Statement> body) {
        scope = packageScope.child();
        out = new GoWriter(1);
        valueReturn = false;
        currentFunction = null;
        emitBody(body, false);
        return "func " + goName + "() {\n" + out + "}\n";
    }

    private static String functionName(final FunctionDef f) {
        if (f.getNamespace() != null) {
            return "rugons_" + f.getNamespace() + "_" + f.getName();
        }
        return "rugofn_" + f.getName();
    }

    /**
     * Emit a function or closure body into {@link #out}. Variables first assigned inside nested
     * blocks are declared up front; with {@code valueReturn} the trailing expression is the
     * result.
     */
    private void emitBody(final List<Statement> body, final boolean returnsValue) {
        Set<String> topLevel = new HashSet<>();
        Set<String> hoisted = new LinkedHashSet<>();
        for (Statement s : body) {
            if (s instanceof AssignStmt) {
                topLevel.add(((AssignStmt) s).getTarget());
            } else {
                Set<String> nested = new LinkedHashSet<>();
                collectAssigned(s, nested, true);
                for (String name : nested) {
                    if (!topLevel.contains(name)) {
                        hoisted.add(name);
                    }
                }
            }
        }
        for (String name : hoisted) {
            if (!scope.isVisible(name)) {
                String goName = GoNames.local(name, packageNames);
                scope.declare(name, goName);
                out.line("var " + goName + " interface{}");
                out.line("_ = " + goName);
            }
        }
        for (int i = 0; i < body.size(); i++) {
            visitStatement(body.get(i), returnsValue && i == body.size() - 1);
        }
        if (returnsValue) {
            out.line("return nil");
        }
    }

    // ---- Statement Visiting ----

    private void visitStatement(final Statement s, final boolean tail) {
        if (s instanceof FunctionDef || s instanceof TestDef || s instanceof BenchDef
            || s instanceof UseStmt || s instanceof ImportStmt || s instanceof RequireStmt) {
            return;
        }
        if (emitLineComments) {
            out.line("// line " + s.getLine());
        }
        if (s.getLine() > 0) {
            currentLine = s.getLine();
            out.line("//line " + directiveFile() + ":" + currentLine);
        }
        if (s instanceof ExprStmt) {
            String e = visitExpr(((ExprStmt) s).getExpression());
            out.line(tail ? "return " + e : "_ = " + e);
        } else if (s instanceof AssignStmt) {
            AssignStmt a = (AssignStmt) s;
            AssignStmt first = scope.constant(a.getTarget());
            if (first != null && first != a) {
                throw error(a, "cannot reassign constant " + a.getTarget() + " (first assigned at line "
                    + first.getLine() + ")");
            }
            boolean declared = assign(a.getTarget(), visitExpr(a.getValue()));
            if (declared && isConstant(a.getTarget())) {
                scope.bindConstant(a.getTarget(), a);
            }
        } else if (s instanceof IndexAssignStmt) {
            IndexAssignStmt a = (IndexAssignStmt) s;
            out.line("rugo_index_set(" + visitExpr(a.getObject()) + ", " + visitExpr(a.getIndex()) + ", "
                + visitExpr(a.getValue()) + ")");
        } else if (s instanceof DotAssignStmt) {
            DotAssignStmt a = (DotAssignStmt) s;
            out.line("rugo_dot_set(" + visitExpr(a.getObject()) + ", " + GoNames.quote(a.getField()) + ", "
                + visitExpr(a.getValue()) + ")");
        } else if (s instanceof IfStmt) {
            visitIf((IfStmt) s, tail);
        } else if (s instanceof WhileStmt) {
            WhileStmt w = (WhileStmt) s;
            out.open("for rugo_truthy(" + visitExpr(w.getCondition()) + ") {");
            visitLoopBody(w.getBody());
            out.close("}");
        } else if (s instanceof ForStmt) {
            visitFor((ForStmt) s);
        } else if (s instanceof ReturnStmt) {
            visitReturn((ReturnStmt) s);
        } else if (s instanceof BreakStmt) {
            if (loopDepth == 0) {
                throw error(s, "break outside of a loop");
            }
            out.line("break");
        } else if (s instanceof NextStmt) {
            if (loopDepth == 0) {
                throw error(s, "next outside of a loop");
            }
            out.line("continue");
        } else {
            throw new InternalCompilerException(sourceName, s.getLine(),
                "Unsupported statement type: " + s.getClass().getSimpleName());
        }
    }

    /**
     * @return whether the assignment declared a new variable
     */
    private boolean assign(final String target, final String value) {
        String goName = scope.lookup(target);
        if (goName != null) {
            out.line(goName + " = " + value);
            return false;
        }
        goName = GoNames.local(target, packageNames);
        scope.declare(target, goName);
        out.line(goName + " := " + value);
        out.line("_ = " + goName);
        return true;
    }

    private void visitIf(final IfStmt s, final boolean tail) {
        out.open("if rugo_truthy(" + visitExpr(s.getCondition()) + ") {");
        visitBlock(s.getBody(), tail);
        for (ElsifClause c : s.getElsifClauses()) {
            out.reopen("} else if rugo_truthy(" + visitExpr(c.getCondition()) + ") {");
            visitBlock(c.getBody(), tail);
        }
        if (s.getElseBody() != null && !s.getElseBody().isEmpty()) {
            out.reopen("} else {");
            visitBlock(s.getElseBody(), tail);
        }
        out.close("}");
    }

    private void visitBlock(final List<Statement> body, final boolean tail) {
        for (int i = 0; i < body.size(); i++) {
            visitStatement(body.get(i), tail && i == body.size() - 1);
        }
    }

    private void visitLoopBody(final List<Statement> body) {
        loopDepth++;
        visitBlock(body, false);
        loopDepth--;
    }

    private void visitFor(final ForStmt f) {
        String collection = visitExpr(f.getCollection());
        String it = "_it" + (++tempCounter);
        out.open("for _, " + it + " := range rugo_iterable(" + collection + ") {");
        if (f.getIndexVar() == null) {
            assign(f.getVar(), it + ".one");
        } else {
            assign(f.getVar(), it + ".key");
            assign(f.getIndexVar(), it + ".value");
        }
        visitLoopBody(f.getBody());
        out.close("}");
    }

    private void visitReturn(final ReturnStmt r) {
        if (valueReturn) {
            out.line(r.getValue() == null ? "return nil" : "return " + visitExpr(r.getValue()));
            return;
        }
        if (r.getValue() != null) {
            out.line("_ = " + visitExpr(r.getValue()));
        }
        out.line("return");
    }

    // ---- Expression Visiting ----

    private String visitExpr(final Expr e) {
        if (e instanceof IntLit) {
            return "interface{}(" + ((IntLit) e).getValue() + ")";
        }
        if (e instanceof FloatLit) {
            return "interface{}(float64(" + ((FloatLit) e).getText() + "))";
        }
        if (e instanceof StringLit) {
            return "interface{}(" + GoNames.quote(((StringLit) e).getValue()) + ")";
        }
        if (e instanceof BoolLit) {
            return "interface{}(" + ((BoolLit) e).isValue() + ")";
        }
        if (e instanceof NilLit) {
            return "interface{}(nil)";
        }
        if (e instanceof IdentExpr) {
            return visitIdent((IdentExpr) e);
        }
        if (e instanceof DotExpr) {
            return visitDot((DotExpr) e);
        }
        if (e instanceof IndexExpr) {
            IndexExpr i = (IndexExpr) e;
            return "rugo_index(" + visitExpr(i.getObject()) + ", " + visitExpr(i.getIndex()) + ")";
        }
        if (e instanceof SliceExpr) {
            SliceExpr sl = (SliceExpr) e;
            return "rugo_slice(" + visitExpr(sl.getObject()) + ", " + visitExpr(sl.getStart()) + ", "
                + visitExpr(sl.getLength()) + ")";
        }
        if (e instanceof CallExpr) {
            return visitCall((CallExpr) e);
        }
        if (e instanceof BinaryExpr) {
            return visitBinary((BinaryExpr) e);
        }
        if (e instanceof UnaryExpr) {
            UnaryExpr u = (UnaryExpr) e;
            return u.getOp().getRuntimeHelper() + "(" + visitExpr(u.getOperand()) + ")";
        }
        if (e instanceof ArrayLit) {
            return "interface{}([]interface{}{" + joinExprs(((ArrayLit) e).getElements()) + "})";
        }
        if (e instanceof HashLit) {
            List<String> parts = new ArrayList<>();
            for (HashLit.Entry entry : ((HashLit) e).getEntries()) {
                parts.add(visitExpr(entry.getKey()));
                parts.add(visitExpr(entry.getValue()));
            }
            return "rugo_hash(" + String.join(", ", parts) + ")";
        }
        if (e instanceof TryExpr) {
            return visitTry((TryExpr) e);
        }
        if (e instanceof SpawnExpr) {
            return visitSpawn((SpawnExpr) e);
        }
        if (e instanceof ParallelExpr) {
            return visitParallel((ParallelExpr) e);
        }
        if (e instanceof FnExpr) {
            return visitFn((FnExpr) e);
        }
        throw new InternalCompilerException(sourceName, e.getLine(),
            "Unsupported expression type: " + e.getClass().getSimpleName());
    }

    private String joinExprs(final List<Expr> exprs) {
        List<String> parts = new ArrayList<>(exprs.size());
        for (Expr e : exprs) {
            parts.add(visitExpr(e));
        }
        return String.join(", ", parts);
    }

    private String visitBinary(final BinaryExpr b) {
        String left = visitExpr(b.getLeft());
        String right = visitExpr(b.getRight());
        if (b.getOp() == BinaryOp.AND || b.getOp() == BinaryOp.OR) {
            String helper = b.getOp() == BinaryOp.AND ? "rugo_and" : "rugo_or";
            return helper + "(" + left + ", func() interface{} { return " + right + " })";
        }
        return b.getOp().getRuntimeHelper() + "(" + left + ", " + right + ")";
    }

    private String visitIdent(final IdentExpr id) {
        String goName = scope.lookup(id.getName());
        if (goName != null) {
            return goName;
        }
        FunctionDef f = resolveFunction(id.getName());
        if (f != null) {
            return functionValue(f);
        }
        throw error(id, "undefined: " + id.getName());
    }

    /**
     * A user function used as a value: a closure adapter with a runtime arity check.
     */
    private String functionValue(final FunctionDef f) {
        List<String> args = new ArrayList<>();
        for (int i = 0; i < f.getParams().size(); i++) {
            args.add("_args[" + i + "]");
        }
        return "interface{}(func(_args ...interface{}) interface{} {\n"
            + "\trugo_check_arity(" + GoNames.quote(f.getName()) + ", " + f.getParams().size() + ", len(_args))\n"
            + "\treturn " + functionName(f) + "(" + String.join(", ", args) + ")\n"
            + "})";
    }

    /**
     * Sibling functions of the current required unit first, then top-level functions.
     */
    private FunctionDef resolveFunction(final String name) {
        if (currentFunction != null && currentFunction.getNamespace() != null) {
            FunctionDef sibling = namespaces.get(currentFunction.getNamespace()).get(name);
            if (sibling != null) {
                return sibling;
            }
        }
        return functions.get(name);
    }

    private String visitDot(final DotExpr d) {
        if (d.getObject() instanceof IdentExpr) {
            String name = ((IdentExpr) d.getObject()).getName();
            String goName = scope.lookup(name);
            if (goName != null) {
                return "rugo_dot_get(" + goName + ", " + GoNames.quote(d.getField()) + ")";
            }
            String call = namespaceCall(d, name, d.getField(), ImmutableList.of());
            if (call != null) {
                return call;
            }
            throw error(d, "undefined: " + name);
        }
        return "rugo_dot_get(" + visitExpr(d.getObject()) + ", " + GoNames.quote(d.getField()) + ")";
    }

    // ---- Calls ----

    private String visitCall(final CallExpr c) {
        List<String> args = new ArrayList<>();
        for (Expr a : c.getArgs()) {
            args.add(visitExpr(a));
        }
        Expr callee = c.getCallee();
        if (callee instanceof IdentExpr) {
            return callNamed(c, ((IdentExpr) callee).getName(), args);
        }
        if (callee instanceof DotExpr) {
            DotExpr d = (DotExpr) callee;
            if (d.getObject() instanceof IdentExpr) {
                String name = ((IdentExpr) d.getObject()).getName();
                String goName = scope.lookup(name);
                if (goName != null) {
                    return methodCall(goName, d.getField(), args);
                }
                String call = namespaceCall(c, name, d.getField(), args);
                if (call != null) {
                    return call;
                }
                throw error(c, "undefined: " + name);
            }
            return methodCall(visitExpr(d.getObject()), d.getField(), args);
        }
        return "rugo_call(" + prepend(visitExpr(callee), args) + ")";
    }

    private String callNamed(final Node at, final String name, final List<String> args) {
        Builtin builtin = Builtin.of(name);
        if (builtin != null) {
            String arityError = builtin.arityError(args.size());
            if (arityError != null) {
                throw error(at, arityError);
            }
            String call = builtin.getHelper() + "(" + String.join(", ", args) + ")";
            return builtin.isBoxed() ? call : "interface{}(" + call + ")";
        }
        FunctionDef f = resolveFunction(name);
        if (f != null) {
            checkArity(at, name, f.getParams().size(), args.size());
            return functionName(f) + "(" + String.join(", ", args) + ")";
        }
        String goName = scope.lookup(name);
        if (goName != null) {
            return "rugo_call(" + prepend(goName, args) + ")";
        }
        throw error(at, "undefined: " + name);
    }

    /**
     * {@code obj.name(args)} on a value. A top-level function whose first parameter is
     * {@code self} and whose arity fits is called directly with the receiver; anything else is
     * dispatched at run time.
     */
    private String methodCall(final String receiver, final String name, final List<String> args) {
        FunctionDef f = functions.get(name);
        if (f != null && !f.getParams().isEmpty() && "self".equals(f.getParams().get(0))
            && f.getParams().size() == args.size() + 1) {
            return functionName(f) + "(" + prepend(receiver, args) + ")";
        }
        return "rugo_dot_call(" + prepend(receiver + ", " + GoNames.quote(name), args) + ")";
    }

    /**
     * {@code ns.fn(args)} where {@code ns} names a used module, an imported Go package or a
     * required unit.
     *
     * @return the Go call, or null when {@code ns} is none of these
     */
    private String namespaceCall(final Node at, final String ns, final String fn, final List<String> args) {
        CuratedModule module = usedModules.get(ns);
        if (module != null) {
            ModuleFunction function = module.function(fn).orElseThrow(
                () -> error(at, "undefined: " + ns + "." + fn));
            if (!function.isVariadic() && args.size() > function.minArgs()) {
                throw error(at, ns + "." + fn + "() takes " + function.minArgs() + " argument(s) but "
                    + args.size() + " given");
            }
            String wrapper = module.wrapperName(function);
            wrappers.computeIfAbsent(wrapper, k -> WrapperEmitter.curated(module, function));
            return wrapper + "(" + String.join(", ", args) + ")";
        }
        BridgeModule bridge = importAliases.get(ns);
        if (bridge != null) {
            return bridgeCall(at, ns, bridge, fn, args);
        }
        Map<String, FunctionDef> unit = namespaces.get(ns);
        if (unit != null) {
            FunctionDef f = unit.get(fn);
            if (f == null) {
                throw error(at, "undefined: " + ns + "." + fn);
            }
            checkArity(at, ns + "." + fn, f.getParams().size(), args.size());
            return functionName(f) + "(" + String.join(", ", args) + ")";
        }
        return null;
    }

    private String bridgeCall(final Node at, final String alias, final BridgeModule module, final String fn,
                              final List<String> args) {
        Optional<BridgeFunction> found = module.function(fn);
        if (!found.isPresent()) {
            for (BridgeFunction rejected : module.getFunctions()) {
                if (rejected.getRugoName().equals(fn) || rejected.getGoName().equals(fn)) {
                    throw error(at, alias + "." + fn + " cannot be called from Rugo: " + rejected.getReason());
                }
            }
            throw error(at, "undefined: " + alias + "." + fn);
        }
        BridgeFunction function = found.get();
        int fixed = function.fixedArity();
        if (function.isVariadic() && args.size() < fixed) {
            throw error(at, alias + "." + fn + "() takes at least " + fixed + " argument(s) but " + args.size() + " given");
        }
        if (!function.isVariadic() && args.size() != fixed) {
            throw error(at, alias + "." + fn + "() takes " + fixed + " argument(s) but " + args.size() + " given");
        }
        String wrapper = BridgeModule.wrapperName(alias, function);
        if (!wrappers.containsKey(wrapper)) {
            wrappers.put(wrapper, WrapperEmitter.bridge(alias, module, function));
            addConversionImports(function.getParams());
            addConversionImports(function.getReturns());
        }
        return wrapper + "(" + String.join(", ", args) + ")";
    }

    private void addConversionImports(final List<TypeClassification> types) {
        for (TypeClassification t : types) {
            String required = t.getKind().requiredImport();
            if (required != null) {
                imports.add(required);
            }
        }
    }

    private void checkArity(final Node at, final String name, final int expected, final int given) {
        if (expected != given) {
            throw error(at, name + "() takes " + expected + " argument(s) but " + given + " given");
        }
    }

    private static String prepend(final String first, final List<String> rest) {
        if (rest.isEmpty()) {
            return first;
        }
        return first + ", " + String.join(", ", rest);
    }

    // ---- Closures: try, spawn, parallel, fn ----

    private String visitTry(final TryExpr t) {
        String value = visitExpr(t.getExpr());
        Scope handlerScope = scope.child();
        String errName = GoNames.local(t.getErrVar(), packageNames);
        handlerScope.declare(t.getErrVar(), errName);
        String handler = closure("func(" + errName + " interface{}) interface{}", t.getHandler(), handlerScope,
                                 ImmutableList.of("_ = " + errName));
        GoWriter w = new GoWriter(0);
        w.open("func() (_res interface{}) {");
        w.open("defer func() {");
        w.open("if _r := recover(); _r != nil {");
        w.line("_res = " + handler + "(rugo_error_of(_r).msg)");
        w.close("}");
        w.close("}()");
        w.line("return " + value);
        w.close("}()");
        return trimTrailingNewline(w.toString());
    }

    private String visitSpawn(final SpawnExpr s) {
        if (s.getBody().isEmpty()) {
            return "interface{}(rugo_task_resolved())";
        }
        return "interface{}(rugo_spawn(" + closure("func() interface{}", s.getBody(), scope.child(),
                                                    ImmutableList.of()) + "))";
    }

    /**
     * One goroutine per top-level statement of the block; each statement's value fills the
     * result slot at its position.
     */
    private String visitParallel(final ParallelExpr p) {
        List<String> branches = new ArrayList<>();
        for (Statement s : p.getBody()) {
            branches.add(closure("func() interface{}", ImmutableList.of(s), scope.child(), ImmutableList.of()));
        }
        return "rugo_parallel(" + String.join(", ", branches) + ")";
    }

    private String visitFn(final FnExpr f) {
        Scope fnScope = scope.child();
        List<String> preamble = new ArrayList<>();
        preamble.add("rugo_check_arity(\"fn\", " + f.getParams().size() + ", len(_args))");
        for (int i = 0; i < f.getParams().size(); i++) {
            String p = f.getParams().get(i);
            String goName = GoNames.local(p, packageNames);
            fnScope.declare(p, goName);
            preamble.add(goName + " := _args[" + i + "]");
            preamble.add("_ = " + goName);
        }
        return "interface{}(" + closure("func(_args ...interface{}) interface{}", f.getBody(), fnScope, preamble) + ")";
    }

    /**
     * Render {@code body} as a Go function literal evaluating to its last expression.
     */
    private String closure(final String header, final List<Statement> body, final Scope closureScope,
                           final List<String> preamble) {
        GoWriter savedOut = out;
        Scope savedScope = scope;
        int savedLine = currentLine;
        boolean savedValue = valueReturn;
        int savedLoops = loopDepth;
        try {
            out = new GoWriter(1);
            scope = closureScope;
            valueReturn = true;
            loopDepth = 0;
            for (String line : preamble) {
                out.line(line);
            }
            emitBody(body, true);
            String text = header + " {\n" + out + "}";
            return savedLine > 0 ? text + "/*line " + directiveFile() + ":" + savedLine + ":1*/" : text;
        } finally {
            out = savedOut;
            scope = savedScope;
            currentLine = savedLine;
            valueReturn = savedValue;
            loopDepth = savedLoops;
        }
    }

    /**
     * File name for {@code //line} directives; failures report the Rugo line these give the
     * calling frame.
     */
    private String directiveFile() {
        return CharMatcher.anyOf("\r\n").replaceFrom(sourceName, ' ');
    }

    private static String trimTrailingNewline(final String s) {
        return s.endsWith("\n") ? s.substring(0, s.length() - 1) : s;
    }

    private CompileException error(final Node at, final String message) {
        return new CompileException(sourceName, at.getLine(), message);
    }
}
