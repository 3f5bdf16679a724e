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

package org.rugo.frontend.walker;

import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
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
import org.rugo.frontend.ast.UnaryOp;
import org.rugo.frontend.ast.UseStmt;
import org.rugo.frontend.ast.WhileStmt;
import org.rugo.frontend.error.InternalCompilerException;
import org.rugo.frontend.error.RugoSyntaxException;
import org.rugo.frontend.grammar.RugoBaseVisitor;
import org.rugo.frontend.grammar.RugoParser;
import org.rugo.frontend.preprocess.PreprocessResult;

/**
 * Lowers the {@code Rugo.g4} parse tree into {@link Program}. Every node gets its start and
 * end line translated back to the original source.
 */
public class AstWalker extends RugoBaseVisitor<Node> {

    private final String sourceName;

    private final PreprocessResult preprocessed;

    AstWalker(final String sourceName, final PreprocessResult preprocessed) {
        this.sourceName = sourceName;
        this.preprocessed = preprocessed;
    }

    public static Program walk(final RugoParser.ProgramContext ctx, final PreprocessResult preprocessed,
                               final String sourceName) {
        return (Program) new AstWalker(sourceName, preprocessed).visit(ctx);
    }

    // ---- Statements ----

    @Override
    public Node visitProgram(final RugoParser.ProgramContext ctx) {
        List<Statement> statements = new ArrayList<>();
        for (RugoParser.StatementContext statement : ctx.statement()) {
            statements.add(statement(statement));
        }
        Program program = new Program(sourceName, preprocessed.getSource(), statements, preprocessed.getStructs());
        program.setLine(1);
        program.setEndLine(preprocessed.originalLine(ctx.getStop().getLine()));
        return program;
    }

    @Override
    public Node visitStatement(final RugoParser.StatementContext ctx) {
        if (ctx.getChildCount() != 1) {
            throw unexpected(ctx);
        }
        return visit(ctx.getChild(0));
    }

    @Override
    public Node visitUseStmt(final RugoParser.UseStmtContext ctx) {
        return at(new UseStmt(unescape(ctx.STRING())), ctx);
    }

    @Override
    public Node visitImportStmt(final RugoParser.ImportStmtContext ctx) {
        String alias = ctx.IDENT() == null ? null : ctx.IDENT().getText();
        return at(new ImportStmt(unescape(ctx.STRING()), alias), ctx);
    }

    @Override
    public Node visitRequireStmt(final RugoParser.RequireStmtContext ctx) {
        String alias = null;
        if (ctx.IDENT() != null) {
            alias = ctx.IDENT().getText();
        } else if (ctx.STRING().size() > 1) {
            alias = unescape(ctx.STRING(1));
        }
        return at(new RequireStmt(unescape(ctx.STRING(0)), alias), ctx);
    }

    @Override
    public Node visitFuncDef(final RugoParser.FuncDefContext ctx) {
        return at(new FunctionDef(ctx.IDENT().getText(), params(ctx.paramList()), body(ctx.body())), ctx);
    }

    @Override
    public Node visitTestDef(final RugoParser.TestDefContext ctx) {
        return at(new TestDef(unescape(ctx.STRING()), body(ctx.body())), ctx);
    }

    @Override
    public Node visitBenchDef(final RugoParser.BenchDefContext ctx) {
        return at(new BenchDef(unescape(ctx.STRING()), body(ctx.body())), ctx);
    }

    @Override
    public Node visitIfStmt(final RugoParser.IfStmtContext ctx) {
        List<ElsifClause> elsifs = new ArrayList<>();
        for (RugoParser.ElsifClauseContext clause : ctx.elsifClause()) {
            elsifs.add(new ElsifClause(expr(clause.expr()), body(clause.body())));
        }
        List<Statement> elseBody = ctx.elseClause() == null ? new ArrayList<>() : body(ctx.elseClause().body());
        return at(new IfStmt(expr(ctx.expr()), body(ctx.body()), elsifs, elseBody), ctx);
    }

    @Override
    public Node visitWhileStmt(final RugoParser.WhileStmtContext ctx) {
        return at(new WhileStmt(expr(ctx.expr()), body(ctx.body())), ctx);
    }

    @Override
    public Node visitForStmt(final RugoParser.ForStmtContext ctx) {
        String indexVar = ctx.IDENT().size() > 1 ? ctx.IDENT(1).getText() : null;
        return at(new ForStmt(ctx.IDENT(0).getText(), indexVar, expr(ctx.expr()), body(ctx.body())), ctx);
    }

    @Override
    public Node visitBreakStmt(final RugoParser.BreakStmtContext ctx) {
        return at(new BreakStmt(), ctx);
    }

    @Override
    public Node visitNextStmt(final RugoParser.NextStmtContext ctx) {
        return at(new NextStmt(), ctx);
    }

    @Override
    public Node visitReturnStmt(final RugoParser.ReturnStmtContext ctx) {
        return at(new ReturnStmt(ctx.expr() == null ? null : expr(ctx.expr())), ctx);
    }

    @Override
    public Node visitAssignOrExpr(final RugoParser.AssignOrExprContext ctx) {
        Expr left = expr(ctx.expr(0));
        if (ctx.ASSIGN() == null) {
            return at(new ExprStmt(left), ctx);
        }
        Expr value = expr(ctx.expr(1));
        if (left instanceof IdentExpr) {
            return at(new AssignStmt(((IdentExpr) left).getName(), value), ctx);
        }
        if (left instanceof IndexExpr) {
            IndexExpr target = (IndexExpr) left;
            return at(new IndexAssignStmt(target.getObject(), target.getIndex(), value), ctx);
        }
        if (left instanceof DotExpr) {
            DotExpr target = (DotExpr) left;
            return at(new DotAssignStmt(target.getObject(), target.getField(), value), ctx);
        }
        throw new RugoSyntaxException(sourceName, lineOf(ctx.getStart()),
            "cannot assign to " + ctx.expr(0).getText());
    }

    // ---- Expressions ----

    @Override
    public Node visitExpr(final RugoParser.ExprContext ctx) {
        return visit(ctx.orExpr());
    }

    @Override
    public Node visitOrExpr(final RugoParser.OrExprContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Node visitAndExpr(final RugoParser.AndExprContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Node visitCompExpr(final RugoParser.CompExprContext ctx) {
        if (ctx.compOp() == null) {
            return visit(ctx.addExpr(0));
        }
        BinaryOp op = operator(ctx.compOp().getText(), ctx);
        return at(new BinaryExpr(expr(ctx.addExpr(0)), op, expr(ctx.addExpr(1))), ctx);
    }

    @Override
    public Node visitAddExpr(final RugoParser.AddExprContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Node visitMulExpr(final RugoParser.MulExprContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Node visitUnaryExpr(final RugoParser.UnaryExprContext ctx) {
        if (ctx.postfix() != null) {
            return visit(ctx.postfix());
        }
        UnaryOp op = ctx.BANG() != null ? UnaryOp.NOT : UnaryOp.NEGATE;
        return at(new UnaryExpr(op, expr(ctx.unaryExpr())), ctx);
    }

    @Override
    public Node visitPostfix(final RugoParser.PostfixContext ctx) {
        Expr current = expr(ctx.primary());
        for (RugoParser.SuffixContext suffix : ctx.suffix()) {
            if (suffix.LPAREN() != null) {
                List<Expr> args = new ArrayList<>();
                if (suffix.argList() != null) {
                    for (RugoParser.ExprContext arg : suffix.argList().expr()) {
                        args.add(expr(arg));
                    }
                }
                current = at(new CallExpr(current, args), ctx.getStart(), suffix.getStop());
            } else if (suffix.LBRACK() != null) {
                Expr index = expr(suffix.expr(0));
                Expr slice = suffix.expr().size() > 1
                    ? new SliceExpr(current, index, expr(suffix.expr(1)))
                    : new IndexExpr(current, index);
                current = at(slice, ctx.getStart(), suffix.getStop());
            } else if (suffix.DOT() != null) {
                current = at(new DotExpr(current, suffix.IDENT().getText()), ctx.getStart(), suffix.getStop());
            } else {
                throw unexpected(suffix);
            }
        }
        return current;
    }

    @Override
    public Node visitPrimary(final RugoParser.PrimaryContext ctx) {
        if (ctx.INT() != null) {
            try {
                return at(new IntLit(Long.parseLong(ctx.INT().getText())), ctx);
            } catch (NumberFormatException e) {
                throw new RugoSyntaxException(sourceName, lineOf(ctx.getStart()),
                    "integer literal out of range: " + ctx.INT().getText());
            }
        }
        if (ctx.FLOAT() != null) {
            return at(new FloatLit(ctx.FLOAT().getText()), ctx);
        }
        if (ctx.STRING() != null) {
            return at(new StringLit(unescape(ctx.STRING()), false), ctx);
        }
        if (ctx.RAW_STRING() != null) {
            return at(new StringLit(unescapeRaw(ctx.RAW_STRING().getText()), true), ctx);
        }
        if (ctx.TRUE() != null || ctx.FALSE() != null) {
            return at(new BoolLit(ctx.TRUE() != null), ctx);
        }
        if (ctx.NIL() != null) {
            return at(new NilLit(), ctx);
        }
        if (ctx.IDENT() != null) {
            return at(new IdentExpr(ctx.IDENT().getText()), ctx);
        }
        if (ctx.expr() != null) {
            return visit(ctx.expr());
        }
        if (ctx.getChildCount() == 1 && ctx.getChild(0) instanceof ParserRuleContext) {
            return visit(ctx.getChild(0));
        }
        throw unexpected(ctx);
    }

    @Override
    public Node visitArrayLit(final RugoParser.ArrayLitContext ctx) {
        List<Expr> elements = new ArrayList<>();
        for (RugoParser.ExprContext element : ctx.expr()) {
            elements.add(expr(element));
        }
        return at(new ArrayLit(elements), ctx);
    }

    @Override
    public Node visitHashLit(final RugoParser.HashLitContext ctx) {
        List<HashLit.Entry> entries = new ArrayList<>();
        for (RugoParser.HashEntryContext entry : ctx.hashEntry()) {
            entries.add(new HashLit.Entry(expr(entry.expr(0)), expr(entry.expr(1))));
        }
        return at(new HashLit(entries), ctx);
    }

    @Override
    public Node visitTryExpr(final RugoParser.TryExprContext ctx) {
        return at(new TryExpr(expr(ctx.expr()), ctx.IDENT().getText(), body(ctx.body())), ctx);
    }

    @Override
    public Node visitSpawnExpr(final RugoParser.SpawnExprContext ctx) {
        return at(new SpawnExpr(body(ctx.body())), ctx);
    }

    @Override
    public Node visitParallelExpr(final RugoParser.ParallelExprContext ctx) {
        return at(new ParallelExpr(body(ctx.body())), ctx);
    }

    @Override
    public Node visitFnExpr(final RugoParser.FnExprContext ctx) {
        return at(new FnExpr(params(ctx.paramList()), body(ctx.body())), ctx);
    }

    // ---- Helpers ----

    private Node leftAssociative(final ParserRuleContext ctx) {
        Expr result = expr(ctx.getChild(0));
        for (int i = 1; i + 1 < ctx.getChildCount(); i += 2) {
            BinaryOp op = operator(ctx.getChild(i).getText(), ctx);
            Expr right = expr(ctx.getChild(i + 1));
            ParserRuleContext rightCtx = (ParserRuleContext) ctx.getChild(i + 1);
            result = at(new BinaryExpr(result, op, right), ctx.getStart(), rightCtx.getStop());
        }
        return result;
    }

    private BinaryOp operator(final String symbol, final ParserRuleContext ctx) {
        BinaryOp op = BinaryOp.fromSymbol(symbol);
        if (op == null) {
            throw unexpected(ctx);
        }
        return op;
    }

    private Statement statement(final ParseTree tree) {
        Node node = visit(tree);
        if (!(node instanceof Statement)) {
            throw unexpected(tree);
        }
        return (Statement) node;
    }

    private Expr expr(final ParseTree tree) {
        Node node = visit(tree);
        if (!(node instanceof Expr)) {
            throw unexpected(tree);
        }
        return (Expr) node;
    }

    private List<Statement> body(final RugoParser.BodyContext ctx) {
        List<Statement> statements = new ArrayList<>();
        for (RugoParser.StatementContext statement : ctx.statement()) {
            statements.add(statement(statement));
        }
        return statements;
    }

    private static List<String> params(final RugoParser.ParamListContext ctx) {
        List<String> params = new ArrayList<>();
        if (ctx != null) {
            for (TerminalNode ident : ctx.IDENT()) {
                params.add(ident.getText());
            }
        }
        return params;
    }

    private <T extends Node> T at(final T node, final ParserRuleContext ctx) {
        return at(node, ctx.getStart(), ctx.getStop());
    }

    private <T extends Node> T at(final T node, final Token start, final Token stop) {
        node.setLine(lineOf(start));
        node.setEndLine(stop == null ? node.getLine() : lineOf(stop));
        return node;
    }

    private int lineOf(final Token token) {
        return preprocessed.originalLine(token.getLine());
    }

    private InternalCompilerException unexpected(final ParseTree tree) {
        int line = tree instanceof ParserRuleContext ? lineOf(((ParserRuleContext) tree).getStart()) : 0;
        return new InternalCompilerException(sourceName, line,
            "no lowering for " + tree.getClass().getSimpleName() + ": " + tree.getText());
    }

    // ---- String literals ----

    private static String unescape(final TerminalNode literal) {
        String text = literal.getText();
        String inner = text.substring(1, text.length() - 1);
        StringBuilder out = new StringBuilder(inner.length());
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c != '\\' || i + 1 >= inner.length()) {
                out.append(c);
                continue;
            }
            char next = inner.charAt(++i);
            switch (next) {
                case 'n':
                    out.append('\n');
                    break;
                case 't':
                    out.append('\t');
                    break;
                case 'r':
                    out.append('\r');
                    break;
                case '0':
                    out.append('\0');
                    break;
                case '\\':
                case '"':
                case '\'':
                    out.append(next);
                    break;
                default:
                    out.append('\\').append(next);
            }
        }
        return out.toString();
    }

    /**
     * Single-quoted literals only recognise {@code \'} and {@code \\}.
     */
    static String unescapeRaw(final String text) {
        String inner = text.substring(1, text.length() - 1);
        StringBuilder out = new StringBuilder(inner.length());
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '\\' && i + 1 < inner.length()) {
                char next = inner.charAt(i + 1);
                if (next == '\'' || next == '\\') {
                    out.append(next);
                    i++;
                    continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }
}
