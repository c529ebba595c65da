package com.example.flowbridge.script;

import com.example.flowbridge.errors.ScriptParseException;
import com.example.flowbridge.script.PythonScriptParser.*;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link Stmt} and {@link Expr} trees from a {@link PythonScriptParser} parse tree.
 * <p>
 * Visits return {@code Stmt} for statements and {@code Expr} for expressions; rules that produce lists
 * (blocks, parameters, arguments) are handled by private helpers instead of visits.
 * </p>
 */
final class ScriptTreeBuilder extends PythonScriptBaseVisitor<Object> {

    ScriptModule build(FileInputContext ctx) {
        List<Stmt> body = new ArrayList<>();
        for (StmtContext stmt : ctx.stmt()) {
            body.addAll(statements(stmt));
        }
        return new ScriptModule(body);
    }

    // ---------------------------------------------------------------- statements

    private List<Stmt> statements(StmtContext ctx) {
        if (ctx.simpleStmts() != null) {
            return simpleStatements(ctx.simpleStmts());
        }
        return List.of(stmt(ctx.compoundStmt().getChild(0)));
    }

    private List<Stmt> simpleStatements(SimpleStmtsContext ctx) {
        return ctx.simpleStmt().stream().map(this::stmt).toList();
    }

    private List<Stmt> block(BlockContext ctx) {
        if (ctx.simpleStmts() != null) {
            return simpleStatements(ctx.simpleStmts());
        }
        List<Stmt> body = new ArrayList<>();
        for (StmtContext stmt : ctx.stmt()) {
            body.addAll(statements(stmt));
        }
        return body;
    }

    @Override
    public Object visitExpressionStatement(ExpressionStatementContext ctx) {
        return visit(ctx.exprStmt());
    }

    @Override
    public Object visitAnnotatedAssign(AnnotatedAssignContext ctx) {
        Expr value = ctx.assignedValue() != null ? expr(ctx.assignedValue()) : null;
        return new Stmt.AnnAssign(line(ctx), expr(ctx.testListStarExpr()), expr(ctx.test()), value);
    }

    @Override
    public Object visitAugmentedAssign(AugmentedAssignContext ctx) {
        return new Stmt.AugAssign(line(ctx), expr(ctx.testListStarExpr()), ctx.augAssign().getText(), expr(ctx.assignedValue()));
    }

    @Override
    public Object visitAssignment(AssignmentContext ctx) {
        List<Expr> chain = new ArrayList<>();
        chain.add(expr(ctx.testListStarExpr()));
        for (AssignedValueContext value : ctx.assignedValue()) {
            chain.add(expr(value));
        }
        Expr value = chain.remove(chain.size() - 1);
        return new Stmt.Assign(line(ctx), chain, value);
    }

    @Override
    public Object visitBareExpression(BareExpressionContext ctx) {
        return new Stmt.ExprStmt(line(ctx), expr(ctx.assignedValue()));
    }

    @Override
    public Object visitAssignedValue(AssignedValueContext ctx) {
        return ctx.yieldExpr() != null ? visit(ctx.yieldExpr()) : visit(ctx.testListStarExpr());
    }

    @Override
    public Object visitDelStatement(DelStatementContext ctx) {
        Expr targets = expr(ctx.exprList());
        return new Stmt.Delete(line(ctx), targets instanceof Expr.TupleExpr t ? t.elements() : List.of(targets));
    }

    @Override
    public Object visitPassStatement(PassStatementContext ctx) {
        return new Stmt.Pass(line(ctx));
    }

    @Override
    public Object visitBreakStatement(BreakStatementContext ctx) {
        return new Stmt.Break(line(ctx));
    }

    @Override
    public Object visitContinueStatement(ContinueStatementContext ctx) {
        return new Stmt.Continue(line(ctx));
    }

    @Override
    public Object visitReturnStatement(ReturnStatementContext ctx) {
        return new Stmt.Return(line(ctx), ctx.testListStarExpr() != null ? expr(ctx.testListStarExpr()) : null);
    }

    @Override
    public Object visitRaiseStatement(RaiseStatementContext ctx) {
        List<TestContext> tests = ctx.getRuleContexts(TestContext.class);
        Expr exception = tests.isEmpty() ? null : expr(tests.get(0));
        Expr cause = tests.size() > 1 ? expr(tests.get(1)) : null;
        return new Stmt.Raise(line(ctx), exception, cause);
    }

    @Override
    public Object visitImportStatement(ImportStatementContext ctx) {
        List<Stmt.Alias> names = ctx.dottedAsNames().dottedAsName().stream()
                .map(n -> new Stmt.Alias(n.dottedName().getText(), n.NAME() != null ? n.NAME().getText() : null))
                .toList();
        return new Stmt.Import(line(ctx), names);
    }

    @Override
    public Object visitImportFromStatement(ImportFromStatementContext ctx) {
        ImportSourceContext source = ctx.importSource();
        int level = source.getTokens(PythonScriptParser.DOT).size() + 3 * source.getTokens(PythonScriptParser.ELLIPSIS).size();
        String module = source.dottedName() != null ? source.dottedName().getText() : null;
        ImportTargetsContext targets = ctx.importTargets();
        List<Stmt.Alias> names;
        if (targets.STAR() != null) {
            names = List.of(new Stmt.Alias("*", null));
        } else {
            names = targets.importAsNames().importAsName().stream()
                    .map(n -> new Stmt.Alias(n.NAME(0).getText(), n.NAME().size() > 1 ? n.NAME(1).getText() : null))
                    .toList();
        }
        return new Stmt.ImportFrom(line(ctx), module, names, level);
    }

    @Override
    public Object visitGlobalStatement(GlobalStatementContext ctx) {
        return new Stmt.Global(line(ctx), texts(ctx.getTokens(PythonScriptParser.NAME)));
    }

    @Override
    public Object visitNonlocalStatement(NonlocalStatementContext ctx) {
        return new Stmt.Nonlocal(line(ctx), texts(ctx.getTokens(PythonScriptParser.NAME)));
    }

    @Override
    public Object visitAssertStatement(AssertStatementContext ctx) {
        List<TestContext> tests = ctx.getRuleContexts(TestContext.class);
        return new Stmt.Assert(line(ctx), expr(tests.get(0)), tests.size() > 1 ? expr(tests.get(1)) : null);
    }

    @Override
    public Object visitIfStmt(IfStmtContext ctx) {
        List<BlockContext> blocks = ctx.getRuleContexts(BlockContext.class);
        List<Stmt> orElse = has(ctx, PythonScriptParser.ELSE) ? block(blocks.get(blocks.size() - 1)) : List.of();
        List<ElifClauseContext> elifs = ctx.elifClause();
        for (int i = elifs.size() - 1; i >= 0; i--) {
            ElifClauseContext elif = elifs.get(i);
            orElse = List.of(new Stmt.If(line(elif), expr(elif.namedExprTest()), block(elif.block()), orElse, true));
        }
        return new Stmt.If(line(ctx), expr(ctx.namedExprTest()), block(blocks.get(0)), orElse, false);
    }

    @Override
    public Object visitWhileStmt(WhileStmtContext ctx) {
        List<BlockContext> blocks = ctx.getRuleContexts(BlockContext.class);
        List<Stmt> orElse = blocks.size() > 1 ? block(blocks.get(1)) : List.of();
        return new Stmt.While(line(ctx), expr(ctx.namedExprTest()), block(blocks.get(0)), orElse);
    }

    @Override
    public Object visitForStmt(ForStmtContext ctx) {
        return forStatement(ctx, false, line(ctx));
    }

    private Stmt forStatement(ForStmtContext ctx, boolean async, int line) {
        List<BlockContext> blocks = ctx.getRuleContexts(BlockContext.class);
        List<Stmt> orElse = blocks.size() > 1 ? block(blocks.get(1)) : List.of();
        return new Stmt.For(line, expr(ctx.exprList()), expr(ctx.testList()), block(blocks.get(0)), orElse, async);
    }

    @Override
    public Object visitTryStmt(TryStmtContext ctx) {
        List<BlockContext> blocks = ctx.getRuleContexts(BlockContext.class);
        int next = 1;
        List<Stmt> orElse = has(ctx, PythonScriptParser.ELSE) ? block(blocks.get(next++)) : List.of();
        List<Stmt> finalBody = has(ctx, PythonScriptParser.FINALLY) ? block(blocks.get(next)) : List.of();
        List<Stmt.ExceptHandler> handlers = ctx.exceptClause().stream()
                .map(h -> new Stmt.ExceptHandler(
                        h.test() != null ? expr(h.test()) : null,
                        h.NAME() != null ? h.NAME().getText() : null,
                        block(h.block())))
                .toList();
        return new Stmt.Try(line(ctx), block(blocks.get(0)), handlers, orElse, finalBody);
    }

    @Override
    public Object visitWithStmt(WithStmtContext ctx) {
        return withStatement(ctx, false, line(ctx));
    }

    private Stmt withStatement(WithStmtContext ctx, boolean async, int line) {
        List<Stmt.WithItem> items = ctx.withItem().stream()
                .map(item -> new Stmt.WithItem(expr(item.test()), item.expr() != null ? expr(item.expr()) : null))
                .toList();
        return new Stmt.With(line, items, block(ctx.block()), async);
    }

    @Override
    public Object visitFuncDef(FuncDefContext ctx) {
        return functionDef(ctx, List.of(), false, line(ctx));
    }

    private Stmt functionDef(FuncDefContext ctx, List<Expr> decorators, boolean async, int line) {
        Expr returns = ctx.test() != null ? expr(ctx.test()) : null;
        return new Stmt.FunctionDef(line, ctx.NAME().getText(), parameters(ctx.parameters()), returns, decorators,
                block(ctx.block()), async);
    }

    @Override
    public Object visitClassDef(ClassDefContext ctx) {
        return classDef(ctx, List.of(), line(ctx));
    }

    private Stmt classDef(ClassDefContext ctx, List<Expr> decorators, int line) {
        List<Expr> bases = new ArrayList<>();
        List<Expr.Keyword> keywords = new ArrayList<>();
        arguments(ctx.argList(), bases, keywords);
        return new Stmt.ClassDef(line, ctx.NAME().getText(), bases, keywords, decorators, block(ctx.block()));
    }

    @Override
    public Object visitDecorated(DecoratedContext ctx) {
        List<Expr> decorators = ctx.decorator().stream().map(d -> expr(d.namedExprTest())).toList();
        if (ctx.classDef() != null) {
            return classDef(ctx.classDef(), decorators, line(ctx));
        }
        if (ctx.funcDef() != null) {
            return functionDef(ctx.funcDef(), decorators, false, line(ctx));
        }
        return functionDef(ctx.asyncFuncDef().funcDef(), decorators, true, line(ctx));
    }

    @Override
    public Object visitAsyncStmt(AsyncStmtContext ctx) {
        if (ctx.funcDef() != null) {
            return functionDef(ctx.funcDef(), List.of(), true, line(ctx));
        }
        if (ctx.withStmt() != null) {
            return withStatement(ctx.withStmt(), true, line(ctx));
        }
        return forStatement(ctx.forStmt(), true, line(ctx));
    }

    // ---------------------------------------------------------------- parameters and arguments

    private List<Param> parameters(ParametersContext ctx) {
        if (ctx == null) {
            return List.of();
        }
        List<Param> params = new ArrayList<>();
        boolean keywordOnly = false;
        for (ParameterContext parameter : ctx.parameter()) {
            if (parameter instanceof PlainParameterContext plain) {
                List<TestContext> tests = plain.getRuleContexts(TestContext.class);
                Expr annotation = has(plain, PythonScriptParser.COLON) ? expr(tests.get(0)) : null;
                Expr defaultValue = has(plain, PythonScriptParser.ASSIGN) ? expr(tests.get(tests.size() - 1)) : null;
                params.add(new Param(plain.NAME().getText(), annotation, defaultValue,
                        keywordOnly ? Param.Kind.KEYWORD_ONLY : Param.Kind.POSITIONAL));
            } else if (parameter instanceof StarParameterContext star) {
                keywordOnly = true;
                if (star.NAME() != null) {
                    params.add(new Param(star.NAME().getText(), star.test() != null ? expr(star.test()) : null, null,
                            Param.Kind.VAR_POSITIONAL));
                }
            } else if (parameter instanceof KwargsParameterContext kwargs) {
                params.add(new Param(kwargs.NAME().getText(), kwargs.test() != null ? expr(kwargs.test()) : null, null,
                        Param.Kind.VAR_KEYWORD));
            }
        }
        return params;
    }

    private List<Param> lambdaParameters(LambdaParametersContext ctx) {
        if (ctx == null) {
            return List.of();
        }
        List<Param> params = new ArrayList<>();
        boolean keywordOnly = false;
        for (LambdaParameterContext parameter : ctx.lambdaParameter()) {
            if (parameter instanceof PlainLambdaParameterContext plain) {
                params.add(new Param(plain.NAME().getText(), null, plain.test() != null ? expr(plain.test()) : null,
                        keywordOnly ? Param.Kind.KEYWORD_ONLY : Param.Kind.POSITIONAL));
            } else if (parameter instanceof StarLambdaParameterContext star) {
                keywordOnly = true;
                if (star.NAME() != null) {
                    params.add(new Param(star.NAME().getText(), null, null, Param.Kind.VAR_POSITIONAL));
                }
            } else if (parameter instanceof KwargsLambdaParameterContext kwargs) {
                params.add(new Param(kwargs.NAME().getText(), null, null, Param.Kind.VAR_KEYWORD));
            }
        }
        return params;
    }

    private void arguments(ArgListContext ctx, List<Expr> args, List<Expr.Keyword> keywords) {
        if (ctx == null) {
            return;
        }
        for (ArgumentContext argument : ctx.argument()) {
            if (argument instanceof KeywordArgumentContext keyword) {
                keywords.add(new Expr.Keyword(keyword.NAME().getText(), expr(keyword.test())));
            } else if (argument instanceof KwargsArgumentContext kwargs) {
                keywords.add(new Expr.Keyword(null, expr(kwargs.test())));
            } else if (argument instanceof StarArgumentContext star) {
                args.add(new Expr.Starred(expr(star.test())));
            } else if (argument instanceof PositionalArgumentContext positional) {
                Expr value = expr(positional.namedExprTest());
                args.add(positional.compFor() != null
                        ? new Expr.GeneratorExp(value, comprehensions(positional.compFor()))
                        : value);
            }
        }
    }

    private List<Expr.Comprehension> comprehensions(CompForContext ctx) {
        List<Expr.Comprehension> generators = new ArrayList<>();
        for (CompClauseContext clause : ctx.compClause()) {
            List<OrTestContext> tests = clause.getRuleContexts(OrTestContext.class);
            List<Expr> conditions = tests.subList(1, tests.size()).stream().map(this::expr).toList();
            generators.add(new Expr.Comprehension(expr(clause.exprList()), expr(tests.get(0)), conditions,
                    clause.ASYNC() != null));
        }
        return generators;
    }

    // ---------------------------------------------------------------- expressions

    @Override
    public Object visitNamedExprTest(NamedExprTestContext ctx) {
        Expr value = expr(ctx.test());
        return ctx.NAME() != null ? new Expr.NamedExpr(new Expr.Name(ctx.NAME().getText()), value) : value;
    }

    @Override
    public Object visitTest(TestContext ctx) {
        if (ctx.lambdef() != null) {
            return visit(ctx.lambdef());
        }
        List<OrTestContext> branches = ctx.getRuleContexts(OrTestContext.class);
        if (branches.size() == 1) {
            return visit(branches.get(0));
        }
        return new Expr.IfExp(expr(branches.get(1)), expr(branches.get(0)), expr(ctx.test()));
    }

    @Override
    public Object visitLambdef(LambdefContext ctx) {
        return new Expr.Lambda(lambdaParameters(ctx.lambdaParameters()), expr(ctx.test()));
    }

    @Override
    public Object visitOrTest(OrTestContext ctx) {
        return boolOp("or", ctx.andTest());
    }

    @Override
    public Object visitAndTest(AndTestContext ctx) {
        return boolOp("and", ctx.notTest());
    }

    private Expr boolOp(String op, List<? extends ParserRuleContext> operands) {
        if (operands.size() == 1) {
            return expr(operands.get(0));
        }
        return new Expr.BoolOp(op, operands.stream().map(this::expr).toList());
    }

    @Override
    public Object visitNotTest(NotTestContext ctx) {
        if (ctx.NOT() != null) {
            return new Expr.UnaryOp("not", expr(ctx.notTest()));
        }
        return visit(ctx.comparison());
    }

    @Override
    public Object visitComparison(ComparisonContext ctx) {
        List<ExprContext> operands = ctx.expr();
        if (operands.size() == 1) {
            return visit(operands.get(0));
        }
        List<String> ops = ctx.compOp().stream()
                .map(op -> String.join(" ", texts(terminals(op))))
                .toList();
        List<Expr> comparators = operands.subList(1, operands.size()).stream().map(this::expr).toList();
        return new Expr.Compare(expr(operands.get(0)), ops, comparators);
    }

    @Override
    public Object visitStarExpr(StarExprContext ctx) {
        return new Expr.Starred(expr(ctx.expr()));
    }

    @Override
    public Object visitExpr(ExprContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Object visitXorExpr(XorExprContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Object visitAndExpr(AndExprContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Object visitShiftExpr(ShiftExprContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Object visitArithExpr(ArithExprContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Object visitTerm(TermContext ctx) {
        return leftAssociative(ctx);
    }

    /** Folds {@code operand (op operand)*} children from the left. */
    private Expr leftAssociative(ParserRuleContext ctx) {
        Expr left = expr(ctx.getChild(0));
        for (int i = 1; i + 1 < ctx.getChildCount(); i += 2) {
            left = new Expr.BinOp(left, ctx.getChild(i).getText(), expr(ctx.getChild(i + 1)));
        }
        return left;
    }

    @Override
    public Object visitFactor(FactorContext ctx) {
        if (ctx.power() != null) {
            return visit(ctx.power());
        }
        return new Expr.UnaryOp(ctx.getChild(0).getText(), expr(ctx.factor()));
    }

    @Override
    public Object visitPower(PowerContext ctx) {
        Expr base = expr(ctx.atomExpr());
        return ctx.factor() != null ? new Expr.BinOp(base, "**", expr(ctx.factor())) : base;
    }

    @Override
    public Object visitAtomExpr(AtomExprContext ctx) {
        Expr value = expr(ctx.atom());
        for (TrailerContext trailer : ctx.trailer()) {
            if (trailer instanceof CallTrailerContext call) {
                List<Expr> args = new ArrayList<>();
                List<Expr.Keyword> keywords = new ArrayList<>();
                arguments(call.argList(), args, keywords);
                value = new Expr.Call(value, args, keywords);
            } else if (trailer instanceof SubscriptTrailerContext subscript) {
                value = new Expr.Subscript(value, subscripts(subscript.subscriptList()));
            } else if (trailer instanceof AttributeTrailerContext attribute) {
                value = new Expr.Attribute(value, attribute.NAME().getText());
            }
        }
        return ctx.AWAIT() != null ? new Expr.Await(value) : value;
    }

    private Expr subscripts(SubscriptListContext ctx) {
        List<Expr> items = ctx.subscript().stream().map(this::expr).toList();
        return items.size() == 1 && !has(ctx, PythonScriptParser.COMMA) ? items.get(0) : new Expr.TupleExpr(items);
    }

    @Override
    public Object visitIndexSubscript(IndexSubscriptContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public Object visitSliceSubscript(SliceSubscriptContext ctx) {
        Expr lower = null;
        Expr upper = null;
        boolean afterColon = false;
        for (ParseTree child : ctx.children) {
            if (child instanceof TerminalNode) {
                afterColon = true;
            } else if (child instanceof TestContext test) {
                if (afterColon) {
                    upper = expr(test);
                } else {
                    lower = expr(test);
                }
            }
        }
        Expr step = ctx.sliceOp() != null && ctx.sliceOp().test() != null ? expr(ctx.sliceOp().test()) : null;
        return new Expr.Slice(lower, upper, step);
    }

    @Override
    public Object visitExprList(ExprListContext ctx) {
        return tupleOrSingle(ctx);
    }

    @Override
    public Object visitTestList(TestListContext ctx) {
        return tupleOrSingle(ctx);
    }

    @Override
    public Object visitTestListStarExpr(TestListStarExprContext ctx) {
        return tupleOrSingle(ctx);
    }

    private Expr tupleOrSingle(ParserRuleContext ctx) {
        List<Expr> items = operands(ctx);
        return has(ctx, PythonScriptParser.COMMA) ? new Expr.TupleExpr(items) : items.get(0);
    }

    /** Visits the rule children of a comma separated list, skipping a trailing comprehension. */
    private List<Expr> operands(ParserRuleContext ctx) {
        List<Expr> items = new ArrayList<>();
        for (ParseTree child : ctx.children) {
            if (child instanceof ParserRuleContext rule && !(rule instanceof CompForContext)) {
                items.add(expr(rule));
            }
        }
        return items;
    }

    @Override
    public Object visitYieldExpr(YieldExprContext ctx) {
        if (ctx.FROM() != null) {
            return new Expr.Yield(expr(ctx.test()), true);
        }
        return new Expr.Yield(ctx.testListStarExpr() != null ? expr(ctx.testListStarExpr()) : null, false);
    }

    // ---------------------------------------------------------------- atoms

    @Override
    public Object visitParenAtom(ParenAtomContext ctx) {
        if (ctx.yieldExpr() != null) {
            return visit(ctx.yieldExpr());
        }
        TestListCompContext items = ctx.testListComp();
        if (items == null) {
            return new Expr.TupleExpr(List.of());
        }
        List<Expr> elements = operands(items);
        if (items.compFor() != null) {
            return new Expr.GeneratorExp(elements.get(0), comprehensions(items.compFor()));
        }
        return has(items, PythonScriptParser.COMMA) ? new Expr.TupleExpr(elements) : elements.get(0);
    }

    @Override
    public Object visitListAtom(ListAtomContext ctx) {
        TestListCompContext items = ctx.testListComp();
        if (items == null) {
            return new Expr.ListExpr(List.of());
        }
        List<Expr> elements = operands(items);
        if (items.compFor() != null) {
            return new Expr.ListComp(elements.get(0), comprehensions(items.compFor()));
        }
        return new Expr.ListExpr(elements);
    }

    @Override
    public Object visitBraceAtom(BraceAtomContext ctx) {
        DictOrSetMakerContext maker = ctx.dictOrSetMaker();
        if (maker == null) {
            return new Expr.DictExpr(List.of());
        }
        if (maker instanceof SetMakerContext set) {
            List<Expr> elements = operands(set);
            return set.compFor() != null
                    ? new Expr.SetComp(elements.get(0), comprehensions(set.compFor()))
                    : new Expr.SetExpr(elements);
        }
        DictMakerContext dict = (DictMakerContext) maker;
        List<Expr.DictEntry> entries = dict.dictEntry().stream().map(this::dictEntry).toList();
        if (dict.compFor() != null) {
            Expr.DictEntry first = entries.get(0);
            if (first.key() == null) {
                Token start = dict.getStart();
                throw new ScriptParseException("dict unpacking cannot be used in dict comprehension",
                        start.getLine(), start.getCharPositionInLine() + 1);
            }
            return new Expr.DictComp(first.key(), first.value(), comprehensions(dict.compFor()));
        }
        return new Expr.DictExpr(entries);
    }

    private Expr.DictEntry dictEntry(DictEntryContext ctx) {
        if (ctx instanceof KeyValueEntryContext keyValue) {
            return new Expr.DictEntry(expr(keyValue.test(0)), expr(keyValue.test(1)));
        }
        return new Expr.DictEntry(null, expr(((UnpackEntryContext) ctx).expr()));
    }

    @Override
    public Object visitNameAtom(NameAtomContext ctx) {
        return new Expr.Name(ctx.getText());
    }

    @Override
    public Object visitNumberAtom(NumberAtomContext ctx) {
        return new Expr.Num(ctx.getText());
    }

    @Override
    public Object visitStringAtom(StringAtomContext ctx) {
        return StringLiterals.join(ctx.STRING().stream().map(TerminalNode::getSymbol).toList());
    }

    @Override
    public Object visitEllipsisAtom(EllipsisAtomContext ctx) {
        return new Expr.EllipsisLiteral();
    }

    @Override
    public Object visitNoneAtom(NoneAtomContext ctx) {
        return new Expr.NoneLiteral();
    }

    @Override
    public Object visitTrueAtom(TrueAtomContext ctx) {
        return new Expr.Bool(true);
    }

    @Override
    public Object visitFalseAtom(FalseAtomContext ctx) {
        return new Expr.Bool(false);
    }

    // ---------------------------------------------------------------- helpers

    private Expr expr(ParseTree tree) {
        return (Expr) visit(tree);
    }

    private Stmt stmt(ParseTree tree) {
        return (Stmt) visit(tree);
    }

    private static int line(ParserRuleContext ctx) {
        return ctx.getStart().getLine();
    }

    private static boolean has(ParserRuleContext ctx, int tokenType) {
        return ctx.getToken(tokenType, 0) != null;
    }

    private static List<TerminalNode> terminals(ParserRuleContext ctx) {
        List<TerminalNode> terminals = new ArrayList<>();
        for (ParseTree child : ctx.children) {
            if (child instanceof TerminalNode terminal) {
                terminals.add(terminal);
            }
        }
        return terminals;
    }

    private static List<String> texts(List<TerminalNode> nodes) {
        return nodes.stream().map(TerminalNode::getText).toList();
    }
}
