package com.ailang.ir.lowering;

import com.ailang.compiler.analysis.FunctionScope;
import com.ailang.compiler.analysis.SignatureCollector;
import com.ailang.compiler.analysis.SignatureTable;
import com.ailang.compiler.analysis.Symbol;
import com.ailang.compiler.analysis.SymbolKind;
import com.ailang.compiler.analysis.ValueKind;
import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.SourceLocation;
import com.ailang.compiler.ast.decl.FunctionDef;
import com.ailang.compiler.ast.decl.Program;
import com.ailang.compiler.ast.expr.BinaryExpr;
import com.ailang.compiler.ast.expr.Expression;
import com.ailang.compiler.ast.expr.Identifier;
import com.ailang.compiler.ast.expr.IndexExpr;
import com.ailang.compiler.ast.expr.NumberLiteral;
import com.ailang.compiler.ast.expr.UnaryExpr;
import com.ailang.compiler.ast.stmt.*;
import com.ailang.ir.CompilerOptions;
import com.ailang.ir.builtin.BuiltinResolver;
import com.ailang.ir.builtin.BuiltinSpec;
import com.ailang.ir.inst.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * AST → IR 代码生成。
 *
 * <p>先收集全部函数签名，再按源码顺序逐个生成函数体；每个函数使用新的
 * 作用域和临时变量计数。控制流保持结构化：if/elif/else 降级为嵌套 IfBlock，
 * while 与两种 for 循环降级为 WhileBlock。</p>
 */
public class AstToIrLowering implements AstVisitor<Void, List<IrInst>> {

    private static final Operand ZERO = Operand.number(0L);
    private static final Operand ONE = Operand.number(1L);

    private final CompilerOptions options;
    private final BuiltinResolver builtins = new BuiltinResolver();

    private SignatureTable signatures;
    private LoweringContext ctx;
    private ExpressionFlattener flattener;

    public AstToIrLowering(CompilerOptions options) {
        this.options = options;
    }

    public AstToIrLowering() {
        this(new CompilerOptions());
    }

    /**
     * 生成整个程序
     */
    public IrProgram lower(Program program, String fileName) {
        Set<String> reserved = new HashSet<String>(builtins.getBuiltinNames());
        reserved.add("range");
        signatures = new SignatureCollector(reserved).collect(program);

        List<IrFunction> functions = new ArrayList<IrFunction>();
        for (FunctionDef function : program.getFunctions()) {
            functions.add(lowerFunction(function));
        }
        return new IrProgram(fileName, functions);
    }

    public SignatureTable getSignatures() {
        return signatures;
    }

    private IrFunction lowerFunction(FunctionDef function) {
        FunctionScope scope = new FunctionScope(function.getName());
        KindInference kinds = KindInference.infer(function, builtins);
        for (String param : function.getParams()) {
            Symbol symbol = scope.defineParameter(param, function.getLocation());
            symbol.setValueKind(kinds.kindOfVariable(param));
        }

        ctx = new LoweringContext(options.getTempPrefix(), scope, kinds);
        flattener = new ExpressionFlattener(ctx, signatures, builtins);

        List<IrInst> body = new ArrayList<IrInst>();
        lowerBlock(function.getBody(), body);

        if (options.isImplicitReturn()
                && (body.isEmpty() || !(body.get(body.size() - 1) instanceof ReturnValue))) {
            body.add(new ReturnValue(function.getLocation(), ZERO));
        }
        return new IrFunction(function.getLocation(), function.getName(), function.getParams(),
                body, function.isSynthetic());
    }

    private void lowerBlock(List<Statement> statements, List<IrInst> out) {
        for (Statement stmt : statements) {
            stmt.accept(this, out);
        }
    }

    private void declare(String name, SymbolKind kind, SourceLocation location) {
        ctx.getScope().declare(name, kind, location, ctx.getKinds().kindOfVariable(name));
    }

    // ============ 赋值 ============

    @Override
    public Void visitAssignStmt(AssignStmt node, List<IrInst> out) {
        flattener.flattenInto(node.getValue(), node.getTarget(), out);
        // 右侧先求值：x = x + 1 在 x 未声明时报错
        declare(node.getTarget(), SymbolKind.VARIABLE, node.getLocation());
        return null;
    }

    @Override
    public Void visitAugAssignStmt(AugAssignStmt node, List<IrInst> out) {
        Expression target = node.getTarget();
        if (target instanceof IndexExpr) {
            throw new GenerationException("Augmented assignment to an indexed element is not supported",
                    node.getLocation());
        }
        String name = ((Identifier) target).getName();
        ctx.getScope().resolve(name, target.getLocation());
        BinaryExpr combined = new BinaryExpr(node.getLocation(), target, node.getOperator(), node.getValue());
        flattener.flattenInto(combined, name, out);
        return null;
    }

    @Override
    public Void visitIndexAssignStmt(IndexAssignStmt node, List<IrInst> out) {
        BuiltinSpec spec = builtins.resolveIndexSet(ctx.getKinds().kindOf(node.getTarget()), node.getLocation());
        Operand container = flattener.flatten(node.getTarget(), out);
        Operand index = flattener.flatten(node.getIndex(), out);
        Operand value = flattener.flatten(node.getValue(), out);
        out.add(new BuiltinCall(node.getLocation(), spec.getEntry(), Arrays.asList(container, index, value), null));
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, List<IrInst> out) {
        flattener.flattenStatement(node.getExpression(), out);
        return null;
    }

    // ============ 控制流 ============

    @Override
    public Void visitIfStmt(IfStmt node, List<IrInst> out) {
        lowerIfChain(node, 0, out);
        return null;
    }

    /**
     * 第 index 个分支降级为 IfBlock，后续分支嵌套在它的 else 列表中
     */
    private void lowerIfChain(IfStmt node, int index, List<IrInst> out) {
        IfBranch branch = node.getBranches().get(index);
        Operand condition = flattener.flatten(branch.getCondition(), out);

        List<IrInst> thenBody = new ArrayList<IrInst>();
        lowerBlock(branch.getBody(), thenBody);

        List<IrInst> elseBody = new ArrayList<IrInst>();
        if (index + 1 < node.getBranches().size()) {
            lowerIfChain(node, index + 1, elseBody);
        } else if (node.hasElse()) {
            lowerBlock(node.getElseBody(), elseBody);
        }

        out.add(new IfBlock(branch.getLocation(), condition, thenBody, elseBody));
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, List<IrInst> out) {
        List<IrInst> conditionCode = new ArrayList<IrInst>();
        Operand condition = flattener.flatten(node.getCondition(), conditionCode);

        List<IrInst> body = new ArrayList<IrInst>();
        lowerLoopBody(node.getBody(), LoopContext.plain(), body);

        out.add(new WhileBlock(node.getLocation(), conditionCode, condition, body));
        return null;
    }

    /**
     * for x in range(start, stop, step)：参数只求值一次，之后等价于
     * x = start; while x < stop: ...; x = x + step。
     * 循环体会重新赋值的 stop/step 变量先复制到临时变量。
     */
    @Override
    public Void visitForRangeStmt(ForRangeStmt node, List<IrInst> out) {
        SourceLocation loc = node.getLocation();
        String var = node.getVariable();
        Set<String> rebound = AssignedNames.collect(node.getBody());
        rebound.add(var);

        Operand start = node.getStart() != null ? flattener.flatten(node.getStart(), out) : ZERO;
        Operand stop = snapshot(flattener.flatten(node.getStop(), out), rebound, loc, out);

        Number constantStep = node.getStep() == null ? Long.valueOf(1L) : constantValue(node.getStep());
        Operand step;
        if (constantStep != null) {
            if (constantStep.doubleValue() == 0) {
                throw new GenerationException("range() step must not be zero", node.getStep().getLocation());
            }
            step = Operand.number(constantStep);
        } else {
            step = snapshot(flattener.flatten(node.getStep(), out), rebound, loc, out);
        }

        declare(var, SymbolKind.LOOP_VARIABLE, loc);
        Operand counter = Operand.variable(var);
        out.add(new TempAssign(loc, var, IrOp.COPY, Collections.singletonList(start)));

        List<IrInst> conditionCode = new ArrayList<IrInst>();
        Operand condition;
        if (constantStep != null) {
            IrOp compare = constantStep.doubleValue() < 0 ? IrOp.GT : IrOp.LT;
            condition = emitTemp(loc, compare, conditionCode, counter, stop);
        } else {
            // (step > 0 and x < stop) or (step < 0 and x > stop)
            Operand ascending = emitTemp(loc, IrOp.GT, conditionCode, step, ZERO);
            Operand belowStop = emitTemp(loc, IrOp.LT, conditionCode, counter, stop);
            Operand up = emitTemp(loc, IrOp.AND, conditionCode, ascending, belowStop);
            Operand descending = emitTemp(loc, IrOp.LT, conditionCode, step, ZERO);
            Operand aboveStop = emitTemp(loc, IrOp.GT, conditionCode, counter, stop);
            Operand down = emitTemp(loc, IrOp.AND, conditionCode, descending, aboveStop);
            condition = emitTemp(loc, IrOp.OR, conditionCode, up, down);
        }

        TempAssign increment = new TempAssign(loc, var, IrOp.ADD, Arrays.asList(counter, step));
        List<IrInst> body = new ArrayList<IrInst>();
        lowerLoopBody(node.getBody(), new LoopContext(Collections.<IrInst>singletonList(increment)), body);
        body.add(increment);

        out.add(new WhileBlock(loc, conditionCode, condition, body));
        return null;
    }

    /**
     * for x in e：用隐藏的下标和长度临时变量遍历。
     * 字符串按字符遍历，字典遍历 hashmap_keys 的结果。
     */
    @Override
    public Void visitForEachStmt(ForEachStmt node, List<IrInst> out) {
        SourceLocation loc = node.getLocation();
        ValueKind kind = ctx.getKinds().kindOf(node.getIterable());
        if (kind == ValueKind.NUMBER) {
            throw new GenerationException("Cannot iterate over a number", node.getIterable().getLocation());
        }
        if (kind == ValueKind.AMBIGUOUS) {
            throw new ResolutionException("Cannot iterate: the iterable may hold values of different kinds",
                    node.getIterable().getLocation());
        }

        Set<String> rebound = AssignedNames.collect(node.getBody());
        rebound.add(node.getVariable());
        Operand sequence = snapshot(flattener.flatten(node.getIterable(), out), rebound, loc, out);
        if (kind == ValueKind.DICT) {
            String keys = ctx.freshTemp();
            out.add(new BuiltinCall(loc, BuiltinResolver.HASHMAP_KEYS.getEntry(),
                    Collections.singletonList(sequence), keys));
            sequence = Operand.variable(keys);
        }
        BuiltinSpec lengthSpec = kind == ValueKind.STRING ? BuiltinResolver.STRING_LENGTH : BuiltinResolver.ARRAY_LENGTH;
        BuiltinSpec elementSpec = kind == ValueKind.STRING ? BuiltinResolver.STRING_CHAR_AT : BuiltinResolver.ARRAY_GET;

        Operand index = Operand.variable(ctx.freshTemp());
        out.add(new TempAssign(loc, index.getName(), IrOp.COPY, Collections.singletonList(ZERO)));
        String length = ctx.freshTemp();
        out.add(new BuiltinCall(loc, lengthSpec.getEntry(), Collections.singletonList(sequence), length));

        declare(node.getVariable(), SymbolKind.LOOP_VARIABLE, loc);

        List<IrInst> conditionCode = new ArrayList<IrInst>();
        Operand condition = emitTemp(loc, IrOp.LT, conditionCode, index, Operand.variable(length));

        TempAssign increment = new TempAssign(loc, index.getName(), IrOp.ADD, Arrays.asList(index, ONE));
        List<IrInst> body = new ArrayList<IrInst>();
        body.add(new BuiltinCall(loc, elementSpec.getEntry(), Arrays.asList(sequence, index), node.getVariable()));
        lowerLoopBody(node.getBody(), new LoopContext(Collections.<IrInst>singletonList(increment)), body);
        body.add(increment);

        out.add(new WhileBlock(loc, conditionCode, condition, body));
        return null;
    }

    /**
     * 循环头中的变量若在循环体内被重新赋值，复制一份供整个循环使用
     */
    private Operand snapshot(Operand operand, Set<String> rebound, SourceLocation loc, List<IrInst> out) {
        if (!operand.isVariable() || !rebound.contains(operand.getName())) {
            return operand;
        }
        String copy = ctx.freshTemp();
        out.add(new TempAssign(loc, copy, IrOp.COPY, Collections.singletonList(operand)));
        return Operand.variable(copy);
    }

    private void lowerLoopBody(List<Statement> statements, LoopContext loop, List<IrInst> body) {
        ctx.pushLoop(loop);
        try {
            lowerBlock(statements, body);
        } finally {
            ctx.popLoop();
        }
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, List<IrInst> out) {
        ctx.currentLoop("break", node.getLocation());
        out.add(new BreakInst(node.getLocation()));
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, List<IrInst> out) {
        LoopContext loop = ctx.currentLoop("continue", node.getLocation());
        out.addAll(loop.getContinuePrologue());
        out.add(new ContinueInst(node.getLocation()));
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, List<IrInst> out) {
        Operand value = node.hasValue() ? flattener.flatten(node.getValue(), out) : ZERO;
        out.add(new ReturnValue(node.getLocation(), value));
        return null;
    }

    @Override
    public Void visitPassStmt(PassStmt node, List<IrInst> out) {
        out.add(new NoOp(node.getLocation()));
        return null;
    }

    @Override
    public Void visitRawBlockStmt(RawBlockStmt node, List<IrInst> out) {
        out.add(new RawPassthrough(node.getLocation(), node.getOpener(), node.getPayload()));
        return null;
    }

    // ============ 辅助方法 ============

    private Operand emitTemp(SourceLocation loc, IrOp op, List<IrInst> out, Operand... operands) {
        String temp = ctx.freshTemp();
        out.add(new TempAssign(loc, temp, op, Arrays.asList(operands)));
        return Operand.variable(temp);
    }

    /**
     * 数字字面量或取负的数字字面量的值，其余返回 null
     */
    static Number constantValue(Expression expr) {
        if (expr instanceof NumberLiteral) {
            return ((NumberLiteral) expr).getValue();
        }
        if (expr instanceof UnaryExpr && ((UnaryExpr) expr).getOperator() == UnaryExpr.UnaryOp.NEG) {
            Number inner = constantValue(((UnaryExpr) expr).getOperand());
            if (inner instanceof Long) return Long.valueOf(-inner.longValue());
            if (inner != null) return Double.valueOf(-inner.doubleValue());
        }
        return null;
    }
}
