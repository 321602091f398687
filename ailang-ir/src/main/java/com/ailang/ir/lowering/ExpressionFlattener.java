package com.ailang.ir.lowering;

import com.ailang.compiler.analysis.FunctionScope;
import com.ailang.compiler.analysis.FunctionSignature;
import com.ailang.compiler.analysis.SignatureTable;
import com.ailang.compiler.analysis.ValueKind;
import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.SourceLocation;
import com.ailang.compiler.ast.expr.*;
import com.ailang.ir.builtin.BuiltinResolver;
import com.ailang.ir.builtin.BuiltinSpec;
import com.ailang.ir.inst.BuiltinCall;
import com.ailang.ir.inst.FunctionCall;
import com.ailang.ir.inst.IrInst;
import com.ailang.ir.inst.IrOp;
import com.ailang.ir.inst.Operand;
import com.ailang.ir.inst.TempAssign;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 表达式扁平化
 *
 * <p>叶子（标识符、数字、字符串）直接作为操作数。每个内部节点先从左到右
 * 深度优先展开子节点，再产生恰好一条有值指令，结果放入新的临时变量。
 * 赋值语句右侧的根节点若是运算或调用，则直接写入目标变量。</p>
 *
 * <p>and/or 不短路：两侧总是都被计算。</p>
 */
public final class ExpressionFlattener implements AstVisitor<Operand, ExpressionFlattener.Target> {

    /**
     * 一次展开的输出位置：指令列表、可选的目标变量、是否需要值
     */
    static final class Target {
        final List<IrInst> out;
        final String dest;       // null = 新临时变量
        final boolean discard;   // 表达式语句的根调用不接收返回值

        private Target(List<IrInst> out, String dest, boolean discard) {
            this.out = out;
            this.dest = dest;
            this.discard = discard;
        }

        static Target value(List<IrInst> out) {
            return new Target(out, null, false);
        }

        static Target into(String dest, List<IrInst> out) {
            return new Target(out, dest, false);
        }

        static Target discarded(List<IrInst> out) {
            return new Target(out, null, true);
        }
    }

    private final LoweringContext ctx;
    private final SignatureTable signatures;
    private final BuiltinResolver builtins;

    public ExpressionFlattener(LoweringContext ctx, SignatureTable signatures, BuiltinResolver builtins) {
        this.ctx = ctx;
        this.signatures = signatures;
        this.builtins = builtins;
    }

    // ============ 入口 ============

    /**
     * 展开表达式，返回承载其值的操作数
     */
    public Operand flatten(Expression expr, List<IrInst> out) {
        return expr.accept(this, Target.value(out));
    }

    /**
     * 展开赋值右侧，结果写入 target。叶子和列表/字典字面量通过 COPY 写入。
     */
    public void flattenInto(Expression expr, String target, List<IrInst> out) {
        if (expr.isLeaf() || expr instanceof ListLiteral || expr instanceof DictLiteral) {
            Operand value = flatten(expr, out);
            out.add(new TempAssign(expr.getLocation(), target, IrOp.COPY, Collections.singletonList(value)));
            return;
        }
        expr.accept(this, Target.into(target, out));
    }

    /**
     * 展开表达式语句。根节点为调用时不接收返回值。
     */
    public void flattenStatement(Expression expr, List<IrInst> out) {
        expr.accept(this, Target.discarded(out));
    }

    // ============ 叶子 ============

    @Override
    public Operand visitIdentifier(Identifier node, Target target) {
        return readVariable(node.getName(), node.getLocation());
    }

    @Override
    public Operand visitNumberLiteral(NumberLiteral node, Target target) {
        return Operand.number(node.getValue());
    }

    @Override
    public Operand visitStringLiteral(StringLiteral node, Target target) {
        return Operand.string(node.getValue());
    }

    private Operand readVariable(String name, SourceLocation location) {
        FunctionScope scope = ctx.getScope();
        if (!scope.isDeclared(name)) {
            if (signatures.contains(name) || builtins.isBuiltin(name)) {
                throw new GenerationException("Function '" + name + "' cannot be used as a value", location);
            }
        }
        return Operand.variable(scope.resolve(name, location).getName());
    }

    // ============ 运算 ============

    @Override
    public Operand visitBinaryExpr(BinaryExpr node, Target target) {
        Operand left = child(node.getLeft(), target);
        Operand right = child(node.getRight(), target);
        String dest = destination(target);

        if (node.getOperator() == BinaryExpr.BinaryOp.ADD
                && ctx.getKinds().kindOf(node.getLeft()) == ValueKind.STRING
                && ctx.getKinds().kindOf(node.getRight()) == ValueKind.STRING) {
            target.out.add(new BuiltinCall(node.getLocation(), BuiltinResolver.STRING_CONCAT.getEntry(),
                    Arrays.asList(left, right), dest));
        } else {
            target.out.add(new TempAssign(node.getLocation(), dest, binaryOp(node.getOperator()),
                    Arrays.asList(left, right)));
        }
        return Operand.variable(dest);
    }

    @Override
    public Operand visitUnaryExpr(UnaryExpr node, Target target) {
        Operand operand = child(node.getOperand(), target);
        String dest = destination(target);
        IrOp op = node.getOperator() == UnaryExpr.UnaryOp.NEG ? IrOp.NEG : IrOp.NOT;
        target.out.add(new TempAssign(node.getLocation(), dest, op, Collections.singletonList(operand)));
        return Operand.variable(dest);
    }

    static IrOp binaryOp(BinaryExpr.BinaryOp op) {
        switch (op) {
            case ADD: return IrOp.ADD;
            case SUB: return IrOp.SUB;
            case MUL: return IrOp.MUL;
            case DIV: return IrOp.DIV;
            case FLOOR_DIV: return IrOp.FLOOR_DIV;
            case MOD: return IrOp.MOD;
            case POW: return IrOp.POW;
            case EQ: return IrOp.EQ;
            case NE: return IrOp.NE;
            case LT: return IrOp.LT;
            case GT: return IrOp.GT;
            case LE: return IrOp.LE;
            case GE: return IrOp.GE;
            case AND: return IrOp.AND;
            case OR: return IrOp.OR;
            default: throw new IllegalArgumentException("Unknown binary operator: " + op);
        }
    }

    // ============ 调用 ============

    @Override
    public Operand visitCallExpr(CallExpr node, Target target) {
        String callee = node.getCallee();
        int argCount = node.getArgs().size();
        SourceLocation loc = node.getLocation();

        FunctionSignature signature = signatures.lookup(callee);
        if (signature != null) {
            if (signature.getArity() != argCount) {
                throw new ResolutionException(callee + "() takes "
                        + BuiltinResolver.plural(signature.getArity(), "argument") + ", got " + argCount, loc);
            }
            List<Operand> args = children(node.getArgs(), target);
            String result = target.discard ? null : destination(target);
            target.out.add(new FunctionCall(loc, callee, args, result));
            return result != null ? Operand.variable(result) : null;
        }

        BuiltinSpec spec = builtins.resolveFunction(callee, argCount, loc);
        if (spec == null) {
            if ("range".equals(callee)) {
                throw new ResolutionException("range() is only supported in a for loop header", loc);
            }
            throw new ResolutionException("Unknown function '" + callee + "'", loc);
        }
        List<Operand> args = children(node.getArgs(), target);
        return emitBuiltin(spec, callee + "()", args, loc, target);
    }

    @Override
    public Operand visitMethodCallExpr(MethodCallExpr node, Target target) {
        ValueKind receiverKind = ctx.getKinds().kindOf(node.getReceiver());
        BuiltinSpec spec = builtins.resolveMethod(receiverKind, node.getMethod(),
                node.getArgs().size(), node.getLocation());

        List<Operand> operands = new ArrayList<Operand>();
        operands.add(child(node.getReceiver(), target));
        operands.addAll(children(node.getArgs(), target));
        String display = spec.getContract().getReceiverKind().getDisplayName() + "." + node.getMethod() + "()";
        return emitBuiltin(spec, display, operands, node.getLocation(), target);
    }

    private Operand emitBuiltin(BuiltinSpec spec, String display, List<Operand> operands,
                                SourceLocation loc, Target target) {
        String result = null;
        if (!target.discard) {
            if (!spec.hasResult()) {
                throw new GenerationException(display + " does not produce a value", loc);
            }
            result = destination(target);
        }
        target.out.add(new BuiltinCall(loc, spec.getEntry(), operands, result));
        return result != null ? Operand.variable(result) : null;
    }

    @Override
    public Operand visitIndexExpr(IndexExpr node, Target target) {
        BuiltinSpec spec = builtins.resolveIndexGet(ctx.getKinds().kindOf(node.getTarget()), node.getLocation());
        Operand container = child(node.getTarget(), target);
        Operand index = child(node.getIndex(), target);
        String dest = destination(target);
        target.out.add(new BuiltinCall(node.getLocation(), spec.getEntry(), Arrays.asList(container, index), dest));
        return Operand.variable(dest);
    }

    // ============ 字面量 ============

    /**
     * 列表字面量：array_create 后每个元素一次 array_push
     */
    @Override
    public Operand visitListLiteral(ListLiteral node, Target target) {
        String array = ctx.freshTemp();
        target.out.add(new BuiltinCall(node.getLocation(), BuiltinResolver.ARRAY_CREATE.getEntry(),
                Collections.<Operand>emptyList(), array));
        for (Expression element : node.getElements()) {
            Operand value = child(element, target);
            target.out.add(new BuiltinCall(element.getLocation(), BuiltinResolver.ARRAY_PUSH.getEntry(),
                    Arrays.asList(Operand.variable(array), value), null));
        }
        return Operand.variable(array);
    }

    /**
     * 字典字面量：hashmap_create 后每个条目一次 hashmap_set
     */
    @Override
    public Operand visitDictLiteral(DictLiteral node, Target target) {
        String map = ctx.freshTemp();
        target.out.add(new BuiltinCall(node.getLocation(), BuiltinResolver.HASHMAP_CREATE.getEntry(),
                Collections.<Operand>emptyList(), map));
        for (int i = 0; i < node.size(); i++) {
            Expression keyExpr = node.getKeys().get(i);
            Operand key = child(keyExpr, target);
            Operand value = child(node.getValues().get(i), target);
            target.out.add(new BuiltinCall(keyExpr.getLocation(), BuiltinResolver.HASHMAP_SET.getEntry(),
                    Arrays.asList(Operand.variable(map), key, value), null));
        }
        return Operand.variable(map);
    }

    // ============ 辅助方法 ============

    private Operand child(Expression expr, Target parent) {
        return expr.accept(this, Target.value(parent.out));
    }

    private List<Operand> children(List<Expression> exprs, Target parent) {
        List<Operand> operands = new ArrayList<Operand>(exprs.size());
        for (Expression expr : exprs) {
            operands.add(child(expr, parent));
        }
        return operands;
    }

    /** 子节点展开之后再分配，保证临时变量按求值顺序编号 */
    private String destination(Target target) {
        return target.dest != null ? target.dest : ctx.freshTemp();
    }
}
