package com.ailang.ir.lowering;

import com.ailang.compiler.analysis.ValueKind;
import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.decl.FunctionDef;
import com.ailang.compiler.ast.expr.*;
import com.ailang.compiler.ast.stmt.*;
import com.ailang.ir.builtin.BuiltinResolver;
import com.ailang.ir.builtin.BuiltinSpec;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 函数内的值种类推断
 *
 * <p>对函数体中每个变量的全部赋值取种类合并，迭代到不动点，
 * 因此循环中后出现的赋值也会影响前面的使用点。参数的种类为 UNKNOWN。</p>
 */
public final class KindInference {

    private final BuiltinResolver builtins;
    private final Map<String, ValueKind> kinds = new HashMap<String, ValueKind>();
    private final Set<String> names = new HashSet<String>();
    private boolean changed;

    private KindInference(BuiltinResolver builtins) {
        this.builtins = builtins;
    }

    public static KindInference infer(FunctionDef function, BuiltinResolver builtins) {
        KindInference inference = new KindInference(builtins);
        for (String param : function.getParams()) {
            inference.kinds.put(param, ValueKind.UNKNOWN);
            inference.names.add(param);
        }
        Collector collector = inference.new Collector();
        do {
            inference.changed = false;
            collector.visitAll(function.getBody());
        } while (inference.changed);
        return inference;
    }

    /**
     * 变量在整个函数中的合并种类，从未赋值的变量为 UNKNOWN
     */
    public ValueKind kindOfVariable(String name) {
        ValueKind kind = kinds.get(name);
        return kind != null ? kind : ValueKind.UNKNOWN;
    }

    /**
     * 名称是否是函数中的参数或被赋值的变量（临时变量命名需要避开）
     */
    public boolean isVariableName(String name) {
        return names.contains(name);
    }

    /**
     * 表达式的静态种类
     */
    public ValueKind kindOf(Expression expr) {
        ValueKind kind = rawKindOf(expr);
        return kind != null ? kind : ValueKind.UNKNOWN;
    }

    // null 表示本轮迭代中尚无信息
    private ValueKind rawKindOf(Expression expr) {
        if (expr instanceof NumberLiteral) return ValueKind.NUMBER;
        if (expr instanceof StringLiteral) return ValueKind.STRING;
        if (expr instanceof ListLiteral) return ValueKind.LIST;
        if (expr instanceof DictLiteral) return ValueKind.DICT;
        if (expr instanceof Identifier) return kinds.get(((Identifier) expr).getName());

        if (expr instanceof BinaryExpr) {
            BinaryExpr binary = (BinaryExpr) expr;
            if (binary.getOperator() != BinaryExpr.BinaryOp.ADD) {
                return ValueKind.NUMBER;
            }
            ValueKind left = rawKindOf(binary.getLeft());
            ValueKind right = rawKindOf(binary.getRight());
            if (left == ValueKind.STRING && right == ValueKind.STRING) return ValueKind.STRING;
            if (left == ValueKind.NUMBER && right == ValueKind.NUMBER) return ValueKind.NUMBER;
            if (left == null || right == null) return null;
            return ValueKind.UNKNOWN;
        }
        if (expr instanceof UnaryExpr) {
            return ValueKind.NUMBER;
        }
        if (expr instanceof CallExpr) {
            BuiltinSpec spec = builtins.lookupFunction(((CallExpr) expr).getCallee());
            return spec != null && spec.hasResult() ? spec.getResultKind() : ValueKind.UNKNOWN;
        }
        if (expr instanceof MethodCallExpr) {
            MethodCallExpr call = (MethodCallExpr) expr;
            BuiltinSpec spec = builtins.findMethod(kindOf(call.getReceiver()), call.getMethod());
            return spec != null && spec.hasResult() ? spec.getResultKind() : ValueKind.UNKNOWN;
        }
        if (expr instanceof IndexExpr) {
            return kindOf(((IndexExpr) expr).getTarget()) == ValueKind.STRING ? ValueKind.STRING : ValueKind.UNKNOWN;
        }
        return ValueKind.UNKNOWN;
    }

    private void record(String name, ValueKind kind) {
        names.add(name);
        if (kind == null) return;
        ValueKind existing = kinds.get(name);
        ValueKind merged = existing == null ? kind : existing.merge(kind);
        if (merged != existing) {
            kinds.put(name, merged);
            changed = true;
        }
    }

    /**
     * 收集赋值。只需遍历语句，表达式内部不产生赋值。
     */
    private final class Collector implements AstVisitor<Void, Void> {

        void visitAll(List<Statement> statements) {
            for (Statement stmt : statements) {
                stmt.accept(this, null);
            }
        }

        @Override
        public Void visitAssignStmt(AssignStmt node, Void ctx) {
            record(node.getTarget(), rawKindOf(node.getValue()));
            return null;
        }

        @Override
        public Void visitAugAssignStmt(AugAssignStmt node, Void ctx) {
            if (node.getTarget() instanceof Identifier) {
                String name = ((Identifier) node.getTarget()).getName();
                BinaryExpr combined = new BinaryExpr(node.getLocation(), node.getTarget(),
                        node.getOperator(), node.getValue());
                record(name, rawKindOf(combined));
            }
            return null;
        }

        @Override
        public Void visitIfStmt(IfStmt node, Void ctx) {
            for (IfBranch branch : node.getBranches()) {
                visitAll(branch.getBody());
            }
            if (node.hasElse()) {
                visitAll(node.getElseBody());
            }
            return null;
        }

        @Override
        public Void visitWhileStmt(WhileStmt node, Void ctx) {
            visitAll(node.getBody());
            return null;
        }

        @Override
        public Void visitForRangeStmt(ForRangeStmt node, Void ctx) {
            record(node.getVariable(), ValueKind.NUMBER);
            visitAll(node.getBody());
            return null;
        }

        @Override
        public Void visitForEachStmt(ForEachStmt node, Void ctx) {
            ValueKind iterable = rawKindOf(node.getIterable());
            ValueKind element = iterable == null ? null
                    : iterable == ValueKind.STRING ? ValueKind.STRING : ValueKind.UNKNOWN;
            record(node.getVariable(), element);
            visitAll(node.getBody());
            return null;
        }
    }
}
