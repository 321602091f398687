package com.ailang.ir.lowering;

import com.ailang.compiler.analysis.FunctionScope;
import com.ailang.compiler.ast.SourceLocation;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 单个函数的降级上下文：临时变量计数、作用域、种类推断和循环栈。
 * 每个函数新建一个，临时变量编号从 0 开始。
 */
public class LoweringContext {

    private final String tempPrefix;
    private final FunctionScope scope;
    private final KindInference kinds;
    private final Deque<LoopContext> loopStack = new ArrayDeque<LoopContext>();
    private int tempCounter = 0;

    public LoweringContext(String tempPrefix, FunctionScope scope, KindInference kinds) {
        this.tempPrefix = tempPrefix;
        this.scope = scope;
        this.kinds = kinds;
    }

    /**
     * 生成唯一的临时变量名，跳过与用户变量同名的编号。
     */
    public String freshTemp() {
        String name = tempPrefix + (tempCounter++);
        while (kinds.isVariableName(name)) {
            name = tempPrefix + (tempCounter++);
        }
        return name;
    }

    public FunctionScope getScope() {
        return scope;
    }

    public KindInference getKinds() {
        return kinds;
    }

    void pushLoop(LoopContext loop) {
        loopStack.push(loop);
    }

    void popLoop() {
        loopStack.pop();
    }

    /**
     * 最内层循环；不在循环内时报生成错误
     */
    LoopContext currentLoop(String keyword, SourceLocation location) {
        LoopContext loop = loopStack.peek();
        if (loop == null) {
            throw new GenerationException("'" + keyword + "' outside of a loop", location);
        }
        return loop;
    }
}
