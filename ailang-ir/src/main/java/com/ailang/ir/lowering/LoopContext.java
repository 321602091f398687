package com.ailang.ir.lowering;

import com.ailang.ir.inst.IrInst;

import java.util.Collections;
import java.util.List;

/**
 * 正在生成的循环。continue 在跳转前先执行 continuePrologue（for 循环的递增）。
 */
final class LoopContext {

    private final List<IrInst> continuePrologue;

    LoopContext(List<IrInst> continuePrologue) {
        this.continuePrologue = continuePrologue;
    }

    static LoopContext plain() {
        return new LoopContext(Collections.<IrInst>emptyList());
    }

    List<IrInst> getContinuePrologue() {
        return continuePrologue;
    }
}
