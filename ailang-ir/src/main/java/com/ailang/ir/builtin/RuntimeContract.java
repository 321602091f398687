package com.ailang.ir.builtin;

import com.ailang.compiler.analysis.ValueKind;

/**
 * 运行时契约：一组由运行时提供的固定入口。
 */
public enum RuntimeContract {
    CORE(null),
    ARRAY(ValueKind.LIST),
    HASHMAP(ValueKind.DICT),
    STRING(ValueKind.STRING);

    private final ValueKind receiverKind;

    RuntimeContract(ValueKind receiverKind) {
        this.receiverKind = receiverKind;
    }

    /** 方法调用接收者的种类；CORE 没有接收者 */
    public ValueKind getReceiverKind() {
        return receiverKind;
    }

    public static RuntimeContract forReceiver(ValueKind kind) {
        for (RuntimeContract contract : values()) {
            if (contract.receiverKind == kind) {
                return contract;
            }
        }
        return null;
    }
}
