package com.ailang.ir.inst;

import java.util.List;

final class CallFormat {

    private CallFormat() {
    }

    static String arguments(List<Operand> operands) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(operands.get(i));
        }
        return sb.append(')').toString();
    }
}
