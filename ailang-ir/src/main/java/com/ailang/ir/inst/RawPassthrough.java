package com.ailang.ir.inst;

import com.ailang.compiler.ast.SourceLocation;

/**
 * 透传块，payload 与源码中花括号之间的文本逐字节一致。
 */
public final class RawPassthrough extends IrInst {

    private final String opener;
    private final String payload;

    public RawPassthrough(SourceLocation location, String opener, String payload) {
        super(location);
        this.opener = opener;
        this.payload = payload;
    }

    public String getOpener() { return opener; }
    public String getPayload() { return payload; }

    @Override
    public String getKind() {
        return "RawPassthrough";
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitRawPassthrough(this);
    }

    @Override
    public String toString() {
        return opener + " {" + payload + "}";
    }
}
