package com.ailang.compiler.analysis;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 程序中所有函数的签名表。在生成任何函数体之前构建，构建后不可变，
 * 因此前向调用和相互递归都能解析。
 */
public final class SignatureTable {

    private final Map<String, FunctionSignature> signatures;

    SignatureTable(Map<String, FunctionSignature> signatures) {
        this.signatures = Collections.unmodifiableMap(new LinkedHashMap<String, FunctionSignature>(signatures));
    }

    public FunctionSignature lookup(String name) {
        return signatures.get(name);
    }

    public boolean contains(String name) {
        return signatures.containsKey(name);
    }

    public Collection<FunctionSignature> getSignatures() {
        return signatures.values();
    }

    public int size() {
        return signatures.size();
    }
}
