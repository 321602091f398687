package com.ailang.compiler.analysis;

import com.ailang.compiler.ast.decl.FunctionDef;
import com.ailang.compiler.ast.decl.Program;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 签名收集预处理：在代码生成前登记所有函数。
 *
 * <p>检查重复函数名、重复参数名、与保留名（内置函数）冲突，
 * 以及用户定义的入口函数与顶层语句合成的入口函数冲突。</p>
 */
public final class SignatureCollector {

    private final Set<String> reservedNames;

    public SignatureCollector(Set<String> reservedNames) {
        this.reservedNames = reservedNames != null ? reservedNames : Collections.<String>emptySet();
    }

    public SignatureTable collect(Program program) {
        Map<String, FunctionSignature> signatures = new LinkedHashMap<String, FunctionSignature>();

        for (FunctionDef function : program.getFunctions()) {
            String name = function.getName();

            FunctionSignature existing = signatures.get(name);
            if (existing != null) {
                if (function.isSynthetic() || existing.isSynthetic()) {
                    throw new NameResolutionException("Function '" + name
                            + "' conflicts with the entry function built from top-level statements",
                            function.isSynthetic() ? existing.getLocation() : function.getLocation());
                }
                throw new NameResolutionException("Duplicate function '" + name
                        + "' (first defined at line " + existing.getLocation().getLine() + ")",
                        function.getLocation());
            }
            if (reservedNames.contains(name)) {
                throw new NameResolutionException("Function '" + name + "' shadows a built-in",
                        function.getLocation());
            }

            Set<String> seen = new HashSet<String>();
            for (String param : function.getParams()) {
                if (!seen.add(param)) {
                    throw new NameResolutionException("Duplicate parameter '" + param
                            + "' in function '" + name + "'", function.getLocation());
                }
            }

            signatures.put(name, new FunctionSignature(name, function.getParams(),
                    function.getLocation(), function.isSynthetic()));
        }

        return new SignatureTable(signatures);
    }
}
