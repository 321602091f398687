package com.ailang.ir.builtin;

import com.ailang.compiler.analysis.ValueKind;
import com.ailang.compiler.ast.SourceLocation;
import com.ailang.ir.lowering.ResolutionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 内置函数解析器
 *
 * <p>把裸调用映射到固定的运行时入口，把方法调用按接收者的静态种类分派到
 * 数组、哈希表或字符串契约。所有映射在编译期确定，参数个数静态检查。</p>
 */
public final class BuiltinResolver {

    // ============ 内部契约入口 ============

    public static final BuiltinSpec ARRAY_CREATE = internal("array_create", 0, ValueKind.LIST, RuntimeContract.ARRAY);
    public static final BuiltinSpec ARRAY_PUSH = internal("array_push", 2, null, RuntimeContract.ARRAY);
    public static final BuiltinSpec ARRAY_GET = internal("array_get", 2, ValueKind.UNKNOWN, RuntimeContract.ARRAY);
    public static final BuiltinSpec ARRAY_SET = internal("array_set", 3, null, RuntimeContract.ARRAY);
    public static final BuiltinSpec ARRAY_LENGTH = internal("array_length", 1, ValueKind.NUMBER, RuntimeContract.ARRAY);
    public static final BuiltinSpec HASHMAP_CREATE = internal("hashmap_create", 0, ValueKind.DICT, RuntimeContract.HASHMAP);
    public static final BuiltinSpec HASHMAP_GET = internal("hashmap_get", 2, ValueKind.UNKNOWN, RuntimeContract.HASHMAP);
    public static final BuiltinSpec HASHMAP_SET = internal("hashmap_set", 3, null, RuntimeContract.HASHMAP);
    public static final BuiltinSpec HASHMAP_KEYS = internal("hashmap_keys", 1, ValueKind.LIST, RuntimeContract.HASHMAP);
    public static final BuiltinSpec STRING_LENGTH = internal("string_length", 1, ValueKind.NUMBER, RuntimeContract.STRING);
    public static final BuiltinSpec STRING_CHAR_AT = internal("string_char_at", 2, ValueKind.STRING, RuntimeContract.STRING);
    public static final BuiltinSpec STRING_CONCAT = internal("string_concat", 2, ValueKind.STRING, RuntimeContract.STRING);

    private static final Map<String, BuiltinSpec> FUNCTIONS = new LinkedHashMap<String, BuiltinSpec>();
    private static final Map<RuntimeContract, Map<String, BuiltinSpec>> METHODS =
            new EnumMap<RuntimeContract, Map<String, BuiltinSpec>>(RuntimeContract.class);

    static {
        function("print", "rt_print", BuiltinSpec.VARIADIC, null);
        function("len", "rt_len", 1, ValueKind.NUMBER);
        function("str", "rt_to_string", 1, ValueKind.STRING);
        function("int", "rt_to_int", 1, ValueKind.NUMBER);
        function("float", "rt_to_float", 1, ValueKind.NUMBER);
        function("abs", "rt_abs", 1, ValueKind.NUMBER);
        function("chr", "string_from_char", 1, ValueKind.STRING);
        function("ord", "string_char_code", 1, ValueKind.NUMBER);
        function("input", "rt_input", 1, ValueKind.STRING);
        function("max", "rt_max", 2, ValueKind.NUMBER);
        function("min", "rt_min", 2, ValueKind.NUMBER);
        function("pow", "rt_pow", 2, ValueKind.NUMBER);
        function("list", "array_create", 0, ValueKind.LIST);
        function("dict", "hashmap_create", 0, ValueKind.DICT);

        method(RuntimeContract.ARRAY, "append", "array_push", 1, null);
        method(RuntimeContract.ARRAY, "pop", "array_pop", 0, ValueKind.UNKNOWN);
        method(RuntimeContract.ARRAY, "insert", "array_insert", 2, null);
        method(RuntimeContract.ARRAY, "clear", "array_clear", 0, null);

        method(RuntimeContract.HASHMAP, "get", "hashmap_get", 1, ValueKind.UNKNOWN);
        method(RuntimeContract.HASHMAP, "keys", "hashmap_keys", 0, ValueKind.LIST);
        method(RuntimeContract.HASHMAP, "values", "hashmap_values", 0, ValueKind.LIST);
        method(RuntimeContract.HASHMAP, "clear", "hashmap_clear", 0, null);

        method(RuntimeContract.STRING, "upper", "string_upper", 0, ValueKind.STRING);
        method(RuntimeContract.STRING, "lower", "string_lower", 0, ValueKind.STRING);
        method(RuntimeContract.STRING, "strip", "string_strip", 0, ValueKind.STRING);
        method(RuntimeContract.STRING, "find", "string_find", 1, ValueKind.NUMBER);
        method(RuntimeContract.STRING, "replace", "string_replace", 2, ValueKind.STRING);
        method(RuntimeContract.STRING, "split", "string_split", 1, ValueKind.LIST);
        method(RuntimeContract.STRING, "startswith", "string_starts_with", 1, ValueKind.NUMBER);
        method(RuntimeContract.STRING, "endswith", "string_ends_with", 1, ValueKind.NUMBER);
        method(RuntimeContract.STRING, "join", "string_join", 1, ValueKind.STRING);
    }

    private static BuiltinSpec internal(String entry, int arity, ValueKind result, RuntimeContract contract) {
        return new BuiltinSpec(entry, entry, arity, result, contract);
    }

    private static void function(String name, String entry, int arity, ValueKind result) {
        FUNCTIONS.put(name, new BuiltinSpec(name, entry, arity, result, RuntimeContract.CORE));
    }

    private static void method(RuntimeContract contract, String name, String entry, int arity, ValueKind result) {
        Map<String, BuiltinSpec> table = METHODS.get(contract);
        if (table == null) {
            table = new LinkedHashMap<String, BuiltinSpec>();
            METHODS.put(contract, table);
        }
        table.put(name, new BuiltinSpec(name, entry, arity, result, contract));
    }

    // ============ 裸调用 ============

    public boolean isBuiltin(String name) {
        return FUNCTIONS.containsKey(name);
    }

    /** 内置函数名，函数定义不能与之重名 */
    public Set<String> getBuiltinNames() {
        return Collections.unmodifiableSet(FUNCTIONS.keySet());
    }

    /**
     * 查找内置函数（不检查参数）
     */
    public BuiltinSpec lookupFunction(String name) {
        return FUNCTIONS.get(name);
    }

    /**
     * 解析内置函数调用并检查参数个数。不是内置函数时返回 null。
     */
    public BuiltinSpec resolveFunction(String name, int argCount, SourceLocation location) {
        BuiltinSpec spec = FUNCTIONS.get(name);
        if (spec == null) {
            return null;
        }
        checkArity(name + "()", spec, argCount, location);
        return spec;
    }

    // ============ 方法调用 ============

    /**
     * 按接收者种类查找方法，找不到或无法确定时返回 null（用于种类推断）
     */
    public BuiltinSpec findMethod(ValueKind receiverKind, String method) {
        if (receiverKind == ValueKind.UNKNOWN) {
            List<BuiltinSpec> candidates = candidates(method);
            return candidates.size() == 1 ? candidates.get(0) : null;
        }
        RuntimeContract contract = RuntimeContract.forReceiver(receiverKind);
        return contract != null ? METHODS.get(contract).get(method) : null;
    }

    /**
     * 解析方法调用。
     *
     * <p>已知种类使用对应契约；UNKNOWN 只在方法名恰好属于一个契约时解析；
     * AMBIGUOUS 一律报错。</p>
     */
    public BuiltinSpec resolveMethod(ValueKind receiverKind, String method, int argCount,
                                     SourceLocation location) {
        BuiltinSpec spec;
        switch (receiverKind) {
            case AMBIGUOUS:
                throw new ResolutionException("Cannot resolve method '" + method
                        + "': receiver may hold values of different kinds", location);
            case UNKNOWN: {
                List<BuiltinSpec> candidates = candidates(method);
                if (candidates.isEmpty()) {
                    throw new ResolutionException("Unknown method '" + method + "'", location);
                }
                if (candidates.size() > 1) {
                    throw new ResolutionException("Method '" + method
                            + "' is defined for several kinds and the receiver kind is unknown", location);
                }
                spec = candidates.get(0);
                break;
            }
            default: {
                RuntimeContract contract = RuntimeContract.forReceiver(receiverKind);
                spec = contract != null ? METHODS.get(contract).get(method) : null;
                if (spec == null) {
                    throw new ResolutionException("Type " + receiverKind.getDisplayName()
                            + " has no method '" + method + "'", location);
                }
                break;
            }
        }
        checkArity(spec.getContract().getReceiverKind().getDisplayName() + "." + method + "()",
                spec, argCount, location);
        return spec;
    }

    private static List<BuiltinSpec> candidates(String method) {
        List<BuiltinSpec> result = new ArrayList<BuiltinSpec>();
        for (Map<String, BuiltinSpec> table : METHODS.values()) {
            BuiltinSpec spec = table.get(method);
            if (spec != null) {
                result.add(spec);
            }
        }
        return result;
    }

    // ============ 下标与迭代 ============

    public BuiltinSpec resolveIndexGet(ValueKind targetKind, SourceLocation location) {
        switch (targetKind) {
            case LIST:
            case UNKNOWN:
                return ARRAY_GET;
            case DICT:
                return HASHMAP_GET;
            case STRING:
                return STRING_CHAR_AT;
            default:
                throw new ResolutionException("Cannot index a value of kind "
                        + targetKind.getDisplayName(), location);
        }
    }

    public BuiltinSpec resolveIndexSet(ValueKind targetKind, SourceLocation location) {
        switch (targetKind) {
            case LIST:
            case UNKNOWN:
                return ARRAY_SET;
            case DICT:
                return HASHMAP_SET;
            case STRING:
                throw new ResolutionException("Strings do not support item assignment", location);
            default:
                throw new ResolutionException("Cannot assign to an index of a value of kind "
                        + targetKind.getDisplayName(), location);
        }
    }

    // ============ 参数检查 ============

    private static void checkArity(String display, BuiltinSpec spec, int argCount, SourceLocation location) {
        if (!spec.accepts(argCount)) {
            throw new ResolutionException(display + " takes " + plural(spec.getArity(), "argument")
                    + ", got " + argCount, location);
        }
    }

    public static String plural(int count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }
}
