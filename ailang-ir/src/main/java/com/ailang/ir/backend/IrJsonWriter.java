package com.ailang.ir.backend;

import com.ailang.ir.inst.*;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.List;

/**
 * IR 的 JSON 交接格式。
 *
 * <p>每个函数一个对象（name、params、instructions），每条指令用 "kind" 标记类别；
 * 操作数为 {"var": name}、{"num": value} 或 {"str": value}。</p>
 */
public final class IrJsonWriter implements IrVisitor<JsonObject> {

    private final Gson gson;

    public IrJsonWriter(boolean pretty) {
        GsonBuilder builder = new GsonBuilder().disableHtmlEscaping().serializeNulls();
        if (pretty) {
            builder.setPrettyPrinting();
        }
        this.gson = builder.create();
    }

    public IrJsonWriter() {
        this(true);
    }

    public String write(IrProgram program) {
        return gson.toJson(toJson(program));
    }

    public JsonObject toJson(IrProgram program) {
        JsonObject root = new JsonObject();
        root.addProperty("file", program.getFileName());
        JsonArray functions = new JsonArray();
        for (IrFunction function : program.getFunctions()) {
            functions.add(toJson(function));
        }
        root.add("functions", functions);
        return root;
    }

    public JsonObject toJson(IrFunction function) {
        JsonObject obj = new JsonObject();
        obj.addProperty("name", function.getName());
        JsonArray params = new JsonArray();
        for (String param : function.getParams()) {
            params.add(param);
        }
        obj.add("params", params);
        obj.addProperty("synthetic", function.isSynthetic());
        obj.add("instructions", instructions(function.getBody()));
        return obj;
    }

    private JsonArray instructions(List<IrInst> insts) {
        JsonArray array = new JsonArray();
        for (IrInst inst : insts) {
            array.add(inst.accept(this));
        }
        return array;
    }

    private static JsonObject tagged(IrInst inst) {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", inst.getKind());
        if (inst.getLocation() != null) {
            obj.addProperty("line", inst.getLocation().getLine());
        }
        return obj;
    }

    static JsonObject operand(Operand operand) {
        JsonObject obj = new JsonObject();
        switch (operand.getKind()) {
            case VARIABLE:
                obj.addProperty("var", operand.getName());
                break;
            case NUMBER:
                obj.addProperty("num", (Number) operand.getValue());
                break;
            default:
                obj.addProperty("str", (String) operand.getValue());
                break;
        }
        return obj;
    }

    private static JsonArray operands(List<Operand> operands) {
        JsonArray array = new JsonArray();
        for (Operand operand : operands) {
            array.add(operand(operand));
        }
        return array;
    }

    private static JsonElement nullable(String value) {
        return value != null ? new JsonPrimitive(value) : JsonNull.INSTANCE;
    }

    @Override
    public JsonObject visitTempAssign(TempAssign inst) {
        JsonObject obj = tagged(inst);
        obj.addProperty("target", inst.getTarget());
        obj.addProperty("op", inst.getOp().name());
        obj.add("operands", operands(inst.getOperands()));
        return obj;
    }

    @Override
    public JsonObject visitBuiltinCall(BuiltinCall inst) {
        JsonObject obj = tagged(inst);
        obj.addProperty("entry", inst.getEntry());
        obj.add("operands", operands(inst.getOperands()));
        obj.add("result", nullable(inst.getResult()));
        return obj;
    }

    @Override
    public JsonObject visitFunctionCall(FunctionCall inst) {
        JsonObject obj = tagged(inst);
        obj.addProperty("function", inst.getFunction());
        obj.add("operands", operands(inst.getOperands()));
        obj.add("result", nullable(inst.getResult()));
        return obj;
    }

    @Override
    public JsonObject visitIfBlock(IfBlock inst) {
        JsonObject obj = tagged(inst);
        obj.add("condition", operand(inst.getCondition()));
        obj.add("then", instructions(inst.getThenBody()));
        obj.add("else", instructions(inst.getElseBody()));
        return obj;
    }

    @Override
    public JsonObject visitWhileBlock(WhileBlock inst) {
        JsonObject obj = tagged(inst);
        obj.add("conditionCode", instructions(inst.getConditionCode()));
        obj.add("condition", operand(inst.getCondition()));
        obj.add("body", instructions(inst.getBody()));
        return obj;
    }

    @Override
    public JsonObject visitReturnValue(ReturnValue inst) {
        JsonObject obj = tagged(inst);
        obj.add("value", operand(inst.getValue()));
        return obj;
    }

    @Override
    public JsonObject visitRawPassthrough(RawPassthrough inst) {
        JsonObject obj = tagged(inst);
        obj.addProperty("opener", inst.getOpener());
        obj.addProperty("payload", inst.getPayload());
        return obj;
    }

    @Override
    public JsonObject visitBreak(BreakInst inst) {
        return tagged(inst);
    }

    @Override
    public JsonObject visitContinue(ContinueInst inst) {
        return tagged(inst);
    }

    @Override
    public JsonObject visitNoOp(NoOp inst) {
        return tagged(inst);
    }
}
