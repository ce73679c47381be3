package com.arxlang.ir.print;

import com.arxlang.ir.ssa.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 将 IR 模块序列化为 LLVM 文本 IR。
 *
 * <p>默认输出带类型指针（{@code i32*}，LLVM 14 及以前）；开启 opaque 模式后
 * 所有指针类型输出为 {@code ptr}（LLVM 15 及以后）。</p>
 */
public class IrPrinter {

    private static final Pattern BARE_NAME = Pattern.compile("[-a-zA-Z$._][-a-zA-Z$._0-9]*");

    private final boolean opaquePointers;

    public IrPrinter() {
        this(false);
    }

    public IrPrinter(boolean opaquePointers) {
        this.opaquePointers = opaquePointers;
    }

    public String print(IrModule module) {
        StringBuilder sb = new StringBuilder();
        sb.append("; ModuleID = '").append(module.getName()).append("'\n");
        sb.append("source_filename = \"").append(escape(module.getSourceFileName())).append("\"\n");
        if (module.getTargetTriple() != null) {
            sb.append("target triple = \"").append(module.getTargetTriple()).append("\"\n");
        }

        if (!module.getStructTypes().isEmpty()) {
            sb.append('\n');
            for (IrType struct : module.getStructTypes()) {
                sb.append('%').append(name(struct.getStructName())).append(" = type { ");
                List<IrType> fields = struct.getFields();
                for (int i = 0; i < fields.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(type(fields.get(i)));
                }
                sb.append(" }\n");
            }
        }

        if (!module.getGlobals().isEmpty()) {
            sb.append('\n');
            for (IrGlobal global : module.getGlobals()) {
                sb.append('@').append(name(global.getName()))
                        .append(" = private unnamed_addr constant ")
                        .append(type(global.getType()))
                        .append(" c\"").append(bytes(global.getData())).append("\", align 1\n");
            }
        }

        // 先声明，后定义
        boolean first = true;
        for (IrFunction function : module.getFunctions()) {
            if (!function.isDeclaration()) continue;
            if (first) {
                sb.append('\n');
                first = false;
            }
            printDeclaration(function, sb);
        }
        for (IrFunction function : module.getFunctions()) {
            if (function.isDeclaration()) continue;
            sb.append('\n');
            printDefinition(function, sb);
        }
        return sb.toString();
    }

    // ========== 函数 ==========

    private void printDeclaration(IrFunction function, StringBuilder sb) {
        sb.append("declare ").append(type(function.getReturnType()))
                .append(" @").append(name(function.getName())).append('(');
        List<IrParam> params = function.getParams();
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(type(params.get(i).getType()));
        }
        sb.append(")\n");
    }

    private void printDefinition(IrFunction function, StringBuilder sb) {
        sb.append("define ").append(type(function.getReturnType()))
                .append(" @").append(name(function.getName())).append('(');
        List<IrParam> params = function.getParams();
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(type(params.get(i).getType())).append(" %").append(name(params.get(i).getName()));
        }
        sb.append(") {\n");
        boolean firstBlock = true;
        for (BasicBlock block : function.getBlocks()) {
            if (!firstBlock) sb.append('\n');
            firstBlock = false;
            sb.append(name(block.getLabel())).append(":\n");
            for (IrInst inst : block.getInstructions()) {
                sb.append("  ");
                printInstruction(inst, sb);
                sb.append('\n');
            }
            if (block.getTerminator() != null) {
                sb.append("  ");
                printTerminator(block.getTerminator(), sb);
                sb.append('\n');
            }
        }
        sb.append("}\n");
    }

    // ========== 指令 ==========

    private void printInstruction(IrInst inst, StringBuilder sb) {
        if (inst.hasResult()) {
            sb.append('%').append(name(inst.getResult().getName())).append(" = ");
        }
        switch (inst.getOp()) {
            case ALLOCA:
                sb.append("alloca ").append(type(inst.getAuxType()));
                break;
            case LOAD: {
                IrValue pointer = inst.getOperand(0);
                sb.append("load ").append(type(inst.getResult().getType()))
                        .append(", ").append(typed(pointer));
                break;
            }
            case STORE:
                sb.append("store ").append(typed(inst.getOperand(0)))
                        .append(", ").append(typed(inst.getOperand(1)));
                break;
            case GEP:
                sb.append("getelementptr ").append(type(inst.getAuxType()));
                for (IrValue operand : inst.getOperands()) {
                    sb.append(", ").append(typed(operand));
                }
                break;
            case BITCAST:
                sb.append("bitcast ").append(typed(inst.getOperand(0)))
                        .append(" to ").append(type(inst.getResult().getType()));
                break;
            case ICMP:
                sb.append("icmp ").append(inst.getPredicate().getIntMnemonic()).append(' ')
                        .append(typed(inst.getOperand(0))).append(", ").append(operand(inst.getOperand(1)));
                break;
            case FCMP:
                sb.append("fcmp ").append(inst.getPredicate().getFloatMnemonic()).append(' ')
                        .append(typed(inst.getOperand(0))).append(", ").append(operand(inst.getOperand(1)));
                break;
            case CALL: {
                IrType returnType = inst.hasResult() ? inst.getResult().getType() : IrType.VOID;
                sb.append("call ").append(type(returnType)).append(" @").append(name(inst.getCallee())).append('(');
                List<IrValue> args = inst.getOperands();
                for (int i = 0; i < args.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(typed(args.get(i)));
                }
                sb.append(')');
                break;
            }
            default:
                // 二元算术 / 逻辑
                sb.append(inst.getOp().getMnemonic()).append(' ')
                        .append(typed(inst.getOperand(0))).append(", ").append(operand(inst.getOperand(1)));
                break;
        }
    }

    private void printTerminator(IrTerminator terminator, StringBuilder sb) {
        if (terminator instanceof IrTerminator.Goto) {
            sb.append("br label %").append(name(((IrTerminator.Goto) terminator).getTarget().getLabel()));
        } else if (terminator instanceof IrTerminator.Branch) {
            IrTerminator.Branch branch = (IrTerminator.Branch) terminator;
            sb.append("br ").append(typed(branch.getCondition()))
                    .append(", label %").append(name(branch.getThenBlock().getLabel()))
                    .append(", label %").append(name(branch.getElseBlock().getLabel()));
        } else if (terminator instanceof IrTerminator.Return) {
            IrTerminator.Return ret = (IrTerminator.Return) terminator;
            sb.append(ret.isVoid() ? "ret void" : "ret " + typed(ret.getValue()));
        } else {
            sb.append("unreachable");
        }
    }

    // ========== 类型与操作数 ==========

    String type(IrType type) {
        switch (type.getKind()) {
            case POINTER:
                return opaquePointers ? "ptr" : type(type.getElement()) + "*";
            case ARRAY:
                return "[" + type.getCount() + " x " + type(type.getElement()) + "]";
            case STRUCT:
                return "%" + name(type.getStructName());
            default:
                return type.toString();
        }
    }

    private String typed(IrValue value) {
        return type(value.getType()) + " " + operand(value);
    }

    String operand(IrValue value) {
        switch (value.getKind()) {
            case LOCAL:
            case ARGUMENT:
                return "%" + name(value.getName());
            case STRING_POINTER: {
                if (opaquePointers) {
                    return "@" + name(value.getName());
                }
                IrGlobal global = (IrGlobal) value.getConstant();
                String array = type(global.getType());
                return "getelementptr inbounds (" + array + ", " + array + "* @" + name(global.getName())
                        + ", i64 0, i64 0)";
            }
            default:
                return constant(value);
        }
    }

    private static String constant(IrValue value) {
        Object c = value.getConstant();
        if (c instanceof Boolean) {
            return ((Boolean) c) ? "true" : "false";
        }
        if (c instanceof Double) {
            // 十六进制形式可精确表示任意 double
            return String.format("0x%016X", Double.doubleToRawLongBits((Double) c));
        }
        return c.toString();
    }

    static String name(String raw) {
        if (BARE_NAME.matcher(raw).matches()) {
            return raw;
        }
        return "\"" + escape(raw) + "\"";
    }

    private static String escape(String raw) {
        StringBuilder sb = new StringBuilder();
        for (byte b : raw.getBytes(StandardCharsets.UTF_8)) {
            appendByte(sb, b);
        }
        return sb.toString();
    }

    private static String bytes(byte[] data) {
        StringBuilder sb = new StringBuilder();
        for (byte b : data) {
            appendByte(sb, b);
        }
        return sb.toString();
    }

    private static void appendByte(StringBuilder sb, byte b) {
        int c = b & 0xFF;
        if (c >= 0x20 && c < 0x7F && c != '"' && c != '\\') {
            sb.append((char) c);
        } else {
            sb.append('\\').append(String.format("%02X", c));
        }
    }
}
