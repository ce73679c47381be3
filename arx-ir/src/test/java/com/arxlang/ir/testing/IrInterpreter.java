package com.arxlang.ir.testing;

import com.arxlang.ir.runtime.RuntimeFunctions;
import com.arxlang.ir.runtime.TypeLayout;
import com.arxlang.ir.ssa.*;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * 测试用 IR 解释器。
 *
 * <p>内存按块模拟：每次 alloca / malloc 产生一个新块，块内按字节偏移存放值。
 * 运行时库（malloc、core_list_*、core_string_*）在此用 Java 实现，
 * 其他外部函数可通过 {@link #registerNative} 注入。</p>
 */
public class IrInterpreter {

    private static final int STEP_LIMIT = 1_000_000;

    private final IrModule module;
    private final Map<String, Function<List<Object>, Object>> natives = new HashMap<>();
    private final Map<IrGlobal, Pointer> globals = new IdentityHashMap<>();
    private final List<String> callLog = new ArrayList<>();
    private int steps;

    public IrInterpreter(IrModule module) {
        this.module = module;
        installRuntime();
    }

    /** 模拟内存块 */
    public static final class Block {
        final Map<Long, Object> cells = new HashMap<>();
        String text;        // 字符串块
        ListRecord list;    // core_list_create 结果
    }

    /** 指针 = (块, 字节偏移) */
    public static final class Pointer {
        final Block block;
        final long offset;

        Pointer(Block block, long offset) {
            this.block = block;
            this.offset = offset;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Pointer)) return false;
            Pointer p = (Pointer) o;
            return block == p.block && offset == p.offset;
        }

        @Override
        public int hashCode() {
            return Objects.hash(System.identityHashCode(block), offset);
        }

        public String text() {
            return block.text;
        }
    }

    /** {@code %List} 记录 */
    public static final class ListRecord {
        final Pointer data;
        final int length;
        final int elementSize;
        final boolean pointerElements;

        ListRecord(Pointer data, int length, int elementSize, boolean pointerElements) {
            this.data = data;
            this.length = length;
            this.elementSize = elementSize;
            this.pointerElements = pointerElements;
        }

        public int getLength() { return length; }
        public int getElementSize() { return elementSize; }
        public boolean isPointerElements() { return pointerElements; }
    }

    public void registerNative(String symbol, Function<List<Object>, Object> impl) {
        natives.put(symbol, impl);
    }

    /** 已执行的外部调用（符号名），按调用顺序 */
    public List<String> getCallLog() {
        return callLog;
    }

    public static Pointer string(String text) {
        Block block = new Block();
        block.text = text;
        return new Pointer(block, 0);
    }

    public static ListRecord listOf(Object value) {
        return ((Pointer) value).block.list;
    }

    /** 读取列表第 index 个元素的原始存储值 */
    public static Object listElement(Object listValue, int index) {
        ListRecord list = listOf(listValue);
        return list.data.block.cells.get(list.data.offset + (long) index * list.elementSize);
    }

    // ========== 执行 ==========

    public Object run(String functionName, Object... args) {
        IrFunction function = module.getFunction(functionName);
        if (function == null) {
            throw new IllegalArgumentException("no function " + functionName);
        }
        return invoke(function, Arrays.asList(args));
    }

    private Object invoke(IrFunction function, List<Object> args) {
        if (function.isDeclaration()) {
            Function<List<Object>, Object> impl = natives.get(function.getName());
            if (impl == null) {
                throw new IllegalStateException("no native implementation for @" + function.getName());
            }
            callLog.add(function.getName());
            return impl.apply(args);
        }
        Map<String, Object> frame = new HashMap<>();
        for (int i = 0; i < function.getParams().size(); i++) {
            frame.put(function.getParams().get(i).getName(), args.get(i));
        }
        BasicBlock block = function.getEntryBlock();
        while (true) {
            for (IrInst inst : block.getInstructions()) {
                step();
                execute(inst, frame);
            }
            IrTerminator terminator = block.getTerminator();
            step();
            if (terminator instanceof IrTerminator.Goto) {
                block = ((IrTerminator.Goto) terminator).getTarget();
            } else if (terminator instanceof IrTerminator.Branch) {
                IrTerminator.Branch branch = (IrTerminator.Branch) terminator;
                block = (Boolean) eval(branch.getCondition(), frame) ? branch.getThenBlock() : branch.getElseBlock();
            } else if (terminator instanceof IrTerminator.Return) {
                IrValue value = ((IrTerminator.Return) terminator).getValue();
                return value == null ? null : eval(value, frame);
            } else {
                throw new IllegalStateException("reached unreachable in @" + function.getName()
                        + " block " + block.getLabel());
            }
        }
    }

    private void step() {
        if (++steps > STEP_LIMIT) {
            throw new IllegalStateException("step limit exceeded");
        }
    }

    private void execute(IrInst inst, Map<String, Object> frame) {
        Object result;
        switch (inst.getOp()) {
            case ALLOCA:
                result = new Pointer(new Block(), 0);
                break;
            case LOAD: {
                Pointer p = (Pointer) eval(inst.getOperand(0), frame);
                if (!p.block.cells.containsKey(p.offset)) {
                    throw new IllegalStateException("load of uninitialized memory: " + inst);
                }
                result = p.block.cells.get(p.offset);
                break;
            }
            case STORE: {
                Pointer p = (Pointer) eval(inst.getOperand(1), frame);
                p.block.cells.put(p.offset, eval(inst.getOperand(0), frame));
                return;
            }
            case GEP: {
                Pointer base = (Pointer) eval(inst.getOperand(0), frame);
                long index = ((Number) eval(inst.getOperand(1), frame)).longValue();
                result = new Pointer(base.block, base.offset + index * TypeLayout.sizeOf(inst.getAuxType()));
                break;
            }
            case BITCAST:
                result = eval(inst.getOperand(0), frame);
                break;
            case ICMP:
                result = compare(inst.getPredicate(), eval(inst.getOperand(0), frame),
                        eval(inst.getOperand(1), frame));
                break;
            case FCMP:
                result = compareFloat(inst.getPredicate(), (Double) eval(inst.getOperand(0), frame),
                        (Double) eval(inst.getOperand(1), frame));
                break;
            case CALL: {
                List<Object> args = new ArrayList<>();
                for (IrValue operand : inst.getOperands()) {
                    args.add(eval(operand, frame));
                }
                result = invoke(module.getFunction(inst.getCallee()), args);
                break;
            }
            default:
                result = arithmetic(inst.getOp(), eval(inst.getOperand(0), frame), eval(inst.getOperand(1), frame));
        }
        if (inst.hasResult()) {
            frame.put(inst.getResult().getName(), result);
        }
    }

    private Object eval(IrValue value, Map<String, Object> frame) {
        switch (value.getKind()) {
            case LOCAL:
            case ARGUMENT:
                if (!frame.containsKey(value.getName())) {
                    throw new IllegalStateException("use of undefined value %" + value.getName());
                }
                return frame.get(value.getName());
            case STRING_POINTER: {
                IrGlobal global = (IrGlobal) value.getConstant();
                return globals.computeIfAbsent(global, g -> {
                    byte[] data = g.getData();
                    return string(new String(data, 0, data.length - 1, StandardCharsets.UTF_8));
                });
            }
            default: {
                Object c = value.getConstant();
                if (c instanceof Long && value.getType().isInt(32)) {
                    return ((Long) c).intValue();
                }
                return c;
            }
        }
    }

    private static Object arithmetic(IrOp op, Object l, Object r) {
        switch (op) {
            case ADD:  return (Integer) l + (Integer) r;
            case SUB:  return (Integer) l - (Integer) r;
            case MUL:  return (Integer) l * (Integer) r;
            case SDIV: return (Integer) l / (Integer) r;
            case SREM: return (Integer) l % (Integer) r;
            case FADD: return (Double) l + (Double) r;
            case FSUB: return (Double) l - (Double) r;
            case FMUL: return (Double) l * (Double) r;
            case FDIV: return (Double) l / (Double) r;
            case FREM: return (Double) l % (Double) r;
            case AND:  return (Boolean) l && (Boolean) r;
            case OR:   return (Boolean) l || (Boolean) r;
            default:
                throw new IllegalStateException("unsupported op " + op);
        }
    }

    private static boolean compare(CmpPredicate predicate, Object l, Object r) {
        if (l instanceof Integer) {
            int a = (Integer) l, b = (Integer) r;
            switch (predicate) {
                case EQ: return a == b;
                case NE: return a != b;
                case LT: return a < b;
                case LE: return a <= b;
                case GT: return a > b;
                default: return a >= b;
            }
        }
        switch (predicate) {
            case EQ: return Objects.equals(l, r);
            case NE: return !Objects.equals(l, r);
            default: throw new IllegalStateException("unordered icmp on " + l);
        }
    }

    private static boolean compareFloat(CmpPredicate predicate, double a, double b) {
        if (Double.isNaN(a) || Double.isNaN(b)) return false;
        switch (predicate) {
            case EQ: return a == b;
            case NE: return a != b;
            case LT: return a < b;
            case LE: return a <= b;
            case GT: return a > b;
            default: return a >= b;
        }
    }

    // ========== 运行时库 ==========

    private void installRuntime() {
        natives.put(RuntimeFunctions.MALLOC, args -> new Pointer(new Block(), 0));
        natives.put(RuntimeFunctions.LIST_CREATE, args -> {
            Block block = new Block();
            block.list = new ListRecord((Pointer) args.get(0), (Integer) args.get(1),
                    (Integer) args.get(2), (Boolean) args.get(3));
            return new Pointer(block, 0);
        });
        natives.put(RuntimeFunctions.LIST_LEN, args -> listOf(args.get(0)).length);
        natives.put(RuntimeFunctions.LIST_GET, args -> {
            ListRecord list = listOf(args.get(0));
            int index = (Integer) args.get(1);
            if (index < 0 || index >= list.length) {
                throw new IllegalStateException("list index out of range: " + index);
            }
            Pointer slot = new Pointer(list.data.block, list.data.offset + (long) index * list.elementSize);
            // 指针元素直接返回存放的指针，标量元素返回槽地址
            return list.pointerElements ? slot.block.cells.get(slot.offset) : slot;
        });
        natives.put(RuntimeFunctions.STRING_EQUAL, args ->
                ((Pointer) args.get(0)).text().equals(((Pointer) args.get(1)).text()));
        natives.put(RuntimeFunctions.STRING_CONCAT, args ->
                string(((Pointer) args.get(0)).text() + ((Pointer) args.get(1)).text()));
    }
}
