package com.arxlang.ir.runtime;

import com.arxlang.ir.testing.IrInterpreter;
import com.arxlang.ir.ssa.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("列表运行时模型测试")
class ListRuntimeTest {

    private IrModule module;
    private ListRuntime lists;

    @BeforeEach
    void setUp() {
        module = new IrModule("m");
        ListLayout.register(module);
        lists = new ListRuntime(module);
    }

    @Test
    @DisplayName("标量元素：分配、写入、读取")
    void testScalarElements() {
        IrFunction f = module.addFunction(new IrFunction("f", IrType.I32, Collections.<IrParam>emptyList()));
        IrBuilder builder = new IrBuilder(f);
        IrValue data = lists.allocate(builder, IrType.I32, 3);
        for (int i = 0; i < 3; i++) {
            lists.storeElement(builder, data, IrType.I32, i, IrValue.i32(10 * (i + 1)));
        }
        IrValue list = lists.create(builder, data, IrType.I32, 3);
        assertThat(list.getType()).isEqualTo(ListLayout.LIST_PTR);
        builder.ret(lists.loadElement(builder, list, IrValue.i32(2), IrType.I32, "x"));

        IrInterpreter interpreter = new IrInterpreter(module);
        assertThat(interpreter.run("f")).isEqualTo(30);
        assertThat(interpreter.getCallLog()).containsExactly(
                RuntimeFunctions.MALLOC, RuntimeFunctions.LIST_CREATE, RuntimeFunctions.LIST_GET);
    }

    @Test
    @DisplayName("列表记录携带元素大小与指针标记")
    void testListRecordFlags() {
        IrFunction f = module.addFunction(new IrFunction("f", ListLayout.LIST_PTR, Collections.<IrParam>emptyList()));
        IrBuilder builder = new IrBuilder(f);
        IrValue data = lists.allocate(builder, IrType.I8_PTR, 1);
        lists.storeElement(builder, data, IrType.I8_PTR, 0, IrValue.stringPointer(module.addStringConstant("a")));
        builder.ret(lists.create(builder, data, IrType.I8_PTR, 1));

        Object result = new IrInterpreter(module).run("f");
        assertThat(IrInterpreter.listOf(result).getLength()).isEqualTo(1);
        assertThat(IrInterpreter.listOf(result).getElementSize()).isEqualTo(8);
        assertThat(IrInterpreter.listOf(result).isPointerElements()).isTrue();
    }

    @Test
    @DisplayName("指针元素读取时直接重解释，不再加载")
    void testPointerElementLoad() {
        IrFunction f = module.addFunction(new IrFunction("f", IrType.I8_PTR, Collections.<IrParam>emptyList()));
        IrBuilder builder = new IrBuilder(f);
        IrValue data = lists.allocate(builder, IrType.I8_PTR, 2);
        lists.storeElement(builder, data, IrType.I8_PTR, 0, IrValue.stringPointer(module.addStringConstant("a")));
        lists.storeElement(builder, data, IrType.I8_PTR, 1, IrValue.stringPointer(module.addStringConstant("b")));
        IrValue list = lists.create(builder, data, IrType.I8_PTR, 2);
        IrValue element = lists.loadElement(builder, list, IrValue.i32(1), IrType.I8_PTR, "s");
        builder.ret(element);

        long loads = f.getEntryBlock().getInstructions().stream()
                .filter(inst -> inst.getOp() == IrOp.LOAD).count();
        assertThat(loads).isZero();
        assertThat(((IrInterpreter.Pointer) new IrInterpreter(module).run("f")).text()).isEqualTo("b");
    }

    @Test
    @DisplayName("写入指向元素类型的指针时先解引用")
    void testStoreDereferencesPointer() {
        IrFunction f = module.addFunction(new IrFunction("f", IrType.I32, Collections.<IrParam>emptyList()));
        IrBuilder builder = new IrBuilder(f);
        IrValue slot = builder.alloca(IrType.I32, "v");
        builder.store(IrValue.i32(42), slot);
        IrValue data = lists.allocate(builder, IrType.I32, 1);
        lists.storeElement(builder, data, IrType.I32, 0, slot);
        IrValue list = lists.create(builder, data, IrType.I32, 1);
        builder.ret(lists.loadElement(builder, list, IrValue.i32(0), IrType.I32, "x"));

        assertThat(new IrInterpreter(module).run("f")).isEqualTo(42);
    }

    @Test
    @DisplayName("元素类型不符时拒绝写入")
    void testStoreTypeMismatch() {
        IrFunction f = module.addFunction(new IrFunction("f", IrType.VOID, Collections.<IrParam>emptyList()));
        IrBuilder builder = new IrBuilder(f);
        IrValue data = lists.allocate(builder, IrType.I32, 1);
        assertThatThrownBy(() -> lists.storeElement(builder, data, IrType.I32, 0, IrValue.constDouble(1.0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("malloc 字节数为元素个数乘元素大小")
    void testAllocationSize() {
        IrFunction f = module.addFunction(new IrFunction("f", IrType.VOID, Collections.<IrParam>emptyList()));
        IrBuilder builder = new IrBuilder(f);
        lists.allocate(builder, IrType.DOUBLE, 3);
        IrInst call = f.getEntryBlock().getInstructions().get(0);
        assertThat(call.getCallee()).isEqualTo("malloc");
        assertThat(call.getOperand(0)).isEqualTo(IrValue.i64(24));
    }
}
