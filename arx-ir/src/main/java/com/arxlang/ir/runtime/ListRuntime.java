package com.arxlang.ir.runtime;

import com.arxlang.ir.ssa.IrBuilder;
import com.arxlang.ir.ssa.IrModule;
import com.arxlang.ir.ssa.IrType;
import com.arxlang.ir.ssa.IrValue;

import java.util.Arrays;
import java.util.Collections;

/**
 * 列表值的指令序列：堆上分配数据区、逐元素写入、创建 List 记录、按下标读取。
 *
 * <pre>
 *   %data = call i8* @malloc(i64 N*size)
 *   %slot = getelementptr i8, i8* %data, i64 offset
 *   %typed = bitcast i8* %slot to T*
 *   store T %v, T* %typed
 *   %list = call %List* @core_list_create(i8* %data, i32 N, i32 size, i1 ptrFlag)
 * </pre>
 */
public class ListRuntime {

    private final IrModule module;

    public ListRuntime(IrModule module) {
        this.module = module;
    }

    /** 为 count 个元素分配数据区，返回 {@code i8*} */
    public IrValue allocate(IrBuilder builder, IrType elementType, int count) {
        long bytes = (long) count * TypeLayout.sizeOf(elementType);
        return builder.call(RuntimeFunctions.malloc(module),
                Collections.singletonList(IrValue.i64(bytes)), "list.data");
    }

    /**
     * 写入第 index 个元素。value 若是指向元素类型的指针，先解引用。
     */
    public void storeElement(IrBuilder builder, IrValue data, IrType elementType, int index, IrValue value) {
        IrValue element = value;
        if (value.getType().isPointer() && value.getType().pointee().equals(elementType)) {
            element = builder.load(value, "list.elem");
        }
        if (!element.getType().equals(elementType)) {
            throw new IllegalArgumentException("list element of type " + element.getType()
                    + " does not match " + elementType);
        }
        long offset = index * TypeLayout.sizeOf(elementType);
        IrValue slot = builder.gep(IrType.I8, data, Collections.singletonList(IrValue.i64(offset)), "list.slot");
        IrValue typed = builder.bitcast(slot, elementType.pointer(), "list.slot.typed");
        builder.store(element, typed);
    }

    /** 创建 List 记录，返回 {@code %List*} */
    public IrValue create(IrBuilder builder, IrValue data, IrType elementType, int count) {
        IrValue size = IrValue.i32((int) TypeLayout.sizeOf(elementType));
        IrValue pointerFlag = IrValue.bool(TypeLayout.isPointerElement(elementType));
        return builder.call(RuntimeFunctions.listCreate(module),
                Arrays.asList(data, IrValue.i32(count), size, pointerFlag), "list");
    }

    /** {@code core_list_len(list)} */
    public IrValue length(IrBuilder builder, IrValue list) {
        return builder.call(RuntimeFunctions.listLen(module), Collections.singletonList(list), "list.len");
    }

    /**
     * 读取第 index 个元素。标量元素把返回指针重解释为 {@code T*} 后加载，
     * 指针形元素直接重解释为 {@code T}。
     */
    public IrValue loadElement(IrBuilder builder, IrValue list, IrValue index, IrType elementType, String hint) {
        IrValue raw = builder.call(RuntimeFunctions.listGet(module), Arrays.asList(list, index), hint + ".raw");
        if (TypeLayout.isPointerElement(elementType)) {
            return builder.bitcast(raw, elementType, hint);
        }
        IrValue typed = builder.bitcast(raw, elementType.pointer(), hint + ".ptr");
        return builder.load(typed, hint);
    }
}
