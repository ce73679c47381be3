package com.arxlang.ir.runtime;

import com.arxlang.ir.ssa.IrType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TypeLayout 测试")
class TypeLayoutTest {

    @Test
    @DisplayName("标量大小")
    void testScalars() {
        assertThat(TypeLayout.sizeOf(IrType.I1)).isEqualTo(1);
        assertThat(TypeLayout.sizeOf(IrType.I8)).isEqualTo(1);
        assertThat(TypeLayout.sizeOf(IrType.I32)).isEqualTo(4);
        assertThat(TypeLayout.sizeOf(IrType.I64)).isEqualTo(8);
        assertThat(TypeLayout.sizeOf(IrType.DOUBLE)).isEqualTo(8);
    }

    @Test
    @DisplayName("指针宽度固定为 8")
    void testPointers() {
        assertThat(TypeLayout.sizeOf(IrType.I8_PTR)).isEqualTo(8);
        assertThat(TypeLayout.sizeOf(ListLayout.LIST_PTR)).isEqualTo(8);
        assertThat(TypeLayout.isPointerElement(IrType.I8_PTR)).isTrue();
        assertThat(TypeLayout.isPointerElement(IrType.I32)).isFalse();
    }

    @Test
    @DisplayName("数组与结构体")
    void testAggregates() {
        assertThat(TypeLayout.sizeOf(IrType.arrayOf(4, IrType.I8))).isEqualTo(4);
        // i8* + i32 + i32 + i64 + i1
        assertThat(TypeLayout.sizeOf(ListLayout.LIST_TYPE)).isEqualTo(25);
    }

    @Test
    @DisplayName("void 没有大小")
    void testVoid() {
        assertThatThrownBy(() -> TypeLayout.sizeOf(IrType.VOID))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
