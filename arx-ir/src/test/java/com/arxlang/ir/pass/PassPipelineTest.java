package com.arxlang.ir.pass;

import com.arxlang.ir.ssa.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Pass 管线测试")
class PassPipelineTest {

    private IrModule module;

    @BeforeEach
    void setUp() {
        module = new IrModule("m");
    }

    private IrFunction define(String name, IrType returnType) {
        return module.addFunction(new IrFunction(name, returnType, Collections.<IrParam>emptyList()));
    }

    @Test
    @DisplayName("默认管线：先封闭再校验")
    void testDefaultPipeline() {
        PassPipeline pipeline = PassPipeline.createDefault();
        assertThat(pipeline.getPasses()).extracting(IrPass::getName)
                .containsExactly("UnreachableBlockSealing", "ModuleVerification");
    }

    @Test
    @DisplayName("pass 按添加顺序执行")
    void testOrder() {
        List<String> order = new ArrayList<>();
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(recording("a", order));
        pipeline.addPass(recording("b", order));
        pipeline.run(module);
        assertThat(order).containsExactly("a", "b");
    }

    private static IrPass recording(String name, List<String> order) {
        return new IrPass() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public IrModule run(IrModule module) {
                order.add(name);
                return module;
            }
        };
    }

    @Nested
    @DisplayName("封闭不可达块")
    class Sealing {

        @Test
        @DisplayName("不可达的开放块补上 unreachable")
        void testSealsUnreachable() {
            IrFunction f = define("f", IrType.VOID);
            IrBuilder builder = new IrBuilder(f);
            BasicBlock orphan = builder.newBlock("orphan");
            builder.retVoid();

            new UnreachableBlockSealing().run(module);
            assertThat(orphan.getTerminator()).isInstanceOf(IrTerminator.Unreachable.class);
        }

        @Test
        @DisplayName("可达的开放块保持原样，由校验报错")
        void testReachableOpenBlockRejected() {
            IrFunction f = define("f", IrType.VOID);
            IrBuilder builder = new IrBuilder(f);
            BasicBlock next = builder.newBlock("next");
            builder.br(next);

            new UnreachableBlockSealing().run(module);
            assertThat(next.hasTerminator()).isFalse();
            assertThatThrownBy(() -> new ModuleVerification().run(module))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("Malformed IR in @f block 'next': block has no terminator");
        }
    }

    @Nested
    @DisplayName("模块校验")
    class Verification {

        @Test
        @DisplayName("返回类型与签名不符")
        void testReturnTypeMismatch() {
            IrFunction f = define("f", IrType.I32);
            new IrBuilder(f).ret(IrValue.bool(true));
            assertThatThrownBy(() -> new ModuleVerification().run(module))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("returns i1, expected i32");
        }

        @Test
        @DisplayName("跳转到其他函数的块")
        void testForeignBranch() {
            IrFunction g = define("g", IrType.VOID);
            IrBuilder gb = new IrBuilder(g);
            gb.retVoid();
            IrFunction f = define("f", IrType.VOID);
            new IrBuilder(f).br(g.getEntryBlock());
            assertThatThrownBy(() -> new ModuleVerification().run(module))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("foreign block");
        }

        @Test
        @DisplayName("实参个数与被调函数不符")
        void testCallArity() {
            IrFunction callee = module.getOrDeclare("ext", IrType.I32, Arrays.asList(IrType.I32, IrType.I32));
            IrFunction f = define("f", IrType.I32);
            IrBuilder builder = new IrBuilder(f);
            IrValue r = builder.call(callee, Collections.singletonList(IrValue.i32(1)), "r");
            builder.ret(r);
            assertThatThrownBy(() -> new ModuleVerification().run(module))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("with 1 arguments, expected 2");
        }

        @Test
        @DisplayName("实参类型与被调函数不符")
        void testCallArgumentType() {
            IrFunction callee = module.getOrDeclare("ext", IrType.I32, Collections.singletonList(IrType.I32));
            IrFunction f = define("f", IrType.I32);
            IrBuilder builder = new IrBuilder(f);
            IrValue r = builder.call(callee, Collections.singletonList(IrValue.bool(true)), "r");
            builder.ret(r);
            assertThatThrownBy(() -> new ModuleVerification().run(module))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("argument 1 of call to @ext is i1, expected i32");
        }

        @Test
        @DisplayName("合法模块原样通过")
        void testValidModule() {
            IrFunction f = define("f", IrType.I32);
            new IrBuilder(f).ret(IrValue.i32(0));
            assertThat(PassPipeline.createDefault().run(module)).isSameAs(module);
        }
    }
}
