package com.arxlang.ir.lowering;

import com.arxlang.compiler.ast.decl.Program;
import com.arxlang.ir.ssa.BasicBlock;
import com.arxlang.ir.ssa.IrFunction;
import com.arxlang.ir.testing.TestCompiler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.arxlang.ir.testing.Ast.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("语句降级测试")
class StatementLoweringTest {

    private static LoweringException lowerFailure(Program program) {
        return catchThrowableOfType(() -> TestCompiler.compile(program), LoweringException.class);
    }

    @Nested
    @DisplayName("声明与赋值")
    class Declarations {

        @Test
        @DisplayName("声明分配栈槽并存储初值")
        void testDeclaration() {
            Program p = program(fun("main", "int",
                    declare("int", "x", intLit(5)),
                    assign("x", bin(var("x"), "+", intLit(1))),
                    ret(var("x"))));
            String ir = TestCompiler.ir(p);
            assertThat(ir).contains("%x.addr = alloca i32");
            assertThat(ir).contains("store i32 5, i32* %x.addr");
            assertThat(TestCompiler.run(p, "main")).isEqualTo(6);
        }

        @Test
        @DisplayName("声明类型与初值类型不符")
        void testDeclarationMismatch() {
            LoweringException e = lowerFailure(program(fun("main", "int",
                    declare("int", "x", str("five")), ret(intLit(0)))));
            assertThat(e.getKind()).isEqualTo(LoweringException.Kind.TYPE_MISMATCH);
            assertThat(e.getMessage()).contains("Cannot initialize int variable 'x' with str");
        }

        @Test
        @DisplayName("不支持的声明类型")
        void testUnsupportedType() {
            LoweringException e = lowerFailure(program(fun("main", "int",
                    declare("map", "m", intLit(0)), ret(intLit(0)))));
            assertThat(e.getKind()).isEqualTo(LoweringException.Kind.TYPE_MISMATCH);
            assertThat(e.getMessage()).contains("Unsupported type 'map'");
        }

        @Test
        @DisplayName("赋值给未声明变量")
        void testAssignUndefined() {
            LoweringException e = lowerFailure(program(fun("main", "int",
                    assign("y", intLit(1)), ret(intLit(0)))));
            assertThat(e.getKind()).isEqualTo(LoweringException.Kind.UNRESOLVED_REFERENCE);
        }

        @Test
        @DisplayName("赋值类型不符")
        void testAssignMismatch() {
            LoweringException e = lowerFailure(program(fun("main", "int",
                    declare("bool", "b", boolLit(true)),
                    assign("b", intLit(1)),
                    ret(intLit(0)))));
            assertThat(e.getKind()).isEqualTo(LoweringException.Kind.TYPE_MISMATCH);
            assertThat(e.getMessage()).contains("Cannot assign int to 'b' of type bool");
        }

        @Test
        @DisplayName("分支内声明的变量在分支后仍可见")
        void testFlatScope() {
            Program p = program(fun("main", "int",
                    ifChain(when(boolLit(true), declare("int", "y", intLit(3)))),
                    ret(var("y"))));
            assertThat(TestCompiler.run(p, "main")).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("返回")
    class Returns {

        @Test
        @DisplayName("非 void 函数中的 return-void")
        void testReturnVoidInIntFunction() {
            LoweringException e = lowerFailure(program(fun("f", "int", retVoid())));
            assertThat(e.getKind()).isEqualTo(LoweringException.Kind.TYPE_MISMATCH);
            assertThat(e.getMessage()).contains("Missing return value in function returning int");
        }

        @Test
        @DisplayName("void 函数返回值")
        void testReturnValueInVoidFunction() {
            LoweringException e = lowerFailure(program(fun("f", "void", ret(intLit(1)))));
            assertThat(e.getKind()).isEqualTo(LoweringException.Kind.TYPE_MISMATCH);
        }

        @Test
        @DisplayName("返回值类型不符")
        void testReturnMismatch() {
            LoweringException e = lowerFailure(program(fun("f", "int", ret(boolLit(false)))));
            assertThat(e.getMessage()).contains("Return type mismatch: expected int, got bool");
        }

        @Test
        @DisplayName("return 之后的语句进入不可达块")
        void testStatementsAfterReturn() {
            Program p = program(fun("f", "int",
                    ret(intLit(1)),
                    declare("int", "x", intLit(2)),
                    ret(var("x"))));
            String ir = TestCompiler.ir(p);
            assertThat(ir).contains("dead:");
            assertThat(TestCompiler.run(p, "f")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("if 链")
    class IfChains {

        private final Program classify = program(fun("classify", "int", params("int", "n"),
                ifChain(
                        when(bin(var("n"), "<", intLit(0)), ret(bin(intLit(0), "-", intLit(1)))),
                        when(bin(var("n"), "==", intLit(0)), ret(intLit(0))),
                        otherwise(ret(intLit(1))))));

        @Test
        @DisplayName("多分支选择")
        void testClassify() {
            assertThat(TestCompiler.run(classify, "classify", -5)).isEqualTo(-1);
            assertThat(TestCompiler.run(classify, "classify", 0)).isEqualTo(0);
            assertThat(TestCompiler.run(classify, "classify", 7)).isEqualTo(1);
        }

        @Test
        @DisplayName("块命名与跳转结构")
        void testBlockLayout() {
            String ir = TestCompiler.ir(classify);
            assertThat(ir).contains("br i1 %cmp, label %if0.then0, label %if0.next0");
            assertThat(ir).contains("br i1 %cmp.1, label %if0.then1, label %if0.next1");
            assertThat(ir).contains("if0.next1:\n  br label %if0.then2");
        }

        @Test
        @DisplayName("全部分支返回时 end 块封闭为 unreachable")
        void testAllBranchesReturn() {
            String ir = TestCompiler.ir(classify);
            assertThat(ir).contains("if0.end:\n  unreachable");
        }

        @Test
        @DisplayName("返回、落空、返回：end 块只有落空分支一个前驱")
        void testEndBlockPredecessors() {
            Program p = program(fun("f", "int", params("int", "n"),
                    declare("int", "x", intLit(0)),
                    ifChain(
                            when(bin(var("n"), "<", intLit(0)), ret(intLit(-1))),
                            when(bin(var("n"), "==", intLit(0)), assign("x", intLit(10))),
                            otherwise(ret(intLit(1)))),
                    ret(var("x"))));

            IrFunction f = TestCompiler.compile(p).getModule().getFunction("f");
            int incoming = 0;
            String source = null;
            for (BasicBlock block : f.getBlocks()) {
                for (BasicBlock succ : block.getTerminator().getSuccessors()) {
                    if (succ.getLabel().equals("if0.end")) {
                        incoming++;
                        source = block.getLabel();
                    }
                }
            }
            assertThat(incoming).isEqualTo(1);
            assertThat(source).isEqualTo("if0.then1");

            assertThat(TestCompiler.run(p, "f", -3)).isEqualTo(-1);
            assertThat(TestCompiler.run(p, "f", 0)).isEqualTo(10);
            assertThat(TestCompiler.run(p, "f", 4)).isEqualTo(1);
        }

        @Test
        @DisplayName("无 else 的分支落空后继续执行")
        void testFallThrough() {
            Program p = program(fun("f", "int", params("int", "n"),
                    declare("int", "x", intLit(1)),
                    ifChain(when(bin(var("n"), ">", intLit(0)), assign("x", intLit(2)))),
                    ret(var("x"))));
            assertThat(TestCompiler.run(p, "f", 5)).isEqualTo(2);
            assertThat(TestCompiler.run(p, "f", -5)).isEqualTo(1);
        }

        @Test
        @DisplayName("条件必须是 bool")
        void testNonBoolCondition() {
            LoweringException e = lowerFailure(program(fun("f", "int",
                    ifChain(when(intLit(1), ret(intLit(1)))),
                    ret(intLit(0)))));
            assertThat(e.getKind()).isEqualTo(LoweringException.Kind.TYPE_MISMATCH);
            assertThat(e.getMessage()).contains("Condition must be bool, got int");
        }

        @Test
        @DisplayName("嵌套 if 链编号递增")
        void testNestedIds() {
            Program p = program(fun("f", "int", params("bool", "a", "bool", "b"),
                    ifChain(when(var("a"),
                            ifChain(when(var("b"), ret(intLit(2)))),
                            ret(intLit(1)))),
                    ret(intLit(0))));
            String ir = TestCompiler.ir(p);
            assertThat(ir).contains("if1.then0:");
            assertThat(TestCompiler.run(p, "f", true, true)).isEqualTo(2);
            assertThat(TestCompiler.run(p, "f", true, false)).isEqualTo(1);
            assertThat(TestCompiler.run(p, "f", false, true)).isEqualTo(0);
        }
    }

    @Nested
    @DisplayName("循环")
    class Loops {

        @Test
        @DisplayName("while 循环与 continue")
        void testWhileContinue() {
            Program p = program(fun("f", "int",
                    declare("int", "i", intLit(0)),
                    declare("int", "s", intLit(0)),
                    whileLoop(bin(var("i"), "<", intLit(10)),
                            assign("i", bin(var("i"), "+", intLit(1))),
                            ifChain(when(bin(bin(var("i"), "%", intLit(2)), "==", intLit(1)), cont())),
                            assign("s", bin(var("s"), "+", var("i")))),
                    ret(var("s"))));
            assertThat(TestCompiler.run(p, "f")).isEqualTo(30);
            String ir = TestCompiler.ir(p);
            assertThat(ir).contains("while0.cond:");
            assertThat(ir).contains("while0.continue:\n  br label %while0.cond");
        }

        @Test
        @DisplayName("break 跳出 while(true)")
        void testBreak() {
            Program p = program(fun("f", "int",
                    declare("int", "i", intLit(0)),
                    whileLoop(boolLit(true),
                            ifChain(when(bin(var("i"), "==", intLit(5)), brk())),
                            assign("i", bin(var("i"), "+", intLit(1)))),
                    ret(var("i"))));
            assertThat(TestCompiler.run(p, "f")).isEqualTo(5);
        }

        @Test
        @DisplayName("嵌套循环中 break 只跳出内层")
        void testNestedBreak() {
            Program p = program(fun("f", "int",
                    declare("int", "i", intLit(0)),
                    declare("int", "n", intLit(0)),
                    whileLoop(bin(var("i"), "<", intLit(3)),
                            assign("i", bin(var("i"), "+", intLit(1))),
                            whileLoop(boolLit(true),
                                    assign("n", bin(var("n"), "+", intLit(1))),
                                    brk())),
                    ret(var("n"))));
            assertThat(TestCompiler.run(p, "f")).isEqualTo(3);
        }

        @Test
        @DisplayName("循环外的 break / continue")
        void testOutsideLoop() {
            LoweringException b = lowerFailure(program(fun("f", "void", brk(), retVoid())));
            assertThat(b.getKind()).isEqualTo(LoweringException.Kind.STRUCTURAL);
            assertThat(b.getMessage()).contains("'break' outside of a loop");

            LoweringException c = lowerFailure(program(fun("f", "void", cont(), retVoid())));
            assertThat(c.getKind()).isEqualTo(LoweringException.Kind.STRUCTURAL);
            assertThat(c.getMessage()).contains("'continue' outside of a loop");
        }

        @Test
        @DisplayName("循环体之后 break 不再指向外层循环")
        void testBreakAfterLoop() {
            LoweringException e = lowerFailure(program(fun("f", "void",
                    whileLoop(boolLit(false), brk()),
                    brk(),
                    retVoid())));
            assertThat(e.getKind()).isEqualTo(LoweringException.Kind.STRUCTURAL);
        }
    }
}
