package com.arxlang.ir.lowering;

import com.arxlang.compiler.ast.SourceLocation;
import com.arxlang.compiler.ast.decl.FunDecl;
import com.arxlang.compiler.ast.decl.Parameter;
import com.arxlang.compiler.ast.decl.Program;
import com.arxlang.ir.extern.ExternLinkage;
import com.arxlang.ir.runtime.RuntimeFunctions;
import com.arxlang.ir.ssa.IrBuilder;
import com.arxlang.ir.ssa.IrFunction;
import com.arxlang.ir.ssa.IrModule;
import com.arxlang.ir.ssa.IrParam;
import com.arxlang.ir.ssa.IrType;
import com.arxlang.ir.ssa.IrValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * AST → IR 降级驱动。
 *
 * <p>先声明全部函数签名，再逐个降级函数体，使前向调用能解析到真实签名。
 * 外部链接必须在此之前解析完成。程序只定义 {@code _exec} 而没有 {@code main} 时，
 * 生成调用它的 C 入口 {@code i32 main()}。</p>
 */
public class AstToIrLowering {

    private static final Logger LOG = Logger.getLogger(AstToIrLowering.class.getName());

    static final String EXEC_ENTRY = "_exec";
    static final String C_ENTRY = "main";

    private final IrModule module;
    private final ExternLinkage linkage;

    public AstToIrLowering(IrModule module, ExternLinkage linkage) {
        this.module = module;
        this.linkage = linkage;
    }

    public IrModule lower(Program program) {
        Map<FunDecl, IrFunction> declared = new LinkedHashMap<>();
        Set<String> names = new HashSet<>();
        for (FunDecl decl : program.getFunctions()) {
            if (RuntimeFunctions.isReserved(decl.getName())) {
                throw new LoweringException(LoweringException.Kind.STRUCTURAL,
                        "Function name '" + decl.getName() + "' is reserved by the runtime", decl.getLocation());
            }
            if (!names.add(decl.getName()) || module.hasFunction(decl.getName())) {
                throw new LoweringException(LoweringException.Kind.STRUCTURAL,
                        "Duplicate function '" + decl.getName() + "'", decl.getLocation());
            }
            declared.put(decl, module.addFunction(declare(decl)));
        }

        ExpressionLowering expressions = new ExpressionLowering(module, linkage.getTable());
        FunctionLowering functions = new FunctionLowering(new StatementLowering(expressions));
        for (Map.Entry<FunDecl, IrFunction> entry : declared.entrySet()) {
            LOG.fine("Lowering function " + entry.getKey().getName());
            functions.lower(entry.getKey(), entry.getValue());
        }
        if (names.contains(EXEC_ENTRY) && !names.contains(C_ENTRY)) {
            addCEntry(module.getFunction(EXEC_ENTRY), program.getLocation());
        }
        return module;
    }

    private void addCEntry(IrFunction exec, SourceLocation location) {
        if (!exec.hasSignature(IrType.I32, Collections.<IrType>emptyList())) {
            throw new LoweringException(LoweringException.Kind.TYPE_MISMATCH,
                    "Entry function '" + EXEC_ENTRY + "' must take no parameters and return int", location);
        }
        if (module.hasFunction(C_ENTRY)) {
            throw new LoweringException(LoweringException.Kind.STRUCTURAL,
                    "Cannot generate C entry: '" + C_ENTRY + "' is already declared", location);
        }
        IrFunction main = module.addFunction(new IrFunction(C_ENTRY, IrType.I32, Collections.<IrParam>emptyList()));
        IrBuilder builder = new IrBuilder(main);
        builder.ret(builder.call(exec, Collections.<IrValue>emptyList(), "call"));
        LOG.fine("Generated C entry calling " + EXEC_ENTRY);
    }

    private static IrFunction declare(FunDecl decl) {
        IrType returnType = SourceTypes.requireReturnType(decl.getReturnType(), decl.getLocation());
        List<IrParam> params = new ArrayList<>();
        Set<String> paramNames = new HashSet<>();
        for (Parameter param : decl.getParams()) {
            if (!paramNames.add(param.getName())) {
                throw new LoweringException(LoweringException.Kind.STRUCTURAL,
                        "Duplicate parameter '" + param.getName() + "' in function '" + decl.getName() + "'",
                        param.getLocation());
            }
            params.add(new IrParam(param.getName(),
                    SourceTypes.requireValueType(param.getType(), param.getLocation())));
        }
        return new IrFunction(decl.getName(), returnType, params);
    }
}
