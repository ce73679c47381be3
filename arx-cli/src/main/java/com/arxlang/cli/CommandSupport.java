package com.arxlang.cli;

import com.arxlang.compiler.parser.AstFormatException;
import com.arxlang.ir.extern.DescriptorException;
import com.arxlang.ir.lowering.LoweringException;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 子命令公共流程：日志配置、输入检查、错误报告与退出码。
 */
final class CommandSupport {

    interface Action {
        void run() throws IOException;
    }

    private CommandSupport() {}

    static int execute(PrintWriter err, Path astFile, boolean verbose, Action action) {
        LoggingSetup.configure(verbose);
        if (!Files.exists(astFile)) {
            err.println("错误: 文件不存在 - " + astFile);
            return 1;
        }
        try {
            action.run();
            return 0;
        } catch (AstFormatException e) {
            err.println("AST 格式错误: " + e.getMessage());
        } catch (DescriptorException e) {
            err.println("描述文件错误: " + e.getMessage());
        } catch (LoweringException e) {
            err.println("编译错误: " + e.getMessage());
        } catch (BuildException e) {
            if (e.getKind() == BuildException.Kind.ENVIRONMENT) {
                err.println("环境错误: " + e.getMessage());
            } else {
                err.println("构建错误: " + e.getMessage());
                if (e.getOutput() != null && !e.getOutput().isEmpty()) {
                    err.println(e.getOutput());
                }
            }
        } catch (IOException e) {
            err.println("I/O 错误: " + e.getMessage());
        }
        err.flush();
        return 1;
    }
}
