package com.arxlang.cli;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * 外部工具链：静态编译器 llc 与系统 C 编译器。
 */
public class Toolchain {

    private final Path llc;
    private final Path cc;

    public Toolchain(Path llc, Path cc) {
        this.llc = llc;
        this.cc = cc;
    }

    public Path getLlc() { return llc; }
    public Path getCc() { return cc; }

    /**
     * 定位工具链，任一程序缺失时抛出 ENVIRONMENT 错误。
     */
    public static Toolchain locate(BuildConfig config) {
        String pathEnv = System.getenv("PATH");
        String pathExt = System.getenv("PATHEXT");
        Path llc = find(config.getLlc() != null ? Arrays.asList(config.getLlc()) : Arrays.asList("llc"),
                pathEnv, pathExt, config.isWindows());
        if (llc == null) {
            throw new BuildException(BuildException.Kind.ENVIRONMENT,
                    "llc not found" + (config.getLlc() != null ? ": " + config.getLlc() : " in PATH"));
        }
        Path cc = find(config.getCc() != null ? Arrays.asList(config.getCc()) : Arrays.asList("gcc", "cc"),
                pathEnv, pathExt, config.isWindows());
        if (cc == null) {
            throw new BuildException(BuildException.Kind.ENVIRONMENT,
                    "C compiler not found" + (config.getCc() != null ? ": " + config.getCc() : " (tried gcc, cc)"));
        }
        return new Toolchain(llc, cc);
    }

    /**
     * 依次查找候选程序，返回第一个存在的可执行文件；都不存在时返回 null。
     * 含路径分隔符的候选按文件路径检查，否则在 PATH 中查找。
     */
    static Path find(List<String> candidates, String pathEnv, String pathExt, boolean windows) {
        for (String candidate : candidates) {
            Path found = which(candidate, pathEnv, pathExt, windows);
            if (found != null) return found;
        }
        return null;
    }

    static Path which(String program, String pathEnv, String pathExt, boolean windows) {
        List<String> names = new ArrayList<>();
        names.add(program);
        if (windows) {
            String exts = pathExt != null ? pathExt : ".COM;.EXE;.BAT;.CMD";
            for (String ext : exts.split(";")) {
                if (!ext.isEmpty() && !program.toLowerCase(Locale.ROOT).endsWith(ext.toLowerCase(Locale.ROOT))) {
                    names.add(program + ext.toLowerCase(Locale.ROOT));
                }
            }
        }

        if (program.contains("/") || program.contains(File.separator)) {
            for (String name : names) {
                Path path = Paths.get(name);
                if (isExecutable(path)) return path;
            }
            return null;
        }
        if (pathEnv == null) return null;
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isEmpty()) continue;
            for (String name : names) {
                Path path = Paths.get(dir, name);
                if (isExecutable(path)) return path;
            }
        }
        return null;
    }

    private static boolean isExecutable(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }
}
