package com.arxlang.ir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 编译选项
 */
public class CompilerOptions {
    private List<Path> descriptorDirs = new ArrayList<>();
    private String targetTriple = hostTriple();
    private boolean opaquePointers = false;
    private String moduleName = "arx";
    private String sourceFileName;

    public CompilerOptions() {
    }

    public List<Path> getDescriptorDirs() {
        return descriptorDirs;
    }

    public void setDescriptorDirs(List<Path> descriptorDirs) {
        this.descriptorDirs = new ArrayList<>(descriptorDirs);
    }

    public CompilerOptions addDescriptorDir(Path dir) {
        descriptorDirs.add(dir);
        return this;
    }

    public String getTargetTriple() {
        return targetTriple;
    }

    public void setTargetTriple(String targetTriple) {
        this.targetTriple = targetTriple;
    }

    public boolean isOpaquePointers() {
        return opaquePointers;
    }

    public void setOpaquePointers(boolean opaquePointers) {
        this.opaquePointers = opaquePointers;
    }

    public String getModuleName() {
        return moduleName;
    }

    public void setModuleName(String moduleName) {
        this.moduleName = moduleName;
    }

    /** 未设置时与模块名相同 */
    public String getSourceFileName() {
        return sourceFileName != null ? sourceFileName : moduleName;
    }

    public void setSourceFileName(String sourceFileName) {
        this.sourceFileName = sourceFileName;
    }

    /**
     * 根据 os.name / os.arch 推断宿主目标三元组。
     */
    public static String hostTriple() {
        String arch = System.getProperty("os.arch", "").toLowerCase(Locale.ROOT);
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        String cpu;
        switch (arch) {
            case "amd64":
            case "x86_64":
                cpu = "x86_64";
                break;
            case "aarch64":
            case "arm64":
                cpu = "aarch64";
                break;
            case "x86":
            case "i386":
            case "i686":
                cpu = "i686";
                break;
            default:
                cpu = arch.isEmpty() ? "x86_64" : arch;
        }
        if (os.startsWith("windows")) {
            return cpu + "-pc-windows-gnu";
        }
        if (os.startsWith("mac") || os.contains("darwin")) {
            return (cpu.equals("aarch64") ? "arm64" : cpu) + "-apple-darwin";
        }
        return cpu + "-unknown-linux-gnu";
    }
}
