package com.arxlang.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 构建配置
 *
 * <p>安装目录依次取系统属性 {@code arx.home}、环境变量 {@code ARX_HOME}、当前目录；
 * 描述文件目录默认 {@code <home>/c_map}，C 源码目录默认 {@code <home>/c_lib}。</p>
 */
public class BuildConfig {
    private Path home;
    private List<Path> mapDirs = new ArrayList<>();
    private Path libDir;
    private Path workDir;
    private String llc;
    private String cc;
    private boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");

    public BuildConfig() {
        this.home = defaultHome();
        this.workDir = home;
    }

    public static Path defaultHome() {
        String prop = System.getProperty("arx.home");
        if (prop != null && !prop.isEmpty()) {
            return Paths.get(prop);
        }
        String env = System.getenv("ARX_HOME");
        if (env != null && !env.isEmpty()) {
            return Paths.get(env);
        }
        return Paths.get(".");
    }

    public Path getHome() {
        return home;
    }

    public void setHome(Path home) {
        this.home = home;
    }

    /** 未显式指定时为 {@code <home>/c_map} */
    public List<Path> getMapDirs() {
        if (mapDirs.isEmpty()) {
            List<Path> dirs = new ArrayList<>();
            dirs.add(home.resolve("c_map"));
            return dirs;
        }
        return mapDirs;
    }

    public void setMapDirs(List<Path> mapDirs) {
        this.mapDirs = new ArrayList<>(mapDirs);
    }

    public Path getLibDir() {
        return libDir != null ? libDir : home.resolve("c_lib");
    }

    public void setLibDir(Path libDir) {
        this.libDir = libDir;
    }

    /** build/ 与 out/ 的父目录 */
    public Path getWorkDir() {
        return workDir;
    }

    public void setWorkDir(Path workDir) {
        this.workDir = workDir;
    }

    public Path getBuildDir() {
        return workDir.resolve("build");
    }

    public Path getOutDir() {
        return workDir.resolve("out");
    }

    /** llc 路径或程序名，null 表示在 PATH 中查找 */
    public String getLlc() {
        return llc;
    }

    public void setLlc(String llc) {
        this.llc = llc;
    }

    /** C 编译器路径或程序名，null 表示依次查找 gcc、cc */
    public String getCc() {
        return cc;
    }

    public void setCc(String cc) {
        this.cc = cc;
    }

    public boolean isWindows() {
        return windows;
    }

    public void setWindows(boolean windows) {
        this.windows = windows;
    }

    public String getObjectExtension() {
        return windows ? ".obj" : ".o";
    }

    public String getExecutableExtension() {
        return windows ? ".exe" : "";
    }
}
