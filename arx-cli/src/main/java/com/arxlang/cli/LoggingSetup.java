package com.arxlang.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * 从类路径加载 logging.properties；verbose 时把 com.arxlang 的级别降到 FINE。
 */
final class LoggingSetup {

    /** 持有引用，避免 LogManager 只保留弱引用导致级别设置丢失 */
    private static final Logger ROOT = Logger.getLogger("com.arxlang");

    private LoggingSetup() {}

    static void configure(boolean verbose) {
        try (InputStream in = LoggingSetup.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("警告: 无法加载日志配置 - " + e.getMessage());
        }
        if (verbose) {
            ROOT.setLevel(Level.FINE);
            for (Handler handler : Logger.getLogger("").getHandlers()) {
                handler.setLevel(Level.FINE);
            }
        }
    }
}
