package com.arxlang.cli;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * 顺序执行外部程序并等待其结束。
 */
public class ProcessRunner {

    private static final Logger LOG = Logger.getLogger(ProcessRunner.class.getName());

    /**
     * 执行命令，非零退出码抛出 PROCESS_FAILURE。
     *
     * @return 合并后的标准输出与标准错误
     */
    public String run(List<String> command, Path workDir) {
        LOG.info("Running: " + String.join(" ", command));
        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new BuildException(BuildException.Kind.PROCESS_FAILURE,
                    "Cannot start " + command.get(0) + ": " + e.getMessage(), e);
        }
        String output;
        int exitCode;
        try (InputStream in = process.getInputStream()) {
            output = readAll(in);
            exitCode = process.waitFor();
        } catch (IOException e) {
            process.destroyForcibly();
            throw new BuildException(BuildException.Kind.PROCESS_FAILURE,
                    "I/O error while running " + command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new BuildException(BuildException.Kind.PROCESS_FAILURE,
                    "Interrupted while running " + command.get(0), e);
        }
        if (exitCode != 0) {
            throw new BuildException(BuildException.Kind.PROCESS_FAILURE,
                    command.get(0) + " exited with status " + exitCode, output);
        }
        if (!output.isEmpty()) {
            LOG.fine(output);
        }
        return output;
    }

    private static String readAll(InputStream in) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[8192];
        int n;
        while ((n = in.read(chunk)) != -1) {
            buffer.write(chunk, 0, n);
        }
        return buffer.toString(Charset.defaultCharset().name());
    }
}
