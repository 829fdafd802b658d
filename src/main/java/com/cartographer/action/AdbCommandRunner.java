package com.cartographer.action;

import com.cartographer.config.AdbProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 执行模块 - adb 命令执行器
 * 通过 ProcessBuilder 调用 adb，带超时
 */
@Slf4j
@Component
public class AdbCommandRunner {

    private final AdbProperties adbProperties;

    public AdbCommandRunner(AdbProperties adbProperties) {
        this.adbProperties = adbProperties;
    }

    /**
     * 执行 adb shell 命令
     *
     * @param args shell 之后的参数，逐个传递，不经过本地 shell 拆分
     */
    public ExecutionResult shell(String... args) {
        List<String> command = new ArrayList<>();
        command.add("shell");
        command.addAll(List.of(args));
        return execute(command);
    }

    /**
     * 执行 adb 命令 (不带 shell 前缀)
     */
    public ExecutionResult execute(List<String> args) {
        List<String> command = new ArrayList<>();
        command.add(adbProperties.getAdbPath());
        String serial = adbProperties.getSerial();
        if (serial != null && !serial.isBlank()) {
            command.add("-s");
            command.add(serial);
        }
        command.addAll(args);

        log.debug("执行 adb: {}", String.join(" ", command));

        Path outputFile = null;
        try {
            // 输出写入临时文件，避免读管道阻塞导致超时失效
            outputFile = Files.createTempFile("adb-", ".out");
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            pb.redirectOutput(outputFile.toFile());

            Process process = pb.start();

            boolean completed = process.waitFor(adbProperties.getTimeoutSeconds(), TimeUnit.SECONDS);

            if (!completed) {
                process.destroyForcibly();
                log.warn("adb 执行超时 ({}s): {}", adbProperties.getTimeoutSeconds(), String.join(" ", args));
                return new ExecutionResult(false, "执行超时", -1);
            }

            int exitCode = process.exitValue();
            String result = Files.readString(outputFile, StandardCharsets.UTF_8).trim();

            log.debug("adb 执行结果: exitCode={}, output={}", exitCode,
                    result.length() > 200 ? result.substring(0, 200) + "..." : result);

            return new ExecutionResult(exitCode == 0, result, exitCode);

        } catch (IOException e) {
            log.error("adb 执行失败: {}", String.join(" ", args), e);
            return new ExecutionResult(false, e.getMessage(), -1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("adb 执行被中断: {}", String.join(" ", args));
            return new ExecutionResult(false, "interrupted", -1);
        } finally {
            deleteQuietly(outputFile);
        }
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("临时输出文件删除失败: {}", file, e);
        }
    }

    /**
     * 执行结果包装类
     */
    public record ExecutionResult(boolean success, String output, int exitCode) {
        @Override
        public String toString() {
            return String.format("ExecutionResult{success=%s, exitCode=%d, output='%s'}",
                    success, exitCode, output);
        }
    }
}
