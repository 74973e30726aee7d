/**
 * SystemCommandExecutor.java
 *
 * 这是一个工具类，负责以安全的方式执行外部系统命令（例如 spack list）。
 * 它接受一个命令列表（而不是单个字符串）以避免因路径中存在空格而导致的解析问题。
 * 标准输出被完整收集并返回；标准错误在后台逐行写入日志。每次执行都带有明确的超时，
 * 超时后进程被强制终止，并以 IOException 报告给调用方（可重试的失败）。
 */
package club.ppmc.softpack.util;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SystemCommandExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SystemCommandExecutor.class);

    /**
     * 命令的执行结果。
     *
     * @param exitCode 进程的退出码。
     * @param stdout 标准输出的全部内容。
     */
    public record CommandResult(int exitCode, byte[] stdout) {

        public boolean succeeded() {
            return exitCode == 0;
        }

        public String stdoutAsString() {
            return new String(stdout, StandardCharsets.UTF_8);
        }
    }

    /**
     * 同步执行一个系统命令。
     *
     * @param commandList 要执行的命令及其参数列表 (e.g., ["spack", "list", "--format", "html"])。
     * @param workingDirectory 命令执行的工作目录，为 null 时使用当前目录。
     * @param timeout 最长执行时间。
     * @return 退出码与标准输出。
     * @throws IOException 命令无法启动、超时或被中断。
     */
    public CommandResult execute(List<String> commandList, File workingDirectory, Duration timeout) throws IOException {
        if (commandList == null || commandList.isEmpty()) {
            throw new IOException("执行的命令不能为空。");
        }
        LOGGER.info(
                "在目录 {} 中执行命令: {}",
                workingDirectory == null ? "." : workingDirectory.getAbsolutePath(),
                String.join(" ", commandList));

        var processBuilder = new ProcessBuilder(commandList);
        if (workingDirectory != null) {
            processBuilder.directory(workingDirectory);
        }
        Process process = processBuilder.start();

        CompletableFuture<byte[]> stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
        CompletableFuture<Void> stderr = CompletableFuture.runAsync(() -> logLines(commandList.get(0), process.getErrorStream()));

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException("命令在 " + timeout.toSeconds() + " 秒后超时: " + String.join(" ", commandList));
            }
            byte[] output = stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            stderr.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            int exitCode = process.exitValue();
            LOGGER.info("命令执行完毕，退出码: {}", exitCode);
            return new CommandResult(exitCode, output);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt(); // 重新设置中断状态
            throw new IOException("命令执行被中断: " + String.join(" ", commandList), e);
        } catch (ExecutionException | TimeoutException e) {
            process.destroyForcibly();
            throw new IOException("读取命令输出失败: " + String.join(" ", commandList), e);
        }
    }

    private static byte[] readFully(InputStream stream) {
        try (stream; var buffer = new ByteArrayOutputStream()) {
            stream.transferTo(buffer);
            return buffer.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("读取标准输出失败", e);
        }
    }

    private static void logLines(String program, InputStream stream) {
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            reader.lines().forEach(line -> LOGGER.debug("[{}] {}", program, line));
        } catch (IOException e) {
            LOGGER.warn("读取 {} 的错误输出失败", program, e);
        }
    }
}
