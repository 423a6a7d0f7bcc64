package fun.ai.devhub.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 一次性短命令执行器（健康检查 command 探测等）：带超时，超时则结束整棵进程树
 */
@Component
public class CommandRunner {
    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    // 输出只保留前 32K，够定位失败原因
    private static final int MAX_OUTPUT = 32_000;

    private final ShellCommandBuilder shellCommandBuilder;
    private final ProcessTreeKiller treeKiller;

    private final ExecutorService ioPool = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "cmd-io");
        t.setDaemon(true);
        return t;
    });

    public CommandRunner(ShellCommandBuilder shellCommandBuilder, ProcessTreeKiller treeKiller) {
        this.shellCommandBuilder = shellCommandBuilder;
        this.treeKiller = treeKiller;
    }

    /**
     * 通过 shell 执行一行命令
     */
    public CommandResult runShell(Duration timeout, String command, File workingDir) {
        return run(timeout, shellCommandBuilder.build(command), workingDir);
    }

    public CommandResult run(Duration timeout, List<String> command, File workingDir) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command 不能为空");
        }
        Process p;
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            if (workingDir != null) {
                pb.directory(workingDir);
            }
            p = pb.start();
        } catch (IOException e) {
            log.warn("run command failed: cmd={}, error={}", command, e.getMessage());
            return new CommandResult(1, "run command failed: " + e.getMessage());
        }

        StringBuilder out = new StringBuilder();
        CompletableFuture<Void> reader = CompletableFuture.runAsync(() -> {
            try (BufferedReader r = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = r.readLine()) != null) {
                    if (out.length() < MAX_OUTPUT) {
                        out.append(line).append('\n');
                    }
                }
            } catch (IOException e) {
                // 超时被 kill 时流会被关闭
                log.debug("read command output interrupted: cmd={}, error={}", command, e.getMessage());
            }
        }, ioPool);

        try {
            long ms = timeout == null ? 0 : timeout.toMillis();
            boolean finished;
            if (ms <= 0) {
                p.waitFor();
                finished = true;
            } else {
                finished = p.waitFor(ms, TimeUnit.MILLISECONDS);
            }
            if (!finished) {
                treeKiller.terminateProcessTree(p.pid(), KillSignal.KILL);
                p.waitFor(200, TimeUnit.MILLISECONDS);
                awaitReader(reader, 200);
                return new CommandResult(CommandResult.TIMEOUT_EXIT_CODE, out + "\n[timeout]");
            }
            awaitReader(reader, 500);
            return new CommandResult(p.exitValue(), out.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            treeKiller.terminateProcessTree(p.pid(), KillSignal.KILL);
            return new CommandResult(1, "run command interrupted");
        }
    }

    private void awaitReader(CompletableFuture<Void> reader, long ms) throws InterruptedException {
        try {
            reader.get(ms, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("command output not fully drained: error={}", e.getMessage());
        }
    }
}
