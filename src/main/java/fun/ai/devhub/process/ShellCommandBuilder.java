package fun.ai.devhub.process;

import fun.ai.devhub.config.DevHubProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 把服务的 command 字符串转成 ProcessBuilder 参数：
 * 去掉首尾空白后原样交给 shell 执行（&& / 管道 / 重定向 / 引号内的空白都保持不变）
 */
@Component
public class ShellCommandBuilder {

    private final String shell;
    private final boolean windows;

    @Autowired
    public ShellCommandBuilder(DevHubProperties props) {
        this(props.getServices().getShell(),
                System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows"));
    }

    ShellCommandBuilder(String shell, boolean windows) {
        this.shell = StringUtils.hasText(shell) ? shell.trim() : null;
        this.windows = windows;
    }

    public List<String> build(String command) {
        String normalized = normalize(command);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("command 不能为空");
        }
        List<String> cmd = new ArrayList<>();
        String sh = shell != null ? shell : (windows ? "cmd.exe" : "/bin/sh");
        if (isCmdExe(sh)) {
            cmd.add(sh);
            cmd.add("/d");
            cmd.add("/s");
            cmd.add("/c");
        } else {
            cmd.add(sh);
            cmd.add("-c");
        }
        cmd.add(normalized);
        return cmd;
    }

    /**
     * 只去首尾空白；中间内容不动，引号里的连续空格要原样传给 shell
     */
    static String normalize(String command) {
        return command == null ? "" : command.trim();
    }

    private static boolean isCmdExe(String sh) {
        String lower = sh.toLowerCase(Locale.ROOT);
        return lower.endsWith("cmd") || lower.endsWith("cmd.exe");
    }
}
