package fun.ai.devhub.process;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 输出块 -> 行：未以换行结尾的半行留到下一块拼接；去 ANSI 转义后丢弃空行。
 * 每个输出流一个实例，只在该流的读线程上使用（非线程安全）。
 */
public class LogLineBuffer {

    // CSI（颜色/光标）与 OSC（终端标题等）序列
    private static final Pattern ANSI = Pattern.compile(
            "\u001B\\[[0-?]*[ -/]*[@-~]|\u001B\\][^\u0007\u001B]*(?:\u0007|\u001B\\\\)|\u001B[@-Z\\\\-_]");

    // 防止不带换行的超长输出无限累积
    private static final int MAX_CARRY = 64 * 1024;

    private final StringBuilder carry = new StringBuilder();

    public List<String> append(CharSequence chunk) {
        List<String> lines = new ArrayList<>();
        if (chunk == null || chunk.length() == 0) {
            return lines;
        }
        carry.append(chunk);
        int start = 0;
        for (int i = 0; i < carry.length(); i++) {
            if (carry.charAt(i) == '\n') {
                addLine(lines, carry.substring(start, i));
                start = i + 1;
            }
        }
        carry.delete(0, start);
        if (carry.length() > MAX_CARRY) {
            addLine(lines, carry.toString());
            carry.setLength(0);
        }
        return lines;
    }

    /**
     * 流结束时取出剩余半行
     */
    public List<String> flush() {
        List<String> lines = new ArrayList<>();
        if (carry.length() > 0) {
            addLine(lines, carry.toString());
            carry.setLength(0);
        }
        return lines;
    }

    public static String stripAnsi(String s) {
        if (s == null || s.indexOf('\u001B') < 0) return s;
        return ANSI.matcher(s).replaceAll("");
    }

    private static void addLine(List<String> out, String raw) {
        String line = stripAnsi(raw);
        // \r\n 以及进度条式的 \r 覆写：保留最后一段
        int cr = line.lastIndexOf('\r');
        if (cr >= 0) {
            String tail = line.substring(cr + 1);
            line = tail.isBlank() ? line.substring(0, cr) : tail;
            line = line.replace("\r", "");
        }
        if (!line.isBlank()) {
            out.add(line);
        }
    }
}
