package fun.ai.devhub.log;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 批量写日志的一行输入；level 为空时按 info 处理
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LogEntryInput {
    private String message;
    private LogLevel level;

    public static LogEntryInput of(String message) {
        return new LogEntryInput(message, null);
    }
}
