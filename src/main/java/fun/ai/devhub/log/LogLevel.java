package fun.ai.devhub.log;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 日志级别（库内以小写存储：info/warn/error/debug）
 */
public enum LogLevel {
    INFO("info"),
    WARN("warn"),
    ERROR("error"),
    DEBUG("debug");

    private final String code;

    LogLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static LogLevel fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String c = code.trim().toLowerCase(Locale.ROOT);
        for (LogLevel level : values()) {
            if (level.code.equals(c)) {
                return level;
            }
        }
        throw new IllegalArgumentException("未知日志级别: " + code);
    }

    /**
     * 按内容粗略判断级别，优先级 error > warn > debug > info。
     * 只是展示用的元数据，歧义行分错不影响任何约束。
     */
    public static LogLevel parse(String message) {
        if (message == null) {
            return INFO;
        }
        String m = message.toLowerCase(Locale.ROOT);
        if (m.contains("error") || m.contains("fail") || m.contains("exception")) {
            return ERROR;
        }
        if (m.contains("warn")) {
            return WARN;
        }
        if (m.contains("debug") || m.contains("trace")) {
            return DEBUG;
        }
        return INFO;
    }
}
