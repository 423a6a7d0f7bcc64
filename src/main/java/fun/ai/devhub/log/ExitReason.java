package fun.ai.devhub.log;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * session 结束原因
 * - STOPPED：退出码 0
 * - KILLED：被信号终止（没有退出码）
 * - CRASHED：其它非 0 退出码
 */
public enum ExitReason {
    STOPPED("stopped"),
    KILLED("killed"),
    CRASHED("crashed");

    private final String code;

    ExitReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ExitReason of(Integer exitCode) {
        if (exitCode == null) {
            return KILLED;
        }
        return exitCode == 0 ? STOPPED : CRASHED;
    }
}
