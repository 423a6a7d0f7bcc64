package fun.ai.devhub.process;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ServiceStatus {
    RUNNING("running"),
    STOPPED("stopped"),
    /**
     * 非 0 退出、被信号结束或 spawn 失败
     */
    ERROR("error");

    private final String code;

    ServiceStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
