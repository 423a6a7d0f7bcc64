package fun.ai.devhub.common;

/**
 * 业务异常基类：携带返回给调用方的业务码（与 {@link Result#getCode()} 对齐）
 */
public class DevHubException extends RuntimeException {
    private final int code;

    public DevHubException(int code, String message) {
        super(message);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
