package fun.ai.devhub.log;

import lombok.Data;

/**
 * 日志查询过滤条件（session 视图与 service 视图共用；sessionId 仅 service 视图生效）
 */
@Data
public class LogQuery {
    public static final int DEFAULT_LIMIT = 500;

    private String sessionId;
    private LogLevel level;
    /**
     * message 子串匹配
     */
    private String search;
    private Integer limit = DEFAULT_LIMIT;
    private Integer offset = 0;

    public static LogQuery defaults() {
        return new LogQuery();
    }

    public int limitOrDefault() {
        return limit == null || limit <= 0 ? DEFAULT_LIMIT : limit;
    }

    public int offsetOrDefault() {
        return offset == null || offset < 0 ? 0 : offset;
    }
}
