package fun.ai.devhub.entity.response;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class LogStatsResponse {
    private long totalSessions;
    private long totalLogs;
    /**
     * 仍打开（进程未退出）的 session 数
     */
    private long activeSessions;
    private List<LevelCount> logsByLevel = new ArrayList<>();

    @Data
    public static class LevelCount {
        private String level;
        private long count;

        public LevelCount() {
        }

        public LevelCount(String level, long count) {
            this.level = level;
            this.count = count;
        }
    }
}
