package fun.ai.devhub.entity.response;

import fun.ai.devhub.entity.ServiceConfig;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class BatchCreateResult {
    private List<ServiceConfig> created = new ArrayList<>();
    /**
     * 同 workspace 下 repoPath 已存在而跳过的
     */
    private List<String> skipped = new ArrayList<>();
    private List<Failure> failed = new ArrayList<>();

    @Data
    public static class Failure {
        private String name;
        private String error;

        public Failure() {
        }

        public Failure(String name, String error) {
            this.name = name;
            this.error = error;
        }
    }
}
