package fun.ai.devhub.entity.request;

import lombok.Data;

import java.util.Map;

/**
 * 部分更新：null 字段不修改
 */
@Data
public class ServiceUpdateRequest {
    private String name;
    private String repoPath;
    private String command;
    private Integer port;
    private Map<String, String> envVars;
}
