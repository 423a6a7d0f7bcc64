package fun.ai.devhub.entity.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.Map;

@Data
public class ServiceCreateRequest {
    /**
     * 为空时使用当前 active workspace
     */
    private String workspaceId;
    @NotBlank(message = "name 不能为空")
    private String name;
    /**
     * 进程工作目录（绝对路径）
     */
    @NotBlank(message = "repoPath 不能为空")
    private String repoPath;
    @NotBlank(message = "command 不能为空")
    private String command;
    private Integer port;
    private Map<String, String> envVars;
}
