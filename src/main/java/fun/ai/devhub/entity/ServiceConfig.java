package fun.ai.devhub.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.Map;

/**
 * 服务定义：在哪个目录下、用什么命令、带哪些环境变量启动
 */
@Data
@TableName(value = "services", autoResultMap = true)
public class ServiceConfig {

    @TableId(value = "id", type = IdType.INPUT)
    private String id;

    @TableField("workspace_id")
    private String workspaceId;

    @TableField("name")
    private String name;

    @TableField("repo_path")
    @Schema(description = "工作目录（进程 cwd）")
    private String repoPath;

    @TableField("command")
    @Schema(description = "shell 命令，支持 && 与管道，例如 npm run dev")
    private String command;

    @TableField("port")
    private Integer port;

    @TableField(value = "env_vars", typeHandler = JacksonTypeHandler.class)
    @Schema(description = "覆盖到进程环境上的变量")
    private Map<String, String> envVars;

    @TableField("health_status")
    @Schema(description = "unknown/healthy/unhealthy（由健康检查写入）")
    private String healthStatus;

    @TableField("last_health_check")
    private Long lastHealthCheck;

    @TableField("health_check_failures")
    private Integer healthCheckFailures;

    @TableField("created_at")
    private Long createdAt;

    @TableField("updated_at")
    private Long updatedAt;
}
