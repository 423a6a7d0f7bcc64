package fun.ai.devhub.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@TableName("service_health_checks")
public class ServiceHealthCheck {

    @TableId(value = "id", type = IdType.INPUT)
    private String id;

    @TableField("service_id")
    private String serviceId;

    @TableField("type")
    @Schema(description = "http/tcp/command")
    private String type;

    @TableField("endpoint")
    @Schema(description = "http 探测地址")
    private String endpoint;

    @TableField("expected_status")
    private Integer expectedStatus;

    @TableField("expected_body")
    @Schema(description = "可选：响应体需包含的子串")
    private String expectedBody;

    @TableField("port")
    @Schema(description = "tcp 探测端口（localhost）")
    private Integer port;

    @TableField("command")
    private String command;

    @TableField("interval_seconds")
    private Integer intervalSeconds;

    @TableField("timeout_ms")
    private Integer timeoutMs;

    @TableField("retries")
    private Integer retries;

    @TableField("enabled")
    private Boolean enabled;

    @TableField("created_at")
    private Long createdAt;

    @TableField("updated_at")
    private Long updatedAt;
}
