package fun.ai.devhub.entity.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class HealthCheckCreateRequest {
    /**
     * http / tcp / command
     */
    @NotBlank(message = "type 不能为空")
    @Pattern(regexp = "http|tcp|command", message = "type 只能是 http/tcp/command")
    private String type;
    /**
     * http：完整 URL，例如 http://localhost:3000/health
     */
    private String endpoint;
    private Integer expectedStatus;
    private String expectedBody;
    /**
     * tcp：localhost 端口
     */
    private Integer port;
    /**
     * command：退出码 0 视为健康
     */
    private String command;
    private Integer intervalSeconds;
    private Integer timeoutMs;
    private Integer retries;
    private Boolean enabled;
}
