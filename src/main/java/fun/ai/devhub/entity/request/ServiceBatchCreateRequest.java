package fun.ai.devhub.entity.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

/**
 * 批量创建（例如仓库扫描后一次导入多个服务）；同一 workspace 下 repoPath 已存在的跳过
 */
@Data
public class ServiceBatchCreateRequest {
    private String workspaceId;
    @NotEmpty(message = "services 不能为空")
    @Valid
    private List<ServiceCreateRequest> services;
}
