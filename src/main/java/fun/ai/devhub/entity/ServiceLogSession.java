package fun.ai.devhub.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

/**
 * 一次进程运行对应一个日志 session：spawn 时创建，进程真正退出时关闭（仅一次）
 */
@Data
@TableName("service_log_sessions")
public class ServiceLogSession {

    @TableId(value = "id", type = IdType.INPUT)
    private String id;

    @TableField("service_id")
    private String serviceId;

    @TableField("started_at")
    @Schema(description = "epoch ms")
    private Long startedAt;

    @TableField("stopped_at")
    @Schema(description = "epoch ms；为空表示 session 仍打开（进程未退出）")
    private Long stoppedAt;

    @TableField("exit_code")
    private Integer exitCode;

    @TableField("exit_reason")
    @Schema(description = "stopped/killed/crashed")
    private String exitReason;

    @TableField("logs_count")
    private Integer logsCount;

    @TableField("created_at")
    private Long createdAt;
}
