package fun.ai.devhub.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

/**
 * 单行日志（只增不改）。id 自增即到达顺序，timestamp 可能相同，排序一律按 id。
 */
@Data
@TableName("service_logs")
public class ServiceLogEntry {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    @TableField("session_id")
    private String sessionId;

    @TableField("service_id")
    private String serviceId;

    @TableField("timestamp")
    @Schema(description = "epoch ms")
    private Long timestamp;

    @TableField("level")
    @Schema(description = "info/warn/error/debug")
    private String level;

    @TableField("message")
    private String message;
}
