package fun.ai.devhub.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

/**
 * workspace（由 workspace 管理模块维护，这里只读存在性与 active 标记）
 */
@Data
@TableName("workspaces")
public class Workspace {

    @TableId(value = "id", type = IdType.INPUT)
    private String id;

    @TableField("name")
    private String name;

    @TableField("active")
    private Boolean active;

    @TableField("created_at")
    private Long createdAt;
}
