package fun.ai.devhub.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import fun.ai.devhub.entity.Workspace;

public interface WorkspaceMapper extends BaseMapper<Workspace> {
}
