package fun.ai.devhub.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import fun.ai.devhub.entity.ServiceHealthCheck;

public interface ServiceHealthCheckMapper extends BaseMapper<ServiceHealthCheck> {
}
