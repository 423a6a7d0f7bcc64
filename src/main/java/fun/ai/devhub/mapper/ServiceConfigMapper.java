package fun.ai.devhub.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import fun.ai.devhub.entity.ServiceConfig;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

public interface ServiceConfigMapper extends BaseMapper<ServiceConfig> {

    /**
     * 健康检查结果回写：成功清零失败计数，失败 +1
     */
    @Update("UPDATE services SET health_status = #{healthStatus}, last_health_check = #{checkedAt}, "
            + "health_check_failures = CASE WHEN #{healthy} THEN 0 ELSE COALESCE(health_check_failures, 0) + 1 END "
            + "WHERE id = #{serviceId}")
    int updateHealth(@Param("serviceId") String serviceId,
                     @Param("healthStatus") String healthStatus,
                     @Param("healthy") boolean healthy,
                     @Param("checkedAt") long checkedAt);
}
