package fun.ai.devhub.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import fun.ai.devhub.entity.ServiceLogSession;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

public interface ServiceLogSessionMapper extends BaseMapper<ServiceLogSession> {

    @Update("UPDATE service_log_sessions SET logs_count = logs_count + #{delta} WHERE id = #{sessionId}")
    int incrementLogsCount(@Param("sessionId") String sessionId, @Param("delta") int delta);

    /**
     * 只关闭仍打开的 session，保证 stopped_at/exit_reason 只写一次
     */
    @Update("UPDATE service_log_sessions SET stopped_at = #{stoppedAt}, exit_code = #{exitCode}, exit_reason = #{exitReason} "
            + "WHERE id = #{sessionId} AND stopped_at IS NULL")
    int closeSession(@Param("sessionId") String sessionId,
                     @Param("stoppedAt") long stoppedAt,
                     @Param("exitCode") Integer exitCode,
                     @Param("exitReason") String exitReason);
}
