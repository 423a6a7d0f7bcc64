package fun.ai.devhub.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import fun.ai.devhub.entity.ServiceLogEntry;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;

import java.util.List;

public interface ServiceLogEntryMapper extends BaseMapper<ServiceLogEntry> {

    /**
     * 多行 VALUES 一次插入；调用方负责分片（sqlite 单语句变量数有上限）
     */
    @Insert({"<script>",
            "INSERT INTO service_logs (session_id, service_id, timestamp, level, message) VALUES",
            "<foreach collection='entries' item='e' separator=','>",
            "(#{e.sessionId}, #{e.serviceId}, #{e.timestamp}, #{e.level}, #{e.message})",
            "</foreach>",
            "</script>"})
    int insertBatch(@Param("entries") List<ServiceLogEntry> entries);
}
