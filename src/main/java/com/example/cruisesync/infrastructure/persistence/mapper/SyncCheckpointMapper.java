package com.example.cruisesync.infrastructure.persistence.mapper;

import com.example.cruisesync.infrastructure.persistence.entity.SyncCheckpointEntity;
import java.util.List;
import java.util.Set;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface SyncCheckpointMapper {

    @Insert("<script>"
            + "INSERT INTO sync_checkpoint(task_id, path_md5, remote_path, line_id, status, error_code, error_message) VALUES "
            + "<foreach item='item' collection='items' separator=','>"
            + "(#{item.taskId}, #{item.pathMd5}, #{item.remotePath}, #{item.lineId}, #{item.status}, "
            + "#{item.errorCode}, #{item.errorMessage})"
            + "</foreach>"
            + " ON DUPLICATE KEY UPDATE status = VALUES(status), error_code = VALUES(error_code), "
            + "error_message = VALUES(error_message)"
            + "</script>")
    int batchUpsert(@Param("items") List<SyncCheckpointEntity> items);

    /** References a run finished, with success or a recorded failure. */
    @Select("SELECT path_md5 FROM sync_checkpoint WHERE task_id = #{taskId}")
    Set<String> selectDonePathMd5s(@Param("taskId") Long taskId);

    @Select("SELECT COUNT(1) FROM sync_checkpoint WHERE task_id = #{taskId} AND status = #{status}")
    int countByStatus(@Param("taskId") Long taskId, @Param("status") String status);

    /** Moves an interrupted task's checkpoint onto the task that resumes it. */
    @Update("UPDATE sync_checkpoint SET task_id = #{toTaskId} WHERE task_id = #{fromTaskId}")
    int reassignTask(@Param("fromTaskId") Long fromTaskId, @Param("toTaskId") Long toTaskId);

    @Delete("DELETE FROM sync_checkpoint WHERE task_id = #{taskId}")
    int deleteByTaskId(@Param("taskId") Long taskId);
}
