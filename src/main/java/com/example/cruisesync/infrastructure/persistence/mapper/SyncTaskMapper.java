package com.example.cruisesync.infrastructure.persistence.mapper;

import com.example.cruisesync.infrastructure.persistence.entity.SyncTaskEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface SyncTaskMapper {

    String COLUMNS = "id, task_type, status, line_id, range_start, range_end, resume_from_task_id, "
            + "start_time, end_time, discovered_count, processed_count, inserted_count, updated_count, "
            + "failed_count, skipped_count, price_changed_count, deactivated_count, "
            + "last_synced_path, last_completed_month, error_summary, created_at, updated_at";

    @Insert("INSERT INTO sync_task(task_type, status, line_id, range_start, range_end, resume_from_task_id, "
            + "discovered_count, processed_count, inserted_count, updated_count, failed_count, skipped_count, "
            + "price_changed_count, deactivated_count) "
            + "VALUES(#{taskType}, #{status}, #{lineId}, #{rangeStart}, #{rangeEnd}, #{resumeFromTaskId}, "
            + "0, 0, 0, 0, 0, 0, 0, 0)")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(SyncTaskEntity entity);

    @Select("SELECT " + COLUMNS + " FROM sync_task WHERE id = #{id}")
    SyncTaskEntity selectById(@Param("id") Long id);

    @Select("SELECT status FROM sync_task WHERE id = #{id}")
    String selectStatusById(@Param("id") Long id);

    @Select("SELECT " + COLUMNS + " FROM sync_task WHERE status = #{status} ORDER BY id")
    List<SyncTaskEntity> selectByStatus(@Param("status") String status);

    @Select("SELECT COUNT(1) FROM sync_task WHERE task_type = #{taskType} AND status IN ('PENDING','RUNNING')")
    int countActiveByType(@Param("taskType") String taskType);

    @Update("UPDATE sync_task SET status = 'RUNNING', start_time = NOW(), updated_at = NOW() "
            + "WHERE id = #{id} AND status = 'PENDING'")
    int markRunning(@Param("id") Long id);

    @Update("UPDATE sync_task SET discovered_count = #{discoveredCount}, processed_count = #{processedCount}, "
            + "inserted_count = #{insertedCount}, updated_count = #{updatedCount}, failed_count = #{failedCount}, "
            + "skipped_count = #{skippedCount}, price_changed_count = #{priceChangedCount}, "
            + "last_synced_path = #{lastSyncedPath}, last_completed_month = COALESCE(#{lastCompletedMonth}, last_completed_month), "
            + "updated_at = NOW() WHERE id = #{id} AND status IN ('RUNNING','CANCELED')")
    int updateProgress(SyncTaskEntity progress);

    @Update("UPDATE sync_task SET status = #{status}, end_time = NOW(), deactivated_count = #{deactivatedCount}, "
            + "error_summary = #{errorSummary}, updated_at = NOW() WHERE id = #{id} AND status = 'RUNNING'")
    int markFinished(@Param("id") Long id,
                     @Param("status") String status,
                     @Param("deactivatedCount") int deactivatedCount,
                     @Param("errorSummary") String errorSummary);

    @Update("UPDATE sync_task SET status = 'FAILED', end_time = NOW(), error_summary = #{errorSummary}, "
            + "updated_at = NOW() WHERE id = #{id} AND status = 'PENDING'")
    int markFailedBeforeRunning(@Param("id") Long id, @Param("errorSummary") String errorSummary);

    @Update("UPDATE sync_task SET status = 'CANCELED', end_time = NOW(), updated_at = NOW() "
            + "WHERE id = #{id} AND status IN ('PENDING','RUNNING')")
    int cancel(@Param("id") Long id);

    @Update("UPDATE sync_task SET status = 'INTERRUPTED', end_time = NOW(), updated_at = NOW(), "
            + "error_summary = 'process stopped while running' WHERE id = #{id} AND status IN ('PENDING','RUNNING')")
    int markInterrupted(@Param("id") Long id);
}
