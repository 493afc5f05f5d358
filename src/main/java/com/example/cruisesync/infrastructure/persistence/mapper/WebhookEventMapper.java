package com.example.cruisesync.infrastructure.persistence.mapper;

import com.example.cruisesync.infrastructure.persistence.entity.WebhookEventEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface WebhookEventMapper {

    /** Returns 0 when the webhook id was already recorded. */
    @Insert("INSERT IGNORE INTO webhook_event(webhook_id, event_type, line_id, event_timestamp, status, received_at) "
            + "VALUES(#{webhookId}, #{eventType}, #{lineId}, #{eventTimestamp}, #{status}, #{receivedAt})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insertIgnore(WebhookEventEntity entity);

    @Update("UPDATE webhook_event SET status = #{status}, reason = #{reason}, marked_count = #{markedCount} "
            + "WHERE webhook_id = #{webhookId}")
    int updateOutcome(@Param("webhookId") String webhookId,
                      @Param("status") String status,
                      @Param("reason") String reason,
                      @Param("markedCount") int markedCount);

    @Delete("DELETE FROM webhook_event WHERE webhook_id = #{webhookId} AND status = 'RECEIVED'")
    int deleteReceived(@Param("webhookId") String webhookId);
}
