package com.example.cruisesync.infrastructure.persistence.mapper;

import com.example.cruisesync.infrastructure.persistence.entity.CruiseLineLockEntity;
import java.time.LocalDateTime;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface CruiseLineLockMapper {

    /**
     * Inserts the lock, or takes over an expired one. A live lock held by someone else is
     * left untouched; callers read the row back to learn who holds it. expires_at must be
     * assigned last because the conditions read its old value.
     */
    @Insert("INSERT INTO cruise_line_lock(line_id, lock_key, holder_id, acquired_at, expires_at) "
            + "VALUES(#{lineId}, #{lockKey}, #{holderId}, #{now}, #{expiresAt}) "
            + "ON DUPLICATE KEY UPDATE "
            + "holder_id = IF(expires_at <= #{now}, VALUES(holder_id), holder_id), "
            + "acquired_at = IF(expires_at <= #{now}, VALUES(acquired_at), acquired_at), "
            + "expires_at = IF(expires_at <= #{now}, VALUES(expires_at), expires_at)")
    int insertOrTakeOver(@Param("lineId") Integer lineId,
                         @Param("lockKey") String lockKey,
                         @Param("holderId") String holderId,
                         @Param("now") LocalDateTime now,
                         @Param("expiresAt") LocalDateTime expiresAt);

    @Select("SELECT line_id, lock_key, holder_id, acquired_at, expires_at FROM cruise_line_lock WHERE line_id = #{lineId}")
    CruiseLineLockEntity selectByLineId(@Param("lineId") Integer lineId);

    @Update("UPDATE cruise_line_lock SET expires_at = #{expiresAt} "
            + "WHERE line_id = #{lineId} AND holder_id = #{holderId} AND expires_at > #{now}")
    int renew(@Param("lineId") Integer lineId,
              @Param("holderId") String holderId,
              @Param("now") LocalDateTime now,
              @Param("expiresAt") LocalDateTime expiresAt);

    @Delete("DELETE FROM cruise_line_lock WHERE line_id = #{lineId} AND holder_id = #{holderId}")
    int release(@Param("lineId") Integer lineId, @Param("holderId") String holderId);

    @Delete("DELETE FROM cruise_line_lock WHERE expires_at <= #{now}")
    int deleteExpired(@Param("now") LocalDateTime now);
}
