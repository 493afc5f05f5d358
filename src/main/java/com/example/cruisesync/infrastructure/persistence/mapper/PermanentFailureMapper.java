package com.example.cruisesync.infrastructure.persistence.mapper;

import com.example.cruisesync.infrastructure.persistence.entity.PermanentFailureEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface PermanentFailureMapper {

    @Insert("INSERT INTO sync_permanent_failure(path_md5, remote_path, file_size, error_code, error_message, failed_at) "
            + "VALUES(#{pathMd5}, #{remotePath}, #{fileSize}, #{errorCode}, #{errorMessage}, #{failedAt}) "
            + "ON DUPLICATE KEY UPDATE file_size = VALUES(file_size), error_code = VALUES(error_code), "
            + "error_message = VALUES(error_message), failed_at = VALUES(failed_at)")
    int upsert(PermanentFailureEntity entity);

    @Select("SELECT path_md5, remote_path, file_size, error_code, error_message, failed_at FROM sync_permanent_failure")
    List<PermanentFailureEntity> selectAll();

    @Delete("DELETE FROM sync_permanent_failure WHERE path_md5 = #{pathMd5}")
    int deleteByPathMd5(@Param("pathMd5") String pathMd5);
}
