package com.example.cruisesync.infrastructure.persistence.mapper;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface CruiseLineMapper {

    @Insert("INSERT INTO cruise_lines(id, name) VALUES(#{id}, #{name}) "
            + "ON DUPLICATE KEY UPDATE name = COALESCE(VALUES(name), name), updated_at = NOW()")
    int upsert(@Param("id") Integer id, @Param("name") String name);
}
