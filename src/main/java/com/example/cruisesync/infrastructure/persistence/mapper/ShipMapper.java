package com.example.cruisesync.infrastructure.persistence.mapper;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface ShipMapper {

    @Insert("INSERT INTO ships(id, cruise_line_id, name) VALUES(#{id}, #{cruiseLineId}, #{name}) "
            + "ON DUPLICATE KEY UPDATE cruise_line_id = VALUES(cruise_line_id), "
            + "name = COALESCE(VALUES(name), name), updated_at = NOW()")
    int upsert(@Param("id") Integer id, @Param("cruiseLineId") Integer cruiseLineId, @Param("name") String name);
}
