package com.example.cruisesync.infrastructure.persistence.mapper;

import com.example.cruisesync.infrastructure.persistence.entity.PriceHistoryEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;

@Mapper
public interface PriceHistoryMapper {

    @Insert("INSERT INTO price_history(cruise_id, interior_price, oceanview_price, balcony_price, suite_price, "
            + "cheapest_price, currency, sync_task_id, snapshot_date) "
            + "VALUES(#{cruiseId}, #{interiorPrice}, #{oceanviewPrice}, #{balconyPrice}, #{suitePrice}, "
            + "#{cheapestPrice}, #{currency}, #{syncTaskId}, #{snapshotDate})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(PriceHistoryEntity entity);
}
