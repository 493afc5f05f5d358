package com.example.cruisesync.infrastructure.persistence.mapper;

import com.example.cruisesync.infrastructure.persistence.entity.CruiseEntity;
import java.time.LocalDate;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface CruiseMapper {

    /**
     * Atomic insert-or-update keyed by the sailing id. Returns 1 for an insert; updates
     * report 2, or 1 under found-rows semantics, so callers must not rely on the count alone.
     */
    @Insert("INSERT INTO cruises("
            + "id, cruise_id, cruise_line_id, ship_id, name, voyage_code, sailing_date, nights, "
            + "embark_port_id, disembark_port_id, port_ids, region_ids, "
            + "interior_price, oceanview_price, balcony_price, suite_price, cheapest_price, currency, "
            + "needs_price_update, is_active, raw_data, last_sync_task_id, last_synced_at"
            + ") VALUES ("
            + "#{id}, #{cruiseId}, #{cruiseLineId}, #{shipId}, #{name}, #{voyageCode}, #{sailingDate}, #{nights}, "
            + "#{embarkPortId}, #{disembarkPortId}, #{portIds}, #{regionIds}, "
            + "#{interiorPrice}, #{oceanviewPrice}, #{balconyPrice}, #{suitePrice}, #{cheapestPrice}, #{currency}, "
            + "0, 1, #{rawData}, #{lastSyncTaskId}, #{lastSyncedAt}"
            + ") ON DUPLICATE KEY UPDATE "
            + "cruise_id = VALUES(cruise_id), "
            + "cruise_line_id = VALUES(cruise_line_id), "
            + "ship_id = VALUES(ship_id), "
            + "name = VALUES(name), "
            + "voyage_code = VALUES(voyage_code), "
            + "sailing_date = VALUES(sailing_date), "
            + "nights = VALUES(nights), "
            + "embark_port_id = VALUES(embark_port_id), "
            + "disembark_port_id = VALUES(disembark_port_id), "
            + "port_ids = VALUES(port_ids), "
            + "region_ids = VALUES(region_ids), "
            + "interior_price = VALUES(interior_price), "
            + "oceanview_price = VALUES(oceanview_price), "
            + "balcony_price = VALUES(balcony_price), "
            + "suite_price = VALUES(suite_price), "
            + "cheapest_price = VALUES(cheapest_price), "
            + "currency = VALUES(currency), "
            + "needs_price_update = 0, "
            + "is_active = 1, "
            + "raw_data = VALUES(raw_data), "
            + "last_sync_task_id = VALUES(last_sync_task_id), "
            + "last_synced_at = VALUES(last_synced_at), "
            + "updated_at = NOW()")
    int upsert(CruiseEntity entity);

    /** Current prices, row-locked until the surrounding transaction ends. */
    @Select("SELECT id, interior_price, oceanview_price, balcony_price, suite_price, cheapest_price, currency "
            + "FROM cruises WHERE id = #{id} FOR UPDATE")
    CruiseEntity selectPricesForUpdate(@Param("id") String id);

    @Update("UPDATE cruises SET needs_price_update = 1, updated_at = NOW() "
            + "WHERE cruise_line_id = #{lineId} AND is_active = 1 AND sailing_date >= #{fromDate}")
    int markNeedsPriceUpdateByLine(@Param("lineId") Integer lineId, @Param("fromDate") LocalDate fromDate);

    @Select("SELECT COUNT(1) FROM cruises WHERE needs_price_update = 1 AND is_active = 1")
    long countNeedingPriceUpdate();

    /** Counts the sailings as seen by the run without rewriting them. */
    @Update("<script>"
            + "UPDATE cruises SET last_sync_task_id = #{taskId} WHERE id IN "
            + "<foreach collection='ids' item='id' open='(' separator=',' close=')'>#{id}</foreach>"
            + "</script>")
    int claimForTask(@Param("taskId") Long taskId, @Param("ids") List<String> ids);

    /**
     * Deactivates active sailings in the date range that the given run never touched.
     */
    @Update("<script>"
            + "UPDATE cruises SET is_active = 0, updated_at = NOW() "
            + "WHERE is_active = 1 "
            + "AND sailing_date &gt;= #{fromDate} AND sailing_date &lt; #{toDateExclusive} "
            + "AND (last_sync_task_id IS NULL OR last_sync_task_id &lt;&gt; #{taskId}) "
            + "<if test='lineId != null'>AND cruise_line_id = #{lineId} </if>"
            + "</script>")
    int deactivateUnlisted(@Param("taskId") Long taskId,
                           @Param("lineId") Integer lineId,
                           @Param("fromDate") LocalDate fromDate,
                           @Param("toDateExclusive") LocalDate toDateExclusive);
}
