package com.example.cruisesync.infrastructure.persistence.mapper;

import com.example.cruisesync.infrastructure.persistence.model.NamedRow;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface PortMapper {

    /** A null name keeps the stored one. */
    @Insert("<script>"
            + "INSERT INTO ports(id, name) VALUES "
            + "<foreach item='row' collection='rows' separator=','>"
            + "(#{row.id}, #{row.name})"
            + "</foreach>"
            + " ON DUPLICATE KEY UPDATE name = COALESCE(VALUES(name), name), updated_at = NOW()"
            + "</script>")
    int batchUpsert(@Param("rows") List<NamedRow> rows);
}
