package com.example.cruisesync.domain.model;

import com.example.cruisesync.common.util.HashUtil;
import java.time.YearMonth;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One remote sailing file: {@code /{year}/{month}/{lineId}/{shipId}/{sailingId}.json}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SailingReference {

    private int year;

    private int month;

    private int lineId;

    private int shipId;

    private String sailingId;

    private String remotePath;

    private long size;

    public static SailingReference of(String rootPath, YearMonth yearMonth, int lineId, int shipId,
                                      String sailingId, long size) {
        String path = joinPath(rootPath, String.valueOf(yearMonth.getYear()),
                String.format("%02d", yearMonth.getMonthValue()),
                String.valueOf(lineId), String.valueOf(shipId), sailingId + ".json");
        return new SailingReference(yearMonth.getYear(), yearMonth.getMonthValue(), lineId, shipId,
                sailingId, path, size);
    }

    public YearMonth yearMonth() {
        return YearMonth.of(year, month);
    }

    public String pathMd5() {
        return HashUtil.pathKey(remotePath);
    }

    public static String joinPath(String root, String... segments) {
        StringBuilder sb = new StringBuilder();
        String base = root == null ? "" : root.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        sb.append(base);
        for (String segment : segments) {
            sb.append('/').append(segment);
        }
        return sb.length() == 0 ? "/" : sb.toString();
    }
}
