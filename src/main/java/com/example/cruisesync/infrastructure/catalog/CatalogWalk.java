package com.example.cruisesync.infrastructure.catalog;

import com.example.cruisesync.domain.model.RemoteEntry;
import com.example.cruisesync.domain.model.SailingReference;
import com.example.cruisesync.infrastructure.ftp.CircuitOpenException;
import com.example.cruisesync.infrastructure.ftp.RemoteAuthException;
import com.example.cruisesync.infrastructure.ftp.RemoteFileClient;
import com.example.cruisesync.infrastructure.ftp.RemoteFileException;
import com.example.cruisesync.infrastructure.ftp.RemoteNotFoundException;
import java.time.YearMonth;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazy depth-first traversal of {@code year/month -> line -> ship -> *.json}. Directories are
 * listed only when the consumer asks for more references.
 *
 * <p>A failed listing skips that subtree and is counted. Missing directories (typically
 * months the vendor has not published yet) are not failures. Authentication errors and an
 * open circuit breaker propagate out of {@link #hasNext()}, since every following listing
 * would fail the same way.
 */
public class CatalogWalk implements Iterator<SailingReference> {

    private static final Logger log = LoggerFactory.getLogger(CatalogWalk.class);

    private static final String JSON_SUFFIX = ".json";

    private final RemoteFileClient client;
    private final String rootPath;
    private final Integer lineFilter;
    private final int maxReferences;

    private final Deque<YearMonth> pendingMonths = new ArrayDeque<>();
    private final Deque<Integer> pendingLines = new ArrayDeque<>();
    private final Deque<Integer> pendingShips = new ArrayDeque<>();
    private final Deque<SailingReference> pendingFiles = new ArrayDeque<>();

    private YearMonth currentMonth;
    private int currentLine;
    private int produced;
    private int listingFailures;
    private boolean truncated;

    CatalogWalk(RemoteFileClient client, String rootPath, YearMonth start, YearMonth end,
                Integer lineFilter, int maxReferences) {
        this.client = client;
        this.rootPath = rootPath;
        this.lineFilter = lineFilter;
        this.maxReferences = maxReferences <= 0 ? Integer.MAX_VALUE : maxReferences;
        for (YearMonth month = start; !month.isAfter(end); month = month.plusMonths(1)) {
            pendingMonths.addLast(month);
        }
    }

    @Override
    public boolean hasNext() {
        if (produced >= maxReferences) {
            if (!truncated && (!pendingFiles.isEmpty() || !pendingShips.isEmpty()
                    || !pendingLines.isEmpty() || !pendingMonths.isEmpty())) {
                truncated = true;
                log.info("CATALOG_WALK_TRUNCATED limit={} lineFilter={}", maxReferences, lineFilter);
            }
            return false;
        }
        while (pendingFiles.isEmpty()) {
            if (!pendingShips.isEmpty()) {
                expandShip(pendingShips.pollFirst());
            } else if (!pendingLines.isEmpty()) {
                expandLine(pendingLines.pollFirst());
            } else if (!pendingMonths.isEmpty()) {
                expandMonth(pendingMonths.pollFirst());
            } else {
                return false;
            }
        }
        return true;
    }

    @Override
    public SailingReference next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        produced++;
        return pendingFiles.pollFirst();
    }

    public int getListingFailures() {
        return listingFailures;
    }

    /** True when the limit cut the walk short. */
    public boolean isTruncated() {
        return truncated;
    }

    public int getProduced() {
        return produced;
    }

    private void expandMonth(YearMonth month) {
        currentMonth = month;
        if (lineFilter != null) {
            pendingLines.addLast(lineFilter);
            return;
        }
        String monthPath = monthPath(month);
        for (RemoteEntry entry : safeList(monthPath)) {
            Integer lineId = numericDirectory(entry);
            if (lineId != null) {
                pendingLines.addLast(lineId);
            }
        }
    }

    private void expandLine(int lineId) {
        currentLine = lineId;
        String linePath = SailingReference.joinPath(monthPath(currentMonth), String.valueOf(lineId));
        for (RemoteEntry entry : safeList(linePath)) {
            Integer shipId = numericDirectory(entry);
            if (shipId != null) {
                pendingShips.addLast(shipId);
            }
        }
    }

    private void expandShip(int shipId) {
        String shipPath = SailingReference.joinPath(monthPath(currentMonth),
                String.valueOf(currentLine), String.valueOf(shipId));
        List<RemoteEntry> entries = new ArrayList<>(safeList(shipPath));
        entries.sort((a, b) -> a.getName().compareTo(b.getName()));
        for (RemoteEntry entry : entries) {
            if (entry.isDirectory()) {
                continue;
            }
            String name = entry.getName();
            if (!name.toLowerCase(Locale.ROOT).endsWith(JSON_SUFFIX)) {
                continue;
            }
            String sailingId = name.substring(0, name.length() - JSON_SUFFIX.length());
            if (sailingId.isEmpty()) {
                continue;
            }
            pendingFiles.addLast(SailingReference.of(rootPath, currentMonth, currentLine, shipId,
                    sailingId, entry.getSize()));
        }
    }

    private List<RemoteEntry> safeList(String path) {
        try {
            return client.listDirectory(path);
        } catch (RemoteNotFoundException e) {
            log.debug("CATALOG_DIR_MISSING path={}", path);
            return Collections.emptyList();
        } catch (RemoteAuthException | CircuitOpenException e) {
            throw e;
        } catch (RemoteFileException e) {
            listingFailures++;
            log.warn("CATALOG_LIST_FAILED path={} error={}", path, e.getMessage());
            return Collections.emptyList();
        }
    }

    private String monthPath(YearMonth month) {
        return SailingReference.joinPath(rootPath, String.valueOf(month.getYear()),
                String.format("%02d", month.getMonthValue()));
    }

    private Integer numericDirectory(RemoteEntry entry) {
        if (!entry.isDirectory()) {
            return null;
        }
        try {
            return Integer.valueOf(entry.getName().trim());
        } catch (NumberFormatException e) {
            log.debug("CATALOG_SKIP_NON_NUMERIC_DIR name={}", entry.getName());
            return null;
        }
    }
}
