package com.example.cruisesync.application.service;

import com.example.cruisesync.domain.enumtype.CabinClass;
import com.example.cruisesync.domain.model.CabinPrices;
import com.example.cruisesync.domain.model.NormalizedSailing;
import com.example.cruisesync.domain.model.PriceDelta;
import com.example.cruisesync.domain.model.UpsertResult;
import com.example.cruisesync.infrastructure.persistence.entity.CruiseEntity;
import com.example.cruisesync.infrastructure.persistence.entity.PriceHistoryEntity;
import com.example.cruisesync.infrastructure.persistence.mapper.CruiseLineMapper;
import com.example.cruisesync.infrastructure.persistence.mapper.CruiseMapper;
import com.example.cruisesync.infrastructure.persistence.mapper.PortMapper;
import com.example.cruisesync.infrastructure.persistence.mapper.PriceHistoryMapper;
import com.example.cruisesync.infrastructure.persistence.mapper.RegionMapper;
import com.example.cruisesync.infrastructure.persistence.mapper.ShipMapper;
import com.example.cruisesync.infrastructure.persistence.model.NamedRow;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Transactional units behind {@link SailingPersistenceService}. Kept in a separate bean so
 * the retry after a constraint violation runs in a fresh transaction.
 */
@Component
public class SailingWriter {

    private final CruiseLineMapper cruiseLineMapper;
    private final ShipMapper shipMapper;
    private final PortMapper portMapper;
    private final RegionMapper regionMapper;
    private final CruiseMapper cruiseMapper;
    private final PriceHistoryMapper priceHistoryMapper;
    private final Clock clock;

    public SailingWriter(CruiseLineMapper cruiseLineMapper,
                         ShipMapper shipMapper,
                         PortMapper portMapper,
                         RegionMapper regionMapper,
                         CruiseMapper cruiseMapper,
                         PriceHistoryMapper priceHistoryMapper,
                         Clock clock) {
        this.cruiseLineMapper = cruiseLineMapper;
        this.shipMapper = shipMapper;
        this.portMapper = portMapper;
        this.regionMapper = regionMapper;
        this.cruiseMapper = cruiseMapper;
        this.priceHistoryMapper = priceHistoryMapper;
        this.clock = clock;
    }

    /**
     * Dimension rows in fixed order: cruise line, ship, ports, regions.
     */
    @Transactional(rollbackFor = Exception.class)
    public void upsertDimensions(NormalizedSailing sailing) {
        cruiseLineMapper.upsert(sailing.getLineId(), sailing.getLineName());
        shipMapper.upsert(sailing.getShipId(), sailing.getLineId(), sailing.getShipName());
        List<NamedRow> ports = namedRows(portIdsOf(sailing), sailing.getPortNames());
        if (!ports.isEmpty()) {
            portMapper.batchUpsert(ports);
        }
        List<NamedRow> regions = namedRows(new LinkedHashSet<>(sailing.getRegionIds()), sailing.getRegionNames());
        if (!regions.isEmpty()) {
            regionMapper.batchUpsert(regions);
        }
    }

    /**
     * Dimensions, then the snapshot of the stored prices, then the sailing row. The stored
     * row is locked from the snapshot read until commit, so the snapshot always holds the
     * prices the update replaces.
     */
    @Transactional(rollbackFor = Exception.class)
    public UpsertResult write(NormalizedSailing sailing, Long taskId) {
        upsertDimensions(sailing);

        LocalDateTime now = LocalDateTime.now(clock);
        CruiseEntity prior = cruiseMapper.selectPricesForUpdate(sailing.getSailingId());
        if (prior != null) {
            priceHistoryMapper.insert(toSnapshot(prior, taskId, now));
        }
        int affected = cruiseMapper.upsert(toEntity(sailing, taskId, now));
        if (prior == null && affected == 1) {
            return UpsertResult.inserted();
        }
        CabinPrices previous = prior == null ? CabinPrices.empty() : pricesOf(prior);
        return UpsertResult.updated(new PriceDelta(sailing.getSailingId(), previous, sailing.getPrices()));
    }

    private Set<Integer> portIdsOf(NormalizedSailing sailing) {
        Set<Integer> ids = new LinkedHashSet<>();
        if (sailing.getEmbarkPortId() != null) {
            ids.add(sailing.getEmbarkPortId());
        }
        if (sailing.getDisembarkPortId() != null) {
            ids.add(sailing.getDisembarkPortId());
        }
        ids.addAll(sailing.getPortIds());
        ids.addAll(sailing.getPortNames().keySet());
        return ids;
    }

    private List<NamedRow> namedRows(Set<Integer> ids, Map<Integer, String> names) {
        Set<Integer> all = new LinkedHashSet<>(ids);
        all.addAll(names.keySet());
        List<NamedRow> rows = new ArrayList<>(all.size());
        for (Integer id : all) {
            if (id != null && id > 0) {
                rows.add(new NamedRow(id, names.get(id)));
            }
        }
        return rows;
    }

    private PriceHistoryEntity toSnapshot(CruiseEntity prior, Long taskId, LocalDateTime now) {
        PriceHistoryEntity snapshot = new PriceHistoryEntity();
        snapshot.setCruiseId(prior.getId());
        snapshot.setInteriorPrice(prior.getInteriorPrice());
        snapshot.setOceanviewPrice(prior.getOceanviewPrice());
        snapshot.setBalconyPrice(prior.getBalconyPrice());
        snapshot.setSuitePrice(prior.getSuitePrice());
        snapshot.setCheapestPrice(prior.getCheapestPrice());
        snapshot.setCurrency(prior.getCurrency());
        snapshot.setSyncTaskId(taskId);
        snapshot.setSnapshotDate(now);
        return snapshot;
    }

    static CruiseEntity toEntity(NormalizedSailing sailing, Long taskId, LocalDateTime now) {
        CruiseEntity entity = new CruiseEntity();
        entity.setId(sailing.getSailingId());
        entity.setCruiseId(sailing.getCruiseId());
        entity.setCruiseLineId(sailing.getLineId());
        entity.setShipId(sailing.getShipId());
        entity.setName(sailing.getName());
        entity.setVoyageCode(sailing.getVoyageCode());
        entity.setSailingDate(sailing.getSailingDate());
        entity.setNights(sailing.getNights());
        entity.setEmbarkPortId(sailing.getEmbarkPortId());
        entity.setDisembarkPortId(sailing.getDisembarkPortId());
        entity.setPortIds(joinIds(sailing.getPortIds()));
        entity.setRegionIds(joinIds(sailing.getRegionIds()));
        entity.setInteriorPrice(sailing.price(CabinClass.INTERIOR));
        entity.setOceanviewPrice(sailing.price(CabinClass.OCEANVIEW));
        entity.setBalconyPrice(sailing.price(CabinClass.BALCONY));
        entity.setSuitePrice(sailing.price(CabinClass.SUITE));
        entity.setCheapestPrice(sailing.getCheapestPrice());
        entity.setCurrency(sailing.getCurrency());
        entity.setNeedsPriceUpdate(false);
        entity.setIsActive(true);
        entity.setRawData(sailing.getRawData());
        entity.setLastSyncTaskId(taskId);
        entity.setLastSyncedAt(now);
        return entity;
    }

    private static CabinPrices pricesOf(CruiseEntity entity) {
        return CabinPrices.of(entity.getInteriorPrice(), entity.getOceanviewPrice(),
                entity.getBalconyPrice(), entity.getSuitePrice());
    }

    private static String joinIds(List<Integer> ids) {
        if (ids == null || ids.isEmpty()) {
            return null;
        }
        return ids.stream().map(String::valueOf).collect(Collectors.joining(","));
    }
}
