package com.example.cruisesync.application.service;

import com.example.cruisesync.common.exception.SailingConstraintException;
import com.example.cruisesync.domain.enumtype.CabinClass;
import com.example.cruisesync.domain.model.NormalizedSailing;
import com.example.cruisesync.domain.model.PriceDelta;
import com.example.cruisesync.domain.model.UpsertResult;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Idempotent sailing upsert. Dimensions first, snapshot of the stored prices, then the
 * sailing row through a single insert-or-update statement.
 */
@Service
public class SailingPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(SailingPersistenceService.class);

    private final SailingWriter sailingWriter;

    public SailingPersistenceService(SailingWriter sailingWriter) {
        this.sailingWriter = sailingWriter;
    }

    /**
     * @throws SailingConstraintException when the write still violates a constraint after the
     *                                    dimension rows were re-upserted once
     */
    public UpsertResult upsert(NormalizedSailing sailing, Long taskId) {
        UpsertResult result;
        try {
            result = sailingWriter.write(sailing, taskId);
        } catch (DataIntegrityViolationException first) {
            log.warn("SAILING_CONSTRAINT_RETRY sailingId={} lineId={} shipId={} error={}",
                    sailing.getSailingId(), sailing.getLineId(), sailing.getShipId(), first.getMessage());
            try {
                sailingWriter.upsertDimensions(sailing);
                result = sailingWriter.write(sailing, taskId);
            } catch (DataIntegrityViolationException second) {
                throw new SailingConstraintException(sailing.getSailingId(), second);
            }
        }
        if (result.pricesChanged()) {
            logPriceChange(result.getDelta());
        }
        return result;
    }

    private void logPriceChange(PriceDelta delta) {
        StringBuilder changes = new StringBuilder();
        for (CabinClass cabinClass : delta.changedClasses()) {
            if (changes.length() > 0) {
                changes.append(' ');
            }
            changes.append(cabinClass.name().toLowerCase(Locale.ROOT))
                    .append('=').append(delta.getPrevious().get(cabinClass))
                    .append("->").append(delta.getCurrent().get(cabinClass));
        }
        log.info("SAILING_PRICE_CHANGED sailingId={} {}", delta.getSailingId(), changes);
    }
}
