package com.example.cruisesync.application.service;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.cruisesync.common.exception.SailingConstraintException;
import com.example.cruisesync.domain.model.NormalizedSailing;
import com.example.cruisesync.domain.model.UpsertResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.dao.DataIntegrityViolationException;

class SailingPersistenceServiceTest {

    private SailingWriter writer;
    private SailingPersistenceService service;
    private NormalizedSailing sailing;

    @BeforeEach
    void setUp() {
        writer = mock(SailingWriter.class);
        service = new SailingPersistenceService(writer);
        sailing = new NormalizedSailing();
        sailing.setSailingId("2145865");
        sailing.setLineId(22);
        sailing.setShipId(180);
    }

    @Test
    void successfulWriteShouldNotRetry() {
        UpsertResult inserted = UpsertResult.inserted();
        when(writer.write(sailing, 3L)).thenReturn(inserted);

        assertSame(inserted, service.upsert(sailing, 3L));
        verify(writer, never()).upsertDimensions(sailing);
    }

    @Test
    void constraintViolationShouldReupsertDimensionsAndRetryOnce() {
        UpsertResult inserted = UpsertResult.inserted();
        when(writer.write(sailing, 3L))
                .thenThrow(new DataIntegrityViolationException("fk_cruises_ship"))
                .thenReturn(inserted);

        assertSame(inserted, service.upsert(sailing, 3L));

        InOrder order = inOrder(writer);
        order.verify(writer).write(sailing, 3L);
        order.verify(writer).upsertDimensions(sailing);
        order.verify(writer).write(sailing, 3L);
    }

    @Test
    void secondConstraintViolationShouldFailTheSailing() {
        when(writer.write(sailing, 3L)).thenThrow(new DataIntegrityViolationException("fk_cruises_ship"));

        assertThrows(SailingConstraintException.class, () -> service.upsert(sailing, 3L));
        verify(writer, times(2)).write(sailing, 3L);
    }
}
