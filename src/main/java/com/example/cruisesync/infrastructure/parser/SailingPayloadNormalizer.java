package com.example.cruisesync.infrastructure.parser;

import com.example.cruisesync.domain.model.NormalizedSailing;
import com.example.cruisesync.domain.model.SailingReference;

/**
 * Pure transform from raw vendor bytes to a canonical sailing.
 *
 * @throws CorruptPayloadException    when the bytes cannot be decoded, even after recovery
 * @throws MissingIdentifierException when either sailing or cruise id is missing
 */
public interface SailingPayloadNormalizer {

    NormalizedSailing normalize(byte[] raw);

    /**
     * Line and ship ids missing from the payload are taken from the file's location.
     */
    NormalizedSailing normalize(byte[] raw, SailingReference reference);
}
