package com.example.cruisesync.domain.enumtype;

/**
 * The four canonical cabin classes every sailing is priced on.
 */
public enum CabinClass {
    INTERIOR,
    OCEANVIEW,
    BALCONY,
    SUITE
}
