package com.freightbid.shared.enums;

public enum CargoType {
    GENERAL,
    PALLETIZED,
    REFRIGERATED,
    BULK,
    HAZMAT,
    OVERSIZED
}
