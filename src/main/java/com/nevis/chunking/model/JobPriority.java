package com.nevis.chunking.model;

/**
 * Declared from most to least urgent; the coordinator orders its queue by ordinal.
 */
public enum JobPriority {
    URGENT,
    HIGH,
    NORMAL,
    LOW
}
