package com.infinitspace.nexudus.model;

public enum SyncLayer {
    BRONZE, SILVER;

    public String dbValue() {
        return name().toLowerCase();
    }
}
