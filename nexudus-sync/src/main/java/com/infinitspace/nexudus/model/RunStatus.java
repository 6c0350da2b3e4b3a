package com.infinitspace.nexudus.model;

public enum RunStatus {
    RUNNING, SUCCESS, FAILED;

    public String dbValue() {
        return name().toLowerCase();
    }
}
