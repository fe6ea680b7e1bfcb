package com.example.rental.model;

import java.util.EnumSet;
import java.util.Set;

public enum SyncTaskStatus {
    PENDING, RETRY, COMPLETED, FAILED;

    public static final Set<SyncTaskStatus> OPEN = EnumSet.of(PENDING, RETRY);
}
