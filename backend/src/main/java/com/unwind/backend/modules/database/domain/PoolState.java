package com.unwind.backend.modules.database.domain;

public enum PoolState {
    UNINITIALIZED,
    CONNECTED
}
