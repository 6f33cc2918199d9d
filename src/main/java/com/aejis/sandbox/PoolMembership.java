package com.aejis.sandbox;

public enum PoolMembership {
    WARM,
    EPHEMERAL
}
