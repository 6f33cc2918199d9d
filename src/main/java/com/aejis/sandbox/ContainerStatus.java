package com.aejis.sandbox;

public enum ContainerStatus {
    STARTING,
    READY,
    BUSY,
    DEAD
}
