package com.xgraph.server.data;

public enum ItemType {
    NODE,
    DATA_VAR,
    COORD
}
