package com.xgraph.server.measure;

public enum MeasureType {
    MEAN,
    MEDIAN,
    MIN,
    MAX,
    STD,
    VARIANCE
}
