package com.vtb.leastprivilege.models;

/**
 * Исход сбора активности по одному приложению
 */
public enum CollectionStatus {
    SUCCESS,
    EMPTY,
    FAILED,
    NOT_COLLECTED
}
