package com.seiscatalog;

/**
 * Last stage a {@link SeisCatalog} completed.
 */
public enum CatalogStage {
    UNINITIALIZED,
    MATCHED,
    FILTERED,
    GROUPED,
    ORGANIZED
}
