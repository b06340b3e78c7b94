package com.bmsedge.production.model;

/**
 * Where a work-center to machine assignment came from.
 */
public enum ResolutionSource {
    MAPPING_TABLE,
    NAME_MATCH,
    OPERATOR,
    UNRESOLVED
}
