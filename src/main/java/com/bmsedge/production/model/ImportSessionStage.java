package com.bmsedge.production.model;

public enum ImportSessionStage {
    MAPPING_REVIEW,
    FABRIC_REVIEW,
    STAGED,
    APPLIED,
    DISCARDED
}
