package com.sanctionsentinel.core.model;

public enum EntityType {
    PERSON,
    COMPANY,
    VESSEL,
    AIRCRAFT,
    OTHER
}
