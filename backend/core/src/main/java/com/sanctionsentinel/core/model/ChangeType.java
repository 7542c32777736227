package com.sanctionsentinel.core.model;

public enum ChangeType {
    ADDED,
    MODIFIED,
    REMOVED
}
