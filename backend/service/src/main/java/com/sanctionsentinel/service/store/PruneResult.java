package com.sanctionsentinel.service.store;

public record PruneResult(int runsRemoved, int snapshotsRemoved) {
}
