package com.sanctionsentinel.service.runtime;

class RunAbortedException extends RuntimeException {
    RunAbortedException(String reason) {
        super("run aborted: " + reason);
    }
}
