package com.archflow.core.state;

import java.util.Locale;

public enum RunStatus {
    PENDING,
    APPROVED,
    NEEDS_REVISION,
    COMPLETE,
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
