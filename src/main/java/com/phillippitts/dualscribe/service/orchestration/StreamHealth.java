package com.phillippitts.dualscribe.service.orchestration;

/** Recognition health of one stream during a recording. */
public enum StreamHealth {
    HEALTHY,
    RECONNECTING,
    DISABLED
}
