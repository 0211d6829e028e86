package com.questrail.edgecontrol.observability;

public enum ProcessEventType {
    PROCESS_STARTED,
    PROCESS_STOPPED,
    EVALUATION_ERROR,
    EVALUATION_TIMEOUT,
    FAILSAFE_ACTIVATED,
    DATA_QUALITY_FALLBACK
}
