package com.questrail.edgecontrol.process;

import com.questrail.edgecontrol.observability.ProcessEventType;

import java.time.Instant;

public record DiagnosticRecord(Instant at, ProcessEventType type, String detail) {
}
