package com.roundabout.core.governor;

import java.time.Instant;

public record ErrorRecord(String agentId, Instant timestamp, String error) {
}
