package com.counselbooking.scheduling.domain.model;

import java.time.Instant;

public record SuggestedSlot(Instant dateTime, String displayTime) {
}
