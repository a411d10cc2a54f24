package com.counselbooking.scheduling.api.dto;

import com.counselbooking.scheduling.domain.model.BlockedSlot;

import java.time.Instant;

public record BlockedSlotResponse(
        Long id,
        Instant dateTime,
        Integer duration,
        String reason,
        Instant createdAt
) {
    public static BlockedSlotResponse from(BlockedSlot blockedSlot) {
        return new BlockedSlotResponse(
                blockedSlot.getId(),
                blockedSlot.getDateTime(),
                blockedSlot.getDurationMinutes(),
                blockedSlot.getReason(),
                blockedSlot.getCreatedAt()
        );
    }
}
