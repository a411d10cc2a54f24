package com.counselbooking.scheduling.api.dto;

import jakarta.validation.constraints.Size;

public record UpdateNotesRequest(
        @Size(max = 500, message = "Notes must be at most 500 characters")
        String notes
) {
}
