package com.counselbooking.scheduling.domain.model;

/**
 * Who performed a change, as written into the appointment history.
 */
public record Actor(String id, String name) {

    public static final String CLIENT_NAME = "Client";

    public static Actor client(Long userId) {
        return new Actor(String.valueOf(userId), CLIENT_NAME);
    }
}
