package com.serge.appointments.domain;

public enum ClosureType {
    VACATION,
    MAINTENANCE,
    EMERGENCY,
    HOLIDAY,
    STAFF_SHORTAGE,
    OTHER
}
