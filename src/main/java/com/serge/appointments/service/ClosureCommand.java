package com.serge.appointments.service;

import com.serge.appointments.domain.ClosureType;

import java.time.LocalDate;
import java.time.LocalTime;

public record ClosureCommand(LocalDate startDate,
                             LocalDate endDate,
                             LocalTime fromTime,
                             LocalTime untilTime,
                             ClosureType type,
                             String reason) {
}
