package com.serge.appointments.service;

import com.serge.appointments.schedule.Interval;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Occupied intervals of one business day, per resource. A null staff id is the unassigned
 * resource.
 */
public record OccupancySnapshot(Map<UUID, List<Interval>> byStaff, List<Interval> unassigned) {

    public List<Interval> intervalsFor(UUID staffId) {
        if (staffId == null) return unassigned;
        return byStaff.getOrDefault(staffId, List.of());
    }
}
