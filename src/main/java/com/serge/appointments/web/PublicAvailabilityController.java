package com.serge.appointments.web;

import com.serge.appointments.service.AvailabilityService;
import com.serge.appointments.service.SlotView;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/public/businesses")
@RequiredArgsConstructor
public class PublicAvailabilityController {
    private static final Logger log = LoggerFactory.getLogger(PublicAvailabilityController.class);
    private final AvailabilityService availabilityService;

    @GetMapping("/{businessId}/available-slots")
    public List<SlotItem> availableSlots(
            @PathVariable UUID businessId,
            @RequestParam UUID serviceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) UUID staffId
    ) {
        log.info("public.slots businessId={} serviceId={} date={} staffId={}", businessId, serviceId, date, staffId);
        return availabilityService.getAvailableSlots(businessId, serviceId, date, staffId)
                .stream().map(SlotItem::from).collect(Collectors.toList());
    }

    @Data
    public static class SlotItem {
        private OffsetDateTime start;
        private OffsetDateTime end;
        private boolean available;
        private UUID staffId;

        public static SlotItem from(SlotView v) {
            SlotItem i = new SlotItem();
            i.start = v.start();
            i.end = v.end();
            i.available = v.available();
            i.staffId = v.staffId();
            return i;
        }
    }
}
