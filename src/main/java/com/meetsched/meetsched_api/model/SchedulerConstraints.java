package com.meetsched.meetsched_api.model;

import java.time.LocalDate;
import java.time.LocalTime;

import com.fasterxml.jackson.annotation.JsonFormat;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Event-wide limits for a scheduling run. A host's own daily cap takes precedence over
 * {@link #maxMeetingsPerDay}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerConstraints {

    public static final int DEFAULT_BUFFER_MINUTES = 15;

    private LocalDate eventStartDate;
    private LocalDate eventEndDate;

    @JsonFormat(pattern = "HH:mm")
    private LocalTime workingHoursStart;

    @JsonFormat(pattern = "HH:mm")
    private LocalTime workingHoursEnd;

    private Integer meetingDurationMinutes;
    private Integer maxMeetingsPerDay;
    private Integer bufferMinutes;

    public int effectiveBufferMinutes() {
        return bufferMinutes != null ? bufferMinutes : DEFAULT_BUFFER_MINUTES;
    }

    public boolean coversDate(LocalDate date) {
        return date != null && !date.isBefore(eventStartDate) && !date.isAfter(eventEndDate);
    }
}
