package com.meetsched.meetsched_api.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonFormat;

/**
 * A concrete interval offered by a host. Times are wall-clock with minute granularity.
 */
public class TimeSlot {
    private LocalDate date;

    @JsonFormat(pattern = "HH:mm")
    private LocalTime startTime;

    @JsonFormat(pattern = "HH:mm")
    private LocalTime endTime;

    private String hostId;

    // Constructors
    public TimeSlot() {}

    public TimeSlot(LocalDate date, LocalTime startTime, LocalTime endTime) {
        this(date, startTime, endTime, null);
    }

    public TimeSlot(LocalDate date, LocalTime startTime, LocalTime endTime, String hostId) {
        this.date = date;
        this.startTime = startTime;
        this.endTime = endTime;
        this.hostId = hostId;
    }

    // Getters
    public LocalDate getDate() { return date; }
    public LocalTime getStartTime() { return startTime; }
    public LocalTime getEndTime() { return endTime; }
    public String getHostId() { return hostId; }

    // Setters
    public void setDate(LocalDate date) { this.date = date; }
    public void setStartTime(LocalTime startTime) { this.startTime = startTime; }
    public void setEndTime(LocalTime endTime) { this.endTime = endTime; }
    public void setHostId(String hostId) { this.hostId = hostId; }

    public int startMinutes() {
        return startTime.getHour() * 60 + startTime.getMinute();
    }

    public int endMinutes() {
        return endTime.getHour() * 60 + endTime.getMinute();
    }

    /**
     * Copy of this slot owned by {@code ownerId}. A slot without a date takes {@code fallbackDate}.
     */
    public TimeSlot ownedBy(String ownerId, LocalDate fallbackDate) {
        return new TimeSlot(date != null ? date : fallbackDate, startTime, endTime, ownerId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeSlot other = (TimeSlot) o;
        return Objects.equals(date, other.date)
                && Objects.equals(startTime, other.startTime)
                && Objects.equals(endTime, other.endTime)
                && Objects.equals(hostId, other.hostId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, startTime, endTime, hostId);
    }

    @Override
    public String toString() {
        return date + " " + startTime + "-" + endTime + (hostId != null ? " @" + hostId : "");
    }
}
