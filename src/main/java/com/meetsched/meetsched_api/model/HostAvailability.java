package com.meetsched.meetsched_api.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public class HostAvailability {
    private LocalDate date;
    private List<TimeSlot> timeSlots = new ArrayList<>();
    private boolean blocked;
    private String blockReason;

    // Constructors
    public HostAvailability() {}

    public HostAvailability(LocalDate date, List<TimeSlot> timeSlots, boolean blocked) {
        this.date = date;
        this.timeSlots = timeSlots;
        this.blocked = blocked;
    }

    // Getters
    public LocalDate getDate() { return date; }
    public List<TimeSlot> getTimeSlots() { return timeSlots; }
    public boolean isBlocked() { return blocked; }
    public String getBlockReason() { return blockReason; }

    // Setters
    public void setDate(LocalDate date) { this.date = date; }
    public void setTimeSlots(List<TimeSlot> timeSlots) { this.timeSlots = timeSlots; }
    public void setBlocked(boolean blocked) { this.blocked = blocked; }
    public void setBlockReason(String blockReason) { this.blockReason = blockReason; }
}
