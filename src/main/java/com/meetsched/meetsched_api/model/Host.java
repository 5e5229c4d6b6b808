package com.meetsched.meetsched_api.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class Host {
    private String id;
    private String name;
    private List<HostAvailability> availability = new ArrayList<>();
    private Integer maxMeetingsPerDay;
    private List<String> expertise = new ArrayList<>();
    private List<String> preferredMeetingTypes = new ArrayList<>();
    private Boolean active;

    // Constructors
    public Host() {}

    public Host(String id, String name, List<HostAvailability> availability, Integer maxMeetingsPerDay,
                List<String> expertise, List<String> preferredMeetingTypes) {
        this.id = id;
        this.name = name;
        this.availability = availability;
        this.maxMeetingsPerDay = maxMeetingsPerDay;
        this.expertise = expertise;
        this.preferredMeetingTypes = preferredMeetingTypes;
    }

    // Getters
    public String getId() { return id; }
    public String getName() { return name; }
    public List<HostAvailability> getAvailability() { return availability; }
    public Integer getMaxMeetingsPerDay() { return maxMeetingsPerDay; }
    public List<String> getExpertise() { return expertise; }
    public List<String> getPreferredMeetingTypes() { return preferredMeetingTypes; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setName(String name) { this.name = name; }
    public void setAvailability(List<HostAvailability> availability) { this.availability = availability; }
    public void setMaxMeetingsPerDay(Integer maxMeetingsPerDay) { this.maxMeetingsPerDay = maxMeetingsPerDay; }
    public void setExpertise(List<String> expertise) { this.expertise = expertise; }
    public void setPreferredMeetingTypes(List<String> preferredMeetingTypes) { this.preferredMeetingTypes = preferredMeetingTypes; }
    public void setActive(Boolean active) { this.active = active; }

    /** Hosts are active unless explicitly switched off. */
    public boolean isActive() {
        return active == null || active;
    }

    public String getDisplayName() {
        return name != null && !name.isBlank() ? name : id;
    }

    /**
     * The host's own daily cap when set, otherwise {@code globalMax}.
     */
    public int effectiveMaxMeetingsPerDay(int globalMax) {
        return (maxMeetingsPerDay != null && maxMeetingsPerDay > 0) ? maxMeetingsPerDay : globalMax;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Host host = (Host) o;
        if (id == null || host.id == null) {
            return false;
        }
        return Objects.equals(id, host.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
