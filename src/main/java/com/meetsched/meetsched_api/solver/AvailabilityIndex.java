package com.meetsched.meetsched_api.solver;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.meetsched.meetsched_api.model.Host;
import com.meetsched.meetsched_api.model.HostAvailability;
import com.meetsched.meetsched_api.model.SchedulerConstraints;
import com.meetsched.meetsched_api.model.TimeSlot;

/**
 * Usable slots per host for one run, addressed by a dense host handle (the host's position
 * in the input list). Blocked days and days outside the event window contribute nothing,
 * and neither does a slot dated differently from the day it is listed under.
 * Slot order is availability order, then slot order within a day.
 */
public final class AvailabilityIndex {

    private final List<Host> hosts;
    private final List<List<TimeSlot>> slotsByHandle;
    private final Map<String, Integer> handlesById;

    private AvailabilityIndex(List<Host> hosts, List<List<TimeSlot>> slotsByHandle, Map<String, Integer> handlesById) {
        this.hosts = hosts;
        this.slotsByHandle = slotsByHandle;
        this.handlesById = handlesById;
    }

    public static AvailabilityIndex build(List<Host> hosts, SchedulerConstraints constraints) {
        List<List<TimeSlot>> slotsByHandle = new ArrayList<>(hosts.size());
        Map<String, Integer> handlesById = new HashMap<>();
        for (int handle = 0; handle < hosts.size(); handle++) {
            Host host = hosts.get(handle);
            handlesById.putIfAbsent(host.getId(), handle);
            List<TimeSlot> slots = new ArrayList<>();
            if (host.getAvailability() != null) {
                for (HostAvailability day : host.getAvailability()) {
                    if (day.isBlocked() || day.getTimeSlots() == null) continue;
                    for (TimeSlot slot : day.getTimeSlots()) {
                        // a slot only counts for the day it is listed under
                        if (slot.getDate() != null && !slot.getDate().equals(day.getDate())) continue;
                        TimeSlot owned = slot.ownedBy(host.getId(), day.getDate());
                        if (constraints.coversDate(owned.getDate())) {
                            slots.add(owned);
                        }
                    }
                }
            }
            slotsByHandle.add(List.copyOf(slots));
        }
        return new AvailabilityIndex(List.copyOf(hosts), slotsByHandle, handlesById);
    }

    public int hostCount() {
        return hosts.size();
    }

    public Host host(int handle) {
        return hosts.get(handle);
    }

    public List<TimeSlot> slots(int handle) {
        return slotsByHandle.get(handle);
    }

    public Integer handleOf(String hostId) {
        return handlesById.get(hostId);
    }

    public int totalSlots() {
        return slotsByHandle.stream().mapToInt(List::size).sum();
    }

    /** Handles of hosts offering at least one slot, in host order. */
    public int[] handlesWithSlots() {
        List<Integer> handles = new ArrayList<>();
        for (int handle = 0; handle < slotsByHandle.size(); handle++) {
            if (!slotsByHandle.get(handle).isEmpty()) {
                handles.add(handle);
            }
        }
        return handles.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * The first {@code limit} indexed slots across all hosts. Nothing is checked against
     * what has already been committed.
     */
    public List<TimeSlot> suggestions(int limit) {
        List<TimeSlot> suggestions = new ArrayList<>();
        for (List<TimeSlot> slots : slotsByHandle) {
            for (TimeSlot slot : slots) {
                if (suggestions.size() >= limit) return suggestions;
                suggestions.add(slot);
            }
        }
        return suggestions;
    }
}
