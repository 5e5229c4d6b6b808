package com.meetsched.meetsched_api.service;

import java.util.HashSet;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.meetsched.meetsched_api.exception.InvalidConstraintsException;
import com.meetsched.meetsched_api.model.Host;
import com.meetsched.meetsched_api.model.HostAvailability;
import com.meetsched.meetsched_api.model.MeetingRequest;
import com.meetsched.meetsched_api.model.SchedulerConstraints;
import com.meetsched.meetsched_api.model.SchedulerRequest;
import com.meetsched.meetsched_api.model.TimeSlot;

@Component
public class ConstraintsValidator {

    static final int MIN_DURATION_MINUTES = 15;
    static final int MAX_DURATION_MINUTES = 180;
    static final int MIN_MEETINGS_PER_DAY = 1;
    static final int MAX_MEETINGS_PER_DAY = 12;
    static final int MAX_BUFFER_MINUTES = 60;

    public void validate(SchedulerRequest request) {
        if (request == null) {
            throw new InvalidConstraintsException("Scheduling request is required.");
        }
        if (request.getRequests() == null) {
            throw new InvalidConstraintsException("requests list is required.");
        }
        if (request.getHosts() == null) {
            throw new InvalidConstraintsException("hosts list is required.");
        }
        validateConstraints(request.getConstraints());

        Set<String> seenIds = new HashSet<>();
        for (MeetingRequest meetingRequest : request.getRequests()) {
            if (meetingRequest == null || meetingRequest.getId() == null || meetingRequest.getId().isBlank()) {
                throw new InvalidConstraintsException("Every meeting request needs an id.");
            }
            if (!seenIds.add(meetingRequest.getId())) {
                throw new InvalidConstraintsException("Duplicate meeting request id: " + meetingRequest.getId());
            }
            Integer importance = meetingRequest.getImportanceScore();
            if (importance != null && (importance < 0 || importance > 100)) {
                throw new InvalidConstraintsException("importanceScore of request " + meetingRequest.getId()
                        + " must be between 0 and 100.");
            }
        }
        Set<String> seenHostIds = new HashSet<>();
        for (Host host : request.getHosts()) {
            if (host == null || host.getId() == null || host.getId().isBlank()) {
                throw new InvalidConstraintsException("Every host needs an id.");
            }
            if (!seenHostIds.add(host.getId())) {
                throw new InvalidConstraintsException("Duplicate host id: " + host.getId());
            }
            validateAvailability(host);
        }
    }

    void validateAvailability(Host host) {
        if (host.getAvailability() == null) return;
        for (HostAvailability day : host.getAvailability()) {
            if (day == null || day.getDate() == null) {
                throw new InvalidConstraintsException("Availability of host " + host.getId() + " needs a date.");
            }
            if (day.getTimeSlots() == null) continue;
            for (TimeSlot slot : day.getTimeSlots()) {
                if (slot == null || slot.getStartTime() == null || slot.getEndTime() == null) {
                    throw new InvalidConstraintsException("Time slot of host " + host.getId() + " on "
                            + day.getDate() + " needs startTime and endTime.");
                }
                if (!slot.getEndTime().isAfter(slot.getStartTime())) {
                    throw new InvalidConstraintsException("Time slot " + slot + " of host " + host.getId()
                            + " must end after it starts.");
                }
                if (slot.getDate() != null && !slot.getDate().equals(day.getDate())) {
                    throw new InvalidConstraintsException("Time slot " + slot + " of host " + host.getId()
                            + " is listed under " + day.getDate() + ".");
                }
            }
        }
    }

    void validateConstraints(SchedulerConstraints constraints) {
        if (constraints == null) {
            throw new InvalidConstraintsException("constraints are required.");
        }
        if (constraints.getEventStartDate() == null || constraints.getEventEndDate() == null) {
            throw new InvalidConstraintsException("eventStartDate and eventEndDate are required.");
        }
        if (constraints.getEventEndDate().isBefore(constraints.getEventStartDate())) {
            throw new InvalidConstraintsException("eventEndDate must not be before eventStartDate.");
        }
        if (constraints.getWorkingHoursStart() == null || constraints.getWorkingHoursEnd() == null) {
            throw new InvalidConstraintsException("workingHoursStart and workingHoursEnd are required.");
        }
        if (!constraints.getWorkingHoursEnd().isAfter(constraints.getWorkingHoursStart())) {
            throw new InvalidConstraintsException("workingHoursEnd must be after workingHoursStart.");
        }
        requireRange("meetingDurationMinutes", constraints.getMeetingDurationMinutes(),
                MIN_DURATION_MINUTES, MAX_DURATION_MINUTES);
        requireRange("maxMeetingsPerDay", constraints.getMaxMeetingsPerDay(),
                MIN_MEETINGS_PER_DAY, MAX_MEETINGS_PER_DAY);
        if (constraints.getBufferMinutes() != null) {
            requireRange("bufferMinutes", constraints.getBufferMinutes(), 0, MAX_BUFFER_MINUTES);
        }
    }

    private void requireRange(String field, Integer value, int min, int max) {
        if (value == null) {
            throw new InvalidConstraintsException(field + " is required.");
        }
        if (value < min || value > max) {
            throw new InvalidConstraintsException(field + " must be between " + min + " and " + max + ".");
        }
    }
}
