package com.meetsched.meetsched_api.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MeetingAssignment {
    private String requestId;
    private String hostId;
    private TimeSlot timeSlot;
    private double score;
    private String explanation;
}
