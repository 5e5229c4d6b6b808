package com.meetsched.meetsched_api.model;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UnscheduledRequest {
    private String requestId;
    private String reason;
    // Best effort, not checked against the request's own constraints.
    private List<TimeSlot> alternativeSuggestions = new ArrayList<>();
}
