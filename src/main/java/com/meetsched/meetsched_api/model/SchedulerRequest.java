package com.meetsched.meetsched_api.model;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One scheduling run: the requests to place, the hosts that may take them and the event limits.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerRequest {
    private List<MeetingRequest> requests = new ArrayList<>();
    private List<Host> hosts = new ArrayList<>();
    private SchedulerConstraints constraints;
    private SchedulerAlgorithm algorithm;

    public SchedulerAlgorithm effectiveAlgorithm() {
        return algorithm != null ? algorithm : SchedulerAlgorithm.HYBRID;
    }
}
