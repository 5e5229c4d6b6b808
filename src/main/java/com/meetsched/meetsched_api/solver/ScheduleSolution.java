package com.meetsched.meetsched_api.solver;

import java.util.List;

import com.meetsched.meetsched_api.model.MeetingAssignment;
import com.meetsched.meetsched_api.model.SchedulerAlgorithm;
import com.meetsched.meetsched_api.model.UnscheduledRequest;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Raw output of one solver before metrics are attached.
 */
@Data
@AllArgsConstructor
public class ScheduleSolution {
    private SchedulerAlgorithm algorithm;
    private List<MeetingAssignment> assignments;
    private List<UnscheduledRequest> unscheduled;
    private String summary;
}
