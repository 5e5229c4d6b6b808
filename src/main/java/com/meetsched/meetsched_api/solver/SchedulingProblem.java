package com.meetsched.meetsched_api.solver;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import com.meetsched.meetsched_api.model.Host;
import com.meetsched.meetsched_api.model.MeetingRequest;
import com.meetsched.meetsched_api.model.SchedulerConstraints;
import com.meetsched.meetsched_api.model.SchedulerRequest;

/**
 * Read-only snapshot handed to a {@link SchedulingStrategy}. Only active hosts are kept.
 */
public final class SchedulingProblem {

    private final List<MeetingRequest> requests;
    private final List<Host> hosts;
    private final SchedulerConstraints constraints;
    private final Instant deadline;

    public SchedulingProblem(List<MeetingRequest> requests, List<Host> hosts,
                             SchedulerConstraints constraints, Instant deadline) {
        this.requests = List.copyOf(requests);
        this.hosts = Collections.unmodifiableList(hosts.stream()
                .filter(Host::isActive)
                .collect(Collectors.toList()));
        this.constraints = constraints;
        this.deadline = deadline;
    }

    public static SchedulingProblem of(SchedulerRequest request, Instant deadline) {
        return new SchedulingProblem(request.getRequests(), request.getHosts(), request.getConstraints(), deadline);
    }

    public List<MeetingRequest> getRequests() { return requests; }
    public List<Host> getHosts() { return hosts; }
    public SchedulerConstraints getConstraints() { return constraints; }
    public Instant getDeadline() { return deadline; }

    public boolean isPastDeadline(Clock clock) {
        return deadline != null && !clock.instant().isBefore(deadline);
    }
}
