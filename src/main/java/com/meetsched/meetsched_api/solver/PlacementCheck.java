package com.meetsched.meetsched_api.solver;

public enum PlacementCheck {
    OK("feasible"),
    OVERLAP("slot collides with another meeting already placed for this host"),
    OUTSIDE_WORKING_HOURS("slot falls outside working hours"),
    DAILY_CAP_REACHED("host has reached its daily meeting limit");

    private final String reason;

    PlacementCheck(String reason) {
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
