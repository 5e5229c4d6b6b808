package com.meetsched.meetsched_api.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public class MeetingRequest {

    public static final int DEFAULT_IMPORTANCE_SCORE = 50;

    private String id;
    private String companyName;
    private Integer importanceScore; // 0-100, set upstream by qualification
    private List<String> requestedTopics = new ArrayList<>();
    private List<LocalDate> preferredDates = new ArrayList<>();
    private String meetingType;

    // Constructors
    public MeetingRequest() {}

    public MeetingRequest(String id, Integer importanceScore, List<String> requestedTopics,
                          List<LocalDate> preferredDates, String meetingType) {
        this.id = id;
        this.importanceScore = importanceScore;
        this.requestedTopics = requestedTopics;
        this.preferredDates = preferredDates;
        this.meetingType = meetingType;
    }

    // Getters
    public String getId() { return id; }
    public String getCompanyName() { return companyName; }
    public Integer getImportanceScore() { return importanceScore; }
    public List<String> getRequestedTopics() { return requestedTopics; }
    public List<LocalDate> getPreferredDates() { return preferredDates; }
    public String getMeetingType() { return meetingType; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setCompanyName(String companyName) { this.companyName = companyName; }
    public void setImportanceScore(Integer importanceScore) { this.importanceScore = importanceScore; }
    public void setRequestedTopics(List<String> requestedTopics) { this.requestedTopics = requestedTopics; }
    public void setPreferredDates(List<LocalDate> preferredDates) { this.preferredDates = preferredDates; }
    public void setMeetingType(String meetingType) { this.meetingType = meetingType; }

    public int effectiveImportance() {
        return importanceScore != null ? importanceScore : DEFAULT_IMPORTANCE_SCORE;
    }

    public boolean prefersDate(LocalDate date) {
        return preferredDates != null && date != null && preferredDates.contains(date);
    }

    @Override
    public String toString() {
        return "MeetingRequest{" +
               "id='" + id + '\'' +
               ", importanceScore=" + importanceScore +
               ", meetingType='" + meetingType + '\'' +
               '}';
    }
}
