package com.example.shiftrota.schedule;

import jakarta.persistence.*;

import java.time.LocalDateTime;

/**
 * The one schedule document a team has, stored as JSON text.
 */
@Entity
@Table(name = "saved_schedules")
public class SavedSchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "team_id", nullable = false, unique = true)
    private Long teamId;

    @Lob
    @Column(name = "schedule_data", nullable = false)
    private String scheduleData;

    @Column(name = "generated_on", nullable = false)
    private LocalDateTime generatedOn;

    @Column(name = "updated_on")
    private LocalDateTime updatedOn;

    protected SavedSchedule() {
    }

    public SavedSchedule(Long teamId, String scheduleData) {
        this.teamId = teamId;
        this.scheduleData = scheduleData;
    }

    @PrePersist
    protected void onCreate() {
        generatedOn = LocalDateTime.now();
        updatedOn = generatedOn;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedOn = LocalDateTime.now();
    }

    public Long getId() { return id; }
    public Long getTeamId() { return teamId; }

    public String getScheduleData() {
        return scheduleData;
    }

    public void setScheduleData(String scheduleData) {
        this.scheduleData = scheduleData;
    }

    public LocalDateTime getGeneratedOn() { return generatedOn; }
    public LocalDateTime getUpdatedOn() { return updatedOn; }
}
