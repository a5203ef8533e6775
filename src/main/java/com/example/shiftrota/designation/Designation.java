package com.example.shiftrota.designation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Entity
@Table(name = "designations")
public class Designation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    @NotBlank(message = "Designation title is required")
    @Size(max = 100, message = "Designation title must be at most 100 characters")
    private String title;

    // lower value = more senior
    @Column(name = "hierarchy_level", nullable = false, unique = true)
    @Min(value = 1, message = "Hierarchy level must be 1 or greater")
    private Integer hierarchyLevel;

    @Column(name = "monthly_leave_allowance")
    private Integer monthlyLeaveAllowance = 0;

    protected Designation() {
    }

    public Designation(String title, Integer hierarchyLevel, Integer monthlyLeaveAllowance) {
        this.title = title;
        this.hierarchyLevel = hierarchyLevel;
        this.monthlyLeaveAllowance = monthlyLeaveAllowance;
    }

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public Integer getHierarchyLevel() {
        return hierarchyLevel;
    }

    public void setHierarchyLevel(Integer hierarchyLevel) {
        this.hierarchyLevel = hierarchyLevel;
    }

    public Integer getMonthlyLeaveAllowance() { return monthlyLeaveAllowance; }
    public void setMonthlyLeaveAllowance(Integer monthlyLeaveAllowance) { this.monthlyLeaveAllowance = monthlyLeaveAllowance; }
}
