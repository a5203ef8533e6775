package com.example.shiftrota.team;

import com.example.shiftrota.employee.Employee;
import jakarta.persistence.*;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "teams")
public class Team {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    @NotBlank(message = "Team name is required")
    private String name;

    // "3-shift", "4-shift" or "5-shift"
    @Column(name = "shift_template", length = 50)
    private String shiftTemplate;

    @Column(name = "people_per_shift")
    @Min(value = 1, message = "People per shift must be 1 or greater")
    private Integer peoplePerShift;

    @ManyToMany(fetch = FetchType.EAGER)
    @JoinTable(name = "team_members",
            joinColumns = @JoinColumn(name = "team_id"),
            inverseJoinColumns = @JoinColumn(name = "employee_id"))
    @OrderBy("id ASC")
    private Set<Employee> members = new LinkedHashSet<>();

    protected Team() {
    }

    public Team(String name, String shiftTemplate, Integer peoplePerShift) {
        this.name = name;
        this.shiftTemplate = shiftTemplate;
        this.peoplePerShift = peoplePerShift;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getShiftTemplate() {
        return shiftTemplate;
    }

    public void setShiftTemplate(String shiftTemplate) {
        this.shiftTemplate = shiftTemplate;
    }

    public Integer getPeoplePerShift() {
        return peoplePerShift;
    }

    public void setPeoplePerShift(Integer peoplePerShift) {
        this.peoplePerShift = peoplePerShift;
    }

    public Set<Employee> getMembers() { return members; }
    public void setMembers(Set<Employee> members) { this.members = members; }
}
