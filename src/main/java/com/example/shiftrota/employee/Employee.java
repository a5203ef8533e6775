package com.example.shiftrota.employee;

import com.example.shiftrota.designation.Designation;
import jakarta.persistence.*;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;

@Entity
@Table(name = "employees")
public class Employee {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    @NotBlank(message = "Employee name is required")
    @Size(max = 150, message = "Employee name must be at most 150 characters")
    private String name;

    @Column(nullable = false, unique = true)
    @Email(message = "Please enter a valid email address")
    private String email;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "designation_id")
    private Designation designation;

    @Column(length = 10)
    private String gender;

    // carried for the roster screens, not used by rotation
    @Column(name = "shift_preference", length = 50)
    private String shiftPreference;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    protected Employee() {
    }

    public Employee(String name, String email, Designation designation) {
        this.name = name;
        this.email = email;
        this.designation = designation;
        this.createdAt = LocalDateTime.now();
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
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

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public Designation getDesignation() {
        return designation;
    }

    public void setDesignation(Designation designation) {
        this.designation = designation;
    }

    public String getGender() { return gender; }
    public void setGender(String gender) { this.gender = gender; }
    public String getShiftPreference() { return shiftPreference; }
    public void setShiftPreference(String shiftPreference) { this.shiftPreference = shiftPreference; }
    public LocalDateTime getCreatedAt() { return createdAt; }
}
