package com.example.shiftrota.team;

import com.example.shiftrota.designation.Designation;
import com.example.shiftrota.designation.DesignationRepository;
import com.example.shiftrota.employee.Employee;
import com.example.shiftrota.employee.EmployeeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
public class DemoDataInitializer {

    private static final Logger logger = LoggerFactory.getLogger(DemoDataInitializer.class);

    static final String DEMO_TEAM = "Demo Team";

    // seeds a 12-person, three-level team when the database is empty
    @Bean
    CommandLineRunner loadDemoTeam(DesignationRepository designationRepository,
                                   EmployeeRepository employeeRepository,
                                   TeamRepository teamRepository) {
        return args -> {
            if (teamRepository.count() > 0 || employeeRepository.count() > 0) {
                return;
            }
            Designation lead = designationRepository.save(new Designation("Team Lead", 1, 2));
            Designation senior = designationRepository.save(new Designation("Senior Engineer", 2, 2));
            Designation engineer = designationRepository.save(new Designation("Engineer", 3, 1));

            List<Employee> employees = new ArrayList<>();
            for (int i = 1; i <= 12; i++) {
                Designation designation = i <= 3 ? lead : i <= 6 ? senior : engineer;
                employees.add(new Employee("Employee %02d".formatted(i),
                        "employee%02d@example.com".formatted(i), designation));
            }
            employeeRepository.saveAll(employees);

            Team team = new Team(DEMO_TEAM, "3-shift", 2);
            team.getMembers().addAll(employees);
            teamRepository.save(team);
            logger.info("Seeded demo team '{}' with {} employees", DEMO_TEAM, employees.size());
        };
    }
}
