package com.example.shiftrota.schedule;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Repository
public interface SavedScheduleRepository extends JpaRepository<SavedSchedule, Long> {

    Optional<SavedSchedule> findByTeamId(Long teamId);

    boolean existsByTeamId(Long teamId);

    @Modifying
    @Transactional
    long deleteByTeamId(Long teamId);
}
