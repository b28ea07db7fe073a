package com.example.routex.repository;

import com.example.routex.model.BroadcastSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BroadcastScheduleRepository extends JpaRepository<BroadcastSchedule, Long> {

    // Newest first; id breaks ties between schedules created in the same instant
    List<BroadcastSchedule> findAllByOrderByCreatedAtDescIdDesc();

    List<BroadcastSchedule> findAllByEnabledTrueOrderByIdAsc();
}
