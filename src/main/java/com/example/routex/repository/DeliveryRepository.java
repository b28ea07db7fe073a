package com.example.routex.repository;

import com.example.routex.model.Delivery;
import com.example.routex.model.DeliveryStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface DeliveryRepository extends JpaRepository<Delivery, Long> {

    boolean existsByScheduleIdAndRecipientIdAndSentAtGreaterThanEqual(Long scheduleId, Long recipientId, LocalDateTime cutoff);

    long countByScheduleIdAndStatus(Long scheduleId, DeliveryStatus status);

    List<Delivery> findByScheduleIdOrderByIdAsc(Long scheduleId);

    // Includes ids of schedules that were deleted since; their deliveries remain as history
    @Query("SELECT DISTINCT d.scheduleId FROM Delivery d WHERE d.scheduleId IS NOT NULL ORDER BY d.scheduleId DESC")
    List<Long> findRecentScheduleIds(Pageable pageable);
}
