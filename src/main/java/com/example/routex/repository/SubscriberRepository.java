package com.example.routex.repository;

import com.example.routex.model.Subscriber;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface SubscriberRepository extends JpaRepository<Subscriber, Long> {

    Optional<Subscriber> findByTelegramId(Long telegramId);

    List<Subscriber> findBySubscribedTrueOrderByIdAsc();

    List<Subscriber> findBySubscribedTrueAndMessageKeyIsNullOrderByIdAsc();

    List<Subscriber> findBySubscribedTrueAndDonorTrueOrderByIdAsc();

    @Query("SELECT s FROM Subscriber s WHERE s.subscribed = true " +
           "AND (s.lastActivityAt IS NULL OR s.lastActivityAt < :cutoff) ORDER BY s.id ASC")
    List<Subscriber> findSubscribedInactiveSince(@Param("cutoff") LocalDateTime cutoff);

    long countBySubscribedTrue();

    long countBySubscribedFalse();

    long countByDonorTrue();
}
