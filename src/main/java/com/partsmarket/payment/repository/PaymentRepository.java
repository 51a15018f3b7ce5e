package com.partsmarket.payment.repository;

import com.partsmarket.payment.entity.Payment;
import com.partsmarket.payment.entity.PaymentStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface PaymentRepository extends JpaRepository<Payment, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Payment p WHERE p.id = :id")
    Optional<Payment> findByIdWithLock(@Param("id") Long id);

    List<Payment> findByOrderIdOrderByCreatedAtAsc(Long orderId);

    long countByOrderIdAndStatus(Long orderId, PaymentStatus status);
}
