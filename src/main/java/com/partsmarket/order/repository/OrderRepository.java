package com.partsmarket.order.repository;

import com.partsmarket.order.entity.Order;
import com.partsmarket.order.entity.OrderStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface OrderRepository extends JpaRepository<Order, Long> {

    @Query("SELECT DISTINCT o FROM Order o " +
            "LEFT JOIN FETCH o.items i " +
            "LEFT JOIN FETCH i.part " +
            "WHERE o.id = :id")
    Optional<Order> findWithItemsById(@Param("id") Long id);

    /**
     * SELECT ... FOR UPDATE on the order row. Every workflow that changes an
     * order's status reads it through here, so competing transitions serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.id = :id")
    Optional<Order> findByIdWithLock(@Param("id") Long id);

    Page<Order> findByUserIdOrderByCreatedAtDescIdDesc(Long userId, Pageable pageable);

    /**
     * Current status of an order, read from the ledger without loading the aggregate.
     * Cached payment snapshots are completed with this value.
     */
    @Query("SELECT o.status FROM Order o WHERE o.id = :id")
    Optional<OrderStatus> findStatusById(@Param("id") Long id);

    /**
     * Like {@link #findStatusById(Long)}, but empty unless the order belongs to the user.
     */
    @Query("SELECT o.status FROM Order o WHERE o.id = :id AND o.userId = :userId")
    Optional<OrderStatus> findStatusByIdAndUserId(@Param("id") Long id, @Param("userId") Long userId);
}
