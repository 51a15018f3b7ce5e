package com.partsmarket.part.repository;

import com.partsmarket.part.entity.Part;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Stock writes for the catalog.
 *
 * <h3>Atomic updates</h3>
 * Both methods are single JPQL UPDATE statements, so the check and the write happen in one
 * row update under the database's row lock. They bump {@code version} by hand because bulk
 * updates bypass Hibernate's optimistic locking.
 *
 * <h3>Persistence context</h3>
 * Bulk updates do not refresh {@link Part} instances already loaded in the current
 * transaction. Callers that need the new count re-read the row.
 */
public interface PartRepository extends JpaRepository<Part, Long> {

    /**
     * Conditional decrement: the row is only touched when enough stock is left,
     * so two concurrent reservations can never take the count below zero.
     * Non-positive quantities match no row.
     *
     * @return 1 when reserved, 0 when the stock was insufficient at write time
     */
    @Modifying
    @Query("UPDATE Part p SET p.stock = p.stock - :quantity, p.version = p.version + 1 " +
            "WHERE p.id = :id AND :quantity > 0 AND p.stock >= :quantity")
    int decreaseStock(@Param("id") Long id, @Param("quantity") int quantity);

    /**
     * Returns reserved units to a part. Non-positive quantities match no row.
     *
     * @return 1 when restored, 0 when the part no longer exists
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Part p SET p.stock = p.stock + :quantity, p.version = p.version + 1 " +
            "WHERE p.id = :id AND :quantity > 0")
    int increaseStock(@Param("id") Long id, @Param("quantity") int quantity);
}
