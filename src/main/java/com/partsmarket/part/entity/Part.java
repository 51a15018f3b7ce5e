package com.partsmarket.part.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Check;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A sellable auto part listed by a vendor.
 *
 * <p>{@code stock} is only changed through the conditional updates in
 * {@link com.partsmarket.part.repository.PartRepository}; the check constraint
 * is the last line against a negative count.</p>
 */
@Entity
@Table(name = "parts", indexes = {
        @Index(name = "idx_part_vendor", columnList = "vendor_id")
})
@Check(constraints = "stock >= 0")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Part {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "part_seq")
    @SequenceGenerator(name = "part_seq", sequenceName = "part_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    // Units available to reserve.
    @Column(nullable = false)
    private int stock;

    @Column(name = "vendor_id", nullable = false)
    private Long vendorId;

    @Version
    private Long version;

    @CreatedDate
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    @Builder
    public Part(String title, BigDecimal price, int stock, Long vendorId) {
        if (stock < 0) {
            throw new IllegalArgumentException("stock must not be negative: " + stock);
        }
        this.title = title;
        this.price = price;
        this.stock = stock;
        this.vendorId = vendorId;
    }

    /** Pre-check only; the conditional update decides under concurrency. */
    public boolean hasStock(int quantity) {
        return stock >= quantity;
    }
}
