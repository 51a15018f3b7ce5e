package com.partsmarket.part.service;

import com.partsmarket.common.exception.BusinessException;
import com.partsmarket.common.exception.ErrorCode;
import com.partsmarket.part.entity.Part;
import com.partsmarket.part.repository.PartRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reserves and releases part stock.
 *
 * <h3>Transactions</h3>
 * Both operations join the caller's transaction: a reservation is only kept if the
 * order that needs it is committed too.
 *
 * <h3>Lock order</h3>
 * Parts are always written in ascending id order so that two orders touching the same
 * parts lock rows in the same sequence.
 *
 * <h3>Check then write</h3>
 * The read-side stock check gives a precise error message. The conditional update in
 * {@link PartRepository#decreaseStock} is what actually guards the count; when it
 * matches no row the reservation fails with INSUFFICIENT_STOCK.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class InventoryService {

    private final PartRepository partRepository;

    /**
     * Validates and decrements stock for every requested part.
     *
     * @param quantities part id to total requested quantity (duplicates already summed)
     * @return the parts read for the check, keyed by id
     * @throws BusinessException PART_NOT_FOUND or INSUFFICIENT_STOCK; nothing is decremented
     *                           that the surrounding transaction will keep
     */
    @Transactional
    public Map<Long, Part> reserve(Map<Long, Integer> quantities) {
        requirePositive(quantities);
        Map<Long, Part> parts = partRepository.findAllById(quantities.keySet()).stream()
                .collect(Collectors.toMap(Part::getId, Function.identity()));

        for (Long partId : quantities.keySet()) {
            if (!parts.containsKey(partId)) {
                log.warn("Reservation rejected, part not found: partId={}", partId);
                throw new BusinessException(ErrorCode.PART_NOT_FOUND, "Part not found: " + partId);
            }
        }

        quantities.forEach((partId, quantity) -> {
            Part part = parts.get(partId);
            if (!part.hasStock(quantity)) {
                log.warn("Reservation rejected, insufficient stock: partId={}, available={}, requested={}",
                        partId, part.getStock(), quantity);
                throw insufficientStock(part.getTitle(), part.getStock(), quantity);
            }
        });

        new TreeMap<>(quantities).forEach((partId, quantity) -> {
            // Stock may have moved since the read above; the conditional update decides.
            if (partRepository.decreaseStock(partId, quantity) == 0) {
                log.warn("Reservation lost to a concurrent order: partId={}, requested={}", partId, quantity);
                throw insufficientStock(parts.get(partId).getTitle(), null, quantity);
            }
        });

        log.info("Stock reserved: {}", quantities);
        return parts;
    }

    /**
     * Puts back exactly the given quantities.
     *
     * @param quantities part id to quantity to return
     */
    @Transactional
    public void release(Map<Long, Integer> quantities) {
        requirePositive(quantities);
        new TreeMap<>(quantities).forEach((partId, quantity) -> {
            if (partRepository.increaseStock(partId, quantity) == 0) {
                throw new BusinessException(ErrorCode.PART_NOT_FOUND, "Part not found: " + partId);
            }
        });
        log.info("Stock released: {}", quantities);
    }

    private void requirePositive(Map<Long, Integer> quantities) {
        quantities.forEach((partId, quantity) -> {
            if (quantity == null || quantity <= 0) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        "Quantity for part " + partId + " must be positive, was " + quantity);
            }
        });
    }

    private BusinessException insufficientStock(String title, Integer available, int requested) {
        String message = available == null
                ? String.format("Insufficient stock for \"%s\". Requested: %d", title, requested)
                : String.format("Insufficient stock for \"%s\". Available: %d, Requested: %d",
                title, available, requested);
        return new BusinessException(ErrorCode.INSUFFICIENT_STOCK, message);
    }
}
