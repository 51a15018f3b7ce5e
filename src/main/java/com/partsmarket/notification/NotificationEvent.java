package com.partsmarket.notification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Published by the workflows inside their transaction and delivered by
 * {@link NotificationDispatcher} once that transaction has committed.
 *
 * @param paymentId null for order-only notifications
 * @param context   template variables for the message (amount, failure reason, retry link, ...)
 */
public record NotificationEvent(
        NotificationKind kind,
        Long orderId,
        Long paymentId,
        Long recipientUserId,
        Map<String, Object> context
) {
    public NotificationEvent {
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static NotificationEvent forOrder(NotificationKind kind, Long orderId, Long userId,
                                             Map<String, Object> context) {
        return new NotificationEvent(kind, orderId, null, userId, context);
    }

    public static NotificationEvent forPayment(NotificationKind kind, Long orderId, Long paymentId,
                                               Long userId, Map<String, Object> context) {
        return new NotificationEvent(kind, orderId, paymentId, userId, context);
    }
}
