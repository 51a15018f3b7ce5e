package com.partsmarket.notification;

import com.partsmarket.common.config.AsyncConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands {@link NotificationEvent}s to the {@link Notifier} after the publishing
 * transaction commits. Rolled-back work never notifies.
 *
 * <p>Runs on the bounded notification executor; the workflow thread returns
 * without waiting. Notifier failures are logged and dropped.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final Notifier notifier;

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void dispatch(NotificationEvent event) {
        try {
            notifier.send(event);
            log.debug("Notification sent: kind={}, orderId={}", event.kind(), event.orderId());
        } catch (Exception e) {
            log.error("Notification failed: kind={}, orderId={}, paymentId={}",
                    event.kind(), event.orderId(), event.paymentId(), e);
        }
    }
}
