package com.partsmarket.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default {@link Notifier}: records the notification in the application log.
 * Replace with a mail or SMS gateway client in deployments that deliver messages.
 */
@Slf4j
@Component
public class LoggingNotifier implements Notifier {

    @Override
    public void send(NotificationEvent event) {
        log.info("Notification {} -> user {}: orderId={}, paymentId={}, context={}",
                event.kind(), event.recipientUserId(), event.orderId(), event.paymentId(), event.context());
    }
}
