package com.partsmarket.notification;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

    @Mock
    private Notifier notifier;

    @InjectMocks
    private NotificationDispatcher dispatcher;

    @Test
    void dispatch_HandsEventToNotifier() {
        NotificationEvent event = NotificationEvent.forOrder(NotificationKind.ORDER_CONFIRMATION, 1L, 7L, Map.of());

        dispatcher.dispatch(event);

        verify(notifier).send(event);
    }

    @Test
    @DisplayName("a failing notifier is logged, never rethrown")
    void dispatch_NotifierFails_Swallowed() {
        NotificationEvent event = NotificationEvent.forPayment(
                NotificationKind.PAYMENT_FAILED, 1L, 10L, 7L, Map.of("failureReason", "Card declined"));
        willThrow(new IllegalStateException("SMTP down")).given(notifier).send(event);

        assertThatCode(() -> dispatcher.dispatch(event)).doesNotThrowAnyException();
    }
}
