package com.partsmarket.payment.entity;

import com.partsmarket.common.exception.BusinessException;
import com.partsmarket.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaymentTest {

    private Payment newPayment() {
        return Payment.builder()
                .orderId(1L)
                .amount(new BigDecimal("40.00"))
                .method(PaymentMethod.MOBILE_MONEY)
                .metadata(Map.of("mobileMoneyPhone", "+22177000000"))
                .build();
    }

    @Test
    @DisplayName("new payments start PENDING with the default currency")
    void builder_Defaults() {
        Payment payment = newPayment();

        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(payment.getCurrency()).isEqualTo("XOF");
        assertThat(payment.getMetadata()).containsEntry("mobileMoneyPhone", "+22177000000");
    }

    @Test
    void complete_StoresTransactionRef() {
        Payment payment = newPayment();

        payment.complete("TX-1");

        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(payment.getTransactionRef()).isEqualTo("TX-1");
    }

    @Test
    void fail_KeepsExistingMetadata() {
        Payment payment = newPayment();

        payment.fail("Insufficient balance");

        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(payment.getMetadata())
                .containsEntry("failureReason", "Insufficient balance")
                .containsEntry("mobileMoneyPhone", "+22177000000");
    }

    @Test
    @DisplayName("an oversized failure text is cut so the metadata still fits its column")
    void fail_LongReason_Truncated() {
        Payment payment = newPayment();

        payment.fail("x".repeat(5000));

        assertThat(payment.getMetadata().get("failureReason")).hasSize(Payment.REASON_MAX_LENGTH);
        assertThat(new MetadataConverter().convertToDatabaseColumn(payment.getMetadata()).length())
                .isLessThanOrEqualTo(2000);
    }

    @Test
    @DisplayName("only COMPLETED payments can be refunded")
    void refund_RequiresCompleted() {
        Payment payment = newPayment();

        assertThatThrownBy(() -> payment.refund("changed my mind"))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_PAYMENT_STATUS);

        payment.complete("TX-1");
        payment.refund("changed my mind");
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
        assertThat(payment.getMetadata()).containsEntry("refundReason", "changed my mind");
    }

    @Test
    void metadataConverter_ReadsBackWhatItWrites() {
        MetadataConverter converter = new MetadataConverter();

        String json = converter.convertToDatabaseColumn(Map.of("failureReason", "declined"));

        assertThat(converter.convertToEntityAttribute(json)).containsExactlyEntriesOf(Map.of("failureReason", "declined"));
        assertThat(converter.convertToDatabaseColumn(Map.of())).isNull();
        assertThat(converter.convertToEntityAttribute(null)).isEmpty();
    }
}
