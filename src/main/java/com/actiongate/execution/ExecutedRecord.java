package com.actiongate.execution;

import com.actiongate.driver.ConfirmationStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Durable proof that a prepared id was broadcast. Never deleted.
 *
 * A record without a receipt marks a broadcast that timed out with unknown outcome.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutedRecord(
    String preparedId,
    String receiptId,
    String executedAt,
    String traceId,
    String chain,
    String adapter,
    String action,
    ConfirmationStatus confirmationStatus
) {

    public ExecutedRecord withConfirmation(ConfirmationStatus status) {
        return new ExecutedRecord(preparedId, receiptId, executedAt, traceId, chain, adapter, action, status);
    }
}
