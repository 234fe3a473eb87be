package com.actiongate.execution;

import com.actiongate.driver.ConfirmationStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param cached true when the result came from the executed store and nothing was broadcast
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecuteResult(
    String preparedId,
    String signature,
    String receiptId,
    String executedAt,
    String traceId,
    boolean cached,
    ConfirmationStatus confirmationStatus
) {

    static ExecuteResult from(ExecutedRecord record, boolean cached) {
        return new ExecuteResult(record.preparedId(), record.receiptId(), record.receiptId(), record.executedAt(),
            record.traceId(), cached, record.confirmationStatus());
    }
}
