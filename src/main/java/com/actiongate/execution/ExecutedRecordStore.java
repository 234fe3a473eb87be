package com.actiongate.execution;

import com.actiongate.driver.ConfirmationStatus;

import java.util.Optional;

public interface ExecutedRecordStore {

    Optional<ExecutedRecord> find(String preparedId);

    /**
     * Persists the record before returning. Recording a prepared id twice is an error.
     */
    void put(ExecutedRecord record);

    ExecutedRecord updateConfirmation(String preparedId, ConfirmationStatus status);

    int size();
}
