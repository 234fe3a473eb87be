package com.actiongate.driver;

/**
 * @param receiptId transaction signature or equivalent receipt identifier
 */
public record BroadcastReceipt(String receiptId) {
}
