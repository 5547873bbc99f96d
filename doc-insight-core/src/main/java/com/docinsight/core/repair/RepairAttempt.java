package com.docinsight.core.repair;

/**
 * One provider repair call made for a diagram.
 *
 * @param index 1-based attempt number
 * @param diagnostic checker or validator message that triggered the attempt
 * @param resultingText text returned by the repair, or null if the call produced none
 */
public record RepairAttempt(int index, String diagnostic, String resultingText) {
}
