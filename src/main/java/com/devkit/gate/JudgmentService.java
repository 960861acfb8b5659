package com.devkit.gate;

/**
 * External reviewer of a change.
 */
public interface JudgmentService {

    /**
     * @param changeSummary description or diff of the change under review
     * @param context       what the change was meant to achieve
     */
    Judgment evaluate(String changeSummary, String context);
}
