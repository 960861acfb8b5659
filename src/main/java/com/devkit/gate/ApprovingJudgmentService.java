package com.devkit.gate;

/**
 * Approves every change. Used when review is disabled ({@code devkit.review.mode=none}).
 */
public class ApprovingJudgmentService implements JudgmentService {

    @Override
    public Judgment evaluate(String changeSummary, String context) {
        return new Judgment(true, "review disabled");
    }
}
