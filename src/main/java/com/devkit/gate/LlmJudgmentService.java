package com.devkit.gate;

import com.devkit.core.llm.LlmResponseException;
import com.devkit.core.llm.LlmService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reviews changes with a chat model. A change passes when the model approves it and scores it at
 * or above the threshold. When the answer cannot be mapped to {@link ReviewFeedback}, a
 * "Score: X/10" in the raw answer is used instead.
 */
public class LlmJudgmentService implements JudgmentService {

    private static final Logger log = LoggerFactory.getLogger(LlmJudgmentService.class);

    private static final Pattern SCORE_PATTERN =
            Pattern.compile("(?i)Score:\\s*(\\d{1,2})\\s*/\\s*10");

    static final String SYSTEM_PROMPT =
            "You are a senior code reviewer. You receive what a change was meant to achieve and a summary "
            + "or diff of the change. Judge correctness, scope, duplication and consistency with the rest "
            + "of the change set.\n\n"
            + "Return: approved (true only when the change can be merged as is), a one-paragraph summary, "
            + "a list of concrete issues (empty when there are none) and an integer score 0-10.";

    private final LlmService llmService;
    private final int scoreThreshold;

    public LlmJudgmentService(LlmService llmService, int scoreThreshold) {
        this.llmService = llmService;
        this.scoreThreshold = scoreThreshold;
    }

    @Override
    public Judgment evaluate(String changeSummary, String context) {
        String prompt = "## Intent\n\n" + context + "\n\n## Change\n\n"
                + (changeSummary == null || changeSummary.isBlank() ? "(no change summary)" : changeSummary);

        ReviewFeedback feedback;
        try {
            feedback = llmService.structuredCall(SYSTEM_PROMPT, prompt, ReviewFeedback.class);
        } catch (LlmResponseException e) {
            feedback = fromRawResponse(e);
        }

        boolean passed = feedback.approved() && feedback.score() >= scoreThreshold;
        log.info("Review {} (score {}/10, threshold {}): {}",
                passed ? "passed" : "failed", feedback.score(), scoreThreshold, feedback.summary());
        return new Judgment(passed, formatFindings(feedback));
    }

    private ReviewFeedback fromRawResponse(LlmResponseException e) {
        String raw = e.getRawResponse();
        if (raw != null) {
            Matcher matcher = SCORE_PATTERN.matcher(raw);
            if (matcher.find()) {
                int score = Integer.parseInt(matcher.group(1));
                log.info("Extracted review score {} via regex", score);
                return new ReviewFeedback(score >= scoreThreshold, raw.strip(), List.of(), score);
            }
        }
        throw e;
    }

    static String formatFindings(ReviewFeedback feedback) {
        var sb = new StringBuilder();
        sb.append("Score ").append(feedback.score()).append("/10");
        if (feedback.summary() != null && !feedback.summary().isBlank()) {
            sb.append(": ").append(feedback.summary().strip());
        }
        for (String issue : feedback.issues()) {
            sb.append("\n- ").append(issue);
        }
        return sb.toString();
    }
}
