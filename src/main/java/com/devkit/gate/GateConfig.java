package com.devkit.gate;

import com.devkit.config.DevkitProperties;
import com.devkit.core.llm.LlmService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GateConfig {

    private static final Logger log = LoggerFactory.getLogger(GateConfig.class);

    @Bean
    public CheckRunner checkRunner(DevkitProperties properties) {
        var verification = properties.getVerification();
        return new JustCheckRunner(verification.getCommand(), verification.getCheckTimeout());
    }

    @Bean
    public VerificationGate verificationGate(CheckRunner checkRunner, DevkitProperties properties) {
        return new VerificationGate(checkRunner, properties.getVerification().getChecks());
    }

    /**
     * {@code llm} mode needs a chat model (see {@code spring.ai.model.chat}); any other mode approves.
     */
    @Bean
    public JudgmentService judgmentService(DevkitProperties properties,
                                           ObjectProvider<ChatClient.Builder> chatClientBuilder) {
        var review = properties.getReview();
        if ("llm".equalsIgnoreCase(review.getMode())) {
            ChatClient.Builder builder = chatClientBuilder.getIfAvailable();
            if (builder == null) {
                throw new IllegalStateException("devkit.review.mode=llm requires a chat model; set spring.ai.model.chat");
            }
            log.info("LLM review enabled (score threshold {})", review.getScoreThreshold());
            return new LlmJudgmentService(new LlmService(builder.build()), review.getScoreThreshold());
        }
        log.info("Review mode '{}': changes are approved without review", review.getMode());
        return new ApprovingJudgmentService();
    }

    @Bean
    public ReviewGate reviewGate(JudgmentService judgmentService, DevkitProperties properties) {
        return new ReviewGate(judgmentService, properties.getReview().isPerTask());
    }
}
