package com.devkit.gate;

import com.devkit.core.model.VerificationResult;
import com.devkit.core.model.WorkspaceHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the fixed, ordered check sequence after each task and stops at the first failure.
 * Has no side effects beyond those of the checks themselves, so it is safe to run repeatedly.
 */
public class VerificationGate {

    private static final Logger log = LoggerFactory.getLogger(VerificationGate.class);

    private final CheckRunner checkRunner;
    private final List<String> checks;

    public VerificationGate(CheckRunner checkRunner, List<String> checks) {
        this.checkRunner = checkRunner;
        this.checks = List.copyOf(checks);
    }

    public VerificationResult run(WorkspaceHandle workspace) {
        var passed = new ArrayList<String>();
        var skipped = new ArrayList<String>();
        for (String check : checks) {
            CheckResult result = checkRunner.runCheck(check, workspace.path());
            if (!result.passed()) {
                log.warn("Verification failed at '{}' for {}", check, workspace.runId());
                return VerificationResult.failed(check, result.output());
            }
            if (result.skipped()) {
                skipped.add(check);
            } else {
                passed.add(check);
            }
        }
        String detail = "passed: " + passed + (skipped.isEmpty() ? "" : ", skipped: " + skipped);
        log.info("Verification {}", detail);
        return VerificationResult.passed(detail);
    }

    public List<String> checks() {
        return checks;
    }
}
