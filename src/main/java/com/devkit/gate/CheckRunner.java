package com.devkit.gate;

import java.nio.file.Path;

/**
 * Runs one named check (test, lint, build, ...) against a checkout.
 */
public interface CheckRunner {

    CheckResult runCheck(String name, Path workingDirectory);
}
