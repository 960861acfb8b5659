package com.devkit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "devkit")
public class DevkitProperties {

    private Run run = new Run();
    private Workspace workspace = new Workspace();
    private Verification verification = new Verification();
    private Review review = new Review();
    private TicketStore ticketStore = new TicketStore();
    private Executor executor = new Executor();

    public Run getRun() { return run; }
    public void setRun(Run run) { this.run = run; }
    public Workspace getWorkspace() { return workspace; }
    public void setWorkspace(Workspace workspace) { this.workspace = workspace; }
    public Verification getVerification() { return verification; }
    public void setVerification(Verification verification) { this.verification = verification; }
    public Review getReview() { return review; }
    public void setReview(Review review) { this.review = review; }
    public TicketStore getTicketStore() { return ticketStore; }
    public void setTicketStore(TicketStore ticketStore) { this.ticketStore = ticketStore; }
    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }

    public static class Run {
        private int maxRetries = 3;
        private Duration taskTimeout = Duration.ofMinutes(30);
        /** Holds abort markers and logs. */
        private String stateDir = ".devkit";

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getTaskTimeout() { return taskTimeout; }
        public void setTaskTimeout(Duration taskTimeout) { this.taskTimeout = taskTimeout; }
        public String getStateDir() { return stateDir; }
        public void setStateDir(String stateDir) { this.stateDir = stateDir; }
    }

    public static class Workspace {
        private String repository = ".";
        private String baseRevision = "main";
        private String root = ".devkit/worktrees";
        private String branchPrefix = "devkit/";
        private String remote = "origin";
        private boolean pushOnIntegrate = true;
        private String authorName = "devkit";
        private String authorEmail = "devkit@localhost";

        public String getRepository() { return repository; }
        public void setRepository(String repository) { this.repository = repository; }
        public String getBaseRevision() { return baseRevision; }
        public void setBaseRevision(String baseRevision) { this.baseRevision = baseRevision; }
        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public String getBranchPrefix() { return branchPrefix; }
        public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }
        public String getRemote() { return remote; }
        public void setRemote(String remote) { this.remote = remote; }
        public boolean isPushOnIntegrate() { return pushOnIntegrate; }
        public void setPushOnIntegrate(boolean pushOnIntegrate) { this.pushOnIntegrate = pushOnIntegrate; }
        public String getAuthorName() { return authorName; }
        public void setAuthorName(String authorName) { this.authorName = authorName; }
        public String getAuthorEmail() { return authorEmail; }
        public void setAuthorEmail(String authorEmail) { this.authorEmail = authorEmail; }
    }

    public static class Verification {
        private List<String> checks = new ArrayList<>(List.of("test", "lint", "build"));
        private String command = "just";
        private Duration checkTimeout = Duration.ofMinutes(10);

        public List<String> getChecks() { return checks; }
        public void setChecks(List<String> checks) { this.checks = checks; }
        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public Duration getCheckTimeout() { return checkTimeout; }
        public void setCheckTimeout(Duration checkTimeout) { this.checkTimeout = checkTimeout; }
    }

    public static class Review {
        /** "none" approves every change, "llm" asks the configured chat model. */
        private String mode = "none";
        private int scoreThreshold = 7;
        private boolean perTask = true;

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
        public int getScoreThreshold() { return scoreThreshold; }
        public void setScoreThreshold(int scoreThreshold) { this.scoreThreshold = scoreThreshold; }
        public boolean isPerTask() { return perTask; }
        public void setPerTask(boolean perTask) { this.perTask = perTask; }
    }

    public static class TicketStore {
        /** file, jdbc or memory. */
        private String type = "file";
        private String directory = ".devkit/tickets";
        private Jdbc jdbc = new Jdbc();

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
        public Jdbc getJdbc() { return jdbc; }
        public void setJdbc(Jdbc jdbc) { this.jdbc = jdbc; }
    }

    public static class Jdbc {
        private String url;
        private String username;
        private String password;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }

    public static class Executor {
        /** Keyed by task label name (FEATURE, CHORE, BUGFIX). */
        private Map<String, Strategy> strategies = new LinkedHashMap<>();

        public Map<String, Strategy> getStrategies() { return strategies; }
        public void setStrategies(Map<String, Strategy> strategies) { this.strategies = strategies; }
    }

    public static class Strategy {
        private List<String> command = new ArrayList<>();
        private Map<String, String> environment = new LinkedHashMap<>();

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public Map<String, String> getEnvironment() { return environment; }
        public void setEnvironment(Map<String, String> environment) { this.environment = environment; }
    }
}
