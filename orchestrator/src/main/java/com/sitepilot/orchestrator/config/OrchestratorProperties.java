package com.sitepilot.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Tunables for the sandbox lifecycle and the correction loop, bound from
 * {@code sitepilot.*}. Defaults match the values the loop was tuned against;
 * unit tests construct this class directly.
 */
@Component
@ConfigurationProperties(prefix = "sitepilot")
public class OrchestratorProperties {

    private Sandbox sandbox = new Sandbox();
    private Server server = new Server();
    private Dependencies dependencies = new Dependencies();
    private Correction correction = new Correction();
    private Generation generation = new Generation();
    private int workers = 4;

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }
    public Server getServer() { return server; }
    public void setServer(Server server) { this.server = server; }
    public Dependencies getDependencies() { return dependencies; }
    public void setDependencies(Dependencies dependencies) { this.dependencies = dependencies; }
    public Correction getCorrection() { return correction; }
    public void setCorrection(Correction correction) { this.correction = correction; }
    public Generation getGeneration() { return generation; }
    public void setGeneration(Generation generation) { this.generation = generation; }
    public int getWorkers() { return workers; }
    public void setWorkers(int workers) { this.workers = workers; }

    public static class Sandbox {
        private Duration timeout = Duration.ofSeconds(600);
        private Duration maxTimeout = Duration.ofSeconds(3600);
        private String template;
        private Duration pingTimeout = Duration.ofSeconds(2);
        private Duration markerTimeout = Duration.ofSeconds(3);

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public Duration getMaxTimeout() { return maxTimeout; }
        public void setMaxTimeout(Duration maxTimeout) { this.maxTimeout = maxTimeout; }
        public String getTemplate() { return template; }
        public void setTemplate(String template) { this.template = template; }
        public Duration getPingTimeout() { return pingTimeout; }
        public void setPingTimeout(Duration pingTimeout) { this.pingTimeout = pingTimeout; }
        public Duration getMarkerTimeout() { return markerTimeout; }
        public void setMarkerTimeout(Duration markerTimeout) { this.markerTimeout = markerTimeout; }
    }

    public static class Server {
        private int port = 5173;
        private int fallbackPort = 4173;
        private int readinessAttempts = 30;
        private Duration readinessBackoff = Duration.ofSeconds(3);
        private Duration readinessCheckTimeout = Duration.ofSeconds(10);
        private Duration startTimeout = Duration.ofSeconds(30);
        private Duration buildTimeout = Duration.ofSeconds(480);
        private Duration installTimeout = Duration.ofSeconds(420);
        private Duration packageInstallTimeout = Duration.ofSeconds(300);
        private Duration verifyTimeout = Duration.ofSeconds(30);
        private Duration shortCommandTimeout = Duration.ofSeconds(10);

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public int getFallbackPort() { return fallbackPort; }
        public void setFallbackPort(int fallbackPort) { this.fallbackPort = fallbackPort; }
        public int getReadinessAttempts() { return readinessAttempts; }
        public void setReadinessAttempts(int readinessAttempts) { this.readinessAttempts = readinessAttempts; }
        public Duration getReadinessBackoff() { return readinessBackoff; }
        public void setReadinessBackoff(Duration readinessBackoff) { this.readinessBackoff = readinessBackoff; }
        public Duration getReadinessCheckTimeout() { return readinessCheckTimeout; }
        public void setReadinessCheckTimeout(Duration readinessCheckTimeout) { this.readinessCheckTimeout = readinessCheckTimeout; }
        public Duration getStartTimeout() { return startTimeout; }
        public void setStartTimeout(Duration startTimeout) { this.startTimeout = startTimeout; }
        public Duration getBuildTimeout() { return buildTimeout; }
        public void setBuildTimeout(Duration buildTimeout) { this.buildTimeout = buildTimeout; }
        public Duration getInstallTimeout() { return installTimeout; }
        public void setInstallTimeout(Duration installTimeout) { this.installTimeout = installTimeout; }
        public Duration getPackageInstallTimeout() { return packageInstallTimeout; }
        public void setPackageInstallTimeout(Duration packageInstallTimeout) { this.packageInstallTimeout = packageInstallTimeout; }
        public Duration getVerifyTimeout() { return verifyTimeout; }
        public void setVerifyTimeout(Duration verifyTimeout) { this.verifyTimeout = verifyTimeout; }
        public Duration getShortCommandTimeout() { return shortCommandTimeout; }
        public void setShortCommandTimeout(Duration shortCommandTimeout) { this.shortCommandTimeout = shortCommandTimeout; }
    }

    public static class Dependencies {
        private String allowListVersion = "2024-1";
        private Set<String> allowList = new LinkedHashSet<>(
                List.of("react-dom", "lucide-react", "react-icons", "@heroicons/react"));

        public String getAllowListVersion() { return allowListVersion; }
        public void setAllowListVersion(String allowListVersion) { this.allowListVersion = allowListVersion; }
        public Set<String> getAllowList() { return allowList; }
        public void setAllowList(Set<String> allowList) { this.allowList = allowList; }
    }

    public static class Correction {
        // Neither threshold has a documented rationale; both are product-level knobs.
        private int targetedAttemptsBeforeRegeneration = 2;
        private int maxTotalAttempts = 5;

        public int getTargetedAttemptsBeforeRegeneration() { return targetedAttemptsBeforeRegeneration; }
        public void setTargetedAttemptsBeforeRegeneration(int v) { this.targetedAttemptsBeforeRegeneration = v; }
        public int getMaxTotalAttempts() { return maxTotalAttempts; }
        public void setMaxTotalAttempts(int v) { this.maxTotalAttempts = v; }
    }

    /** Retry policy for calls to the code generation service. */
    public static class Generation {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private double backoffMultiplier = 2.0;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    }
}
