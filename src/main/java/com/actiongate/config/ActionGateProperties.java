package com.actiongate.config;

import com.actiongate.policy.ConfirmationPolicy;
import com.actiongate.policy.PolicyAction;
import com.actiongate.policy.PolicyConfig;
import com.actiongate.policy.PolicyRule;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings bound from the {@code actiongate} prefix.
 */
@ConfigurationProperties("actiongate")
public class ActionGateProperties {

    /** Root of all persisted state: runs, executed records, failover and broadcast history. */
    private String stateDir = ".actiongate";
    private String defaultNetwork = PolicyConfig.MAINNET;
    private Duration preparedTtl = Duration.ofMinutes(15);
    private Duration sweepInterval = Duration.ofSeconds(10);
    private Duration driverTimeout = Duration.ofSeconds(30);
    private final Retry retry = new Retry();
    /** Upstream endpoint pools by name. */
    private Map<String, List<String>> upstreams = new LinkedHashMap<>();
    /** Signing key references by chain. Never secrets. */
    private Map<String, List<String>> signers = new LinkedHashMap<>();
    private final Sandbox sandbox = new Sandbox();
    private final Policy policy = new Policy();

    public String getStateDir() { return stateDir; }
    public void setStateDir(String stateDir) { this.stateDir = stateDir; }
    public String getDefaultNetwork() { return defaultNetwork; }
    public void setDefaultNetwork(String defaultNetwork) { this.defaultNetwork = defaultNetwork; }
    public Duration getPreparedTtl() { return preparedTtl; }
    public void setPreparedTtl(Duration preparedTtl) { this.preparedTtl = preparedTtl; }
    public Duration getSweepInterval() { return sweepInterval; }
    public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
    public Duration getDriverTimeout() { return driverTimeout; }
    public void setDriverTimeout(Duration driverTimeout) { this.driverTimeout = driverTimeout; }
    public Retry getRetry() { return retry; }
    public Map<String, List<String>> getUpstreams() { return upstreams; }
    public void setUpstreams(Map<String, List<String>> upstreams) { this.upstreams = upstreams; }
    public Map<String, List<String>> getSigners() { return signers; }
    public void setSigners(Map<String, List<String>> signers) { this.signers = signers; }
    public Sandbox getSandbox() { return sandbox; }
    public Policy getPolicy() { return policy; }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private double multiplier = 2.0;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
    }

    public static class Sandbox {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class Policy {
        private Map<String, Network> networks = new LinkedHashMap<>();
        private final Transactions transactions = new Transactions();
        private final Allowlist allowlist = new Allowlist();
        private List<Rule> rules = new ArrayList<>();

        public Map<String, Network> getNetworks() { return networks; }
        public void setNetworks(Map<String, Network> networks) { this.networks = networks; }
        public Transactions getTransactions() { return transactions; }
        public Allowlist getAllowlist() { return allowlist; }
        public List<Rule> getRules() { return rules; }
        public void setRules(List<Rule> rules) { this.rules = rules; }

        /**
         * Immutable snapshot handed to the policy engine.
         */
        public PolicyConfig toPolicyConfig() {
            Map<String, PolicyConfig.NetworkGate> gates = new LinkedHashMap<>();
            networks.forEach((name, n) -> gates.put(name, new PolicyConfig.NetworkGate(
                n.isEnabled(), n.isRequireApproval(), n.isRequireSimulation(), n.getMaxDailyVolume())));
            PolicyConfig.TransactionLimits limits = new PolicyConfig.TransactionLimits(
                transactions.getMaxSingleAmount(),
                transactions.getMaxSlippageBps(),
                ConfirmationPolicy.fromValue(transactions.getRequireConfirmation()),
                transactions.getCooldownSeconds(),
                transactions.getMaxTxPerMinute(),
                transactions.getConfirmTxPerMinute(),
                transactions.isRequireSimulatedSlippage(),
                transactions.isAcceptUnguardedSlippage());
            List<PolicyRule> policyRules = rules.stream()
                .map(r -> new PolicyRule(r.getName(), r.getCondition(), PolicyAction.fromValue(r.getAction()),
                    r.getMessage()))
                .toList();
            return new PolicyConfig(gates, limits,
                new PolicyConfig.Allowlist(allowlist.getActions(), allowlist.getIdentifiers()), policyRules);
        }
    }

    public static class Network {
        private boolean enabled = true;
        private boolean requireApproval;
        private boolean requireSimulation;
        private Double maxDailyVolume;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public boolean isRequireApproval() { return requireApproval; }
        public void setRequireApproval(boolean requireApproval) { this.requireApproval = requireApproval; }
        public boolean isRequireSimulation() { return requireSimulation; }
        public void setRequireSimulation(boolean requireSimulation) { this.requireSimulation = requireSimulation; }
        public Double getMaxDailyVolume() { return maxDailyVolume; }
        public void setMaxDailyVolume(Double maxDailyVolume) { this.maxDailyVolume = maxDailyVolume; }
    }

    public static class Transactions {
        private Double maxSingleAmount;
        private Integer maxSlippageBps;
        private String requireConfirmation = "large";
        private Integer cooldownSeconds;
        private Integer maxTxPerMinute;
        private Integer confirmTxPerMinute;
        private boolean requireSimulatedSlippage;
        private boolean acceptUnguardedSlippage;

        public Double getMaxSingleAmount() { return maxSingleAmount; }
        public void setMaxSingleAmount(Double maxSingleAmount) { this.maxSingleAmount = maxSingleAmount; }
        public Integer getMaxSlippageBps() { return maxSlippageBps; }
        public void setMaxSlippageBps(Integer maxSlippageBps) { this.maxSlippageBps = maxSlippageBps; }
        public String getRequireConfirmation() { return requireConfirmation; }
        public void setRequireConfirmation(String requireConfirmation) { this.requireConfirmation = requireConfirmation; }
        public Integer getCooldownSeconds() { return cooldownSeconds; }
        public void setCooldownSeconds(Integer cooldownSeconds) { this.cooldownSeconds = cooldownSeconds; }
        public Integer getMaxTxPerMinute() { return maxTxPerMinute; }
        public void setMaxTxPerMinute(Integer maxTxPerMinute) { this.maxTxPerMinute = maxTxPerMinute; }
        public Integer getConfirmTxPerMinute() { return confirmTxPerMinute; }
        public void setConfirmTxPerMinute(Integer confirmTxPerMinute) { this.confirmTxPerMinute = confirmTxPerMinute; }
        public boolean isRequireSimulatedSlippage() { return requireSimulatedSlippage; }
        public void setRequireSimulatedSlippage(boolean v) { this.requireSimulatedSlippage = v; }
        public boolean isAcceptUnguardedSlippage() { return acceptUnguardedSlippage; }
        public void setAcceptUnguardedSlippage(boolean v) { this.acceptUnguardedSlippage = v; }
    }

    public static class Allowlist {
        private List<String> actions = new ArrayList<>();
        private Map<String, List<String>> identifiers = new LinkedHashMap<>();

        public List<String> getActions() { return actions; }
        public void setActions(List<String> actions) { this.actions = actions; }
        public Map<String, List<String>> getIdentifiers() { return identifiers; }
        public void setIdentifiers(Map<String, List<String>> identifiers) { this.identifiers = identifiers; }
    }

    public static class Rule {
        private String name;
        private String condition;
        private String action;
        private String message;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getCondition() { return condition; }
        public void setCondition(String condition) { this.condition = condition; }
        public String getAction() { return action; }
        public void setAction(String action) { this.action = action; }
        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }
    }
}
