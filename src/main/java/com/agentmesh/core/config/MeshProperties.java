package com.agentmesh.core.config;

import com.agentmesh.core.model.AgentRole;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "agentmesh")
public class MeshProperties {

    private Hub hub = new Hub();
    private Pool pool = new Pool();
    private Orchestration orchestration = new Orchestration();
    private Loop loop = new Loop();
    private Snapshot snapshot = new Snapshot();

    public Hub getHub() { return hub; }
    public void setHub(Hub hub) { this.hub = hub; }
    public Pool getPool() { return pool; }
    public void setPool(Pool pool) { this.pool = pool; }
    public Orchestration getOrchestration() { return orchestration; }
    public void setOrchestration(Orchestration orchestration) { this.orchestration = orchestration; }
    public Loop getLoop() { return loop; }
    public void setLoop(Loop loop) { this.loop = loop; }
    public Snapshot getSnapshot() { return snapshot; }
    public void setSnapshot(Snapshot snapshot) { this.snapshot = snapshot; }

    public static class Hub {
        private int historyCapacity = 1000;

        public int getHistoryCapacity() { return historyCapacity; }
        public void setHistoryCapacity(int historyCapacity) { this.historyCapacity = historyCapacity; }
    }

    public static class Pool {
        private int defaultMaxInstances = 4;
        /** Per-role overrides keyed by role name (case-insensitive). */
        private Map<String, Integer> maxInstances = new HashMap<>();
        private int heartbeatTimeoutSeconds = 60;
        private int sweepIntervalSeconds = 15;
        /** How long allocate waits for an idle instance at capacity; 0 fails fast. */
        private long allocationWaitMillis = 0;

        public int getDefaultMaxInstances() { return defaultMaxInstances; }
        public void setDefaultMaxInstances(int defaultMaxInstances) { this.defaultMaxInstances = defaultMaxInstances; }
        public Map<String, Integer> getMaxInstances() { return maxInstances; }
        public void setMaxInstances(Map<String, Integer> maxInstances) { this.maxInstances = maxInstances; }
        public int getHeartbeatTimeoutSeconds() { return heartbeatTimeoutSeconds; }
        public void setHeartbeatTimeoutSeconds(int heartbeatTimeoutSeconds) { this.heartbeatTimeoutSeconds = heartbeatTimeoutSeconds; }
        public int getSweepIntervalSeconds() { return sweepIntervalSeconds; }
        public void setSweepIntervalSeconds(int sweepIntervalSeconds) { this.sweepIntervalSeconds = sweepIntervalSeconds; }
        public long getAllocationWaitMillis() { return allocationWaitMillis; }
        public void setAllocationWaitMillis(long allocationWaitMillis) { this.allocationWaitMillis = allocationWaitMillis; }

        public int maxInstancesFor(AgentRole role) {
            for (var entry : maxInstances.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(role.name())) {
                    return entry.getValue();
                }
            }
            return defaultMaxInstances;
        }
    }

    public static class Orchestration {
        private int maxRounds = 10;
        private int maxParallel = 8;

        public int getMaxRounds() { return maxRounds; }
        public void setMaxRounds(int maxRounds) { this.maxRounds = maxRounds; }
        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
    }

    public static class Loop {
        private int maxRounds = 10;
        private int maxParseRetries = 2;
        private List<String> completeActions = new ArrayList<>(List.of("COMPLETE"));
        private List<String> failActions = new ArrayList<>(List.of("FAIL"));
        private int thinkTimeoutSeconds = 120;
        private int actionTimeoutSeconds = 300;
        /** Stop when this many consecutive observations are identical; 0 disables the check. */
        private int stallWindow = 0;
        /** Review limits, only consulted when the agent's provider supplies a reviewer; 0 disables. */
        private int maxRejections = 4;
        private int stuckThreshold = 3;

        public int getMaxRounds() { return maxRounds; }
        public void setMaxRounds(int maxRounds) { this.maxRounds = maxRounds; }
        public int getMaxParseRetries() { return maxParseRetries; }
        public void setMaxParseRetries(int maxParseRetries) { this.maxParseRetries = maxParseRetries; }
        public List<String> getCompleteActions() { return completeActions; }
        public void setCompleteActions(List<String> completeActions) { this.completeActions = completeActions; }
        public List<String> getFailActions() { return failActions; }
        public void setFailActions(List<String> failActions) { this.failActions = failActions; }
        public int getThinkTimeoutSeconds() { return thinkTimeoutSeconds; }
        public void setThinkTimeoutSeconds(int thinkTimeoutSeconds) { this.thinkTimeoutSeconds = thinkTimeoutSeconds; }
        public int getActionTimeoutSeconds() { return actionTimeoutSeconds; }
        public void setActionTimeoutSeconds(int actionTimeoutSeconds) { this.actionTimeoutSeconds = actionTimeoutSeconds; }
        public int getStallWindow() { return stallWindow; }
        public void setStallWindow(int stallWindow) { this.stallWindow = stallWindow; }
        public int getMaxRejections() { return maxRejections; }
        public void setMaxRejections(int maxRejections) { this.maxRejections = maxRejections; }
        public int getStuckThreshold() { return stuckThreshold; }
        public void setStuckThreshold(int stuckThreshold) { this.stuckThreshold = stuckThreshold; }
    }

    public static class Snapshot {
        private boolean enabled = false;
        private String path = System.getProperty("user.home") + "/.agentmesh/snapshot.json";
        private int intervalSeconds = 30;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public int getIntervalSeconds() { return intervalSeconds; }
        public void setIntervalSeconds(int intervalSeconds) { this.intervalSeconds = intervalSeconds; }
    }
}
