package com.pipewright.worker;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "pipewright.worker")
public class WorkerProperties {

    private String command = "agentapi";
    private String agentCommand = "claude";
    private List<String> agentArgs = new ArrayList<>();
    private String host = "localhost";
    private int basePort = 3284;
    private String logDir = System.getProperty("java.io.tmpdir") + "/pipewright-logs";

    private int healthTimeoutSeconds = 120;
    private int stabilizeTimeoutSeconds = 120;
    private long healthPollMillis = 500;
    private long pollIntervalMillis = 1000;
    private int maxConsecutivePollFailures = 30;
    private int requestTimeoutSeconds = 30;
    private int stopGraceSeconds = 10;

    public String getCommand() { return command; }
    public void setCommand(String command) { this.command = command; }
    public String getAgentCommand() { return agentCommand; }
    public void setAgentCommand(String agentCommand) { this.agentCommand = agentCommand; }
    public List<String> getAgentArgs() { return agentArgs; }
    public void setAgentArgs(List<String> agentArgs) { this.agentArgs = agentArgs; }
    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public int getBasePort() { return basePort; }
    public void setBasePort(int basePort) { this.basePort = basePort; }
    public String getLogDir() { return logDir; }
    public void setLogDir(String logDir) { this.logDir = logDir; }

    public int getHealthTimeoutSeconds() { return healthTimeoutSeconds; }
    public void setHealthTimeoutSeconds(int healthTimeoutSeconds) { this.healthTimeoutSeconds = healthTimeoutSeconds; }
    public int getStabilizeTimeoutSeconds() { return stabilizeTimeoutSeconds; }
    public void setStabilizeTimeoutSeconds(int stabilizeTimeoutSeconds) { this.stabilizeTimeoutSeconds = stabilizeTimeoutSeconds; }
    public long getHealthPollMillis() { return healthPollMillis; }
    public void setHealthPollMillis(long healthPollMillis) { this.healthPollMillis = healthPollMillis; }
    public long getPollIntervalMillis() { return pollIntervalMillis; }
    public void setPollIntervalMillis(long pollIntervalMillis) { this.pollIntervalMillis = pollIntervalMillis; }
    public int getMaxConsecutivePollFailures() { return maxConsecutivePollFailures; }
    public void setMaxConsecutivePollFailures(int maxConsecutivePollFailures) { this.maxConsecutivePollFailures = maxConsecutivePollFailures; }
    public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    public int getStopGraceSeconds() { return stopGraceSeconds; }
    public void setStopGraceSeconds(int stopGraceSeconds) { this.stopGraceSeconds = stopGraceSeconds; }
}
