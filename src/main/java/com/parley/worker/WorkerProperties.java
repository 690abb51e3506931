package com.parley.worker;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "parley.worker")
public class WorkerProperties {

    private String provider = "docker";
    private String image = "parley-agent:latest";
    private Duration timeout = Duration.ofMinutes(5);
    private int memoryLimitMb = 2048;
    private int cpuCount = 1;
    private int maxOutputBytes = 10 * 1024 * 1024;
    private List<String> forwardedEnv = new ArrayList<>(List.of("ANTHROPIC_API_KEY", "CLAUDE_CODE_OAUTH_TOKEN"));
    /** "uid:gid" for the container process; empty keeps the image default. */
    private String user = "";

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getImage() { return image; }
    public void setImage(String image) { this.image = image; }
    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }
    public int getMemoryLimitMb() { return memoryLimitMb; }
    public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
    public int getCpuCount() { return cpuCount; }
    public void setCpuCount(int cpuCount) { this.cpuCount = cpuCount; }
    public int getMaxOutputBytes() { return maxOutputBytes; }
    public void setMaxOutputBytes(int maxOutputBytes) { this.maxOutputBytes = maxOutputBytes; }
    public List<String> getForwardedEnv() { return forwardedEnv; }
    public void setForwardedEnv(List<String> forwardedEnv) { this.forwardedEnv = forwardedEnv; }
    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }
}
