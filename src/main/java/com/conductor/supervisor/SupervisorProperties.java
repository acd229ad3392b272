package com.conductor.supervisor;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Process supervisor settings, bound from {@code conductor.supervisor.*}.
 */
@Component
@ConfigurationProperties(prefix = "conductor.supervisor")
public class SupervisorProperties {

    private String provider = "docker";
    private String dockerHost = "";
    /** Compose project whose containers are managed; blank matches any project. */
    private String composeProject = "";

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getDockerHost() { return dockerHost; }
    public void setDockerHost(String dockerHost) { this.dockerHost = dockerHost; }
    public String getComposeProject() { return composeProject; }
    public void setComposeProject(String composeProject) { this.composeProject = composeProject; }
}
