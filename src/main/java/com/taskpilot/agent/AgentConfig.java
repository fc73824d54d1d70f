package com.taskpilot.agent;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import com.taskpilot.core.todo.ProjectProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the agent backend from {@code taskpilot.agent.provider}.
 */
@Configuration
public class AgentConfig {

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    @ConditionalOnProperty(name = "taskpilot.agent.provider", havingValue = "docker")
    public DockerClient dockerClient() {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "taskpilot.agent.provider", havingValue = "docker")
    public DockerAgentProvider dockerAgentProvider(DockerClient dockerClient, AgentProperties properties,
                                                   ProjectProperties project) {
        return new DockerAgentProvider(dockerClient,
                properties.getDocker().getContainerName(),
                properties.getDocker().getWorkspace(),
                project.projectDir(),
                properties.getCommand(),
                properties.getProbeCommand(),
                properties.getClearSessionCommand(),
                properties.getProbeTimeout(),
                properties.getDocker().getStopTimeoutSeconds());
    }

    @Bean
    @ConditionalOnProperty(name = "taskpilot.agent.provider", havingValue = "docker")
    public EnvironmentRestarter dockerEnvironmentRestarter(DockerClient dockerClient, DockerAgentProvider provider,
                                                           AgentProperties properties) {
        return new DockerEnvironmentRestarter(dockerClient, provider, properties.getDocker(),
                properties.getProbeTimeout());
    }

    @Bean
    @ConditionalOnProperty(name = "taskpilot.agent.provider", havingValue = "process", matchIfMissing = true)
    public ProcessAgentProvider processAgentProvider(AgentProperties properties, ProjectProperties project) {
        return new ProcessAgentProvider(
                properties.getCommand(),
                properties.getProbeCommand(),
                properties.getClearSessionCommand(),
                properties.getProbeTimeout(),
                project.projectDir());
    }

    @Bean
    @ConditionalOnProperty(name = "taskpilot.agent.provider", havingValue = "process", matchIfMissing = true)
    public EnvironmentRestarter localEnvironmentRestarter(ProcessAgentProvider provider) {
        return new LocalEnvironmentRestarter(provider);
    }
}
