package com.agentmesh;

import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Command-line entry point. The context runs one CLI command and exits with its code.
 */
@SpringBootApplication
public class AgentMeshApplication {

    public static void main(String[] args) {
        var application = new SpringApplication(AgentMeshApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        application.setBannerMode(Banner.Mode.OFF);
        System.exit(SpringApplication.exit(application.run(args)));
    }
}
