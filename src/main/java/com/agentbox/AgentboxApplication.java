package com.agentbox;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class AgentboxApplication {

    public static void main(String[] args) {
        // The daemon is always a web server: it exists to serve /stream and the control endpoints.
        new SpringApplicationBuilder(AgentboxApplication.class)
                .properties("spring.main.web-application-type=servlet", "spring.main.banner-mode=off")
                .run(args);
    }
}
