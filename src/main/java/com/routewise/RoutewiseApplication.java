package com.routewise;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class RoutewiseApplication {

    public static void main(String[] args) {
        // Embedded service: no web server, the context stays up for in-process callers and JMX health
        new SpringApplicationBuilder(RoutewiseApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);
    }
}
