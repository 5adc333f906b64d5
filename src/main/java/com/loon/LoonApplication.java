package com.loon;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class LoonApplication {

    public static void main(String[] args) {
        ApplicationContext ctx = new SpringApplicationBuilder(LoonApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off",
                        "spring.main.log-startup-info=false")
                .run(args);

        // CLI app: exit with the run result
        ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
        int exitCode = SpringApplication.exit(ctx, exitCodeGen);
        System.exit(exitCode);
    }
}
