package com.devkit;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class DevkitApplication {

    public static void main(String[] args) {
        ApplicationContext ctx = new SpringApplicationBuilder(DevkitApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);

        ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
        System.exit(SpringApplication.exit(ctx, exitCodeGen));
    }
}
