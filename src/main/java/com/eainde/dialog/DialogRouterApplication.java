package com.eainde.dialog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DialogRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(DialogRouterApplication.class, args);
    }
}
