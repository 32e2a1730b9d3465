package com.sqlbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SqlBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SqlBridgeApplication.class, args);
    }
}
