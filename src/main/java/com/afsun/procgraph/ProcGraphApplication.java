package com.afsun.procgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * 存储过程依赖图谱应用主类
 *
 * @author afsun
 */
@SpringBootApplication(scanBasePackages = "com.afsun.procgraph")
@ConfigurationPropertiesScan
public class ProcGraphApplication {
    public static void main(String[] args) {
        SpringApplication.run(ProcGraphApplication.class, args);
    }
}
