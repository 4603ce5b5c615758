package com.afsun.sqldiagram;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * SQL阶段血缘流程图应用主类
 *
 * @author afsun
 */
@SpringBootApplication(scanBasePackages = "com.afsun.sqldiagram")
@ConfigurationPropertiesScan
public class SqlDiagramApplication {
    public static void main(String[] args) {
        SpringApplication.run(SqlDiagramApplication.class, args);
    }
}
