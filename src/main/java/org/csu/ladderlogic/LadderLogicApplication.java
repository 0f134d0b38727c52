package org.csu.ladderlogic;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * @author hidyouth
 * @description: 命令行入口:
 * <pre>
 * java -jar ladderlogic.jar --input logic.txt --platform siemens --output ladder.txt
 * </pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class LadderLogicApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(LadderLogicApplication.class, args)));
    }
}
