package org.pbxlink.alert;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PbxAlertApplication {

    public static void main(String[] args) {
        SpringApplication.run(PbxAlertApplication.class, args);
    }
}
