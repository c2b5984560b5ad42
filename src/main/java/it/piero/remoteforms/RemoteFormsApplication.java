package it.piero.remoteforms;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RemoteFormsApplication {

    public static void main(String[] args) {
        SpringApplication.run(RemoteFormsApplication.class, args);
    }
}
