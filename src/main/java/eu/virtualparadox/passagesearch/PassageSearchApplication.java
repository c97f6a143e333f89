package eu.virtualparadox.passagesearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PassageSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(PassageSearchApplication.class, args);
    }
}
