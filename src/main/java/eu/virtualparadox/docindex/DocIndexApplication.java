package eu.virtualparadox.docindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocIndexApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocIndexApplication.class, args);
    }
}
