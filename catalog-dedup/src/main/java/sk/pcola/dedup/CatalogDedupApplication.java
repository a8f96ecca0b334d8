package sk.pcola.dedup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CatalogDedupApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CatalogDedupApplication.class, args)));
    }
}
