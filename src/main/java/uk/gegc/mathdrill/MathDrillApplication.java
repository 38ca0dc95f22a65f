package uk.gegc.mathdrill;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MathDrillApplication {

    public static void main(String[] args) {
        SpringApplication.run(MathDrillApplication.class, args);
    }
}
