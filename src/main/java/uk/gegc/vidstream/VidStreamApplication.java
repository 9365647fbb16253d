package uk.gegc.vidstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class VidStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(VidStreamApplication.class, args);
    }
}
