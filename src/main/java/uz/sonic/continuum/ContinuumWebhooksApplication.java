package uz.sonic.continuum;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import uz.sonic.continuum.config.GitWebhookProperties;

@SpringBootApplication
@EnableConfigurationProperties(GitWebhookProperties.class)
public class ContinuumWebhooksApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContinuumWebhooksApplication.class, args);
    }

}
