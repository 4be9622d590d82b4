package uz.sonic.continuum;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

@SpringBootTest
@TestPropertySource(properties = {
        "webhooks.github.secret=test-secret",
        "webhooks.gitlab.secret=test-token",
        "webhooks.bitbucket.secret=test-secret",
        "spring.datasource.url=jdbc:h2:mem:contextdb"
})
class ContinuumWebhooksApplicationTests {

    @Test
    void contextLoads() {
    }

}
