package uz.sonic.continuum.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import uz.sonic.continuum.model.GitProvider;

@ConfigurationProperties(prefix = "webhooks")
public record GitWebhookProperties(Provider github, Provider gitlab, Provider bitbucket) {

    public record Provider(String secret) {}

    public String secretFor(GitProvider provider) {
        Provider settings = switch (provider) {
            case GITHUB -> github;
            case GITLAB -> gitlab;
            case BITBUCKET -> bitbucket;
        };
        return settings == null ? null : settings.secret();
    }
}
