package uz.sonic.continuum.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import uz.sonic.continuum.filter.WebhookAuthenticationFilter;
import uz.sonic.continuum.model.ErrorResponse;
import uz.sonic.continuum.model.GitProvider;
import uz.sonic.continuum.model.MessageResponse;
import uz.sonic.continuum.service.GitWebhookService;
import uz.sonic.continuum.service.WebhookOutcome;

@RestController
@RequestMapping("/webhooks")
public class GitWebhookController {

    private static final Logger log = LoggerFactory.getLogger(GitWebhookController.class);

    static final String IGNORED_MESSAGE = "Event ignored (not a push event)";

    private static final String VERIFIED = WebhookAuthenticationFilter.VERIFIED_PROVIDER_ATTRIBUTE;

    private final GitWebhookService webhookService;

    public GitWebhookController(GitWebhookService webhookService) {
        this.webhookService = webhookService;
    }

    @PostMapping("/github")
    public ResponseEntity<?> handleGitHub(
            @RequestHeader(value = "X-GitHub-Event", required = false) String event,
            @RequestAttribute(value = VERIFIED, required = false) GitProvider verified,
            @RequestBody(required = false) byte[] body) {
        return handle(GitProvider.GITHUB, event, verified, body);
    }

    @PostMapping("/gitlab")
    public ResponseEntity<?> handleGitLab(
            @RequestHeader(value = "X-Gitlab-Event", required = false) String event,
            @RequestAttribute(value = VERIFIED, required = false) GitProvider verified,
            @RequestBody(required = false) byte[] body) {
        return handle(GitProvider.GITLAB, event, verified, body);
    }

    @PostMapping("/bitbucket")
    public ResponseEntity<?> handleBitbucket(
            @RequestHeader(value = "X-Event-Key", required = false) String event,
            @RequestAttribute(value = VERIFIED, required = false) GitProvider verified,
            @RequestBody(required = false) byte[] body) {
        return handle(GitProvider.BITBUCKET, event, verified, body);
    }

    private ResponseEntity<?> handle(GitProvider provider, String event, GitProvider verified, byte[] body) {
        if (!provider.isPushEvent(event)) {
            log.info("Ignoring non-push {} event: {}", provider.id(), event);
            return ResponseEntity.ok(new MessageResponse(IGNORED_MESSAGE));
        }
        if (verified != provider) {
            log.warn("Unverified {} push reached the controller, rejecting", provider.id());
            String detail = provider == GitProvider.GITLAB ? "Invalid token" : "Invalid signature";
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(new ErrorResponse(detail));
        }

        WebhookOutcome outcome = webhookService.processPush(provider, body == null ? new byte[0] : body);

        if (outcome instanceof WebhookOutcome.Processed processed) {
            log.info("{} webhook processed successfully: {}", provider.id(), processed.stats());
            return ResponseEntity.ok(processed.stats());
        }
        if (outcome instanceof WebhookOutcome.MalformedPayload malformed) {
            return ResponseEntity.badRequest().body(new ErrorResponse(malformed.detail()));
        }
        WebhookOutcome.UnmappedRepository unmapped = (WebhookOutcome.UnmappedRepository) outcome;
        return ResponseEntity.badRequest().body(new ErrorResponse(unmapped.detail()));
    }
}
