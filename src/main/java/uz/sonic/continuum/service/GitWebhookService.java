package uz.sonic.continuum.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import uz.sonic.continuum.entity.Project;
import uz.sonic.continuum.model.CommitInfo;
import uz.sonic.continuum.model.GitProvider;
import uz.sonic.continuum.model.IngestionStats;
import uz.sonic.continuum.model.PushPayload;
import uz.sonic.continuum.provider.ParseResult;
import uz.sonic.continuum.provider.ProviderAdapter;
import uz.sonic.continuum.provider.ProviderAdapters;

import java.util.List;
import java.util.Optional;

@Service
public class GitWebhookService {

    private static final Logger log = LoggerFactory.getLogger(GitWebhookService.class);

    static final String UNMAPPED_REPOSITORY = "Project mapping required. Repository not linked to a project.";

    private final ProviderAdapters adapters;
    private final RepositoryResolver repositoryResolver;
    private final ContributionIngestionService ingestionService;

    public GitWebhookService(
            ProviderAdapters adapters,
            RepositoryResolver repositoryResolver,
            ContributionIngestionService ingestionService) {
        this.adapters = adapters;
        this.repositoryResolver = repositoryResolver;
        this.ingestionService = ingestionService;
    }

    public WebhookOutcome processPush(GitProvider provider, byte[] rawBody) {
        log.info("Processing {} push event", provider.id());
        return process(adapters.forProvider(provider), rawBody);
    }

    private <P extends PushPayload> WebhookOutcome process(ProviderAdapter<P> adapter, byte[] rawBody) {
        GitProvider provider = adapter.provider();

        ParseResult<P> parsed = adapter.parse(rawBody);
        if (parsed instanceof ParseResult.Failed<P> failed) {
            log.warn("Rejecting {} payload: {}", provider.id(), failed.reason());
            return new WebhookOutcome.MalformedPayload(failed.reason());
        }
        P payload = ((ParseResult.Parsed<P>) parsed).payload();

        List<CommitInfo> commits = adapter.normalize(payload);
        log.info("Extracted {} commits from {} push", commits.size(), provider.id());

        Optional<Project> project = repositoryResolver.resolve(payload.repositoryUrl(), payload.repositoryName());
        if (project.isEmpty()) {
            return new WebhookOutcome.UnmappedRepository(UNMAPPED_REPOSITORY);
        }

        IngestionStats stats = ingestionService.ingest(commits, project.get().getId(), provider, payload.repositoryUrl());
        return new WebhookOutcome.Processed(stats);
    }
}
