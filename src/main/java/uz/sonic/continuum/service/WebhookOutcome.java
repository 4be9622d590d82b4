package uz.sonic.continuum.service;

import uz.sonic.continuum.model.IngestionStats;

public sealed interface WebhookOutcome {

    record Processed(IngestionStats stats) implements WebhookOutcome {}

    record MalformedPayload(String detail) implements WebhookOutcome {}

    record UnmappedRepository(String detail) implements WebhookOutcome {}
}
