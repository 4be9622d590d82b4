package uz.sonic.continuum.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import uz.sonic.continuum.model.CommitInfo;
import uz.sonic.continuum.model.gitlab.GitLabPushEvent;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GitLabAdapterTest {

    private static final String PAYLOAD = """
            {
              "object_kind": "push",
              "ref": "refs/heads/main",
              "project": {
                "name": "Widgets",
                "path_with_namespace": "acme/widgets",
                "web_url": "https://gitlab.com/acme/widgets"
              },
              "repository": {
                "name": "Widgets",
                "url": "git@gitlab.com:acme/widgets.git",
                "git_http_url": "https://gitlab.com/acme/widgets.git"
              },
              "commits": [
                {
                  "id": "9f8e7d6c5b4a",
                  "message": "Add invoice export",
                  "timestamp": "2024-05-15T10:30:00+00:00",
                  "url": "https://gitlab.com/acme/widgets/-/commit/9f8e7d6c5b4a",
                  "author": {"name": "Dana Cruz", "email": "dana@acme.io"}
                },
                {
                  "id": "8e7d6c5b4a9f",
                  "message": "Legacy hook format",
                  "timestamp": "2024-05-15T11:00:00Z",
                  "author_name": "Eli Park",
                  "author_email": "eli@acme.io"
                }
              ]
            }
            """;

    private final GitLabAdapter adapter = new GitLabAdapter(new PushPayloadReader(new ObjectMapper()), Clock.systemUTC());

    @Test
    void verifiesStaticTokenInConstantTime() {
        byte[] body = PAYLOAD.getBytes(StandardCharsets.UTF_8);

        assertThat(adapter.verify(body, "gl-token", "gl-token")).isTrue();
        assertThat(adapter.verify(body, "wrong", "gl-token")).isFalse();
        assertThat(adapter.verify(body, null, "gl-token")).isFalse();
        assertThat(adapter.verify(body, "gl-token", null)).isFalse();
    }

    @Test
    void readsRepositoryIdentityFromProjectAndRepositoryBlocks() {
        GitLabPushEvent event = parse(PAYLOAD);

        assertThat(event.repositoryUrl()).isEqualTo("https://gitlab.com/acme/widgets.git");
        assertThat(event.repositoryName()).isEqualTo("acme/widgets");
    }

    @Test
    void normalizesNestedAndFlatAuthors() {
        List<CommitInfo> commits = adapter.normalize(parse(PAYLOAD));

        assertThat(commits).hasSize(2);
        assertThat(commits.get(0).authorEmail()).isEqualTo("dana@acme.io");
        assertThat(commits.get(0).authorName()).isEqualTo("Dana Cruz");
        assertThat(commits.get(0).branch()).isEqualTo("main");
        assertThat(commits.get(0).timestamp()).isEqualTo(OffsetDateTime.parse("2024-05-15T10:30:00Z"));
        assertThat(commits.get(1).authorEmail()).isEqualTo("eli@acme.io");
        assertThat(commits.get(1).authorName()).isEqualTo("Eli Park");
    }

    @Test
    void commitWithoutIdIsRejected() {
        ParseResult<GitLabPushEvent> result = adapter.parse("""
                {"ref": "refs/heads/main", "commits": [{"message": "no id"}]}
                """.getBytes(StandardCharsets.UTF_8));

        assertThat(result).isInstanceOf(ParseResult.Failed.class);
    }

    private GitLabPushEvent parse(String json) {
        ParseResult<GitLabPushEvent> result = adapter.parse(json.getBytes(StandardCharsets.UTF_8));
        assertThat(result).isInstanceOf(ParseResult.Parsed.class);
        return ((ParseResult.Parsed<GitLabPushEvent>) result).payload();
    }
}
