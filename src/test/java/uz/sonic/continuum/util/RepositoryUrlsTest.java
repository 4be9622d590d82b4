package uz.sonic.continuum.util;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class RepositoryUrlsTest {

    @Test
    void normalizeLowercasesAndStripsGitSuffixAndSlash() {
        assertThat(RepositoryUrls.normalize("  https://GitHub.com/Acme/Widgets.git "))
                .isEqualTo("https://github.com/acme/widgets");
        assertThat(RepositoryUrls.normalize("https://gitlab.com/acme/widgets/"))
                .isEqualTo("https://gitlab.com/acme/widgets");
        assertThat(RepositoryUrls.normalize(null)).isEmpty();
    }

    @Test
    void webUrlKeepsCase() {
        assertThat(RepositoryUrls.webUrl("https://github.com/Acme/Widgets.git"))
                .isEqualTo("https://github.com/Acme/Widgets");
        assertThat(RepositoryUrls.webUrl(" ")).isNull();
    }

    @Test
    void normalizeIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(RepositoryUrls.normalize("HTTPS://GITHUB.COM/ACME/WIDGETS.GIT"))
                    .isEqualTo("https://github.com/acme/widgets");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
