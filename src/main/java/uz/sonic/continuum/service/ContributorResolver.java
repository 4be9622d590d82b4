package uz.sonic.continuum.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import uz.sonic.continuum.repository.UserRepository;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

@Service
public class ContributorResolver {

    private static final Logger log = LoggerFactory.getLogger(ContributorResolver.class);

    private static final List<Pattern> NO_REPLY_PATTERNS = List.of(
            Pattern.compile("noreply@.*"),
            Pattern.compile("no-reply@.*"),
            Pattern.compile(".*@users\\.noreply\\.github\\.com"),
            Pattern.compile(".*@users\\.noreply\\.gitlab\\.com"),
            Pattern.compile(".*@bitbucket\\.org")
    );

    private final UserRepository userRepository;

    public ContributorResolver(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public ContributorMatch resolve(String authorEmail) {
        if (isNoReply(authorEmail)) {
            return new ContributorMatch.NoReply();
        }
        return userRepository.findFirstByEmailIgnoreCase(authorEmail.strip())
                .<ContributorMatch>map(ContributorMatch.Matched::new)
                .orElseGet(ContributorMatch.NoMatch::new);
    }

    public static boolean isNoReply(String email) {
        if (email == null || email.isBlank()) {
            return true;
        }
        String normalized = email.strip().toLowerCase(Locale.ROOT);
        boolean noReply = NO_REPLY_PATTERNS.stream().anyMatch(p -> p.matcher(normalized).matches());
        if (noReply) {
            log.debug("Ignoring no-reply email: {}", email);
        }
        return noReply;
    }
}
