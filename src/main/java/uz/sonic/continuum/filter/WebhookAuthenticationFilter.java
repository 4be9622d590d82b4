package uz.sonic.continuum.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;
import uz.sonic.continuum.config.GitWebhookProperties;
import uz.sonic.continuum.model.ErrorResponse;
import uz.sonic.continuum.model.GitProvider;
import uz.sonic.continuum.provider.ProviderAdapter;
import uz.sonic.continuum.provider.ProviderAdapters;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Optional;

@Component
public class WebhookAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(WebhookAuthenticationFilter.class);

    public static final String VERIFIED_PROVIDER_ATTRIBUTE = "uz.sonic.continuum.webhook.verifiedProvider";

    private final ProviderAdapters adapters;
    private final GitWebhookProperties properties;
    private final ObjectMapper objectMapper;

    public WebhookAuthenticationFilter(
            ProviderAdapters adapters,
            GitWebhookProperties properties,
            ObjectMapper objectMapper) {
        this.adapters = adapters;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !"POST".equals(request.getMethod()) || resolveProvider(request).isEmpty();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        GitProvider provider = resolveProvider(request).orElseThrow();
        log.info("Received {} webhook request", provider.id());

        if (!provider.isPushEvent(request.getHeader(provider.eventHeader()))) {
            filterChain.doFilter(request, response);
            return;
        }

        byte[] body = request.getInputStream().readAllBytes();
        String credential = request.getHeader(provider.credentialHeader());
        String secret = properties.secretFor(provider);

        if (secret == null || secret.isBlank()) {
            log.error("{} webhook secret not configured, rejecting delivery", provider.id());
            reject(response, provider);
            return;
        }
        if (credential == null || credential.isBlank()) {
            log.warn("{} webhook missing {} header", provider.id(), provider.credentialHeader());
            reject(response, provider);
            return;
        }

        ProviderAdapter<?> adapter = adapters.forProvider(provider);
        if (!adapter.verify(body, credential, secret)) {
            log.warn("{} webhook verification failed", provider.id());
            reject(response, provider);
            return;
        }

        log.info("{} webhook verified", provider.id());
        request.setAttribute(VERIFIED_PROVIDER_ATTRIBUTE, provider);
        filterChain.doFilter(new CachedBodyRequest(request, body), response);
    }

    // Decoded, without ;params and duplicate slashes, the same way handler mapping sees it.
    private Optional<GitProvider> resolveProvider(HttpServletRequest request) {
        return GitProvider.fromWebhookPath(UrlPathHelper.defaultInstance.getPathWithinApplication(request));
    }

    private void reject(HttpServletResponse response, GitProvider provider) throws IOException {
        String detail = provider == GitProvider.GITLAB ? "Invalid token" : "Invalid signature";
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), new ErrorResponse(detail));
    }

    private static class CachedBodyRequest extends HttpServletRequestWrapper {
        private final byte[] body;

        CachedBodyRequest(HttpServletRequest request, byte[] body) {
            super(request);
            this.body = body;
        }

        @Override
        public ServletInputStream getInputStream() {
            ByteArrayInputStream byteStream = new ByteArrayInputStream(body);
            return new ServletInputStream() {
                @Override
                public boolean isFinished() { return byteStream.available() == 0; }

                @Override
                public boolean isReady() { return true; }

                @Override
                public void setReadListener(ReadListener readListener) { }

                @Override
                public int read() { return byteStream.read(); }
            };
        }
    }
}
