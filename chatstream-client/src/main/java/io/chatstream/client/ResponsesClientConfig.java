package io.chatstream.client;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection settings for a {@link ResponsesClient}.
 *
 * <p>Requests go to {@code {baseUrl}/{apiVersion}/responses}. The default base URL is
 * {@value #DEFAULT_BASE_URL}.
 */
public final class ResponsesClientConfig {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com";
    public static final String DEFAULT_API_VERSION = "v1";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    public static final String ENV_API_KEY = "OPENAI_API_KEY";
    public static final String ENV_BASE_URL = "OPENAI_BASE_URL";
    public static final String ENV_ORGANIZATION = "OPENAI_ORG_ID";

    private final URI baseUrl;
    private final String apiKey;
    private final String organizationId;
    private final String apiVersion;
    private final Map<String, String> extraHeaders;
    private final Duration timeout;

    private ResponsesClientConfig(Builder b) {
        this.baseUrl = b.baseUrl;
        this.apiKey = Objects.requireNonNull(b.apiKey, "apiKey");
        this.organizationId = b.organizationId;
        this.apiVersion = b.apiVersion;
        this.extraHeaders = Map.copyOf(b.extraHeaders);
        this.timeout = b.timeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@value #ENV_API_KEY}, {@value #ENV_BASE_URL} and {@value #ENV_ORGANIZATION} from the
     * process environment.
     *
     * @throws IllegalStateException if no API key is set
     */
    public static ResponsesClientConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static ResponsesClientConfig fromEnvironment(Map<String, String> env) {
        String key = env.get(ENV_API_KEY);
        if (key == null || key.isBlank()) {
            throw new IllegalStateException(ENV_API_KEY + " is not set");
        }
        Builder b = builder().apiKey(key);
        String base = env.get(ENV_BASE_URL);
        if (base != null && !base.isBlank()) {
            b.baseUrl(URI.create(base.trim()));
        }
        String org = env.get(ENV_ORGANIZATION);
        if (org != null && !org.isBlank()) {
            b.organizationId(org.trim());
        }
        return b.build();
    }

    public URI baseUrl() {
        return baseUrl;
    }

    public String apiKey() {
        return apiKey;
    }

    public Optional<String> organizationId() {
        return Optional.ofNullable(organizationId);
    }

    public String apiVersion() {
        return apiVersion;
    }

    public Map<String, String> extraHeaders() {
        return extraHeaders;
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * The streaming endpoint, {@code {baseUrl}/{apiVersion}/responses}.
     */
    public URI responsesUrl() {
        String base = baseUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/" + apiVersion + "/responses");
    }

    @Override
    public String toString() {
        return "ResponsesClientConfig{baseUrl=" + baseUrl + ", apiVersion=" + apiVersion
                + ", organizationId=" + organizationId + ", timeout=" + timeout + "}";
    }

    public static final class Builder {
        private URI baseUrl = URI.create(DEFAULT_BASE_URL);
        private String apiKey;
        private String organizationId;
        private String apiVersion = DEFAULT_API_VERSION;
        private final Map<String, String> extraHeaders = new LinkedHashMap<>();
        private Duration timeout = DEFAULT_TIMEOUT;

        private Builder() {
        }

        public Builder baseUrl(URI baseUrl) {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder apiVersion(String apiVersion) {
            this.apiVersion = Objects.requireNonNull(apiVersion, "apiVersion");
            return this;
        }

        public Builder header(String name, String value) {
            extraHeaders.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public ResponsesClientConfig build() {
            return new ResponsesClientConfig(this);
        }
    }
}
