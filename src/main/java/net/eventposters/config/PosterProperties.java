package net.eventposters.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for poster rendering and its external collaborators.
 */
@Component
@ConfigurationProperties(prefix = "poster")
public class PosterProperties {

    private final Assets assets = new Assets();
    private final Footer footer = new Footer();
    private final Search search = new Search();
    private final Webhook webhook = new Webhook();

    /**
     * Number of variants rendered per batch request.
     */
    private int batchSize = 5;

    @PostConstruct
    void validate() {
        Assert.isTrue(batchSize >= 1 && batchSize <= 10, "poster.batch-size must be between 1 and 10");
        Assert.isTrue(search.perPage >= 1 && search.perPage <= 80, "poster.search.per-page must be between 1 and 80");
        Assert.isTrue(search.maxRetries >= 0 && search.maxRetries <= 1, "poster.search.max-retries must be 0 or 1");
        Assert.isTrue(!search.timeout.isNegative() && !search.timeout.isZero(), "poster.search.timeout must be positive");
        Assert.isTrue(!webhook.timeout.isNegative() && !webhook.timeout.isZero(), "poster.webhook.timeout must be positive");
        Assert.hasText(footer.qrUrl, "poster.footer.qr-url must not be blank");
    }

    public Assets getAssets() {
        return assets;
    }

    public Footer getFooter() {
        return footer;
    }

    public Search getSearch() {
        return search;
    }

    public Webhook getWebhook() {
        return webhook;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    /**
     * Where logo, font and icons are read from.
     */
    public static class Assets {

        /**
         * Directory holding the asset files; icons fetched remotely are memoized here.
         */
        private String dir = "assets";

        /**
         * Logo path relative to the asset directory.
         */
        private String logo = "logo.png";

        /**
         * TrueType font path relative to the asset directory. When blank the system
         * family {@link #fontFamily} is used instead.
         */
        private String font = "";

        /**
         * System font family used when no font asset is configured.
         */
        private String fontFamily = "SansSerif";

        /**
         * Remote icon sources keyed by icon name ({@code calendar}, {@code clock}).
         */
        private Map<String, String> iconUrls = new LinkedHashMap<>();

        private Duration iconFetchTimeout = Duration.ofSeconds(5);

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public String getLogo() {
            return logo;
        }

        public void setLogo(String logo) {
            this.logo = logo;
        }

        public String getFont() {
            return font;
        }

        public void setFont(String font) {
            this.font = font;
        }

        public String getFontFamily() {
            return fontFamily;
        }

        public void setFontFamily(String fontFamily) {
            this.fontFamily = fontFamily;
        }

        public Map<String, String> getIconUrls() {
            return iconUrls;
        }

        public void setIconUrls(Map<String, String> iconUrls) {
            this.iconUrls = iconUrls == null ? new LinkedHashMap<>() : new LinkedHashMap<>(iconUrls);
        }

        public Duration getIconFetchTimeout() {
            return iconFetchTimeout;
        }

        public void setIconFetchTimeout(Duration iconFetchTimeout) {
            this.iconFetchTimeout = iconFetchTimeout;
        }
    }

    /**
     * Footer texts and QR target.
     */
    public static class Footer {

        private String ctaText = "Reserva tu lugar:";
        private String linkText = "lu.ma/EXATEC-Alemania";
        private String qrUrl = "https://lu.ma/EXATEC-Alemania";

        public String getCtaText() {
            return ctaText;
        }

        public void setCtaText(String ctaText) {
            this.ctaText = ctaText;
        }

        public String getLinkText() {
            return linkText;
        }

        public void setLinkText(String linkText) {
            this.linkText = linkText;
        }

        public String getQrUrl() {
            return qrUrl;
        }

        public void setQrUrl(String qrUrl) {
            this.qrUrl = qrUrl;
        }
    }

    /**
     * Pexels image search settings.
     */
    public static class Search {

        private String baseUrl = "https://api.pexels.com/v1";
        private String apiKey;
        private int perPage = 15;
        private Duration timeout = Duration.ofSeconds(8);
        private int maxRetries = 1;

        /**
         * Requests allowed per minute before searches fall back to the white canvas.
         */
        private int requestsPerMinute = 60;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getPerPage() {
            return perPage;
        }

        public void setPerPage(int perPage) {
            this.perPage = perPage;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public int getRequestsPerMinute() {
            return requestsPerMinute;
        }

        public void setRequestsPerMinute(int requestsPerMinute) {
            this.requestsPerMinute = requestsPerMinute;
        }
    }

    /**
     * Endpoint finished posters are posted to.
     */
    public static class Webhook {

        private String url;
        private Duration timeout = Duration.ofSeconds(10);

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
