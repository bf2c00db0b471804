package com.baykanat.funnel.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** app.* için tip güvenli configuration (filtre politikası, referrer segmentasyonu, tarih aralığı, bulk hedef havuzu). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private FunnelProperties funnel = new FunnelProperties();
    private AnalyticsProperties analytics = new AnalyticsProperties();

    @Getter
    @Setter
    public static class FunnelProperties {
        /** true ise allowlist dışı filtre 400 ile reddedilir; false ise loglanıp atlanır. */
        private boolean rejectInvalidFilters = false;
        /** Bu sayıdan az ziyaretçi giren referrer grupları rapora girmez. */
        private int minSegmentUsers = 2;
        private boolean parallelSegments = true;
    }

    @Getter
    @Setter
    public static class AnalyticsProperties {
        private int defaultRangeDays = 30;
        /** Sadece tarih olan end_date'e eklenir; son gün tamamen kapsanır. */
        private String endOfDaySuffix = " 23:59:59";
        private int bulkPoolSize = 4;
        private long bulkTimeoutSeconds = 30;
        /** Store hatasında istemciye önerilen Retry-After (sn). */
        private int retryAfterSeconds = 30;
    }
}
