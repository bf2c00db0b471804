package com.baykanat.funnel.domain.referrer;

import com.baykanat.funnel.domain.model.ParsedReferrer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** Referrer string'ini {name, type, domain, url} olarak çözer. Geçersiz URL hata vermez, ham değerle döner. */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferrerParser {

    static final String DIRECT_KEY = "direct";

    private final ReferrerLookup referrerLookup;

    public ParsedReferrer parse(String referrer) {
        String value = referrer == null ? "" : referrer.trim();
        if (value.isEmpty() || "direct".equalsIgnoreCase(value) || "(direct)".equalsIgnoreCase(value)) {
            return ParsedReferrer.direct();
        }

        URI uri;
        try {
            uri = new URI(value);
        } catch (URISyntaxException e) {
            log.debug("Referrer is not a valid URL, keeping raw value: {}", value);
            return unparsed(value);
        }

        String host = uri.getHost();
        if (uri.getScheme() == null || host == null || host.isBlank()) {
            return unparsed(value);
        }

        String domain = normalizeHost(host);
        return referrerLookup.find(domain)
                .map(known -> ParsedReferrer.builder()
                        .name(known.getName())
                        .type(known.getType())
                        .domain(domain)
                        .url(value)
                        .build())
                .orElseGet(() -> ParsedReferrer.builder()
                        .name(domain)
                        .type(ParsedReferrer.TYPE_REFERRER)
                        .domain(domain)
                        .url(value)
                        .build());
    }

    /** Segment anahtarı: domain; direct trafik için "direct"; çözülemeyen değer için ham değer. Hepsi küçük harf. */
    public String groupKey(ParsedReferrer parsed) {
        if (ParsedReferrer.TYPE_DIRECT.equals(parsed.getType())) {
            return DIRECT_KEY;
        }
        if (!parsed.getDomain().isEmpty()) {
            return parsed.getDomain().toLowerCase(Locale.ROOT);
        }
        return parsed.getUrl().toLowerCase(Locale.ROOT);
    }

    static String normalizeHost(String host) {
        String normalized = host.toLowerCase(Locale.ROOT);
        return normalized.startsWith("www.") ? normalized.substring(4) : normalized;
    }

    private static ParsedReferrer unparsed(String value) {
        return ParsedReferrer.builder()
                .name(value)
                .type(ParsedReferrer.TYPE_REFERRER)
                .domain("")
                .url(value)
                .build();
    }
}
