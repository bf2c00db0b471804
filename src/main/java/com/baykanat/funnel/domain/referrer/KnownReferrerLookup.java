package com.baykanat.funnel.domain.referrer;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Arama motorları, sosyal ağlar ve e-posta istemcileri için sabit tablo; önce tam host, sonra üst domain'ler denenir. */
@Component
public class KnownReferrerLookup implements ReferrerLookup {

    private static final String SEARCH = "search";
    private static final String SOCIAL = "social";
    private static final String EMAIL = "email";
    private static final String COMMUNITY = "community";

    private static final Map<String, KnownReferrer> KNOWN = Map.ofEntries(
            Map.entry("google.com", new KnownReferrer("Google", SEARCH)),
            Map.entry("google.co.uk", new KnownReferrer("Google", SEARCH)),
            Map.entry("google.de", new KnownReferrer("Google", SEARCH)),
            Map.entry("google.com.tr", new KnownReferrer("Google", SEARCH)),
            Map.entry("bing.com", new KnownReferrer("Bing", SEARCH)),
            Map.entry("duckduckgo.com", new KnownReferrer("DuckDuckGo", SEARCH)),
            Map.entry("search.yahoo.com", new KnownReferrer("Yahoo", SEARCH)),
            Map.entry("yahoo.com", new KnownReferrer("Yahoo", SEARCH)),
            Map.entry("yandex.ru", new KnownReferrer("Yandex", SEARCH)),
            Map.entry("yandex.com", new KnownReferrer("Yandex", SEARCH)),
            Map.entry("baidu.com", new KnownReferrer("Baidu", SEARCH)),
            Map.entry("ecosia.org", new KnownReferrer("Ecosia", SEARCH)),
            Map.entry("facebook.com", new KnownReferrer("Facebook", SOCIAL)),
            Map.entry("l.facebook.com", new KnownReferrer("Facebook", SOCIAL)),
            Map.entry("m.facebook.com", new KnownReferrer("Facebook", SOCIAL)),
            Map.entry("twitter.com", new KnownReferrer("Twitter", SOCIAL)),
            Map.entry("x.com", new KnownReferrer("X", SOCIAL)),
            Map.entry("t.co", new KnownReferrer("Twitter", SOCIAL)),
            Map.entry("linkedin.com", new KnownReferrer("LinkedIn", SOCIAL)),
            Map.entry("lnkd.in", new KnownReferrer("LinkedIn", SOCIAL)),
            Map.entry("reddit.com", new KnownReferrer("Reddit", SOCIAL)),
            Map.entry("instagram.com", new KnownReferrer("Instagram", SOCIAL)),
            Map.entry("youtube.com", new KnownReferrer("YouTube", SOCIAL)),
            Map.entry("pinterest.com", new KnownReferrer("Pinterest", SOCIAL)),
            Map.entry("tiktok.com", new KnownReferrer("TikTok", SOCIAL)),
            Map.entry("mail.google.com", new KnownReferrer("Gmail", EMAIL)),
            Map.entry("outlook.live.com", new KnownReferrer("Outlook", EMAIL)),
            Map.entry("github.com", new KnownReferrer("GitHub", COMMUNITY)),
            Map.entry("news.ycombinator.com", new KnownReferrer("Hacker News", COMMUNITY))
    );

    @Override
    public Optional<KnownReferrer> find(String host) {
        if (host == null || host.isBlank()) {
            return Optional.empty();
        }
        String candidate = host.toLowerCase(Locale.ROOT);
        while (true) {
            KnownReferrer known = KNOWN.get(candidate);
            if (known != null) {
                return Optional.of(known);
            }
            int dot = candidate.indexOf('.');
            // son etiket (TLD) tek başına denenmez
            if (dot < 0 || candidate.indexOf('.', dot + 1) < 0) {
                return Optional.empty();
            }
            candidate = candidate.substring(dot + 1);
        }
    }
}
