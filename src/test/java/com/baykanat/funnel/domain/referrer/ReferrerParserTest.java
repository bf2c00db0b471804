package com.baykanat.funnel.domain.referrer;

import com.baykanat.funnel.domain.model.ParsedReferrer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ReferrerParser and KnownReferrerLookup.
 *
 * <p>Verifies:
 * <ul>
 *   <li>Direct traffic detection</li>
 *   <li>Known sources resolved by exact host or parent domain</li>
 *   <li>Unknown and malformed referrers fail soft</li>
 *   <li>Group keys are lower case</li>
 * </ul>
 */
class ReferrerParserTest {

    private final ReferrerParser parser = new ReferrerParser(new KnownReferrerLookup());

    @Test
    @DisplayName("Empty and direct markers - Direct")
    void directTraffic() {
        assertThat(parser.parse(null)).isEqualTo(ParsedReferrer.direct());
        assertThat(parser.parse("  ")).isEqualTo(ParsedReferrer.direct());
        assertThat(parser.parse("(direct)")).isEqualTo(ParsedReferrer.direct());
        assertThat(parser.groupKey(parser.parse(""))).isEqualTo("direct");
    }

    @Test
    @DisplayName("Known search engine - name and type from the lookup table")
    void knownSearchEngine() {
        ParsedReferrer parsed = parser.parse("https://www.Google.com/search?q=funnels");

        assertThat(parsed.getName()).isEqualTo("Google");
        assertThat(parsed.getType()).isEqualTo("search");
        assertThat(parsed.getDomain()).isEqualTo("google.com");
        assertThat(parsed.getUrl()).isEqualTo("https://www.Google.com/search?q=funnels");
        assertThat(parser.groupKey(parsed)).isEqualTo("google.com");
    }

    @Test
    @DisplayName("Subdomain - exact host wins, then parent domain")
    void subdomainLookup() {
        assertThat(parser.parse("https://mail.google.com/mail/u/0").getName()).isEqualTo("Gmail");
        assertThat(parser.parse("https://news.google.com/").getName()).isEqualTo("Google");
        assertThat(parser.parse("https://old.reddit.com/r/java").getType()).isEqualTo("social");
    }

    @Test
    @DisplayName("Unknown site - domain becomes the name")
    void unknownSite() {
        ParsedReferrer parsed = parser.parse("https://blog.example.org/post/1");

        assertThat(parsed.getName()).isEqualTo("blog.example.org");
        assertThat(parsed.getType()).isEqualTo(ParsedReferrer.TYPE_REFERRER);
        assertThat(parsed.getDomain()).isEqualTo("blog.example.org");
    }

    @Test
    @DisplayName("Malformed referrer - raw value kept, no domain")
    void malformedReferrer() {
        ParsedReferrer parsed = parser.parse("Newsletter Spring");

        assertThat(parsed.getName()).isEqualTo("Newsletter Spring");
        assertThat(parsed.getType()).isEqualTo("referrer");
        assertThat(parsed.getDomain()).isEmpty();
        assertThat(parser.groupKey(parsed)).isEqualTo("newsletter spring");
        assertThat(parser.parse("example.com/path").getDomain()).isEmpty();
    }

    @Test
    @DisplayName("Lookup never matches a bare top-level domain")
    void lookupSkipsTld() {
        KnownReferrerLookup lookup = new KnownReferrerLookup();

        assertThat(lookup.find("com")).isEqualTo(Optional.empty());
        assertThat(lookup.find("unknown.co")).isEmpty();
        assertThat(lookup.find("t.co")).map(KnownReferrer::getName).contains("Twitter");
    }

    @Test
    @DisplayName("Injected lookup replaces the built-in table")
    void injectedLookup() {
        ReferrerParser custom = new ReferrerParser(host -> host.endsWith("partner.io")
                ? Optional.of(new KnownReferrer("Partner", "affiliate"))
                : Optional.empty());

        assertThat(custom.parse("https://shop.partner.io/x").getType()).isEqualTo("affiliate");
        assertThat(custom.parse("https://google.com").getType()).isEqualTo("referrer");
    }
}
