package com.activitytracker.util;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class UrlPartsTest {

    @Test
    void shouldExtractLowerCasedHost() {
        assertEquals(Optional.of("app.acme.com"), UrlParts.host("https://user:pw@App.Acme.com.:8443/x?y=1"));
        assertEquals(Optional.of("acme.com"), UrlParts.host("acme.com/pricing"));
        assertEquals(Optional.of("localhost"), UrlParts.host("http://localhost:3000#top"));
        assertEquals(Optional.empty(), UrlParts.host("file:///tmp/a.html"));
        assertEquals(Optional.empty(), UrlParts.host("  "));
    }

    @Test
    void shouldFindNoHostWhenSchemeHasNoAuthority() {
        assertEquals(Optional.empty(), UrlParts.host("about:blank"));
        assertEquals(Optional.empty(), UrlParts.host("mailto:bob@acme.com"));
        assertEquals(Optional.empty(), UrlParts.path("about:blank"));
        assertEquals(Optional.of("localhost"), UrlParts.host("localhost:3000/app"));
        assertEquals(Optional.of("/app"), UrlParts.path("localhost:3000/app"));
    }

    @Test
    void shouldReportLowerCasedScheme() {
        assertEquals(Optional.of("chrome"), UrlParts.scheme("Chrome://newtab/"));
        assertEquals(Optional.of("about"), UrlParts.scheme("about:blank"));
        assertEquals(Optional.empty(), UrlParts.scheme("acme.com/pricing"));
        assertEquals(Optional.empty(), UrlParts.scheme("localhost:3000"));
    }

    @Test
    void shouldExtractPathWithoutQueryOrFragment() {
        assertEquals(Optional.of("/docs/start"), UrlParts.path("https://acme.com/docs/start?ref=nav#intro"));
        assertEquals(Optional.empty(), UrlParts.path("https://acme.com"));
        assertEquals(Optional.empty(), UrlParts.path("https://acme.com?q=/not/a/path"));
    }
}
