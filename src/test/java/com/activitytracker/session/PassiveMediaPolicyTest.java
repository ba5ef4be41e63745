package com.activitytracker.session;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PassiveMediaPolicyTest {

    private final PassiveMediaPolicy policy = PassiveMediaPolicy.of(List.of(" com.spotify.client ", "VLC.exe"));

    @Test
    void shouldMatchBundleIdsAndExecutableNames() {
        assertTrue(policy.isPassive("com.spotify.client", "Daft Punk - Around the World"));
        assertTrue(policy.isPassive("c:\\program files\\videolan\\vlc\\vlc.exe", "movie.mkv"));
        assertFalse(policy.isPassive("c:\\tools\\notvlc.exe", "movie.mkv"));
        assertFalse(policy.isPassive("com.spotify.client.helper", "Spotify"));
    }

    @Test
    void shouldMatchPdfTitlesInAnyApp() {
        assertTrue(policy.isPassive("firefox", "Annual Report.PDF"));
        assertTrue(policy.isPassive("com.apple.safari", "paper.pdf — Safari"));
        assertFalse(policy.isPassive("firefox", "pdf tools - Firefox"));
    }

    @Test
    void shouldNeverMatchWhenDisabled() {
        assertFalse(PassiveMediaPolicy.none().isPassive("com.spotify.client", "report.pdf"));
    }
}
