package com.veil.blocklist.runtime.url;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainNamesTest {

    @Test
    @DisplayName("Accepts ordinary and internationalized domains")
    void acceptsValidDomains() {
        assertThat(DomainNames.isValidDomain("tracker.com", true)).isTrue();
        assertThat(DomainNames.isValidDomain("a-b_c.example.co.uk", true)).isTrue();
        assertThat(DomainNames.isValidDomain("bücher.de", true)).isTrue();
        assertThat(DomainNames.isValidDomain("localhost", false)).isTrue();
    }

    @Test
    @DisplayName("Rejects malformed domains")
    void rejectsInvalidDomains() {
        assertThat(DomainNames.isValidDomain(null, false)).isFalse();
        assertThat(DomainNames.isValidDomain("", false)).isFalse();
        assertThat(DomainNames.isValidDomain("localhost", true)).isFalse();
        assertThat(DomainNames.isValidDomain(".tracker.com", true)).isFalse();
        assertThat(DomainNames.isValidDomain("tracker..com", true)).isFalse();
        assertThat(DomainNames.isValidDomain("tracker.com.", true)).isFalse();
        assertThat(DomainNames.isValidDomain("tra cker.com", true)).isFalse();
        assertThat(DomainNames.isValidDomain("tracker.com/path", true)).isFalse();
        assertThat(DomainNames.isValidDomain("a".repeat(64) + ".com", true)).isFalse();
        assertThat(DomainNames.isValidDomain("a.".repeat(127) + "com", true)).isFalse();
    }

    @Test
    @DisplayName("Splits labels top-level first")
    void splitsLabels() {
        assertThat(DomainNames.labelsTopLevelFirst("Ads.Tracker.com"))
                .containsExactly("com", "tracker", "ads");
        assertThat(DomainNames.labelsTopLevelFirst("localhost")).containsExactly("localhost");
        assertThatThrownBy(() -> DomainNames.labelsTopLevelFirst(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
