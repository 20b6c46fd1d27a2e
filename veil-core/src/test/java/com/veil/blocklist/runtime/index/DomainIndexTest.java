package com.veil.blocklist.runtime.index;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DomainIndexTest {

    private DomainIndex index;

    @BeforeEach
    void setUp() {
        index = new DomainIndex();
    }

    @Test
    @DisplayName("Indexed domain matches itself and its subdomains")
    void matchesDomainAndSubdomains() {
        index.insert("tracker.com");

        assertThat(index.query("tracker.com")).isTrue();
        assertThat(index.query("sub.tracker.com")).isTrue();
        assertThat(index.query("a.b.c.tracker.com")).isTrue();
    }

    @Test
    @DisplayName("Matching happens on label boundaries only")
    void labelBoundariesOnly() {
        index.insert("tracker.com");

        assertThat(index.query("trackerx.com")).isFalse();
        assertThat(index.query("not-tracker.com")).isFalse();
        assertThat(index.query("mytracker.com")).isFalse();
        assertThat(index.query("tracker.com.evil.org")).isFalse();
        assertThat(index.query("com")).isFalse();
    }

    @Test
    @DisplayName("A subdomain entry does not block its siblings or parent")
    void subdomainEntryIsNarrow() {
        index.insert("sub.example.com");

        assertThat(index.query("sub.example.com")).isTrue();
        assertThat(index.query("deep.sub.example.com")).isTrue();
        assertThat(index.query("other.example.com")).isFalse();
        assertThat(index.query("example.com")).isFalse();
    }

    @Test
    @DisplayName("insert() reports whether the domain is new and size() counts distinct domains")
    void insertIsIdempotent() {
        assertThat(index.insert("ads.com")).isTrue();
        assertThat(index.insert("ads.com")).isFalse();
        assertThat(index.insert("cdn.ads.com")).isTrue();

        assertThat(index.size()).isEqualTo(2);
        assertThat(index.contains("ads.com")).isTrue();
        assertThat(index.contains("x.ads.com")).isFalse();
    }

    @Test
    @DisplayName("remove() drops one reference; the domain stays until the last one goes")
    void removeIsReferenceCounted() {
        index.insert("ads.com");
        index.insert("ads.com");

        assertThat(index.remove("ads.com")).isFalse();
        assertThat(index.query("www.ads.com")).isTrue();

        assertThat(index.remove("ads.com")).isTrue();
        assertThat(index.query("www.ads.com")).isFalse();
        assertThat(index.size()).isZero();
    }

    @Test
    @DisplayName("Removing a parent keeps a separately indexed child")
    void removeParentKeepsChild() {
        index.insert("example.com");
        index.insert("ads.example.com");

        index.remove("example.com");

        assertThat(index.query("www.example.com")).isFalse();
        assertThat(index.query("x.ads.example.com")).isTrue();
    }

    @Test
    @DisplayName("Removing an unknown domain is a no-op")
    void removeUnknown() {
        index.insert("ads.com");

        assertThat(index.remove("unknown.org")).isFalse();
        assertThat(index.remove("x.ads.com")).isFalse();
        assertThat(index.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("clear() empties the index")
    void clearEmpties() {
        index.insert("ads.com");
        index.insert("tracker.net");

        index.clear();

        assertThat(index.size()).isZero();
        assertThat(index.query("ads.com")).isFalse();
    }

    @Test
    @DisplayName("Null and empty hosts never match")
    void nullAndEmptyHosts() {
        index.insert("ads.com");

        assertThat(index.query(null)).isFalse();
        assertThat(index.query("")).isFalse();
    }
}
