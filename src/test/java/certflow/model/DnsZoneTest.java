package certflow.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DnsZoneTest {

    private Locale defaultLocale;

    @BeforeEach
    void setUp() {
        defaultLocale = Locale.getDefault();
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(defaultLocale);
    }

    @Test
    void containsIgnoresCaseUnderAnyDefaultLocale() {
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        final DnsZone zone = new DnsZone("z1", "EXAMPLE.IO", List.of());

        assertThat(zone.contains("www.example.io")).isTrue();
        assertThat(zone.contains("WWW.EXAMPLE.IO")).isTrue();
        assertThat(zone.contains("example.io")).isTrue();
        assertThat(zone.contains("www.otherexample.io")).isFalse();
    }

    @Test
    void relativeLabelOfApexAndSubdomain() {
        final DnsZone zone = new DnsZone("z1", "example.com", null);

        assertThat(zone.relativeLabel("_acme-challenge.www.example.com")).isEqualTo("_acme-challenge.www");
        assertThat(zone.relativeLabel("example.com")).isEqualTo("@");
        assertThat(zone.nameServers()).isEmpty();
    }
}
