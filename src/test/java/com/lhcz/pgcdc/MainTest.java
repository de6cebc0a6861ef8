package com.lhcz.pgcdc;

import com.lhcz.pgcdc.config.AppConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    @Test
    void bundledConfigurationBindsEverySection() throws Exception {
        AppConfig config = Main.loadConfig();

        assertThat(config.mode()).isEqualTo("cdc");
        assertThat(config.destination().schemaOrDefault()).isEqualTo("bronze");
        assertThat(config.replicationOrDefault().slotNameOrDefault()).isEqualTo("pgcdc_slot");
        assertThat(config.replicationOrDefault().tables()).isNull();
        assertThat(config.flushOrDefault().maxBytesOrDefault()).isEqualTo(16L * 1024 * 1024);
        assertThat(config.applyOrDefault().maxRetriesOrDefault()).isEqualTo(3);
        assertThat(config.web().port()).isEqualTo(8080);
    }

    @Test
    void commandLineModeWins() {
        AppConfig config = new AppConfig("cdc", null, null, null, null, null, null);

        assertThat(Main.resolveMode(new String[]{"full_load"}, config)).isEqualTo("full_load");
    }

    @Test
    void missingSectionsFallBackToDefaults() {
        AppConfig config = new AppConfig(null, null, null, null, null, null, null);

        assertThat(config.replicationOrDefault().publicationNameOrDefault()).isEqualTo("pgcdc_pub");
        assertThat(config.replicationOrDefault().requireBackfillOrDefault()).isTrue();
        assertThat(config.flushOrDefault().maxRowsOrDefault()).isEqualTo(5000);
        assertThat(config.applyOrDefault().workersOrDefault()).isEqualTo(4);
    }
}
