package io.github.yok.mongoclonelink.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class ReplicationConfigTest {

    @Test
    void getter_正常ケース_デフォルト値を取得する_既定値が返ること() {
        ReplicationConfig config = new ReplicationConfig();

        assertEquals(ReplicationConfig.DEFAULT_BATCH_SIZE, config.getBatchSize());
        assertTrue(config.isNormalizeUri());
        assertFalse(config.isContinueOnError());
        assertTrue(config.getExcludeCollections().isEmpty());
    }

    @Test
    void bind_正常ケース_ケバブケースのプロパティを指定する_各値が設定されること() {
        MapConfigurationPropertySource source = new MapConfigurationPropertySource(Map.of(
                "replication.batch-size", "250", "replication.normalize-uri", "false",
                "replication.continue-on-error", "true",
                "replication.exclude-collections[0]", "audit",
                "replication.exclude-collections[1]", "sessions"));

        ReplicationConfig config =
                new Binder(source).bind("replication", ReplicationConfig.class).get();

        assertEquals(250, config.getBatchSize());
        assertFalse(config.isNormalizeUri());
        assertTrue(config.isContinueOnError());
        assertEquals(List.of("audit", "sessions"), config.getExcludeCollections());
    }
}
