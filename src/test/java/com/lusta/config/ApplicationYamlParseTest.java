package com.lusta.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ApplicationYamlParseTest {

    @Test
    void applicationYaml_parsesAndCarriesGatewayKeys() throws Exception {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("application", new ClassPathResource("application.yml"));

        assertThat(sources).isNotEmpty();
        PropertySource<?> yaml = sources.get(0);
        assertThat(yaml.getProperty("im.gateway.ws.path")).hasToString("/ws");
        assertThat(yaml.getProperty("im.gateway.ws.push.timeout-ms")).isNotNull();
        assertThat(yaml.getProperty("im.message.policy.max-content-length")).isNotNull();
        assertThat(yaml.getProperty("im.auth.jwt-secret")).isNotNull();
    }

    @Test
    void initialMigration_isOnClasspath() {
        assertThat(new ClassPathResource("db/migration/V1__init.sql").exists()).isTrue();
    }
}
