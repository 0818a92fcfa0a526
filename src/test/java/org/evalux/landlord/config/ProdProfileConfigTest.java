package org.evalux.landlord.config;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.support.PropertiesLoaderUtils;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class ProdProfileConfigTest {

    @Test
    void prodProfile_shouldLetHibernateCreateSchemaOnFreshDatabase() throws Exception {
        ClassPathResource migration = new ClassPathResource("schema.sql");
        Properties prod = PropertiesLoaderUtils.loadProperties(new ClassPathResource("application-prod.properties"));

        // sans script de schéma, "validate" ou "none" empêcheraient le démarrage sur une base vide
        if (!migration.exists()) {
            assertThat(prod.getProperty("spring.jpa.hibernate.ddl-auto")).isIn("update", "create");
        }
        assertThat(prod.getProperty("spring.datasource.url")).contains("postgresql");
    }
}
