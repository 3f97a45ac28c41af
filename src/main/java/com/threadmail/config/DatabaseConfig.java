package com.threadmail.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;
import java.io.File;
import java.time.Clock;

/**
 * MyBatis and DataSource initialization
 */
@Configuration
@RequiredArgsConstructor
public class DatabaseConfig {

    private final ThreadMailProperties properties;

    @Bean
    public DataSourceInitializer dataSourceInitializer(DataSource dataSource) {
        // SQLite creates the file but not its directory
        new File(properties.getStorage().getDataDirectory()).mkdirs();

        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(dataSource);

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        populator.addScript(new ClassPathResource("schema.sql"));
        initializer.setDatabasePopulator(populator);

        return initializer;
    }

    /**
     * Time source for event timestamps and snapshot rows
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
