package com.example.dashboard.config;

import com.example.dashboard.config.properties.TableProperties;
import com.example.dashboard.table.engine.TableEngineFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class TableEngineConfig {

    @Bean
    public TableEngineFactory tableEngineFactory(TableProperties properties) {
        log.info("Table defaults: pageSize={}, maxSorts={}, maxPageButtons={}, locale={}, searchDebounce={}",
                properties.defaultPageSize(), properties.maxSorts(), properties.maxPageButtons(),
                properties.locale(), properties.searchDebounce());
        return new TableEngineFactory(properties);
    }
}
