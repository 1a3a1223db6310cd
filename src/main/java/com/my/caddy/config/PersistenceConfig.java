package com.my.caddy.config;

import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;

/**
 * 왜: 미스 기억 저장소가 파일 기반 SQLite를 쓰도록 DataSource를 한곳에서 만든다.
 */
@ApplicationScoped
public class PersistenceConfig {

    @Produces
    @ApplicationScoped
    @IfBuildProperty(name = "app.memory.backend", stringValue = "sqlite", enableIfMissing = true)
    public DataSource missMemoryDataSource(AppConfig appConfig) {
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + appConfig.memory().sqlitePath());
        return dataSource;
    }
}
