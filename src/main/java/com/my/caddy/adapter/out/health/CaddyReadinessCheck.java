package com.my.caddy.adapter.out.health;

import com.my.caddy.config.AppConfig;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.nio.file.Files;
import java.nio.file.Path;

@Readiness
@ApplicationScoped
public class CaddyReadinessCheck implements HealthCheck {

    private final AppConfig appConfig;

    public CaddyReadinessCheck(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @Override
    public HealthCheckResponse call() {
        String backend = appConfig.memory().backend();
        boolean sqlite = "sqlite".equalsIgnoreCase(backend);
        Path database = Path.of(appConfig.memory().sqlitePath());
        boolean storeOk = !sqlite || Files.exists(database);
        return HealthCheckResponse.named("caddy-readiness")
                .withData("memoryBackend", backend)
                .withData("sqlitePath", database.toString())
                .withData("memoryStoreReady", storeOk)
                .status(storeOk)
                .build();
    }
}
