package com.virtualsol.discovery.modules.providers;

import java.util.Optional;

public interface HealthDataProvider {

    Optional<HealthData> getHealthData(String mint);
}
