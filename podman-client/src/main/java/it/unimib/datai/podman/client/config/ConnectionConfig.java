package it.unimib.datai.podman.client.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class ConnectionConfig {
    private String activeService;
    private Map<String, ServiceDestination> services = new LinkedHashMap<>();

    public String getActiveService() {
        return activeService;
    }

    public void setActiveService(String activeService) {
        this.activeService = activeService;
    }

    public Map<String, ServiceDestination> getServices() {
        return services;
    }

    public void setServices(Map<String, ServiceDestination> services) {
        this.services = (services == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(services);
    }
}
