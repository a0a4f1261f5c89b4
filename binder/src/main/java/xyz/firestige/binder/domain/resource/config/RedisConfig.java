package xyz.firestige.binder.domain.resource.config;

import jakarta.validation.constraints.Min;
import xyz.firestige.binder.domain.resource.ResourceConfig;

public class RedisConfig implements ResourceConfig {

    private String version;

    @Min(1)
    private int port = 6379;

    @Min(1)
    private int memorySizeMb = 256;

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public int getMemorySizeMb() {
        return memorySizeMb;
    }

    public void setMemorySizeMb(int memorySizeMb) {
        this.memorySizeMb = memorySizeMb;
    }
}
