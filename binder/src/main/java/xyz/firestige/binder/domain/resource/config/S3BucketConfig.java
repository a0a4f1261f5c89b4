package xyz.firestige.binder.domain.resource.config;

import jakarta.validation.constraints.NotBlank;
import xyz.firestige.binder.domain.resource.ResourceConfig;

public class S3BucketConfig implements ResourceConfig {

    private String name;

    @NotBlank
    private String region;

    private boolean staticWebsite;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public boolean isStaticWebsite() {
        return staticWebsite;
    }

    public void setStaticWebsite(boolean staticWebsite) {
        this.staticWebsite = staticWebsite;
    }
}
