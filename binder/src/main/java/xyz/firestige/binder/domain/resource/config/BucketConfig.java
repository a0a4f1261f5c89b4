package xyz.firestige.binder.domain.resource.config;

import xyz.firestige.binder.domain.resource.ResourceConfig;

/**
 * 通用对象存储桶
 */
public class BucketConfig implements ResourceConfig {

    /**
     * 实际桶名，为空时使用资源名
     */
    private String name;

    private String location;

    private boolean publicAccess;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public boolean isPublicAccess() {
        return publicAccess;
    }

    public void setPublicAccess(boolean publicAccess) {
        this.publicAccess = publicAccess;
    }
}
