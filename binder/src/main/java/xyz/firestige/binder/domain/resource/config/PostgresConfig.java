package xyz.firestige.binder.domain.resource.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import xyz.firestige.binder.domain.resource.ResourceConfig;

/**
 * 托管 Postgres 实例
 */
public class PostgresConfig implements ResourceConfig {

    @NotBlank
    private String version = "16";

    @Min(1)
    @Max(65535)
    private int port = 5432;

    private String instanceClass;

    /**
     * 实例级管理员用户名
     */
    private String username = "postgres";

    /**
     * 为使用方创建数据库时追加执行的 SQL
     */
    private String initSql;

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

    public String getInstanceClass() {
        return instanceClass;
    }

    public void setInstanceClass(String instanceClass) {
        this.instanceClass = instanceClass;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getInitSql() {
        return initSql;
    }

    public void setInitSql(String initSql) {
        this.initSql = initSql;
    }
}
