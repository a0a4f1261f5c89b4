package xyz.firestige.binder.compute.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.binder.compute.ComputeProcessor;
import xyz.firestige.binder.compute.ProcessorContext;
import xyz.firestige.binder.compute.ResourceDependency;
import xyz.firestige.binder.crossstack.ExportKeys;
import xyz.firestige.binder.domain.resource.ResourceTypes;
import xyz.firestige.binder.domain.resource.config.PostgresConfig;
import xyz.firestige.binder.exception.BinderException;
import xyz.firestige.binder.exception.ErrorType;
import xyz.firestige.binder.exception.InvalidDescriptorException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import static xyz.firestige.binder.compute.EnvVariableNames.suffixed;

/**
 * 共享 Postgres 实例
 * <p>
 * 为使用方 Stack 生成新的随机密码，并同步执行一次性初始化命令创建数据库和角色；
 * 初始化失败时整个部署失败，不做部分绑定。预览模式跳过初始化。
 * <p>
 * 环境变量：{@code PGHOST/PGPORT/PGUSER/PGDATABASE/PGPASSWORD}，各自带 {@code _<RES>} 限定形式。
 * 模板字段：url、host、port、user、database、password。
 */
public class PostgresComputeProcessor implements ComputeProcessor {

    private static final Logger log = LoggerFactory.getLogger(PostgresComputeProcessor.class);

    static final int PASSWORD_LENGTH = 20;

    private final DatabaseBootstrapper bootstrapper;
    private final PasswordGenerator passwords;

    public PostgresComputeProcessor(DatabaseBootstrapper bootstrapper, PasswordGenerator passwords) {
        this.bootstrapper = bootstrapper;
        this.passwords = passwords;
    }

    @Override
    public String resourceType() {
        return ResourceTypes.POSTGRES;
    }

    @Override
    public void process(ProcessorContext ctx) {
        String res = ctx.exportName();
        String resourceName = ctx.getResource().getName();
        PostgresConfig config = ctx.config(PostgresConfig.class);

        String endpoint = ctx.requireOutput(ExportKeys.endpoint(res));
        String rootUser = ctx.requireOutput(ExportKeys.rootUser(res));
        String rootPassword = ctx.requireSecretOutput(ExportKeys.rootPassword(res));
        String host = hostOf(endpoint);
        int port = portOf(endpoint, config.getPort());

        String consumer = ctx.getConsumer().getStackName();
        String database = identifier(consumer);
        String user = identifier(consumer);
        String password = passwords.generate(PASSWORD_LENGTH);

        if (ctx.isPreview()) {
            log.info("预览模式, 跳过数据库初始化: {}@{}/{}", user, resourceName, database);
        } else {
            DatabaseBootstrapRequest request = new DatabaseBootstrapRequest(
                    host, port, rootUser, rootPassword, database, user, password, config.getInitSql());
            log.info("初始化数据库: {}", request);
            try {
                bootstrapper.bootstrap(request);
            } catch (BinderException e) {
                throw e;
            } catch (Exception e) {
                throw new BinderException(ErrorType.BOOTSTRAP_FAILURE, String.format(
                        "failed to create database %s for stack %s in %s: %s",
                        database, consumer, resourceName, e.getMessage()), e);
            }
        }

        String portValue = String.valueOf(port);
        ctx.addEnv(suffixed("PGHOST", resourceName), host);
        ctx.addEnv(suffixed("PGPORT", resourceName), portValue);
        ctx.addEnv(suffixed("PGUSER", resourceName), user);
        ctx.addEnv(suffixed("PGDATABASE", resourceName), database);
        ctx.addSecretEnv(suffixed("PGPASSWORD", resourceName), password);

        ctx.addEnv("PGHOST", host);
        ctx.addEnv("PGPORT", portValue);
        ctx.addEnv("PGUSER", user);
        ctx.addEnv("PGDATABASE", database);
        ctx.addSecretEnv("PGPASSWORD", password);

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("url", String.format("postgresql://%s:%s@%s:%d/%s", user, password, host, port, database));
        fields.put("host", host);
        fields.put("port", portValue);
        fields.put("user", user);
        fields.put("database", database);
        fields.put("password", password);
        ctx.getCollector().addResourceTplExtension(resourceName, fields);
        ctx.getCollector().addDependency(new ResourceDependency(
                resourceType(), resourceName, ctx.getOwnerReference().getFullReference()));
    }

    static String hostOf(String endpoint) {
        int colon = endpoint.lastIndexOf(':');
        return colon > 0 ? endpoint.substring(0, colon) : endpoint;
    }

    static int portOf(String endpoint, int fallback) {
        int colon = endpoint.lastIndexOf(':');
        if (colon < 0 || colon == endpoint.length() - 1) {
            return fallback;
        }
        try {
            return Integer.parseInt(endpoint.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new InvalidDescriptorException("invalid postgres endpoint " + endpoint, e);
        }
    }

    static String identifier(String raw) {
        return raw.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
    }
}
