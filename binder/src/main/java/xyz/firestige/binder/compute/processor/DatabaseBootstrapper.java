package xyz.firestige.binder.compute.processor;

/**
 * 在父 Stack 的共享数据库实例中为使用方创建数据库和角色
 * <p>
 * 同步执行的一次性远程命令，失败时抛出异常使整个部署失败。
 */
@FunctionalInterface
public interface DatabaseBootstrapper {

    void bootstrap(DatabaseBootstrapRequest request) throws Exception;
}
