package xyz.firestige.binder.domain.stack;

/**
 * 对另一个客户端 Stack 导出的计算上下文的依赖，
 * 通过 {@code ${dependency:name.resource.property}} 引用
 */
public class StackDependency {

    private String name;

    /**
     * 拥有该资源的 Stack 引用
     */
    private String owner;

    private String resource;

    public StackDependency() {
    }

    public StackDependency(String name, String owner, String resource) {
        this.name = name;
        this.owner = owner;
        this.resource = resource;
    }

    public StackDependency copy() {
        return new StackDependency(name, owner, resource);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public String getResource() {
        return resource;
    }

    public void setResource(String resource) {
        this.resource = resource;
    }
}
