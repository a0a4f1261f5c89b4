package xyz.firestige.binder.orchestration;

import xyz.firestige.binder.domain.stack.DeployParams;
import xyz.firestige.binder.domain.stack.Stack;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 一次部署请求：部署参数以及项目中全部 Stack（按名称索引）
 */
public final class DeployRequest {

    private final DeployParams params;
    private final Map<String, Stack> stacks;

    public DeployRequest(DeployParams params, Map<String, Stack> stacks) {
        this.params = Objects.requireNonNull(params, "params");
        this.stacks = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(stacks, "stacks")));
    }

    public DeployParams getParams() {
        return params;
    }

    public Map<String, Stack> getStacks() {
        return stacks;
    }

    public String getStackName() {
        return params.getStackName();
    }

    public String getEnvironment() {
        return params.getEnvironment();
    }
}
