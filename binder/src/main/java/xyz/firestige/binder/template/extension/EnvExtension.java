package xyz.firestige.binder.template.extension;

import xyz.firestige.binder.template.ExtensionResult;
import xyz.firestige.binder.template.Placeholder;
import xyz.firestige.binder.template.PlaceholderExtension;
import xyz.firestige.binder.template.ResolutionContext;

import java.util.function.Function;

/**
 * {@code ${env:NAME[:default]}}，读取进程环境变量
 */
public class EnvExtension implements PlaceholderExtension {

    private final Function<String, String> environment;

    public EnvExtension() {
        this(System::getenv);
    }

    public EnvExtension(Function<String, String> environment) {
        this.environment = environment;
    }

    @Override
    public ExtensionResult resolve(Placeholder placeholder, ResolutionContext context) {
        String value = environment.apply(placeholder.getPath());
        if (value == null) {
            return ExtensionResult.notFound("environment variable " + placeholder.getPath() + " is not set");
        }
        return ExtensionResult.resolved(value);
    }
}
