package xyz.firestige.binder.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 对象图首轮解析后仍含延迟占位符的位置
 * <p>
 * {@link #complete} 只替换记录下来的延迟片段并写回原位置，首轮已替换的值（例如解密后的密钥）不会被再次解析。
 */
public final class DeferredPlaceholders {

    private final PlaceholderEngine engine;
    private final int replacedCount;
    private final List<Site> sites;

    DeferredPlaceholders(PlaceholderEngine engine, int replacedCount, List<Site> sites) {
        this.engine = engine;
        this.replacedCount = replacedCount;
        this.sites = new ArrayList<>(sites);
    }

    /**
     * @return 写回的位置数量
     */
    public int complete(ResolutionContext context, ExtensionRegistry extensions) {
        int completed = 0;
        for (Site site : sites) {
            String before = site.partial.render();
            PartialResolution next = engine.complete(site.partial, context, extensions);
            String after = next.render();
            if (!Objects.equals(before, after)) {
                site.setter.accept(after);
                completed++;
            }
            site.partial = next;
        }
        return completed;
    }

    /**
     * 首轮替换的字符串数量
     */
    public int getReplacedCount() {
        return replacedCount;
    }

    public int size() {
        return sites.size();
    }

    static final class Site {

        private PartialResolution partial;
        private final Consumer<String> setter;

        Site(PartialResolution partial, Consumer<String> setter) {
            this.partial = partial;
            this.setter = setter;
        }
    }
}
