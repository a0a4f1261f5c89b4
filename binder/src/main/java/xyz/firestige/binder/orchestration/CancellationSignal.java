package xyz.firestige.binder.orchestration;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 部署取消信号，只在步骤边界检查
 */
public class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal() {
        @Override
        public void cancel() {
            // 不可取消
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private CancellationSignal() {
    }

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /**
     * 共享实例，永不取消，{@link #cancel()} 不产生效果
     */
    public static CancellationSignal none() {
        return NONE;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
