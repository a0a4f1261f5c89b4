package xyz.firestige.binder.crossstack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.binder.exception.BinderException;
import xyz.firestige.binder.exception.EmptyRequiredOutputException;
import xyz.firestige.binder.exception.ErrorType;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 跨 Stack 输出读取
 * <p>
 * 远端读取在调用方的截止时间内完成，超时视为错误。
 * 必需输出缺失或为空字符串一律抛出 {@link EmptyRequiredOutputException}，不做默认值兜底。
 */
public class CrossStackReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(CrossStackReferenceResolver.class);

    private final StackStateRepository repository;
    private final Executor executor;

    public CrossStackReferenceResolver(StackStateRepository repository, Executor executor) {
        this.repository = repository;
        this.executor = executor;
    }

    public StackReference resolve(String fullReference, Instant deadline) {
        long remaining = Duration.between(Instant.now(), deadline).toMillis();
        if (remaining <= 0) {
            throw new BinderException(ErrorType.STATE_READ_FAILURE,
                    "deadline exceeded before reading state of stack " + fullReference);
        }
        CompletableFuture<Optional<StackOutputs>> future =
                CompletableFuture.supplyAsync(() -> repository.load(fullReference), executor);
        try {
            Optional<StackOutputs> outputs = future.get(remaining, TimeUnit.MILLISECONDS);
            if (outputs.isEmpty()) {
                log.warn("Stack {} 尚未发布任何输出", fullReference);
            }
            return new StackReference(fullReference, outputs.orElse(StackOutputs.empty()));
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new BinderException(ErrorType.STATE_READ_FAILURE,
                    "timed out reading state of stack " + fullReference, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BinderException(ErrorType.STATE_READ_FAILURE,
                    "interrupted while reading state of stack " + fullReference, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new BinderException(ErrorType.STATE_READ_FAILURE,
                    "failed to read state of stack " + fullReference + ": " + cause.getMessage(), cause);
        }
    }

    /**
     * 读取父 Stack 的一个必需输出
     *
     * @param refString 用于错误消息的引用字符串
     * @param secret    是否按密文输出读取
     */
    public String getParentOutput(StackReference ref, String exportKey, String refString, boolean secret) {
        String reference = refString != null ? refString : ref.getFullReference();
        StackOutput output = ref.getOutputs().get(exportKey)
                .orElseThrow(() -> new EmptyRequiredOutputException(reference, exportKey, "output does not exist"));
        if (output.isSecret() && !secret) {
            throw new EmptyRequiredOutputException(reference, exportKey, "output is secret but was read as plain value");
        }
        if (output.getValue() == null || output.getValue().isEmpty()) {
            throw new EmptyRequiredOutputException(reference, exportKey, "output value is empty");
        }
        return output.getValue();
    }

    /**
     * 读取可选输出，不存在或为空时返回 empty
     */
    public Optional<String> getOptionalOutput(StackReference ref, String exportKey) {
        return ref.getOutputs().get(exportKey)
                .map(StackOutput::getValue)
                .filter(v -> !v.isEmpty());
    }
}
