package xyz.firestige.binder.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;
import xyz.firestige.binder.crossstack.StackOutput;
import xyz.firestige.binder.crossstack.StackOutputs;
import xyz.firestige.binder.crossstack.StackStateRepository;
import xyz.firestige.binder.exception.BinderException;
import xyz.firestige.binder.exception.ErrorType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Stack 输出的 Redis 实现
 * <p>
 * 每个 Stack 一个 Hash：{@code <namespace>:stack:<org>/<project>/<stack>}，
 * field 为导出键，value 为 {@link StackOutput} 的 JSON。HSET 天然是合并语义。
 */
public class RedisStackStateRepository implements StackStateRepository {

    private static final Logger log = LoggerFactory.getLogger(RedisStackStateRepository.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisStackStateRepository(RedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper,
                                     String namespace) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = namespace + ":stack:";
    }

    @Override
    public Optional<StackOutputs> load(String fullReference) {
        Map<Object, Object> hash = redisTemplate.opsForHash().entries(keyFor(fullReference));
        if (hash == null || hash.isEmpty()) {
            return Optional.empty();
        }
        // 字段顺序不保证，按键排序保持输出稳定
        StackOutputs outputs = new StackOutputs();
        new TreeMap<>(hash).forEach((field, value) -> outputs.put((String) field, fromJson(fullReference, (String) value)));
        return Optional.of(outputs);
    }

    @Override
    public void publish(String fullReference, StackOutputs outputs) {
        if (outputs == null || outputs.isEmpty()) {
            return;
        }
        Map<String, String> hash = new LinkedHashMap<>();
        outputs.asMap().forEach((exportKey, output) -> hash.put(exportKey, toJson(output)));
        redisTemplate.opsForHash().putAll(keyFor(fullReference), hash);
        log.info("发布 Stack 输出到 Redis: {}, keys: {}", fullReference, outputs.keys());
    }

    String keyFor(String fullReference) {
        return keyPrefix + fullReference;
    }

    private String toJson(StackOutput output) {
        try {
            return objectMapper.writeValueAsString(output);
        } catch (JsonProcessingException e) {
            throw new BinderException(ErrorType.SYSTEM_ERROR, "failed to encode stack output", e);
        }
    }

    private StackOutput fromJson(String fullReference, String json) {
        try {
            return objectMapper.readValue(json, StackOutput.class);
        } catch (JsonProcessingException e) {
            throw new BinderException(ErrorType.STATE_READ_FAILURE,
                    "corrupted stack output of " + fullReference + ": " + e.getOriginalMessage(), e);
        }
    }
}
