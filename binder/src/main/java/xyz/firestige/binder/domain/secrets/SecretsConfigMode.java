package xyz.firestige.binder.domain.secrets;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 父 Stack 向子环境暴露密钥的方式
 */
public enum SecretsConfigMode {

    /**
     * 只暴露映射中列出的密钥
     */
    INCLUDE,

    /**
     * 暴露全部密钥，排除列出的（需要 inheritAll）
     */
    EXCLUDE,

    /**
     * 暴露全部密钥，映射中的键改为指向另一个密钥
     */
    OVERRIDE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 未知取值返回 null，由校验给出错误信息
     */
    @JsonCreator
    public static SecretsConfigMode fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (SecretsConfigMode mode : values()) {
            if (mode.value().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        return null;
    }
}
