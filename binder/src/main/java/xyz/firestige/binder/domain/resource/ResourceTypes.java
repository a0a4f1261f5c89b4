package xyz.firestige.binder.domain.resource;

/**
 * 内置资源类型标签
 */
public final class ResourceTypes {

    public static final String BUCKET = "bucket";
    public static final String S3_BUCKET = "s3-bucket";
    public static final String POSTGRES = "postgres";
    public static final String REDIS = "redis";

    private ResourceTypes() {
    }
}
