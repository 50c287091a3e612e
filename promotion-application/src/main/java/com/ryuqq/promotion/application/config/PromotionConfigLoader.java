package com.ryuqq.promotion.application.config;

import com.ryuqq.promotion.core.validation.PromotionPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;

/**
 * {@code promotion.properties} 기반 설정 로더.
 *
 * <p><strong>지원 키:</strong></p>
 * <pre>
 * promotion.enabled=true
 * promotion.allowed-paths=dev->stage,stage->prod,dev->prod
 * promotion.max-items-per-batch=10
 * promotion.rollback-window-hours=72
 * promotion.per-item-timeout-ms=0
 * </pre>
 *
 * <p>누락된 키는 {@link PromotionConfig#PromotionConfig()} 기본값을 사용합니다.
 * 값 형식이 잘못된 경우 IllegalArgumentException이 발생합니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class PromotionConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PromotionConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "promotion.properties";

    static final String KEY_ENABLED = "promotion.enabled";
    static final String KEY_ALLOWED_PATHS = "promotion.allowed-paths";
    static final String KEY_MAX_ITEMS_PER_BATCH = "promotion.max-items-per-batch";
    static final String KEY_ROLLBACK_WINDOW_HOURS = "promotion.rollback-window-hours";
    static final String KEY_PER_ITEM_TIMEOUT_MS = "promotion.per-item-timeout-ms";

    private PromotionConfigLoader() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 클래스패스의 {@code promotion.properties} 로드.
     *
     * @return 설정 (리소스가 없으면 기본 설정)
     */
    public static PromotionConfig loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    /**
     * 클래스패스 리소스에서 설정 로드.
     *
     * @param resourceName 리소스 이름
     * @return 설정 (리소스가 없으면 기본 설정)
     * @throws UncheckedIOException 리소스 읽기 실패 시
     */
    public static PromotionConfig loadResource(String resourceName) {
        if (resourceName == null || resourceName.isBlank()) {
            throw new IllegalArgumentException("resourceName cannot be null or blank");
        }
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = PromotionConfigLoader.class.getClassLoader();
        }
        try (InputStream in = classLoader.getResourceAsStream(resourceName)) {
            if (in == null) {
                log.info("Promotion config resource {} not found, using defaults", resourceName);
                return new PromotionConfig();
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read promotion config: " + resourceName, e);
        }
    }

    /**
     * Properties에서 설정 생성.
     *
     * @param properties 설정 값
     * @return 설정
     * @throws IllegalArgumentException 값 형식이 잘못된 경우
     */
    public static PromotionConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        PromotionConfig config = new PromotionConfig();

        String enabled = trimmed(properties, KEY_ENABLED);
        if (enabled != null) {
            config = config.withEnabled(parseBoolean(KEY_ENABLED, enabled));
        }
        String paths = properties.getProperty(KEY_ALLOWED_PATHS);
        if (paths != null) {
            config = config.withAllowedPaths(PromotionPath.parseList(paths));
        }
        String maxItems = trimmed(properties, KEY_MAX_ITEMS_PER_BATCH);
        if (maxItems != null) {
            config = config.withMaxItemsPerBatch((int) parseLong(KEY_MAX_ITEMS_PER_BATCH, maxItems));
        }
        String windowHours = trimmed(properties, KEY_ROLLBACK_WINDOW_HOURS);
        if (windowHours != null) {
            config = config.withRollbackWindow(Duration.ofHours(parseLong(KEY_ROLLBACK_WINDOW_HOURS, windowHours)));
        }
        String timeout = trimmed(properties, KEY_PER_ITEM_TIMEOUT_MS);
        if (timeout != null) {
            config = config.withPerItemTimeoutMs(parseLong(KEY_PER_ITEM_TIMEOUT_MS, timeout));
        }

        log.debug("Loaded promotion config: enabled={}, allowedPaths={}, maxItemsPerBatch={}",
            config.enabled(), config.allowedPaths(), config.maxItemsPerBatch());
        return config;
    }

    private static String trimmed(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static boolean parseBoolean(String key, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be true or false (current: " + value + ")");
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number (current: " + value + ")", e);
        }
    }
}
