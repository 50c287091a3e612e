package com.ryuqq.promotion.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 설정 항목 (레코드만 존재, 페이로드/벡터 없음).
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class ConfigEntry extends PromotableItem {

    private final String key;
    private final String value;

    public ConfigEntry(ItemId id, Environment environment, String key, String value) {
        super(id, environment);
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        this.key = key;
        this.value = value;
    }

    @Override
    public ContentKind kind() {
        return ContentKind.CONFIG;
    }

    @Override
    public String displayName() {
        return key;
    }

    @Override
    public Map<String, String> textFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("key", key);
        fields.put("value", value);
        return fields;
    }

    @Override
    protected PromotableItem copyContent(ItemId newId, Environment environment) {
        return new ConfigEntry(newId, environment, key, value);
    }

    public String getKey() {
        return key;
    }

    public String getValueOrNull() {
        return value;
    }
}
